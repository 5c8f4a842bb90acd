package org.ecosocial.runtime.spi;

/**
 * Progress information attached to every telemetry snapshot.
 *
 * @param episode the 1-based episode number
 * @param step steps completed so far
 * @param maxSteps the episode length
 * @param progress percentage of the episode completed, 0 to 100
 * @param totalReward sum of all agent rewards so far in this episode
 * @param agentType name of the policy driving the agents
 */
public record EpisodeMetadata(
    int episode,
    int step,
    int maxSteps,
    double progress,
    double totalReward,
    String agentType
) {
    public static EpisodeMetadata of(int episode, int step, int maxSteps, double totalReward, String agentType) {
        return new EpisodeMetadata(episode, step, maxSteps, step * 100.0 / maxSteps, totalReward, agentType);
    }
}
