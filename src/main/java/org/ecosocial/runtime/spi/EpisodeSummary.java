package org.ecosocial.runtime.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.ecosocial.runtime.metrics.StepMetrics;
import org.ecosocial.runtime.model.Personality;

/**
 * Final statistics of one episode, as stored in the episode history.
 *
 * @param episode the 1-based episode number
 * @param totalReward sum of all agent rewards over the episode
 * @param survivalRate fraction of agents with a score above zero at the end
 * @param avgScore mean agent score at the end
 * @param totalFoodCollected food units collected by all agents, equal to the sum of their scores
 * @param cooperationEvents shares during the episode
 * @param theftEvents thefts during the episode
 * @param numAlliances alliances at the end
 * @param avgHealth mean agent health at the end
 * @param personalityScores mean score per personality, keyed by lower-case personality name
 * @param agentType name of the policy that drove the agents
 * @param timestamp ISO-8601 instant at which the episode completed
 */
public record EpisodeSummary(
    int episode,
    double totalReward,
    double survivalRate,
    double avgScore,
    double totalFoodCollected,
    int cooperationEvents,
    int theftEvents,
    int numAlliances,
    double avgHealth,
    Map<String, Double> personalityScores,
    String agentType,
    String timestamp
) {
    public EpisodeSummary {
        personalityScores = personalityScores == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(personalityScores));
    }

    /**
     * Builds a summary from the metrics of the terminal step.
     *
     * @param episode the 1-based episode number
     * @param totalReward the accumulated reward
     * @param metrics the metrics returned by the last step
     * @param agentType the policy name
     * @param timestamp the completion instant, ISO-8601
     * @return the summary
     */
    public static EpisodeSummary from(int episode, double totalReward, StepMetrics metrics, String agentType, String timestamp) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Personality p : Personality.values()) {
            scores.put(p.name().toLowerCase(Locale.ROOT), metrics.personalityScore(p));
        }
        return new EpisodeSummary(episode, totalReward, metrics.survivalRate(), metrics.avgScore(),
                metrics.totalFoodCollected(), metrics.cooperationEvents(), metrics.theftEvents(),
                metrics.numAlliances(), metrics.avgHealth(), scores, agentType, timestamp);
    }
}
