package org.ecosocial.runner;

import com.typesafe.config.Config;

/**
 * Settings of the episode loop.
 *
 * @param episodes number of episodes to run, &gt; 0
 * @param baseSeed seed of the first episode, episode i uses {@code baseSeed + i}; {@code null}
 *                 draws a fresh seed per episode
 * @param telemetryInterval publish a snapshot every this many steps, &gt; 0
 * @param progressInterval log progress every this many steps, &gt; 0
 */
public record RunnerSettings(int episodes, Long baseSeed, int telemetryInterval, int progressInterval) {

    public RunnerSettings {
        if (episodes <= 0) {
            throw new IllegalArgumentException("runner.episodes must be > 0, got " + episodes);
        }
        if (telemetryInterval <= 0) {
            throw new IllegalArgumentException("runner.telemetry-interval must be > 0, got " + telemetryInterval);
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("runner.progress-interval must be > 0, got " + progressInterval);
        }
    }

    /**
     * Reads the {@code runner} block. {@code seed} may be absent or null.
     *
     * @param config the {@code runner} configuration block
     * @return the settings
     */
    public static RunnerSettings fromConfig(Config config) {
        Long seed = config.hasPath("seed") ? config.getLong("seed") : null;
        return new RunnerSettings(
                config.getInt("episodes"),
                seed,
                config.hasPath("telemetry-interval") ? config.getInt("telemetry-interval") : 10,
                config.hasPath("progress-interval") ? config.getInt("progress-interval") : 100);
    }

    /**
     * Returns a copy with the episode count and seed replaced where given.
     *
     * @param episodesOverride new episode count, or {@code null} to keep
     * @param seedOverride new base seed, or {@code null} to keep
     * @return the adjusted settings
     */
    public RunnerSettings withOverrides(Integer episodesOverride, Long seedOverride) {
        return new RunnerSettings(
                episodesOverride != null ? episodesOverride : episodes,
                seedOverride != null ? seedOverride : baseSeed,
                telemetryInterval,
                progressInterval);
    }

    /**
     * Returns the seed of an episode.
     * @param episodeIndex 0-based episode index
     * @return the seed, or {@code null} if seeds are drawn
     */
    public Long seedFor(int episodeIndex) {
        return baseSeed == null ? null : baseSeed + episodeIndex;
    }
}
