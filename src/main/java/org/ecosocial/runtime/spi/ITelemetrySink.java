package org.ecosocial.runtime.spi;

import java.util.Map;

import org.ecosocial.runtime.WorldSnapshot;
import org.ecosocial.runtime.model.Personality;

/**
 * Receives live episode data for display.
 * <p>
 * Sinks are best effort: the episode runner logs and discards any exception thrown here, so a
 * failing sink never aborts a run.
 * <p>
 * Implementations must provide a constructor with signature:
 * {@code (com.typesafe.config.Config options)}
 */
public interface ITelemetrySink extends AutoCloseable {

    /**
     * Called once after each reset.
     *
     * @param episode the 1-based episode number
     * @param personalityCounts number of agents per personality
     */
    void episodeStarted(int episode, Map<Personality, Integer> personalityCounts);

    /**
     * Publishes a periodic view of the running episode.
     *
     * @param snapshot the world after the step
     * @param metadata progress information for the episode
     */
    void publish(WorldSnapshot snapshot, EpisodeMetadata metadata);

    /**
     * Called once when an episode reaches its terminal step.
     *
     * @param summary the final statistics
     */
    void episodeCompleted(EpisodeSummary summary);

    /**
     * Releases any resources held by the sink. The default does nothing.
     */
    @Override
    default void close() {
    }
}
