package org.ecosocial.datapipeline.telemetry;

import java.util.Map;

import org.ecosocial.runtime.WorldSnapshot;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.spi.EpisodeMetadata;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.ecosocial.runtime.spi.ITelemetrySink;

import com.typesafe.config.Config;

/**
 * Discards all telemetry. Used when {@code telemetry.enabled = false}.
 */
public class NoOpTelemetrySink implements ITelemetrySink {

    public NoOpTelemetrySink() {
    }

    public NoOpTelemetrySink(Config options) {
        this();
    }

    @Override
    public void episodeStarted(int episode, Map<Personality, Integer> personalityCounts) {
    }

    @Override
    public void publish(WorldSnapshot snapshot, EpisodeMetadata metadata) {
    }

    @Override
    public void episodeCompleted(EpisodeSummary summary) {
    }
}
