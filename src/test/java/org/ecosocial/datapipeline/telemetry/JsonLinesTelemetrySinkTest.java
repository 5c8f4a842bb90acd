package org.ecosocial.datapipeline.telemetry;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.ecosocial.junit.extensions.logging.LogWatchExtension;
import org.ecosocial.runtime.Simulation;
import org.ecosocial.runtime.SimulationSettings;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.spi.EpisodeMetadata;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class JsonLinesTelemetrySinkTest {

    @TempDir
    Path tempDir;

    private static List<JsonObject> readEvents(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(line -> JsonParser.parseString(line).getAsJsonObject())
                .toList();
    }

    @Test
    void writesOneLinePerEvent() throws IOException {
        Path file = tempDir.resolve("out/telemetry.jsonl");
        Simulation simulation = new Simulation(new SimulationSettings(6, 3, 2, 1));
        simulation.reset(4L);
        Map<Personality, Integer> counts = new EnumMap<>(Personality.class);
        counts.put(Personality.COOPERATIVE, 2);
        counts.put(Personality.NEUTRAL, 1);

        try (JsonLinesTelemetrySink sink = new JsonLinesTelemetrySink(file)) {
            sink.episodeStarted(1, counts);
            sink.publish(simulation.snapshot(), EpisodeMetadata.of(1, 10, 40, -3.5, "personality-biased"));
            sink.episodeCompleted(new EpisodeSummary(1, -3.5, 0.0, 0.0, 0, 0, 0, 0, 99.0, Map.of(),
                    "personality-biased", "2026-01-01T00:00:00Z"));
        }

        List<JsonObject> events = readEvents(file);
        assertThat(events).extracting(e -> e.get("event").getAsString())
                .containsExactly("episode_start", "simulation_update", "episode_complete");

        JsonObject start = events.get(0);
        assertThat(start.get("episode").getAsInt()).isEqualTo(1);
        assertThat(start.getAsJsonObject("personalities").get("cooperative").getAsInt()).isEqualTo(2);

        JsonObject update = events.get(1);
        assertThat(update.get("grid_size").getAsInt()).isEqualTo(6);
        assertThat(update.getAsJsonArray("agents")).hasSize(3);
        assertThat(update.get("progress").getAsDouble()).isEqualTo(25.0);
        assertThat(update.get("agent_type").getAsString()).isEqualTo("personality-biased");
        assertThat(update.has("food_inventory")).isTrue();

        assertThat(events.get(2).get("avg_health").getAsDouble()).isEqualTo(99.0);
    }

    @Test
    void appendsAcrossSinkInstances() throws IOException {
        Path file = tempDir.resolve("telemetry.jsonl");

        try (JsonLinesTelemetrySink sink = new JsonLinesTelemetrySink(file)) {
            sink.episodeStarted(1, Map.of());
        }
        try (JsonLinesTelemetrySink sink = new JsonLinesTelemetrySink(file)) {
            sink.episodeStarted(2, Map.of());
        }

        assertThat(readEvents(file)).extracting(e -> e.get("episode").getAsInt()).containsExactly(1, 2);
    }

    @Test
    void closeWithoutEventsCreatesNoFile() {
        Path file = tempDir.resolve("never.jsonl");

        new JsonLinesTelemetrySink(file).close();

        assertThat(file).doesNotExist();
    }
}
