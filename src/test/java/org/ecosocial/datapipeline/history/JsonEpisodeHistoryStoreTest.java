package org.ecosocial.datapipeline.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.ecosocial.junit.extensions.logging.ExpectLog;
import org.ecosocial.junit.extensions.logging.LogLevel;
import org.ecosocial.junit.extensions.logging.LogWatchExtension;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class JsonEpisodeHistoryStoreTest {

    @TempDir
    Path tempDir;

    private static EpisodeSummary summary(int episode) {
        return new EpisodeSummary(episode, -120.5, 0.4, 1.5, 15, 2, 3, 1, 72.25,
                Map.of("cooperative", 2.0), "personality-biased", "2026-01-01T00:00:00Z");
    }

    @Test
    void missingFileIsAnEmptyHistory() throws IOException {
        JsonEpisodeHistoryStore store = new JsonEpisodeHistoryStore(tempDir.resolve("none.json"), 5);

        assertThat(store.load()).isEmpty();
    }

    @Test
    void appendsAndReloadsSummaries() throws IOException {
        Path file = tempDir.resolve("nested/dir/history.json");
        JsonEpisodeHistoryStore store = new JsonEpisodeHistoryStore(file, 5);

        store.append(summary(1));
        store.append(summary(2));

        List<EpisodeSummary> loaded = new JsonEpisodeHistoryStore(file, 5).load();
        assertThat(loaded).containsExactly(summary(1), summary(2));
        try (var entries = Files.list(file.getParent())) {
            assertThat(entries).containsExactly(file);
        }
    }

    @Test
    void keepsOnlyTheMostRecentEntries() throws IOException {
        JsonEpisodeHistoryStore store = new JsonEpisodeHistoryStore(tempDir.resolve("history.json"), 3);

        for (int episode = 1; episode <= 5; episode++) {
            store.append(summary(episode));
        }

        assertThat(store.load()).extracting(EpisodeSummary::episode).containsExactly(3, 4, 5);
    }

    @Test
    void writesSnakeCaseDocument() throws IOException {
        Path file = tempDir.resolve("history.json");
        new JsonEpisodeHistoryStore(file, 5).append(summary(1));

        String json = Files.readString(file, StandardCharsets.UTF_8);

        assertThat(json).contains("\"episodes\"", "\"total_reward\"", "\"survival_rate\"", "\"personality_scores\"",
                "\"agent_type\"", "\"num_alliances\"");
        assertThat(json).doesNotContain("totalReward");
    }

    @Test
    void corruptFileFailsLoad() throws IOException {
        Path file = tempDir.resolve("history.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new JsonEpisodeHistoryStore(file, 5).load()).isInstanceOf(IOException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*Discarding unreadable episode history.*")
    void appendReplacesCorruptFile() throws IOException {
        Path file = tempDir.resolve("history.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
        JsonEpisodeHistoryStore store = new JsonEpisodeHistoryStore(file, 5);

        store.append(summary(7));

        assertThat(store.load()).containsExactly(summary(7));
    }

    @Test
    void readsOptionsFromConfig() {
        JsonEpisodeHistoryStore store = new JsonEpisodeHistoryStore(ConfigFactory.parseMap(
                Map.of("path", tempDir.resolve("h.json").toString(), "capacity", 7)));

        assertThat(store.getPath()).isEqualTo(tempDir.resolve("h.json"));
        assertThat(store.getCapacity()).isEqualTo(7);
        assertThat(new JsonEpisodeHistoryStore(ConfigFactory.empty()).getCapacity())
                .isEqualTo(JsonEpisodeHistoryStore.DEFAULT_CAPACITY);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new JsonEpisodeHistoryStore(tempDir.resolve("h.json"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
