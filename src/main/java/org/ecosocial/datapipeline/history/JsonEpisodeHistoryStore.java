package org.ecosocial.datapipeline.history;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.ecosocial.runtime.spi.EpisodeSummary;
import org.ecosocial.runtime.spi.IEpisodeHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;

/**
 * Keeps the most recent episode summaries in a single JSON document of the form
 * {@code {"episodes": [...]}}, with snake_case field names.
 * <p>
 * Every append reads the document, adds the summary, drops the oldest entries beyond the
 * capacity and writes the document back through a temporary file and an atomic rename.
 * A missing file is an empty history; an unparseable file is logged and replaced.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code path} - location of the JSON document (default {@code data/episode_history.json})</li>
 *   <li>{@code capacity} - number of episodes retained, &gt; 0 (default 100)</li>
 * </ul>
 */
public class JsonEpisodeHistoryStore implements IEpisodeHistoryStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonEpisodeHistoryStore.class);

    static final int DEFAULT_CAPACITY = 100;

    private final Path path;
    private final int capacity;
    private final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .setPrettyPrinting()
            .create();

    public JsonEpisodeHistoryStore(Config options) {
        this(Paths.get(options.hasPath("path") ? options.getString("path") : "data/episode_history.json"),
                options.hasPath("capacity") ? options.getInt("capacity") : DEFAULT_CAPACITY);
    }

    public JsonEpisodeHistoryStore(Path path, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be > 0, got " + capacity);
        }
        this.path = path;
        this.capacity = capacity;
    }

    @Override
    public void append(EpisodeSummary summary) throws IOException {
        List<EpisodeSummary> episodes = new ArrayList<>(readOrFresh());
        episodes.add(summary);
        if (episodes.size() > capacity) {
            episodes = new ArrayList<>(episodes.subList(episodes.size() - capacity, episodes.size()));
        }
        write(new HistoryDocument(episodes));
        LOG.debug("Appended episode {} to history {} ({} retained)", summary.episode(), path, episodes.size());
    }

    @Override
    public List<EpisodeSummary> load() throws IOException {
        if (!Files.exists(path)) {
            return Collections.emptyList();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            HistoryDocument document = gson.fromJson(reader, HistoryDocument.class);
            if (document == null || document.episodes() == null) {
                return Collections.emptyList();
            }
            return Collections.unmodifiableList(document.episodes());
        } catch (JsonParseException e) {
            throw new IOException("Episode history " + path + " is not valid JSON: " + e.getMessage(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    public int getCapacity() {
        return capacity;
    }

    private List<EpisodeSummary> readOrFresh() throws IOException {
        try {
            return load();
        } catch (IOException e) {
            if (e.getCause() instanceof JsonParseException) {
                LOG.warn("Discarding unreadable episode history {}: {}", path, e.getMessage());
                return Collections.emptyList();
            }
            throw e;
        }
    }

    private void write(HistoryDocument document) throws IOException {
        Path absolute = path.toAbsolutePath();
        Path parent = absolute.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                gson.toJson(document, writer);
            }
            Files.move(tempFile, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    private record HistoryDocument(List<EpisodeSummary> episodes) {}
}
