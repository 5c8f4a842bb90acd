package org.ecosocial.datapipeline.telemetry;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Map;

import org.ecosocial.runtime.WorldSnapshot;
import org.ecosocial.runtime.model.Personality;
import org.ecosocial.runtime.spi.EpisodeMetadata;
import org.ecosocial.runtime.spi.EpisodeSummary;
import org.ecosocial.runtime.spi.ITelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;

/**
 * Appends one JSON object per telemetry event to a file, one event per line.
 * <p>
 * Every line carries an {@code event} field: {@code episode_start}, {@code simulation_update}
 * or {@code episode_complete}. Update lines hold the snapshot fields merged with the episode
 * metadata. Field names are snake_case. The file is opened lazily in append mode and flushed
 * after every line.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code path} - output file (default {@code data/telemetry.jsonl})</li>
 * </ul>
 */
public class JsonLinesTelemetrySink implements ITelemetrySink {
    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesTelemetrySink.class);

    private final Path path;
    private final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();
    private BufferedWriter writer;

    public JsonLinesTelemetrySink(Config options) {
        this(Paths.get(options.hasPath("path") ? options.getString("path") : "data/telemetry.jsonl"));
    }

    public JsonLinesTelemetrySink(Path path) {
        this.path = path;
    }

    @Override
    public void episodeStarted(int episode, Map<Personality, Integer> personalityCounts) {
        JsonObject event = event("episode_start");
        event.addProperty("episode", episode);
        JsonObject counts = new JsonObject();
        for (Map.Entry<Personality, Integer> entry : personalityCounts.entrySet()) {
            counts.addProperty(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }
        event.add("personalities", counts);
        writeLine(event);
    }

    @Override
    public void publish(WorldSnapshot snapshot, EpisodeMetadata metadata) {
        JsonObject event = event("simulation_update");
        merge(event, gson.toJsonTree(snapshot).getAsJsonObject());
        merge(event, gson.toJsonTree(metadata).getAsJsonObject());
        writeLine(event);
    }

    @Override
    public void episodeCompleted(EpisodeSummary summary) {
        JsonObject event = event("episode_complete");
        merge(event, gson.toJsonTree(summary).getAsJsonObject());
        writeLine(event);
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            LOG.warn("Failed to close telemetry file {}: {}", path, e.getMessage());
        } finally {
            writer = null;
        }
    }

    public Path getPath() {
        return path;
    }

    private static JsonObject event(String type) {
        JsonObject event = new JsonObject();
        event.addProperty("event", type);
        return event;
    }

    private static void merge(JsonObject target, JsonObject source) {
        for (Map.Entry<String, JsonElement> entry : source.entrySet()) {
            target.add(entry.getKey(), entry.getValue());
        }
    }

    private void writeLine(JsonObject event) {
        try {
            if (writer == null) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                LOG.debug("Writing telemetry to {}", path);
            }
            writer.write(gson.toJson(event));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write telemetry to " + path, e);
        }
    }
}
