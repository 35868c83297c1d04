package com.phillippitts.multishot.service.metrics;

import com.phillippitts.multishot.domain.TokenUsage;
import com.phillippitts.multishot.exception.ResultSinkException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Stores performance records as {@code <runId>.json} files in one directory.
 *
 * <p>Write failures are logged and do not affect the run. Unreadable files are skipped on load.
 */
public class PerformanceArchive {

    private static final Logger LOG = LogManager.getLogger(PerformanceArchive.class);

    private final Path directory;

    public PerformanceArchive(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    public void write(PerformanceRecord record) {
        Path file = directory.resolve(record.runId() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, toJson(record).toString(2));
        } catch (IOException e) {
            LOG.warn("Failed to archive performance record {}: {}", record.runId(), e.getMessage());
        }
    }

    /**
     * @throws ResultSinkException if the directory exists but cannot be listed
     */
    public List<PerformanceRecord> readAll() {
        List<PerformanceRecord> out = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return out;
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files.filter(p -> p.toString().endsWith(".json")).sorted()::iterator) {
                try {
                    out.add(fromJson(new JSONObject(Files.readString(file))));
                } catch (IOException | JSONException | DateTimeException e) {
                    LOG.warn("Skipping unreadable performance record {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new ResultSinkException(directory.toString(), e);
        }
        return out;
    }

    static JSONObject toJson(PerformanceRecord r) {
        JSONArray engines = new JSONArray();
        for (ModelPerformance m : r.perEngine()) {
            JSONObject e = new JSONObject()
                    .put("engine", m.engine())
                    .put("model", m.model())
                    .put("executionTimeMs", m.executionTimeMs())
                    .put("cost", m.cost())
                    .put("success", m.success())
                    .put("timestamp", m.timestamp().toString());
            if (m.tokenUsage() != null) {
                e.put("tokenUsage", new JSONObject()
                        .put("promptTokens", m.tokenUsage().promptTokens())
                        .put("completionTokens", m.tokenUsage().completionTokens())
                        .put("totalTokens", m.tokenUsage().totalTokens()));
            }
            if (m.qualityScore() != null) {
                e.put("qualityScore", m.qualityScore().doubleValue());
            }
            if (m.error() != null) {
                e.put("error", m.error());
            }
            engines.put(e);
        }

        JSONObject json = new JSONObject()
                .put("runId", r.runId())
                .put("timestamp", r.timestamp().toString())
                .put("prompt", r.prompt())
                .put("models", engines)
                .put("totalCost", r.totalCost())
                .put("totalTimeMs", r.totalTimeMs())
                .put("successRate", r.successRate())
                .put("taskComplexity", r.taskComplexity());
        if (r.avgQualityScore() != null) {
            json.put("averageQualityScore", r.avgQualityScore().doubleValue());
        }
        if (r.context() != null) {
            json.put("context", new JSONObject()
                    .put("concurrent", r.context().concurrent())
                    .put("maxConcurrency", r.context().maxConcurrency())
                    .put("timeoutMs", r.context().timeoutMs())
                    .put("retries", r.context().retries()));
        }
        return json;
    }

    static PerformanceRecord fromJson(JSONObject json) {
        List<ModelPerformance> perEngine = new ArrayList<>();
        JSONArray engines = json.optJSONArray("models");
        if (engines != null) {
            for (int i = 0; i < engines.length(); i++) {
                JSONObject e = engines.getJSONObject(i);
                JSONObject u = e.optJSONObject("tokenUsage");
                TokenUsage usage = u == null ? null
                        : new TokenUsage(u.getInt("promptTokens"), u.getInt("completionTokens"), u.getInt("totalTokens"));
                perEngine.add(new ModelPerformance(
                        e.getString("engine"),
                        e.getString("model"),
                        e.getLong("executionTimeMs"),
                        usage,
                        e.getDouble("cost"),
                        e.has("qualityScore") ? e.getDouble("qualityScore") : null,
                        e.getBoolean("success"),
                        e.optString("error", null),
                        Instant.parse(e.getString("timestamp"))));
            }
        }
        JSONObject c = json.optJSONObject("context");
        RunContext context = c == null ? null
                : new RunContext(c.getBoolean("concurrent"), c.getInt("maxConcurrency"), c.getLong("timeoutMs"), c.getInt("retries"));
        return new PerformanceRecord(
                json.getString("runId"),
                Instant.parse(json.getString("timestamp")),
                json.optString("prompt", ""),
                perEngine,
                json.getDouble("totalCost"),
                json.getLong("totalTimeMs"),
                json.getDouble("successRate"),
                json.has("averageQualityScore") ? json.getDouble("averageQualityScore") : null,
                json.optInt("taskComplexity", 1),
                context);
    }
}
