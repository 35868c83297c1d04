package com.phillippitts.multishot.service.output;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.exception.ResultSinkException;
import com.phillippitts.multishot.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Writes each run into its own timestamped folder under a base directory.
 *
 * <p>Layout of one run folder:
 * <pre>
 * 2025-08-10_14-05_react-auth/
 *   gpt-4o-mini-result.md
 *   claude-haiku-result.md
 *   metadata.json
 *   comparison.md
 * </pre>
 *
 * <p>{@link #initialize()} creates the base directory and, when cleanup is enabled, deletes run
 * folders older than the configured age. Folders are dated from their name, or from their
 * modification time when the name carries no timestamp.
 */
public class FolderResultSink implements ResultSink {

    private static final Logger LOG = LogManager.getLogger(FolderResultSink.class);

    static final String METADATA_FILE = "metadata.json";
    static final String COMPARISON_FILE = "comparison.md";
    static final String RESULT_SUFFIX = "-result.md";

    private final Path baseDir;
    private final boolean cleanupOld;
    private final int maxAgeDays;
    private final Clock clock;

    public FolderResultSink(Path baseDir, boolean cleanupOld, int maxAgeDays) {
        this(baseDir, cleanupOld, maxAgeDays, Clock.systemDefaultZone());
    }

    FolderResultSink(Path baseDir, boolean cleanupOld, int maxAgeDays, Clock clock) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.cleanupOld = cleanupOld;
        this.maxAgeDays = maxAgeDays;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public void initialize() {
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new ResultSinkException(baseDir.toString(), e);
        }
        if (cleanupOld && maxAgeDays > 0) {
            int removed = cleanupOlderThan(maxAgeDays);
            if (removed > 0) {
                LOG.info("Removed {} run folder(s) older than {} days from {}", removed, maxAgeDays, baseDir);
            }
        }
    }

    @Override
    public SinkReceipt saveResults(String runId, PromptRequest request, List<String> engineNames,
                                   Map<String, EngineResponse> results) {
        Instant now = clock.instant();
        String folder = FolderNames.folderName(request.prompt(), LocalDateTime.ofInstant(now, clock.getZone()));
        Path runDir = baseDir.resolve(folder);
        List<String> files = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        try {
            runDir = createRunDir(folder);
            for (Map.Entry<String, EngineResponse> e : results.entrySet()) {
                String file = uniqueFileName(safeFileName(e.getKey()), usedNames) + RESULT_SUFFIX;
                Files.writeString(runDir.resolve(file), formatResult(runId, now, request, e.getValue()));
                files.add(file);
            }
            Files.writeString(runDir.resolve(METADATA_FILE), metadata(runId, now, request, engineNames, results).toString(2));
            files.add(METADATA_FILE);
            Files.writeString(runDir.resolve(COMPARISON_FILE), comparison(runId, now, request, results));
            files.add(COMPARISON_FILE);
        } catch (IOException e) {
            throw new ResultSinkException(runDir.toString(), e);
        }
        LOG.info("Results saved to {}", runDir);
        return new SinkReceipt(runDir.toString(), files);
    }

    /**
     * Deletes run folders older than the given number of days.
     *
     * @return number of folders removed
     */
    int cleanupOlderThan(int days) {
        Instant cutoff = clock.instant().minusSeconds(days * 86_400L);
        int removed = 0;
        try (Stream<Path> entries = Files.list(baseDir)) {
            for (Path dir : (Iterable<Path>) entries.filter(Files::isDirectory)::iterator) {
                Optional<Instant> created = folderTimestamp(dir);
                if (created.isPresent() && created.get().isBefore(cutoff)) {
                    deleteRecursively(dir);
                    removed++;
                }
            }
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Failed to clean up old run folders in {}: {}", baseDir, e.getMessage());
        }
        return removed;
    }

    private Optional<Instant> folderTimestamp(Path dir) throws IOException {
        String name = dir.getFileName().toString();
        Optional<LocalDateTime> parsed = FolderNames.parseTimestamp(name);
        if (parsed.isPresent()) {
            return Optional.of(parsed.get().atZone(clock.getZone()).toInstant());
        }
        if (name.startsWith("run-")) {
            FileTime modified = Files.getLastModifiedTime(dir);
            return Optional.of(modified.toInstant());
        }
        return Optional.empty();
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }

    /**
     * Creates a new run folder, adding a numeric suffix until the name is unclaimed. Creation is
     * atomic, so concurrent runs never share a folder.
     */
    private Path createRunDir(String name) throws IOException {
        Files.createDirectories(baseDir);
        for (int n = 1; ; n++) {
            Path candidate = baseDir.resolve(n == 1 ? name : name + "-" + n);
            try {
                return Files.createDirectory(candidate);
            } catch (FileAlreadyExistsException e) {
                LOG.debug("Run folder {} already exists", candidate);
            }
        }
    }

    /**
     * Distinct engine names may sanitize to the same file name; later ones get a numeric suffix.
     * Names are compared case-insensitively for case-insensitive file systems.
     */
    static String uniqueFileName(String base, Set<String> used) {
        String name = base;
        for (int n = 2; !used.add(name.toLowerCase(Locale.ROOT)); n++) {
            name = base + "-" + n;
        }
        return name;
    }

    static String safeFileName(String engineName) {
        return engineName.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String formatResult(String runId, Instant timestamp, PromptRequest request, EngineResponse r) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Multi-Shot Result: ").append(r.engine()).append("\n\n");
        sb.append("## Run Information\n");
        sb.append("- **Run ID**: ").append(runId).append('\n');
        sb.append("- **Timestamp**: ").append(timestamp).append('\n');
        sb.append("- **Engine**: ").append(r.engine()).append(" (").append(r.model()).append(")\n");
        sb.append("- **Execution Time**: ").append(r.executionTimeMs()).append("ms\n\n");
        sb.append("## Original Prompt\n```\n").append(request.prompt()).append("\n```\n\n");
        if (request.hasSystemPrompt()) {
            sb.append("## System Prompt\n```\n").append(request.systemPrompt()).append("\n```\n\n");
        }
        sb.append("## Response\n");
        sb.append(r.isSuccess() ? r.content() : "**Error**: " + r.error()).append("\n");
        if (r.hasTokenUsage()) {
            sb.append("\n## Token Usage\n");
            sb.append("- **Prompt Tokens**: ").append(r.tokenUsage().promptTokens()).append('\n');
            sb.append("- **Completion Tokens**: ").append(r.tokenUsage().completionTokens()).append('\n');
            sb.append("- **Total Tokens**: ").append(r.tokenUsage().totalTokens()).append('\n');
        }
        return sb.toString();
    }

    private static JSONObject metadata(String runId, Instant timestamp, PromptRequest request,
                                       List<String> engineNames, Map<String, EngineResponse> results) {
        long ok = results.values().stream().filter(EngineResponse::isSuccess).count();
        long totalTime = results.values().stream().mapToLong(EngineResponse::executionTimeMs).sum();

        JSONObject summary = new JSONObject()
                .put("totalEngines", results.size())
                .put("successCount", ok)
                .put("errorCount", results.size() - ok)
                .put("totalExecutionTime", totalTime);

        JSONObject json = new JSONObject()
                .put("runId", runId)
                .put("timestamp", timestamp.toString())
                .put("prompt", request.prompt())
                .put("engines", new JSONArray(engineNames))
                .put("summary", summary);
        if (request.hasSystemPrompt()) {
            json.put("systemPrompt", request.systemPrompt());
        }
        if (!request.metadata().isEmpty()) {
            json.put("metadata", new JSONObject(request.metadata()));
        }
        return json;
    }

    private static String comparison(String runId, Instant timestamp, PromptRequest request,
                                     Map<String, EngineResponse> results) {
        List<EngineResponse> ok = results.values().stream().filter(EngineResponse::isSuccess).toList();
        List<EngineResponse> failed = results.values().stream().filter(r -> !r.isSuccess()).toList();

        StringBuilder sb = new StringBuilder("# Multi-Shot Comparison\n\n");
        sb.append("**Run ID**: ").append(runId).append("  \n");
        sb.append("**Timestamp**: ").append(timestamp).append("  \n");
        sb.append("**Total Engines**: ").append(results.size()).append("  \n");
        sb.append("**Successful**: ").append(ok.size()).append("  \n");
        sb.append("**Failed**: ").append(failed.size()).append("\n\n");
        sb.append("## Original Prompt\n```\n").append(request.prompt()).append("\n```\n\n");

        if (!ok.isEmpty()) {
            sb.append("## Successful Results\n\n");
            for (EngineResponse r : ok) {
                sb.append("### ").append(r.engine()).append(" (").append(r.model()).append(")\n");
                sb.append("**Execution Time**: ").append(TimeUtils.formatDuration(r.executionTimeMs())).append("\n\n");
                sb.append(r.content()).append("\n\n---\n\n");
            }
        }
        if (!failed.isEmpty()) {
            sb.append("## Failed Results\n\n");
            for (EngineResponse r : failed) {
                sb.append("### ").append(r.engine()).append(" - ERROR\n");
                sb.append("**Error**: ").append(r.error()).append("  \n");
                sb.append("**Execution Time**: ").append(TimeUtils.formatDuration(r.executionTimeMs())).append("\n\n");
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "FolderResultSink[" + baseDir + "]";
    }
}
