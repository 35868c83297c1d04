package com.phillippitts.multishot.service.output;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.TokenUsage;
import com.phillippitts.multishot.exception.ResultSinkException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FolderResultSinkTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:30:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path base;

    private static Map<String, EngineResponse> results() {
        Map<String, EngineResponse> results = new LinkedHashMap<>();
        results.put("gpt-4o", EngineResponse.success("B-trees keep keys sorted.", "gpt-4o", "gpt-4o", 1500,
                TokenUsage.of(20, 8)));
        results.put("qwen2.5:0.5b", EngineResponse.failure("connection refused", "qwen2.5:0.5b", "qwen2.5:0.5b", 3));
        return results;
    }

    @Test
    void writesResultMetadataAndComparisonFiles() throws IOException {
        FolderResultSink sink = new FolderResultSink(base, false, 7, CLOCK);
        PromptRequest request = new PromptRequest("Explain database indexes", "be brief", Map.of("ticket", "42"));

        sink.initialize();
        SinkReceipt receipt = sink.saveResults("run-1", request, List.of("gpt-4o", "qwen2.5:0.5b"), results());

        Path runDir = Path.of(receipt.location());
        assertThat(runDir.getFileName().toString()).isEqualTo("2024-05-10_12-30_db-explain-indexes");
        assertThat(receipt.files()).containsExactly(
                "gpt-4o-result.md", "qwen2.5_0.5b-result.md", "metadata.json", "comparison.md");

        String gpt = Files.readString(runDir.resolve("gpt-4o-result.md"));
        assertThat(gpt).contains("# Multi-Shot Result: gpt-4o")
                .contains("B-trees keep keys sorted.")
                .contains("## System Prompt")
                .contains("- **Total Tokens**: 28");
        assertThat(Files.readString(runDir.resolve("qwen2.5_0.5b-result.md")))
                .contains("**Error**: connection refused");

        JSONObject meta = new JSONObject(Files.readString(runDir.resolve("metadata.json")));
        assertThat(meta.getString("runId")).isEqualTo("run-1");
        assertThat(meta.getString("systemPrompt")).isEqualTo("be brief");
        assertThat(meta.getJSONObject("metadata").getString("ticket")).isEqualTo("42");
        assertThat(meta.getJSONArray("engines").length()).isEqualTo(2);
        JSONObject summary = meta.getJSONObject("summary");
        assertThat(summary.getInt("successCount")).isEqualTo(1);
        assertThat(summary.getInt("errorCount")).isEqualTo(1);
        assertThat(summary.getLong("totalExecutionTime")).isEqualTo(1503);

        assertThat(Files.readString(runDir.resolve("comparison.md")))
                .contains("**Successful**: 1")
                .contains("### gpt-4o (gpt-4o)")
                .contains("**Execution Time**: 1.5s")
                .contains("### qwen2.5:0.5b - ERROR");
    }

    @Test
    void sameMinuteRunsGetDistinctFolders() {
        FolderResultSink sink = new FolderResultSink(base, false, 7, CLOCK);
        PromptRequest request = PromptRequest.of("Explain database indexes");

        SinkReceipt first = sink.saveResults("run-1", request, List.of("gpt-4o"), results());
        SinkReceipt second = sink.saveResults("run-2", request, List.of("gpt-4o"), results());

        assertThat(second.location()).isEqualTo(first.location() + "-2");
    }

    @Test
    void cleanupRemovesOnlyOldRunFolders() throws IOException {
        Files.createDirectories(base.resolve("2024-04-01_10-00_old-topic").resolve("nested"));
        Files.writeString(base.resolve("2024-04-01_10-00_old-topic").resolve("nested").resolve("a.md"), "x");
        Files.createDirectories(base.resolve("2024-05-09_10-00_recent-topic"));
        Files.createDirectories(base.resolve("keep-me"));
        FolderResultSink sink = new FolderResultSink(base, true, 7, CLOCK);

        sink.initialize();

        assertThat(base.resolve("2024-04-01_10-00_old-topic")).doesNotExist();
        assertThat(base.resolve("2024-05-09_10-00_recent-topic")).exists();
        assertThat(base.resolve("keep-me")).exists();
    }

    @Test
    void initializeFailsWhenBaseIsAFile() throws IOException {
        Path file = Files.writeString(base.resolve("occupied"), "not a directory");
        FolderResultSink sink = new FolderResultSink(file, false, 7, CLOCK);

        assertThatThrownBy(sink::initialize)
                .isInstanceOf(ResultSinkException.class)
                .hasMessageContaining("occupied");
    }

    @Test
    void safeFileNameReplacesPathCharacters() {
        assertThat(FolderResultSink.safeFileName("org/model:7b")).isEqualTo("org_model_7b");
    }

    @Test
    void collidingEngineFileNamesGetSuffixes() throws IOException {
        FolderResultSink sink = new FolderResultSink(base, false, 7, CLOCK);
        Map<String, EngineResponse> results = new LinkedHashMap<>();
        results.put("a/b", EngineResponse.success("slash", "m1", "a/b", 10, null));
        results.put("a_b", EngineResponse.success("underscore", "m2", "a_b", 10, null));
        results.put("A_B", EngineResponse.success("upper", "m3", "A_B", 10, null));

        SinkReceipt receipt = sink.saveResults("run-9", PromptRequest.of("Compare queues"),
                List.of("a/b", "a_b", "A_B"), results);

        Path runDir = Path.of(receipt.location());
        assertThat(receipt.files()).containsExactly(
                "a_b-result.md", "a_b-2-result.md", "A_B-3-result.md", "metadata.json", "comparison.md");
        assertThat(Files.readString(runDir.resolve("a_b-result.md"))).contains("slash");
        assertThat(Files.readString(runDir.resolve("a_b-2-result.md"))).contains("underscore");
        assertThat(Files.readString(runDir.resolve("A_B-3-result.md"))).contains("upper");
    }

    @Test
    void uniqueFileNameKeepsFirstNameAndNumbersRepeats() {
        Set<String> used = new HashSet<>();

        assertThat(FolderResultSink.uniqueFileName("gpt-4o", used)).isEqualTo("gpt-4o");
        assertThat(FolderResultSink.uniqueFileName("gpt-4o", used)).isEqualTo("gpt-4o-2");
        assertThat(FolderResultSink.uniqueFileName("GPT-4O", used)).isEqualTo("GPT-4O-3");
        assertThat(FolderResultSink.uniqueFileName("claude", used)).isEqualTo("claude");
    }

    @Test
    void concurrentSameMinuteRunsNeverShareAFolder() throws Exception {
        FolderResultSink sink = new FolderResultSink(base, false, 7, CLOCK);
        int runs = 8;
        ExecutorService pool = Executors.newFixedThreadPool(runs);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SinkReceipt>> futures = new ArrayList<>();
            for (int i = 0; i < runs; i++) {
                String runId = "run-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return sink.saveResults(runId, PromptRequest.of("Explain database indexes"),
                            List.of("gpt-4o", "qwen2.5:0.5b"), results());
                }));
            }
            start.countDown();

            Set<String> locations = new HashSet<>();
            for (Future<SinkReceipt> f : futures) {
                locations.add(f.get(5, TimeUnit.SECONDS).location());
            }
            assertThat(locations).hasSize(runs);
            for (String location : locations) {
                String runId = new JSONObject(Files.readString(Path.of(location, "metadata.json"))).getString("runId");
                assertThat(Files.readString(Path.of(location, "gpt-4o-result.md"))).contains(runId);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
