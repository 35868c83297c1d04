package com.phillippitts.multishot.presentation.controller;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.domain.RunResult;
import com.phillippitts.multishot.domain.TokenUsage;
import com.phillippitts.multishot.exception.InvalidPromptException;
import com.phillippitts.multishot.service.runner.MultiShotService;
import com.phillippitts.multishot.service.runner.RunOptions;
import com.phillippitts.multishot.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP entry point for runs and engine status.
 */
@RestController
@RequestMapping("/api")
class RunController {

    private static final Logger LOG = LogManager.getLogger(RunController.class);

    private final MultiShotService service;

    RunController(MultiShotService service) {
        this.service = service;
    }

    @PostMapping("/runs")
    ResponseEntity<RunResponse> run(@Valid @RequestBody RunRequest body) {
        LOG.info("Run requested: engines={}, prompt='{}'", body.engines(), LogSanitizer.preview(body.prompt(), 60));
        PromptRequest request = new PromptRequest(body.prompt(), body.systemPrompt(), checkedMetadata(body.metadata()));
        RunOptions options = new RunOptions(body.concurrent(), body.maxConcurrency(), body.timeoutMs(),
                body.retries(), body.continueOnError(), body.saveOutput());
        RunResult result = service.run(request, body.engines(), options);
        return ResponseEntity.ok(RunResponse.from(result));
    }

    /**
     * JSON allows {@code null} map values; the request model does not.
     */
    static Map<String, String> checkedMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            return null;
        }
        for (Map.Entry<String, String> e : metadata.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new InvalidPromptException("metadata entry '" + e.getKey() + "' must not be null");
            }
        }
        return metadata;
    }

    @GetMapping("/engines/status")
    ResponseEntity<Map<String, Boolean>> engineStatus(@RequestParam(name = "names", required = false) List<String> names) {
        return ResponseEntity.ok(service.engineStatus(names));
    }

    /**
     * Body of {@code POST /api/runs}. Policy fields are optional overrides.
     */
    record RunRequest(
            @NotBlank(message = "prompt must not be blank") String prompt,
            String systemPrompt,
            List<String> engines,
            Map<String, String> metadata,
            Boolean concurrent,
            @Min(value = 1, message = "maxConcurrency must be at least 1") Integer maxConcurrency,
            @PositiveOrZero Long timeoutMs,
            @PositiveOrZero Integer retries,
            Boolean continueOnError,
            Boolean saveOutput
    ) {}

    record EngineResult(String engine, String model, boolean success, String content, String error,
                        long executionTimeMs, TokenUsage tokenUsage) {
        static EngineResult from(EngineResponse r) {
            return new EngineResult(r.engine(), r.model(), r.isSuccess(), r.content(), r.error(),
                    r.executionTimeMs(), r.tokenUsage());
        }
    }

    record RunResponse(boolean success, String runId, long executionTimeMs, long successCount, long failureCount,
                       List<EngineResult> results, List<String> errors, String outputLocation) {
        static RunResponse from(RunResult r) {
            List<EngineResult> results = r.results().values().stream().map(EngineResult::from).toList();
            return new RunResponse(r.success(), r.runId(), r.executionTimeMs(), r.successCount(), r.failureCount(),
                    results, r.errors(), r.outputLocation());
        }
    }
}
