package com.phillippitts.multishot.service.output;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;

import java.util.List;
import java.util.Map;

/**
 * Sink for runs whose output is not persisted.
 */
public final class NoopResultSink implements ResultSink {

    public static final NoopResultSink INSTANCE = new NoopResultSink();

    private NoopResultSink() {
    }

    @Override
    public void initialize() {
        // nothing to prepare
    }

    @Override
    public SinkReceipt saveResults(String runId, PromptRequest request, List<String> engineNames,
                                   Map<String, EngineResponse> results) {
        return SinkReceipt.NONE;
    }
}
