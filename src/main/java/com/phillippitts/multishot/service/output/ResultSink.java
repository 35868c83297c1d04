package com.phillippitts.multishot.service.output;

import com.phillippitts.multishot.domain.EngineResponse;
import com.phillippitts.multishot.domain.PromptRequest;
import com.phillippitts.multishot.exception.ResultSinkException;

import java.util.List;
import java.util.Map;

/**
 * Persists the outcome of a run.
 *
 * <p>The runner calls {@link #initialize()} before dispatching and
 * {@link #saveResults(String, PromptRequest, List, Map)} once all engines have settled. A sink
 * failure never changes the run's success flag; the runner records it in the run's errors.
 */
public interface ResultSink {

    /**
     * Prepares the sink (create directories, prune old output).
     *
     * @throws ResultSinkException if the sink cannot be prepared
     */
    void initialize();

    /**
     * Stores the results of one run.
     *
     * @param runId       run identifier
     * @param request     the request every engine received
     * @param engineNames engines of the run, in caller order
     * @param results     terminal responses; may hold fewer entries than {@code engineNames}
     * @return where the results went
     * @throws ResultSinkException if writing fails
     */
    SinkReceipt saveResults(String runId, PromptRequest request, List<String> engineNames,
                            Map<String, EngineResponse> results);
}
