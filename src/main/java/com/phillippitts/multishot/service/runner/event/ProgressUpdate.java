package com.phillippitts.multishot.service.runner.event;

import com.phillippitts.multishot.domain.EngineResponse;

/**
 * Progress notification emitted while a run executes.
 *
 * @param runId      run the update belongs to
 * @param engineName engine the update is about
 * @param status     dispatch state transition
 * @param result     terminal response (COMPLETED/FAILED only)
 * @param error      failure or retry cause (RETRYING/FAILED only)
 * @param completed  engines with a terminal outcome so far
 * @param total      engines in the run
 */
public record ProgressUpdate(
        String runId,
        String engineName,
        Status status,
        EngineResponse result,
        String error,
        int completed,
        int total
) {

    public enum Status { STARTED, RETRYING, COMPLETED, FAILED }

    /**
     * Share of engines with a terminal outcome, 0-100.
     */
    public int percentage() {
        return total == 0 ? 100 : Math.round(completed * 100f / total);
    }
}
