package com.phillippitts.multishot.service.runner.event;

import com.phillippitts.multishot.domain.RunResult;

import java.time.Instant;

/**
 * Emitted when a run has produced its result (after metrics and output).
 *
 * @param result    the run result
 * @param timestamp when the run finished
 */
public record RunCompletedEvent(RunResult result, Instant timestamp) {}
