package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.service.runner.event.ProgressUpdate;

/**
 * Receives progress updates from a running {@link PromptRunner}.
 *
 * <p>Called from dispatch threads, possibly concurrently. Implementations must be thread-safe
 * and fast; an exception thrown here is logged and otherwise ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = update -> { };

    void onProgress(ProgressUpdate update);
}
