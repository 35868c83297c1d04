package com.phillippitts.multishot.service.events;

import com.phillippitts.multishot.domain.RunResult;
import com.phillippitts.multishot.service.runner.event.ProgressUpdate;
import com.phillippitts.multishot.service.runner.event.RunCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs run progress and user-facing failure hints. Repeated hints are throttled to avoid log spam.
 */
@Component
class RunEventsListener {
    private static final Logger LOG = LogManager.getLogger(RunEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onProgress(ProgressUpdate u) {
        LOG.debug("[{}] {} {} ({}%)", u.runId(), u.engineName(), u.status(), u.percentage());
        if (u.status() != ProgressUpdate.Status.FAILED || u.error() == null) {
            return;
        }
        String error = u.error();
        if (error.contains("API key not configured") && shouldLog("api-key-" + u.engineName())) {
            LOG.warn("Engine {} has no API key. Set multishot.engines.api-keys.<vendor>.", u.engineName());
        } else if (error.contains("No completion transport") && shouldLog("transport-" + u.engineName())) {
            LOG.warn("Engine {} has no completion transport registered; declare a TransportBinding bean for it.",
                    u.engineName());
        } else if (error.contains("timed out after") && shouldLog("timeout-" + u.engineName())) {
            LOG.warn("Engine {} is timing out. Consider raising multishot.runner.timeout-ms.", u.engineName());
        }
    }

    @EventListener
    void onRunCompleted(RunCompletedEvent e) {
        RunResult r = e.result();
        if (!r.success() && shouldLog("all-failed")) {
            LOG.warn("Run {} produced no successful response ({} engines failed)", r.runId(), r.failureCount());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
