package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.service.runner.event.ProgressUpdate;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Forwards progress updates to the Spring event bus.
 */
public final class PublishingProgressListener implements ProgressListener {

    private final ApplicationEventPublisher publisher;

    public PublishingProgressListener(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void onProgress(ProgressUpdate update) {
        publisher.publishEvent(update);
    }
}
