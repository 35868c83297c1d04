package com.phillippitts.multishot.service.engine;

import com.phillippitts.multishot.domain.TokenUsage;

/**
 * Raw reply of a completion transport.
 *
 * @param content    generated text
 * @param tokenUsage token accounting (nullable when the backend does not report it)
 */
public record Completion(String content, TokenUsage tokenUsage) {

    public static Completion of(String content) {
        return new Completion(content, null);
    }
}
