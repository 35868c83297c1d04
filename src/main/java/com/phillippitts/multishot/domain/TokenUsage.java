package com.phillippitts.multishot.domain;

/**
 * Token accounting reported by a backend for a single completion.
 */
public record TokenUsage(
        int promptTokens,
        int completionTokens,
        int totalTokens
) {
    public TokenUsage {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("token counts must be >= 0");
        }
    }

    /**
     * Builds usage from prompt and completion counts, deriving the total.
     */
    public static TokenUsage of(int promptTokens, int completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
