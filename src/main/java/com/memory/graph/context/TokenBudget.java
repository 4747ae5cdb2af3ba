package com.memory.graph.context;

/**
 * Token budget applied to entry text before it is handed to a provider.
 *
 * @param maxTokensPerSegment upper bound on the estimated tokens of one segment
 * @param maxSegments         number of segments kept; anything beyond is dropped
 */
public record TokenBudget(int maxTokensPerSegment, int maxSegments) {

    /**
     * Tokens set aside for the extraction prompt wrapped around the entry text.
     */
    public static final int PROMPT_RESERVE_TOKENS = 1024;

    public TokenBudget {
        if (maxTokensPerSegment <= 0) {
            throw new IllegalArgumentException("maxTokensPerSegment must be > 0");
        }
        if (maxSegments <= 0) {
            throw new IllegalArgumentException("maxSegments must be > 0");
        }
    }

    /**
     * Derives a budget from a model context window, keeping room for the prompt.
     */
    public static TokenBudget forContextWindow(int contextWindowTokens, int maxSegments) {
        int available = Math.max(1, contextWindowTokens - PROMPT_RESERVE_TOKENS);
        return new TokenBudget(available, maxSegments);
    }

    /**
     * Character allowance of one segment, saturated at {@link Integer#MAX_VALUE}.
     */
    public int maxCharsPerSegment() {
        long chars = (long) maxTokensPerSegment * ContextAssembler.CHARS_PER_TOKEN;
        return (int) Math.min(chars, Integer.MAX_VALUE);
    }
}
