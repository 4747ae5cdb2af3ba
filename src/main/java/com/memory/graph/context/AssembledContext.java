package com.memory.graph.context;

import java.util.List;

/**
 * Output of the {@link ContextAssembler}: the segments to extract from and whether text was dropped.
 */
public record AssembledContext(List<String> segments, boolean truncated) {

    public AssembledContext {
        segments = segments != null ? List.copyOf(segments) : List.of();
    }

    public int estimatedTokens() {
        return segments.stream().mapToInt(ContextAssembler::estimateTokens).sum();
    }
}
