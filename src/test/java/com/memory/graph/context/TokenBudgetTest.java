package com.memory.graph.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenBudget Tests")
class TokenBudgetTest {

    @Test
    @DisplayName("The prompt reserve is subtracted from the context window")
    void reservesPromptTokens() {
        TokenBudget budget = TokenBudget.forContextWindow(TokenBudget.PROMPT_RESERVE_TOKENS + 10, 2);

        assertEquals(10, budget.maxTokensPerSegment());
        assertEquals(10 * ContextAssembler.CHARS_PER_TOKEN, budget.maxCharsPerSegment());
    }

    @Test
    @DisplayName("Very large context windows saturate instead of overflowing")
    void saturatesCharacterAllowance() {
        TokenBudget budget = new TokenBudget(Integer.MAX_VALUE, 1);

        assertEquals(Integer.MAX_VALUE, budget.maxCharsPerSegment());
        assertEquals(Integer.MAX_VALUE, TokenBudget.forContextWindow(600_000_000, 1).maxCharsPerSegment());
    }

    @Test
    @DisplayName("A saturated budget still keeps the whole text")
    void saturatedBudgetAssembles() {
        AssembledContext context = new ContextAssembler()
                .assemble("Alice met Bob in Paris.", new TokenBudget(Integer.MAX_VALUE, 1));

        assertEquals(List.of("Alice met Bob in Paris."), context.segments());
        assertFalse(context.truncated());
    }

    @Test
    @DisplayName("Non-positive limits are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBudget(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenBudget(1, 0));
    }
}
