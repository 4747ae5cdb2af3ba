package com.memory.graph.context;

import com.memory.graph.core.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContextAssembler Tests")
class ContextAssemblerTest {

    private static final String THREE_SENTENCES = "Alice met Bob. Bob lives in Paris. Carol works at Acme.";

    private final ContextAssembler assembler = new ContextAssembler();

    @Test
    @DisplayName("Text within budget is one untruncated segment")
    void fitsInOneSegment() {
        AssembledContext context = assembler.assemble("Alice met Bob in Paris.", TokenBudget.forContextWindow(128_000, 1));

        assertEquals(List.of("Alice met Bob in Paris."), context.segments());
        assertFalse(context.truncated());
    }

    @Test
    @DisplayName("Blank text is rejected as malformed input")
    void blankTextRejected() {
        TokenBudget budget = new TokenBudget(100, 1);
        assertThrows(ValidationException.class, () -> assembler.assemble("   ", budget));
        assertThrows(ValidationException.class, () -> assembler.assemble(null, budget));
    }

    @Nested
    @DisplayName("Packing")
    class Packing {

        @Test
        @DisplayName("Sentences are packed into segments no larger than the budget")
        void packsBySentence() {
            // 5 tokens = 20 characters per segment
            AssembledContext context = assembler.assemble(THREE_SENTENCES, new TokenBudget(5, 3));

            assertEquals(List.of("Alice met Bob.", "Bob lives in Paris.", "Carol works at Acme."), context.segments());
            assertFalse(context.truncated());
        }

        @Test
        @DisplayName("Sentences that fit together share a segment")
        void joinsShortSentences() {
            AssembledContext context = assembler.assemble("Hi. Yo. Ok.", new TokenBudget(5, 1));

            assertEquals(List.of("Hi. Yo. Ok."), context.segments());
        }

        @Test
        @DisplayName("An oversized word is cut into budget-sized chunks")
        void cutsOversizedWord() {
            AssembledContext context = assembler.assemble("abcdefghij", new TokenBudget(1, 10));

            assertEquals(List.of("abcd", "efgh", "ij"), context.segments());
        }

        @Test
        @DisplayName("No segment exceeds the character budget")
        void segmentsRespectBudget() {
            String text = "The quick brown fox jumps over the lazy dog near the riverbank today.";
            TokenBudget budget = new TokenBudget(3, 50);

            AssembledContext context = assembler.assemble(text, budget);

            assertTrue(context.segments().size() > 1);
            context.segments().forEach(s -> assertTrue(s.length() <= budget.maxCharsPerSegment(), s));
        }
    }

    @Nested
    @DisplayName("Truncation")
    class Truncation {

        @Test
        @DisplayName("Segments beyond maxSegments are dropped and flagged")
        void dropsExtraSegments() {
            AssembledContext context = assembler.assemble(THREE_SENTENCES, new TokenBudget(5, 1));

            assertEquals(List.of("Alice met Bob."), context.segments());
            assertTrue(context.truncated());
        }
    }

    @Test
    @DisplayName("Tokens are estimated at four characters each, rounded up")
    void estimatesTokens() {
        assertEquals(2, ContextAssembler.estimateTokens("abcde"));
        assertEquals(1, ContextAssembler.estimateTokens("abcd"));
        assertEquals(0, ContextAssembler.estimateTokens(""));
    }

    @Test
    @DisplayName("A context window keeps room for the prompt")
    void budgetFromContextWindow() {
        TokenBudget budget = TokenBudget.forContextWindow(128_000, 2);

        assertEquals(128_000 - TokenBudget.PROMPT_RESERVE_TOKENS, budget.maxTokensPerSegment());
        assertEquals(2, budget.maxSegments());
    }
}
