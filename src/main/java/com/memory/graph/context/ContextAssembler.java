package com.memory.graph.context;

import com.memory.graph.core.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Fits entry text into a {@link TokenBudget}.
 *
 * <p>Text is split into sentences and packed greedily into segments no larger than the budget.
 * A sentence longer than the budget is split on word boundaries, or on characters if a single
 * word is still too long. Segments beyond {@link TokenBudget#maxSegments()} are dropped and the
 * result is flagged as truncated.</p>
 *
 * <p>Token counts are estimated at four characters per token.</p>
 */
public class ContextAssembler {

    static final int CHARS_PER_TOKEN = 4;

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\R+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public AssembledContext assemble(String text, TokenBudget budget) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Entry text must not be blank");
        }

        int maxChars = budget.maxCharsPerSegment();
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String sentence : SENTENCE_BOUNDARY.split(text.strip())) {
            String trimmed = sentence.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            for (String piece : splitOversized(trimmed, maxChars)) {
                int joinedLength = current.length() == 0 ? piece.length() : current.length() + 1 + piece.length();
                if (joinedLength > maxChars && current.length() > 0) {
                    segments.add(current.toString());
                    current.setLength(0);
                }
                if (current.length() > 0) {
                    current.append(' ');
                }
                current.append(piece);
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString());
        }

        boolean truncated = segments.size() > budget.maxSegments();
        if (truncated) {
            segments = new ArrayList<>(segments.subList(0, budget.maxSegments()));
        }
        return new AssembledContext(segments, truncated);
    }

    /**
     * Estimated token count of a piece of text.
     */
    public static int estimateTokens(String text) {
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    private List<String> splitOversized(String sentence, int maxChars) {
        if (sentence.length() <= maxChars) {
            return List.of(sentence);
        }
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : WHITESPACE.split(sentence)) {
            // a single word larger than the budget is cut into fixed-size chunks
            while (word.length() > maxChars) {
                if (current.length() > 0) {
                    pieces.add(current.toString());
                    current.setLength(0);
                }
                pieces.add(word.substring(0, maxChars));
                word = word.substring(maxChars);
            }
            if (word.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
                pieces.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }
}
