package com.memory.graph.core;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes entity names for identity comparison.
 *
 * <p>Applies Unicode NFKC folding, lower-casing, whitespace collapsing and removal of
 * leading/trailing punctuation, so that "Paris", " paris " and "PARIS." compare equal.</p>
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$");

    private NameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String folded = Normalizer.normalize(name, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        String collapsed = WHITESPACE.matcher(folded.strip()).replaceAll(" ");
        return EDGE_PUNCTUATION.matcher(collapsed).replaceAll("");
    }
}
