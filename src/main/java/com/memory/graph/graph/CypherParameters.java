package com.memory.graph.graph;

import java.util.Collection;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines {@code $name} placeholders as Cypher literals.
 *
 * <p>Placeholders are matched as whole identifiers, so {@code $name} never rewrites part of
 * {@code $normalizedName}. Strings are quoted and escaped; collections become list literals.
 * A placeholder without a value is left untouched.</p>
 */
final class CypherParameters {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private CypherParameters() {
    }

    static String render(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return query;
        }
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? literal(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> collection) {
            StringBuilder list = new StringBuilder("[");
            boolean first = true;
            for (Object element : collection) {
                if (!first) {
                    list.append(", ");
                }
                list.append(literal(element));
                first = false;
            }
            return list.append(']').toString();
        }
        return quote(value.toString());
    }

    private static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> quoted.append("\\\\");
                case '\'' -> quoted.append("\\'");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('\'').toString();
    }
}
