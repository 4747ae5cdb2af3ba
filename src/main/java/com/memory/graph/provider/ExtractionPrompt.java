package com.memory.graph.provider;

import com.memory.graph.core.model.EntityKind;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Prompt text shared by the model-backed providers.
 */
public final class ExtractionPrompt {

    private static final String ALLOWED_KINDS = Arrays.stream(EntityKind.values())
            .filter(EntityKind::isExtractable)
            .map(EntityKind::name)
            .collect(Collectors.joining(", "));

    private static final String INSTRUCTIONS = """
            You extract a knowledge graph from personal memory notes.
            Return ONLY a JSON object, with no prose and no Markdown, shaped exactly as:
            {"entities":[{"name":"...","kind":"...","summary":"..."}],
             "relations":[{"source":"...","target":"...","kind":"...","confidence":0.0}]}
            Rules:
            - "kind" of an entity is one of: %s.
            - "summary" is one short sentence about the entity taken from the note.
            - "source" and "target" of a relation must be names listed in "entities".
            - Relation "kind" is an UPPER_SNAKE_CASE verb phrase such as MET, VISITED, WORKS_AT.
            - "confidence" is a number between 0 and 1.
            - Use empty arrays when nothing can be extracted.
            """.formatted(ALLOWED_KINDS);

    private ExtractionPrompt() {
    }

    /**
     * Instructions for providers that accept a separate system prompt.
     */
    public static String systemInstructions() {
        return INSTRUCTIONS;
    }

    public static String userMessage(String text) {
        return "Note:\n\"\"\"\n" + text + "\n\"\"\"";
    }

    /**
     * Single prompt combining instructions and the note, for completion-style APIs.
     */
    public static String combined(String text) {
        return INSTRUCTIONS + "\n" + userMessage(text);
    }
}
