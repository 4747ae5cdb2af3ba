package com.memory.graph.pipeline;

import com.memory.graph.core.NameNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidates read from one provider response.
 */
public record ParsedExtraction(List<CandidateEntity> entities, List<CandidateRelation> relations) {

    public ParsedExtraction {
        entities = List.copyOf(entities);
        relations = List.copyOf(relations);
    }

    /**
     * Concatenates the candidates of several segments, keeping the first occurrence of each
     * entity (kind, name) pair and of each relation triple.
     */
    public static ParsedExtraction combine(List<ParsedExtraction> parts) {
        Map<String, CandidateEntity> entities = new LinkedHashMap<>();
        Map<String, CandidateRelation> relations = new LinkedHashMap<>();
        for (ParsedExtraction part : parts) {
            for (CandidateEntity entity : part.entities()) {
                entities.putIfAbsent(entity.kind() + ":" + NameNormalizer.normalize(entity.name()), entity);
            }
            for (CandidateRelation relation : part.relations()) {
                String key = NameNormalizer.normalize(relation.source()) + "|" + relation.kind()
                        + "|" + NameNormalizer.normalize(relation.target());
                relations.putIfAbsent(key, relation);
            }
        }
        return new ParsedExtraction(new ArrayList<>(entities.values()), new ArrayList<>(relations.values()));
    }
}
