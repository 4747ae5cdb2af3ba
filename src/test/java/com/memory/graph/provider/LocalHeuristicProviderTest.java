package com.memory.graph.provider;

import com.memory.graph.core.model.EntityKind;
import com.memory.graph.pipeline.CandidateEntity;
import com.memory.graph.pipeline.CandidateRelation;
import com.memory.graph.pipeline.ExtractionOutputParser;
import com.memory.graph.pipeline.ParsedExtraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalHeuristicProvider Tests")
class LocalHeuristicProviderTest {

    private final LocalHeuristicProvider provider = new LocalHeuristicProvider();
    private final ExtractionOutputParser parser = new ExtractionOutputParser();
    private final ProviderConfig config = ProviderConfig.defaults();

    private ParsedExtraction extract(String text) throws Exception {
        return parser.parse(provider.extract(text, config));
    }

    private static EntityKind kindOf(ParsedExtraction parsed, String name) {
        return parsed.entities().stream()
                .filter(e -> e.name().equals(name))
                .map(CandidateEntity::kind)
                .findFirst()
                .orElseThrow(() -> new AssertionError("no entity " + name));
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("Capitalized names become people, known places become locations")
        void peopleAndPlaces() throws Exception {
            ParsedExtraction parsed = extract("Alice met Bob in Paris.");

            assertEquals(List.of("Alice", "Bob", "Paris"),
                    parsed.entities().stream().map(CandidateEntity::name).toList());
            assertEquals(EntityKind.PERSON, kindOf(parsed, "Alice"));
            assertEquals(EntityKind.PERSON, kindOf(parsed, "Bob"));
            assertEquals(EntityKind.LOCATION, kindOf(parsed, "Paris"));
        }

        @Test
        @DisplayName("Employment context and suffixes mark organizations")
        void organizations() throws Exception {
            assertEquals(EntityKind.ORGANIZATION, kindOf(extract("Carol works at Acme."), "Acme"));
            assertEquals(EntityKind.ORGANIZATION, kindOf(extract("Dan studied at Oxford University."), "Oxford University"));
        }

        @Test
        @DisplayName("Event suffixes mark events")
        void events() throws Exception {
            assertEquals(EntityKind.EVENT, kindOf(extract("Erin went to the Jazz Festival."), "Jazz Festival"));
        }

        @Test
        @DisplayName("Leading stopwords are stripped from a phrase")
        void stripsLeadingStopwords() throws Exception {
            ParsedExtraction parsed = extract("Yesterday Alice called.");

            assertEquals(List.of("Alice"), parsed.entities().stream().map(CandidateEntity::name).toList());
        }

        @Test
        @DisplayName("The sentence is used as summary")
        void summaryIsSentence() throws Exception {
            ParsedExtraction parsed = extract("Alice met Bob. Bob likes tea.");

            assertEquals("Alice met Bob.", parsed.entities().get(0).summary());
        }

        @Test
        @DisplayName("Text without names yields an empty extraction")
        void noNames() throws Exception {
            ParsedExtraction parsed = extract("nothing to see here.");

            assertTrue(parsed.entities().isEmpty());
            assertTrue(parsed.relations().isEmpty());
        }
    }

    @Nested
    @DisplayName("Relations")
    class Relations {

        @Test
        @DisplayName("The subject is related to each later entity in the sentence")
        void subjectRelations() throws Exception {
            ParsedExtraction parsed = extract("Alice met Bob in Paris.");

            assertEquals(List.of(
                    new CandidateRelation("Alice", "Bob", "MET", LocalHeuristicProvider.HEURISTIC_CONFIDENCE),
                    new CandidateRelation("Alice", "Paris", "LOCATED_IN", LocalHeuristicProvider.HEURISTIC_CONFIDENCE)
            ), parsed.relations());
        }

        @Test
        @DisplayName("The keyword closest to the object wins, longer phrase on a tie")
        void relationKindSelection() {
            assertEquals("VISITED", LocalHeuristicProvider.relationKind(" visited "));
            assertEquals("WORKS_AT", LocalHeuristicProvider.relationKind(" works at "));
            assertEquals("LOCATED_IN", LocalHeuristicProvider.relationKind(" met bob in "));
            assertEquals("LIVES_IN", LocalHeuristicProvider.relationKind(" lives in "));
            assertEquals(LocalHeuristicProvider.DEFAULT_RELATION, LocalHeuristicProvider.relationKind(" and "));
        }
    }

    @Test
    @DisplayName("Output is deterministic")
    void deterministic() {
        String text = "Alice met Bob in Paris. Carol works at Acme.";
        assertEquals(provider.extract(text, config), provider.extract(text, config));
    }

    @Test
    void identifiesAsLocal() {
        assertEquals(ProviderKind.LOCAL, provider.getKind());
        assertEquals("local-heuristic", provider.getProviderName());
    }
}
