package com.memory.graph.graph;

import com.memory.graph.core.NotFoundException;
import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.core.model.Relation;
import com.memory.graph.resolution.EntityMutation;
import com.memory.graph.resolution.MutationPlan;
import com.memory.graph.resolution.RelationMutation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryGraphRepository Tests")
class InMemoryGraphRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryGraphRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryGraphRepository();
    }

    private static Entity entity(String id, EntityKind kind, String name, String summary, int minute) {
        Instant at = T0.plusSeconds(60L * minute);
        return Entity.builder()
                .id(id).kind(kind).name(name).normalizedName(name.toLowerCase())
                .summary(summary).addSourceEntryId("e1").createdAt(at).updatedAt(at)
                .build();
    }

    private static Relation relation(String id, String source, String target, String kind) {
        return Relation.builder()
                .id(id).sourceId(source).targetId(target).kind(kind).sourceEntryId("e1").createdAt(T0).build();
    }

    private void create(Entity... entities) {
        repository.apply(new MutationPlan("e1",
                Arrays.stream(entities).map(EntityMutation::create).toList(), List.of()));
    }

    @Nested
    @DisplayName("Atomic apply")
    class Atomicity {

        @Test
        @DisplayName("A plan with a bad relation leaves nothing behind")
        void failedPlanLeavesNoTrace() {
            Entity alice = entity("a", EntityKind.PERSON, "Alice", null, 0);
            MutationPlan plan = new MutationPlan("e1",
                    List.of(EntityMutation.create(alice)),
                    List.of(RelationMutation.create(relation("r", "a", "missing", "KNOWS"))));

            StoreException e = assertThrows(StoreException.class, () -> repository.apply(plan));

            assertEquals(StoreErrorKind.CONSTRAINT_VIOLATION, e.getKind());
            assertEquals(0, repository.countEntities());
            assertTrue(repository.findEntity(EntityKind.PERSON, "alice").isEmpty());
        }

        @Test
        @DisplayName("Creating an existing identity is rejected")
        void duplicateIdentity() {
            create(entity("a", EntityKind.PERSON, "Alice", null, 0));

            StoreException e = assertThrows(StoreException.class,
                    () -> create(entity("a2", EntityKind.PERSON, "Alice", null, 1)));

            assertEquals(StoreErrorKind.CONSTRAINT_VIOLATION, e.getKind());
            assertEquals(1, repository.countEntities());
        }

        @Test
        @DisplayName("Merging an entity that does not exist is rejected")
        void mergeWithoutTarget() {
            Entity alice = entity("a", EntityKind.PERSON, "Alice", null, 0);

            assertThrows(StoreException.class, () -> repository.apply(
                    new MutationPlan("e1", List.of(EntityMutation.merge(alice, alice)), List.of())));
        }

        @Test
        @DisplayName("Relations are unique per triple")
        void relationTriples() {
            create(entity("a", EntityKind.PERSON, "Alice", null, 0), entity("b", EntityKind.PERSON, "Bob", null, 1));
            repository.apply(new MutationPlan("e1", List.of(),
                    List.of(RelationMutation.create(relation("r1", "a", "b", "KNOWS")))));

            assertThrows(StoreException.class, () -> repository.apply(new MutationPlan("e2", List.of(),
                    List.of(RelationMutation.create(relation("r2", "a", "b", "KNOWS"))))));
            repository.apply(new MutationPlan("e2", List.of(),
                    List.of(RelationMutation.create(relation("r3", "b", "a", "KNOWS")))));

            assertEquals(2, repository.relationCount());
            assertEquals("r1", repository.findRelation("a", "b", "KNOWS").orElseThrow().getId());
            assertEquals(2, repository.relationsOf("a").size());
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @BeforeEach
        void seed() {
            create(entity("3", EntityKind.LOCATION, "Paris", "capital of France", 0),
                    entity("1", EntityKind.PERSON, "Alice", "met in Paris", 1),
                    entity("2", EntityKind.PERSON, "Bob", null, 1),
                    entity("4", EntityKind.ORGANIZATION, "Acme", "sparkling water", 2));
        }

        @Test
        @DisplayName("Listing pages in creation order, ties broken by id")
        void pagination() {
            List<String> first = repository.listEntities(0, 2).stream().map(Entity::getId).toList();
            List<String> second = repository.listEntities(2, 2).stream().map(Entity::getId).toList();

            assertEquals(List.of("3", "1"), first);
            assertEquals(List.of("2", "4"), second);
            assertTrue(repository.listEntities(4, 2).isEmpty());
            assertEquals(4, repository.countEntities());
        }

        @Test
        @DisplayName("Text search matches name or summary, case-insensitively")
        void search() {
            List<String> hits = repository.searchText("PAR", 10).stream().map(Entity::getName).toList();

            assertEquals(List.of("Paris", "Alice", "Acme"), hits);
            assertEquals(1, repository.searchText("par", 1).size());
            assertTrue(repository.searchText("zzz", 10).isEmpty());
        }

        @Test
        @DisplayName("Lookups by id and identity")
        void lookups() {
            assertEquals("Bob", repository.getEntity("2").getName());
            assertEquals("3", repository.findEntity(EntityKind.LOCATION, "paris").orElseThrow().getId());
            assertTrue(repository.findEntity(EntityKind.PERSON, "paris").isEmpty());
            assertThrows(NotFoundException.class, () -> repository.getEntity("nope"));
        }
    }
}
