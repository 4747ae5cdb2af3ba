package com.memory.graph.resolution;

import com.memory.graph.core.model.Entity;
import com.memory.graph.core.model.EntityKind;
import com.memory.graph.graph.InMemoryGraphRepository;
import com.memory.graph.graph.StoreErrorKind;
import com.memory.graph.graph.StoreException;
import com.memory.graph.lock.LocalDistributedLock;
import com.memory.graph.metrics.MetricsService;
import com.memory.graph.pipeline.CandidateEntity;
import com.memory.graph.pipeline.CandidateRelation;
import com.memory.graph.pipeline.ExtractionFailedException;
import com.memory.graph.pipeline.ExtractionFailureKind;
import com.memory.graph.pipeline.ExtractionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.memory.graph.resolution.EntityResolverTest.entry;
import static com.memory.graph.resolution.EntityResolverTest.location;
import static com.memory.graph.resolution.EntityResolverTest.person;
import static com.memory.graph.resolution.EntityResolverTest.result;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ResolutionCommitter Tests")
class ResolutionCommitterTest {

    private InMemoryGraphRepository repository;
    private MetricsService metrics;
    private ResolutionCommitter committer;

    private final ExtractionResult aliceInParis = result(
            List.of(person("Alice"), location("Paris", "capital")),
            List.of(new CandidateRelation("Alice", "Paris", "VISITED", 0.6)));

    @BeforeEach
    void setUp() {
        repository = spy(new InMemoryGraphRepository());
        metrics = mock(MetricsService.class);
        committer = new ResolutionCommitter(repository, new LocalDistributedLock(), metrics,
                Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A result is planned and applied")
    void commitsResult() {
        MutationPlan plan = committer.commit(entry("e1"), aliceInParis);

        assertEquals(6, plan.size());
        assertEquals(3, repository.countEntities());
        assertEquals(3, repository.relationCount());
        assertEquals(2, repository.relationsOf("e1").size());
        verify(metrics).recordPlanSize(6);
        verify(metrics).incrementEntityCreated(EntityKind.ENTRY);
        verify(metrics).incrementEntityCreated(EntityKind.PERSON);
        verify(metrics).incrementEntityCreated(EntityKind.LOCATION);
        verify(metrics, times(3)).incrementRelationCreated();
    }

    @Test
    @DisplayName("Committing the same result twice leaves the graph unchanged")
    void idempotent() {
        committer.commit(entry("e1"), aliceInParis);
        List<Entity> before = repository.listEntities(0, 10);

        MutationPlan second = committer.commit(entry("e1"), aliceInParis);

        assertEquals(0, second.countEntities(MutationType.CREATE));
        assertEquals(0, second.countRelations(MutationType.CREATE));
        assertEquals(before, repository.listEntities(0, 10));
        assertEquals(3, repository.relationCount());
    }

    @Test
    @DisplayName("Entries mentioning the same entity share one node")
    void sharedEntity() {
        committer.commit(entry("e1"), aliceInParis);
        committer.commit(entry("e2"), result(List.of(location("paris", null), person("Bob")), List.of()));

        Entity paris = repository.findEntity(EntityKind.LOCATION, "paris").orElseThrow();
        assertEquals(List.of("e1", "e2"), paris.getSourceEntryIds());
        assertEquals("capital", paris.getSummary());
        assertEquals(5, repository.countEntities());
        assertEquals(2, repository.relationsOf("e2").size());
    }

    @Test
    @DisplayName("An empty result still records the entry node")
    void emptyResult() {
        MutationPlan plan = committer.commit(entry("e1"), result(List.<CandidateEntity>of(), List.of()));

        assertEquals(1, plan.entities().size());
        assertTrue(plan.relations().isEmpty());
        assertEquals(EntityKind.ENTRY, repository.getEntity("e1").getKind());
        verify(repository).apply(plan);
    }

    @Test
    @DisplayName("Store failures propagate and leave the graph untouched")
    void storeFailure() {
        doThrow(new StoreException(StoreErrorKind.UNAVAILABLE, "down")).when(repository).apply(any());

        StoreException e = assertThrows(StoreException.class, () -> committer.commit(entry("e1"), aliceInParis));

        assertEquals(StoreErrorKind.UNAVAILABLE, e.getKind());
        assertEquals(0, repository.countEntities());
        verify(metrics, never()).recordPlanSize(anyInt());
    }

    @Test
    @DisplayName("An interrupted thread commits nothing")
    void interrupted() {
        Thread.currentThread().interrupt();
        try {
            ExtractionFailedException e = assertThrows(ExtractionFailedException.class,
                    () -> committer.commit(entry("e1"), aliceInParis));
            assertEquals(ExtractionFailureKind.CANCELLED, e.getKind());
        } finally {
            assertTrue(Thread.interrupted());
        }
        verify(repository, never()).apply(any());
    }
}
