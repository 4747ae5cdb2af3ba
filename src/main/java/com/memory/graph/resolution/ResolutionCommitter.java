package com.memory.graph.resolution;

import com.memory.graph.core.model.Entry;
import com.memory.graph.graph.GraphRepository;
import com.memory.graph.lock.DistributedLock;
import com.memory.graph.lock.DistributedLock.LockHandle;
import com.memory.graph.logging.LogContext;
import com.memory.graph.metrics.MetricsService;
import com.memory.graph.metrics.NoOpMetricsService;
import com.memory.graph.pipeline.ExtractionFailedException;
import com.memory.graph.pipeline.ExtractionFailureKind;
import com.memory.graph.pipeline.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Turns an extraction result into committed graph state.
 *
 * <p>The identity locks of every candidate entity are held while the plan is computed and
 * applied, so the read-before-write of the resolver and the write itself form one unit with
 * respect to other extractions touching the same identities.</p>
 */
public class ResolutionCommitter {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCommitter.class);

    private final GraphRepository repository;
    private final EntityResolver resolver;
    private final DistributedLock lock;
    private final MetricsService metrics;
    private final Clock clock;

    public ResolutionCommitter(GraphRepository repository, DistributedLock lock) {
        this(repository, lock, new NoOpMetricsService(), Clock.systemUTC());
    }

    public ResolutionCommitter(GraphRepository repository, DistributedLock lock, MetricsService metrics, Clock clock) {
        this.repository = repository;
        this.resolver = new EntityResolver(repository);
        this.lock = lock;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Plans and applies the mutations for one extraction of an entry.
     *
     * @return the applied plan
     * @throws ExtractionFailedException with {@link ExtractionFailureKind#CANCELLED} if the thread was
     *                                   interrupted before the plan was applied
     * @throws com.memory.graph.graph.StoreException if the store rejects the plan
     */
    public MutationPlan commit(Entry entry, ExtractionResult result) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ExtractionFailedException(ExtractionFailureKind.CANCELLED, "Extraction cancelled before commit");
        }
        String entryId = entry.getId();
        List<String> keys = EntityResolver.identityKeys(result, entryId);
        try (LogContext ignored = LogContext.forCommit(entryId);
             LockHandle held = lock.lockAll(keys)) {
            MutationPlan plan = resolver.plan(result, entry, clock.instant());
            repository.apply(plan);
            record(plan);
            log.info("commit.applied entryId={} entityMutations={} relationMutations={}",
                    entryId, plan.entities().size(), plan.relations().size());
            return plan;
        }
    }

    private void record(MutationPlan plan) {
        metrics.recordPlanSize(plan.size());
        for (EntityMutation mutation : plan.entities()) {
            if (mutation.type() == MutationType.CREATE) {
                metrics.incrementEntityCreated(mutation.entity().getKind());
            } else {
                metrics.incrementEntityMerged(mutation.entity().getKind());
            }
        }
        for (RelationMutation mutation : plan.relations()) {
            if (mutation.type() == MutationType.CREATE) {
                metrics.incrementRelationCreated();
            }
        }
    }
}
