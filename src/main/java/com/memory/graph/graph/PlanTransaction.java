package com.memory.graph.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Applies the writes of one mutation plan with undo actions.
 * Undo actions run newest first when the transaction closes without {@link #commit()}.
 *
 * <pre>
 * try (PlanTransaction tx = new PlanTransaction(entryId)) {
 *     tx.write("create entity paris", () -> createEntity(...), () -> deleteEntity(...));
 *     tx.write("merge entity alice", () -> updateEntity(...), () -> restoreEntity(...));
 *     tx.commit();
 * }
 * </pre>
 */
class PlanTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PlanTransaction.class);

    private final String sourceEntryId;
    private final Deque<Step> applied = new ArrayDeque<>();
    private boolean committed;
    private boolean closed;

    PlanTransaction(String sourceEntryId) {
        this.sourceEntryId = sourceEntryId;
    }

    /**
     * Runs one write. Its undo action is registered only after the write succeeds;
     * a failing write propagates and leaves rollback to {@link #close()}.
     */
    void write(String description, Runnable write, Runnable undo) {
        if (closed) {
            throw new IllegalStateException("Plan transaction already closed for entry " + sourceEntryId);
        }
        log.debug("plan.write entryId={} step={}", sourceEntryId, description);
        write.run();
        applied.push(new Step(description, undo));
    }

    void commit() {
        committed = true;
    }

    boolean isCommitted() {
        return committed;
    }

    int appliedCount() {
        return applied.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (committed || applied.isEmpty()) {
            return;
        }
        log.warn("plan.rollback entryId={} steps={}", sourceEntryId, applied.size());
        int failedUndos = 0;
        while (!applied.isEmpty()) {
            Step step = applied.pop();
            try {
                step.undo().run();
            } catch (RuntimeException e) {
                failedUndos++;
                log.error("plan.rollback.step_failed entryId={} step={} error={}",
                        sourceEntryId, step.description(), e.getMessage());
            }
        }
        if (failedUndos > 0) {
            log.error("plan.rollback.incomplete entryId={} failedSteps={}", sourceEntryId, failedUndos);
        }
    }

    private record Step(String description, Runnable undo) {}
}
