package com.memory.graph.dispatch;

import com.memory.graph.core.model.Entry;
import com.memory.graph.graph.EntryRepository;
import com.memory.graph.graph.StoreException;
import com.memory.graph.lock.LockAcquisitionException;
import com.memory.graph.pipeline.ExtractionFailedException;
import com.memory.graph.pipeline.ExtractionFailureKind;
import com.memory.graph.pipeline.ExtractionResult;
import com.memory.graph.pipeline.ExtractionRunner;
import com.memory.graph.pipeline.observer.PipelineEvent;
import com.memory.graph.pipeline.observer.PipelineObservers;
import com.memory.graph.resolution.ResolutionCommitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs extractions in the background, one job per entry.
 *
 * <p>A job loads the entry, marks it {@code running}, runs the {@link ExtractionRunner},
 * commits the result through the {@link ResolutionCommitter} and records the outcome on the
 * entry. At most one job per entry is queued or running: submitting an entry that already has
 * a job flags that job to run one more cycle once the current one finishes.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * try (ExtractionDispatcher dispatcher = new ExtractionDispatcher(runner, committer, entries,
 *         DispatcherConfig.defaults())) {
 *     entries.save(entry);
 *     dispatcher.submit(entry.getId());
 * }
 * </pre>
 */
public class ExtractionDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionDispatcher.class);

    static final String DISPATCH_REJECTED = "DISPATCH_REJECTED";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final ExtractionRunner runner;
    private final ResolutionCommitter committer;
    private final EntryRepository entries;
    private final PipelineObservers observers;
    private final Clock clock;
    private final ThreadPoolExecutor executor;
    private final Map<String, Job> inFlight = new ConcurrentHashMap<>();

    public ExtractionDispatcher(ExtractionRunner runner, ResolutionCommitter committer,
                                EntryRepository entries, DispatcherConfig config) {
        this(runner, committer, entries, config, Clock.systemUTC());
    }

    public ExtractionDispatcher(ExtractionRunner runner, ResolutionCommitter committer,
                                EntryRepository entries, DispatcherConfig config, Clock clock) {
        this.runner = runner;
        this.committer = committer;
        this.entries = entries;
        this.observers = runner.getObservers();
        this.clock = clock;
        this.executor = new ThreadPoolExecutor(config.workers(), config.workers(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.queueCapacity()),
                new WorkerThreadFactory());
        log.info("dispatcher.started workers={} queueCapacity={}", config.workers(), config.queueCapacity());
    }

    /**
     * Schedules an extraction of a saved entry.
     *
     * <p>If the entry already has a job, queued, running or being cancelled, no second job is
     * started: the existing one runs one more cycle after the current one ends.</p>
     *
     * @return {@code true} if a new job was queued or an existing one will run again;
     * {@code false} if the job was rejected and the entry marked failed
     */
    public boolean submit(String entryId) {
        Job job = claim(entryId);
        if (job == null) {
            log.info("dispatch.rerun_requested entryId={}", entryId);
            return true;
        }
        try {
            executor.execute(job);
            log.debug("dispatch.queued entryId={} queued={}", entryId, executor.getQueue().size());
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(entryId, job);
            String reason = executor.isShutdown() ? "dispatcher closed" : "extraction queue full";
            log.warn("dispatch.rejected entryId={} reason={}", entryId, reason);
            recordFailure(entryId, DISPATCH_REJECTED + ": " + reason);
            return false;
        }
    }

    /**
     * Runs the extraction of a saved entry on the calling thread and returns once it has ended.
     *
     * <p>If the entry already has a job, that job is asked for one more cycle instead and this
     * method returns at once.</p>
     *
     * @return {@code true} if the extraction ran on the calling thread
     */
    public boolean runInline(String entryId) {
        if (executor.isShutdown()) {
            recordFailure(entryId, DISPATCH_REJECTED + ": dispatcher closed");
            return false;
        }
        Job job = claim(entryId);
        if (job == null) {
            log.info("dispatch.rerun_requested entryId={} mode=inline", entryId);
            return false;
        }
        log.debug("dispatch.inline entryId={}", entryId);
        runJob(job);
        return true;
    }

    /**
     * Cancels the job of an entry. A queued job is removed; a running job is interrupted.
     * Either way the current cycle ends {@code failed} with {@code CANCELLED}. A rerun requested
     * before the cancel is dropped; one requested after it still runs, once the cancelled cycle
     * has left the worker.
     *
     * @return {@code false} if the entry had no job
     */
    public boolean cancel(String entryId) {
        Job[] target = new Job[1];
        inFlight.computeIfPresent(entryId, (id, job) -> {
            job.rerun = false;
            job.cancel();
            target[0] = job;
            return job;
        });
        Job job = target[0];
        if (job == null) {
            return false;
        }
        if (executor.remove(job)) {
            boolean[] resubmitted = new boolean[1];
            inFlight.compute(entryId, (id, current) -> {
                if (current != job) {
                    return current;
                }
                resubmitted[0] = job.rerun;
                return null;
            });
            log.info("dispatch.cancelled entryId={} state=queued", entryId);
            recordFailure(entryId, cancelledDetail());
            if (resubmitted[0]) {
                submit(entryId);
            }
            return true;
        }
        log.info("dispatch.cancelled entryId={} state=running", entryId);
        return true;
    }

    public boolean isInFlight(String entryId) {
        return inFlight.containsKey(entryId);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits until no job is queued or running.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    @Override
    public void close() {
        List<Runnable> pending = executor.shutdownNow();
        for (Runnable runnable : pending) {
            if (runnable instanceof Job job) {
                inFlight.remove(job.entryId, job);
                recordFailure(job.entryId, cancelledDetail());
            }
        }
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("dispatcher.close workers still running after 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("dispatcher.closed dropped={}", pending.size());
    }

    // ── Job execution ─────────────────────────────────────────

    /**
     * Installs a new job for the entry, or flags the existing one to run again.
     *
     * @return the new job, or {@code null} if the entry already had one
     */
    private Job claim(String entryId) {
        Job[] created = new Job[1];
        inFlight.compute(entryId, (id, existing) -> {
            if (existing != null) {
                existing.rerun = true;
                return existing;
            }
            created[0] = new Job(id);
            return created[0];
        });
        return created[0];
    }

    private void runJob(Job job) {
        job.attach(Thread.currentThread());
        try {
            do {
                if (job.cancelled) {
                    recordFailure(job.entryId, cancelledDetail());
                    continue;
                }
                try {
                    runCycle(job);
                } catch (RuntimeException e) {
                    log.error("dispatch.cycle_failed entryId={}", job.entryId, e);
                    recordFailure(job.entryId, INTERNAL_ERROR + ": " + e.getMessage());
                }
            } while (continueWithRerun(job));
        } finally {
            inFlight.remove(job.entryId, job);
            job.detach();
        }
    }

    /**
     * Ends the current cycle. The job is kept, with its cancellation cleared, only if a rerun
     * was requested; otherwise its in-flight marker is removed.
     */
    private boolean continueWithRerun(Job job) {
        boolean[] again = new boolean[1];
        inFlight.compute(job.entryId, (id, current) -> {
            if (current != job) {
                return current;
            }
            if (job.rerun) {
                job.rerun = false;
                job.resetCancel();
                again[0] = true;
                return job;
            }
            return null;
        });
        return again[0];
    }

    private void runCycle(Job job) {
        String entryId = job.entryId;
        Optional<Entry> found = entries.findById(entryId);
        if (found.isEmpty()) {
            log.warn("dispatch.entry_missing entryId={}", entryId);
            return;
        }
        Entry running = found.get().running(clock.instant());
        try {
            entries.save(running);
        } catch (StoreException e) {
            log.warn("dispatch.status_write_failed entryId={} status=running error={}", entryId, e.getMessage());
            recordFailure(entryId, e.toErrorDetail());
            return;
        }

        ExtractionResult result;
        try {
            result = runner.run(entryId, running.getText());
        } catch (ExtractionFailedException e) {
            // the runner has already published FAILED
            save(running.failed(job.cancelled ? cancelledDetail() : e.toErrorDetail(), clock.instant()));
            return;
        }

        try {
            committer.commit(running, result);
        } catch (ExtractionFailedException e) {
            commitFailed(running, result, e.getKind().name(), e.toErrorDetail(), e);
            return;
        } catch (StoreException e) {
            if (job.cancelled) {
                commitFailed(running, result, ExtractionFailureKind.CANCELLED.name(), cancelledDetail(), e);
            } else {
                commitFailed(running, result, "STORE_" + e.getKind().name(), e.toErrorDetail(), e);
            }
            return;
        } catch (LockAcquisitionException e) {
            if (job.cancelled) {
                commitFailed(running, result, ExtractionFailureKind.CANCELLED.name(), cancelledDetail(), e);
            } else {
                commitFailed(running, result, "LOCK_TIMEOUT", "LOCK_TIMEOUT: " + e.getMessage(), e);
            }
            return;
        }

        if (job.cancelled) {
            log.info("dispatch.cancel_after_commit entryId={}", entryId);
        }
        save(running.succeeded(result.providerName(), result.degraded(), result.truncated(), clock.instant()));
        log.info("dispatch.succeeded entryId={} provider={} degraded={} truncated={}",
                entryId, result.providerName(), result.degraded(), result.truncated());
    }

    private void commitFailed(Entry running, ExtractionResult result, String errorKind, String detail, Exception cause) {
        log.warn("dispatch.commit_failed entryId={} kind={} error={}", running.getId(), errorKind, cause.getMessage());
        observers.publish(PipelineEvent.failed(running.getId(), result.providerName(), errorKind,
                cause.getMessage(), result.latency()));
        save(running.failed(detail, clock.instant()));
    }

    private void recordFailure(String entryId, String detail) {
        try {
            entries.findById(entryId).ifPresent(entry -> entries.save(entry.failed(detail, clock.instant())));
        } catch (RuntimeException e) {
            log.error("dispatch.status_write_failed entryId={} detail={} error={}", entryId, detail, e.getMessage());
        }
    }

    private void save(Entry entry) {
        try {
            entries.save(entry);
        } catch (StoreException e) {
            log.error("dispatch.status_write_failed entryId={} status={} error={}",
                    entry.getId(), entry.getStatus().wireValue(), e.getMessage());
        }
    }

    private static String cancelledDetail() {
        return ExtractionFailureKind.CANCELLED.name() + ": extraction cancelled";
    }

    private final class Job implements Runnable {
        private final String entryId;
        // guarded by the inFlight bin of entryId
        private boolean rerun;
        private volatile boolean cancelled;
        // guarded by this
        private Thread worker;

        private Job(String entryId) {
            this.entryId = entryId;
        }

        synchronized void attach(Thread thread) {
            worker = thread;
        }

        synchronized void cancel() {
            cancelled = true;
            if (worker != null) {
                worker.interrupt();
            }
        }

        /**
         * Clears a cancellation, and the interrupt it delivered, before the next cycle. Called on
         * the worker thread.
         */
        synchronized void resetCancel() {
            if (cancelled) {
                cancelled = false;
                Thread.interrupted();
            }
        }

        /**
         * Called on the worker thread. An interrupt from a cancel is cleared so the thread, a
         * pool worker or an inline caller, carries on clean.
         */
        synchronized void detach() {
            worker = null;
            if (cancelled) {
                Thread.interrupted();
            }
        }

        @Override
        public void run() {
            runJob(this);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "extraction-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
