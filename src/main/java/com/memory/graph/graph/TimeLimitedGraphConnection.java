package com.memory.graph.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds every statement of a delegate connection by a timeout, reported as
 * {@link StoreErrorKind#TIMEOUT}.
 */
public class TimeLimitedGraphConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(TimeLimitedGraphConnection.class);

    private final GraphConnection delegate;
    private final long timeoutMs;
    private final ExecutorService executor;

    public TimeLimitedGraphConnection(GraphConnection delegate, long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.delegate = delegate;
        this.timeoutMs = timeoutMs;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "graph-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        call(query, () -> {
            delegate.execute(query, params);
            return null;
        });
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        return call(query, () -> delegate.query(query, params));
    }

    private <T> T call(String query, Callable<T> work) {
        Future<T> future = executor.submit(work);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("graph.query.timeout timeoutMs={} query={}", timeoutMs, firstLine(query));
            throw new StoreException(StoreErrorKind.TIMEOUT, "query exceeded " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreException storeException) {
                throw storeException;
            }
            if (cause instanceof RuntimeException runtime) {
                throw FalkorDBConnection.translate(runtime);
            }
            throw new StoreException(StoreErrorKind.UNAVAILABLE, "Graph store error: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreException(StoreErrorKind.UNAVAILABLE, "interrupted while waiting for graph store", e);
        }
    }

    private static String firstLine(String query) {
        String trimmed = query.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public String getGraphName() {
        return delegate.getGraphName();
    }

    @Override
    public void createIndexes() {
        delegate.createIndexes();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        delegate.close();
    }
}
