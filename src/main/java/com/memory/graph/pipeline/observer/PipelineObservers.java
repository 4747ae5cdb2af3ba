package com.memory.graph.pipeline.observer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry that fans events out to every registered observer.
 * A failing observer is logged and skipped; the remaining observers still receive the event.
 */
public class PipelineObservers {
    private static final Logger log = LoggerFactory.getLogger(PipelineObservers.class);

    private final List<PipelineObserver> observers = new CopyOnWriteArrayList<>();

    public PipelineObservers() {
    }

    public PipelineObservers(List<PipelineObserver> observers) {
        this.observers.addAll(observers);
    }

    public PipelineObservers register(PipelineObserver observer) {
        observers.add(observer);
        return this;
    }

    public void publish(PipelineEvent event) {
        for (PipelineObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("observer.failed observer={} event={} entryId={} error={}",
                        observer.getClass().getSimpleName(), event.type(), event.entryId(), e.getMessage(), e);
            }
        }
    }

    public int size() {
        return observers.size();
    }
}
