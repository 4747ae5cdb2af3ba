package com.memory.graph.pipeline.observer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every pipeline event to the log as a {@code pipeline.<type>} line.
 */
public class LoggingObserver implements PipelineObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingObserver.class);

    @Override
    public void onEvent(PipelineEvent event) {
        switch (event.type()) {
            case STARTED -> log.info("pipeline.started entryId={} provider={}",
                    event.entryId(), event.provider());
            case PROVIDER_CALLED -> log.debug("pipeline.provider_called entryId={} provider={} attempt={}",
                    event.entryId(), event.provider(), event.attempt());
            case FELL_BACK -> log.warn("pipeline.fell_back entryId={} provider={} cause={} detail={}",
                    event.entryId(), event.provider(), event.errorKind(), event.message());
            case SUCCEEDED -> log.info("pipeline.succeeded entryId={} provider={} attempts={} latencyMs={}",
                    event.entryId(), event.provider(), event.attempt(), millis(event));
            case FAILED -> log.warn("pipeline.failed entryId={} provider={} errorKind={} detail={} latencyMs={}",
                    event.entryId(), event.provider(), event.errorKind(), event.message(), millis(event));
        }
    }

    private static long millis(PipelineEvent event) {
        return event.latency() != null ? event.latency().toMillis() : -1;
    }
}
