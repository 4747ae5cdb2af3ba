package com.memory.graph.pipeline.observer;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Opens an OpenTelemetry span per extraction run, from STARTED until SUCCEEDED or FAILED.
 * Provider calls and fallbacks are recorded as span events.
 */
public class TracingObserver implements PipelineObserver {

    static final String SPAN_NAME = "memory.extraction";

    private final Tracer tracer;
    private final Map<String, Span> openSpans = new ConcurrentHashMap<>();

    public TracingObserver(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void onEvent(PipelineEvent event) {
        switch (event.type()) {
            case STARTED -> {
                Span span = tracer.spanBuilder(SPAN_NAME)
                        .setAttribute("entry.id", event.entryId())
                        .setAttribute("provider", String.valueOf(event.provider()))
                        .startSpan();
                Span previous = openSpans.put(event.entryId(), span);
                if (previous != null) {
                    previous.end();
                }
            }
            case PROVIDER_CALLED -> withSpan(event, span -> span.addEvent("provider_called attempt=" + event.attempt()));
            case FELL_BACK -> withSpan(event, span -> {
                span.setAttribute("degraded", true);
                span.addEvent("fell_back cause=" + event.errorKind());
            });
            case SUCCEEDED -> finish(event, StatusCode.OK);
            case FAILED -> finish(event, StatusCode.ERROR);
        }
    }

    int openSpanCount() {
        return openSpans.size();
    }

    private void finish(PipelineEvent event, StatusCode status) {
        Span span = openSpans.remove(event.entryId());
        if (span == null) {
            return;
        }
        if (event.errorKind() != null) {
            span.setAttribute("error.kind", event.errorKind());
        }
        span.setAttribute("attempts", event.attempt());
        span.setStatus(status);
        span.end();
    }

    private void withSpan(PipelineEvent event, Consumer<Span> action) {
        Span span = openSpans.get(event.entryId());
        if (span != null) {
            action.accept(span);
        }
    }
}
