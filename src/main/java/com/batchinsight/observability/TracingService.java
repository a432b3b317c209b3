package com.batchinsight.observability;

import com.batchinsight.util.Strings;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * OpenTelemetry spans around job execution, with retry and dead-letter events attached.
 * Uses GlobalOpenTelemetry, which the Datadog agent configures.
 * Only active when datadog.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class TracingService implements TracingServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    private final Tracer tracer;

    public TracingService() {
        this.tracer = GlobalOpenTelemetry.getTracer("com.batchinsight", "0.1.0");
        logger.info("TracingService initialized with OpenTelemetry tracer");
    }

    @Override
    public void trace(@Nonnull String spanName, @Nonnull Map<String, String> attributes,
                      @Nonnull Runnable operation) {
        if (spanName.isBlank()) {
            throw new IllegalArgumentException("spanName is required");
        }
        SpanBuilder builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.CONSUMER);
        attributes.forEach((key, value) -> builder.setAttribute(key, Strings.safe(value)));
        Span span = builder.startSpan();
        try (Scope scope = span.makeCurrent()) {
            operation.run();
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, Strings.safe(e.getMessage()));
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void addEvent(@Nonnull String eventName, @Nonnull Map<String, String> attributes) {
        Span span = Span.current();
        if (!span.getSpanContext().isValid()) {
            return;
        }
        AttributesBuilder eventAttributes = Attributes.builder();
        attributes.forEach((key, value) -> eventAttributes.put(key, Strings.safe(value)));
        span.addEvent(eventName, eventAttributes.build());
    }
}
