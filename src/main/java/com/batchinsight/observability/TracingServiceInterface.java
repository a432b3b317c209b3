package com.batchinsight.observability;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Span boundaries around job execution. Implemented by {@link TracingService} when Datadog
 * is enabled and by a no-op stub otherwise.
 */
public interface TracingServiceInterface {

    /**
     * Runs {@code operation} inside a new span carrying {@code attributes}. A runtime
     * exception marks the span as failed and is rethrown.
     */
    void trace(@Nonnull String spanName, @Nonnull Map<String, String> attributes, @Nonnull Runnable operation);

    /**
     * Adds an event (retry, dead-letter, dropped delivery) to the current span, if any.
     */
    void addEvent(@Nonnull String eventName, @Nonnull Map<String, String> attributes);
}
