package com.batchinsight.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Used when Datadog is disabled: runs operations without spans.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    @Override
    public void trace(@Nonnull String spanName, @Nonnull Map<String, String> attributes,
                      @Nonnull Runnable operation) {
        operation.run();
    }

    @Override
    public void addEvent(@Nonnull String eventName, @Nonnull Map<String, String> attributes) {
    }
}
