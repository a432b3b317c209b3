package com.batchinsight.config;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdFlavor;
import io.micrometer.statsd.StatsdMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Ships batch, job and queue-depth metrics to a DogStatsD agent alongside the actuator registry.
 * Every meter is tagged with the service name and environment so tiers of several deployments
 * can be told apart. Only active when datadog.enabled=true.
 */
@Configuration
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true")
public class DatadogMetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsConfig.class);

    @Value("${DD_AGENT_HOST:localhost}")
    private String agentHost;

    @Value("${DD_DOGSTATSD_PORT:8125}")
    private int statsdPort;

    @Value("${DD_SERVICE:batch-insight}")
    private String serviceName;

    @Value("${DD_ENV:local}")
    private String environment;

    @Value("${datadog.step:10s}")
    private Duration step;

    @Bean
    public StatsdConfig statsdConfig() {
        return new StatsdConfig() {
            @Override
            public String get(String key) {
                return null;
            }

            @Override
            public StatsdFlavor flavor() {
                return StatsdFlavor.DATADOG;
            }

            @Override
            public String host() {
                return agentHost;
            }

            @Override
            public int port() {
                return statsdPort;
            }

            @Override
            public Duration step() {
                return step;
            }
        };
    }

    @Bean
    public StatsdMeterRegistry statsdMeterRegistry(StatsdConfig statsdConfig) {
        StatsdMeterRegistry registry = new StatsdMeterRegistry(statsdConfig, Clock.SYSTEM);
        registry.config()
                .meterFilter(MeterFilter.acceptNameStartsWith("batchinsight"))
                .meterFilter(MeterFilter.deny())
                .commonTags("service", serviceName, "env", environment);
        logger.info("DogStatsD registry configured: host={}, port={}, service={}, env={}",
                agentHost, statsdPort, serviceName, environment);
        return registry;
    }

    @Bean
    @Primary
    public CompositeMeterRegistry compositeMeterRegistry(MeterRegistry defaultRegistry,
                                                         StatsdMeterRegistry statsdRegistry) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        composite.add(defaultRegistry);
        composite.add(statsdRegistry);
        return composite;
    }
}
