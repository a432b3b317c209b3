package com.batchinsight;

import com.batchinsight.queue.QueueProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(QueueProperties.class)
public class BatchInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchInsightApplication.class, args);
    }

    /**
     * Preparation polling, deadline sweeps and retention cleanup. Disabled in tests that
     * drive the orchestrator directly.
     */
    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "batchinsight.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {
    }
}
