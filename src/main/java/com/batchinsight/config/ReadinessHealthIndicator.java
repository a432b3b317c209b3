package com.batchinsight.config;

import com.batchinsight.queue.PriorityQueueSet;
import com.batchinsight.shared.model.QueueTier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ready when the database answers. Reports visible queue depth per tier as details.
 */
@Component
public class ReadinessHealthIndicator implements HealthIndicator {

    private final DataSource dataSource;
    private final PriorityQueueSet queueSet;

    public ReadinessHealthIndicator(DataSource dataSource, PriorityQueueSet queueSet) {
        this.dataSource = dataSource;
        this.queueSet = queueSet;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();

        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(5)) {
                details.put("database", "DOWN");
                details.put("connection", "Invalid");
                return Health.down().withDetails(details).build();
            }
        } catch (SQLException e) {
            details.put("database", "DOWN");
            details.put("error", e.getMessage());
            return Health.down().withDetails(details).build();
        }
        details.put("database", "UP");

        try {
            for (QueueTier tier : QueueTier.values()) {
                details.put("queue." + tier.name().toLowerCase(Locale.ROOT) + ".depth", queueSet.depth(tier));
            }
        } catch (RuntimeException e) {
            details.put("queue", "UNKNOWN");
            details.put("queueError", e.getMessage());
        }
        return Health.up().withDetails(details).build();
    }
}
