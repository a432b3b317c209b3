package com.batchinsight.queue;

import com.batchinsight.shared.model.FailureKind;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One failed delivery, appended to a message's failure history.
 */
public final class FailureRecord {

    private final int attempt;
    private final FailureKind kind;
    private final String message;
    private final Instant occurredAt;

    public FailureRecord(int attempt, FailureKind kind, String message, Instant occurredAt) {
        this.attempt = attempt;
        this.kind = kind;
        this.message = message;
        this.occurredAt = occurredAt;
    }

    public static FailureRecord of(int attempt, FailureKind kind, String message) {
        return new FailureRecord(attempt, kind, message, Instant.now());
    }

    public int getAttempt() {
        return attempt;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /**
     * Kind of the most recent failure in a stored history; TIMEOUT when the worker never
     * reported one (the visibility timeout expired).
     */
    public static FailureKind lastKind(List<Map<String, Object>> history) {
        if (history == null || history.isEmpty()) {
            return FailureKind.TIMEOUT;
        }
        Object kind = history.get(history.size() - 1).get("kind");
        if (kind == null) {
            return FailureKind.TIMEOUT;
        }
        try {
            return FailureKind.valueOf(kind.toString());
        } catch (IllegalArgumentException e) {
            return FailureKind.TIMEOUT;
        }
    }

    Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("attempt", attempt);
        map.put("kind", kind != null ? kind.name() : null);
        map.put("message", message);
        map.put("at", occurredAt.toString());
        return map;
    }
}
