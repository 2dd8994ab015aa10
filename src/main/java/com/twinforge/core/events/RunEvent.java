package com.twinforge.core.events;

import com.twinforge.core.model.Target;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted on every run transition, consumed by the status registry, SSE streaming and logs.
 *
 * @param type      transition type
 * @param runId     the run this event belongs to
 * @param target    the target this event relates to (null for run-level events)
 * @param message   human-readable description
 * @param payload   extra key-value data, e.g. iteration or sub-iteration numbers
 * @param timestamp when the transition happened
 */
public record RunEvent(
    RunEventType type,
    String runId,
    Target target,
    String message,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public RunEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static RunEvent of(RunEventType type, String runId, String message, Map<String, Object> payload) {
        return new RunEvent(type, runId, null, message, payload, Instant.now());
    }

    public static RunEvent forTarget(RunEventType type, String runId, Target target,
                                     String message, Map<String, Object> payload) {
        return new RunEvent(type, runId, target, message, payload, Instant.now());
    }

    public String eventType() {
        return type.wireName();
    }

    public int intValue(String key, int fallback) {
        Object value = payload.get(key);
        return value instanceof Number n ? n.intValue() : fallback;
    }
}
