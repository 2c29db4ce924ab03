package com.labelloop.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Health of one engine component. Metadata values are strings so the report can be rendered
 * as-is, e.g. {@code depth} for the queue or {@code overdueBatches} for retraining.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, RuntimeException cause) {
        return new HealthStatus(component, Status.DOWN, "Store error: " + cause.getMessage(), Map.of());
    }

    /** Worst status of the given components; UP when there are none. */
    public static Status overall(Collection<HealthStatus> components) {
        Status worst = Status.UP;
        for (HealthStatus component : components) {
            if (component.status().compareTo(worst) > 0) {
                worst = component.status();
            }
        }
        return worst;
    }
}
