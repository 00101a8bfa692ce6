package com.reference.matching.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * State of one engine component.
 *
 * <p>Nothing in the engine is ever fatal: a failing store or an unreadable cache file
 * only slows a run down or costs re-fetches, so a component is either
 * {@link State#OPERATIONAL} or {@link State#DEGRADED}.</p>
 *
 * @param component name of the component, e.g. {@code rateLimiter}
 * @param state     current state
 * @param message   human-readable summary
 * @param details   component counters, in insertion order
 */
public record ComponentHealth(String component, State state, String message, Map<String, Object> details) {

    public enum State { OPERATIONAL, DEGRADED }

    public ComponentHealth {
        Objects.requireNonNull(component, "component is required");
        Objects.requireNonNull(state, "state is required");
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static ComponentHealth operational(String component, String message, Map<String, Object> details) {
        return new ComponentHealth(component, State.OPERATIONAL, message, details);
    }

    public static ComponentHealth degraded(String component, String message, Map<String, Object> details) {
        return new ComponentHealth(component, State.DEGRADED, message, details);
    }

    public boolean isDegraded() {
        return state == State.DEGRADED;
    }
}
