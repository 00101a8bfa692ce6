package com.reference.matching.health;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Health of the whole engine: degraded as soon as one component is.
 *
 * @param components the state of every checked component, in check order
 */
public record EngineHealth(List<ComponentHealth> components) {

    public EngineHealth {
        components = List.copyOf(components);
    }

    public boolean isDegraded() {
        return components.stream().anyMatch(ComponentHealth::isDegraded);
    }

    /**
     * Returns the named component's state, if it was checked.
     */
    public Optional<ComponentHealth> component(String name) {
        return components.stream().filter(c -> c.component().equals(name)).findFirst();
    }

    /**
     * Summarizes the degraded components as {@code "name: message; ..."}, or "OK".
     */
    public String summary() {
        String degraded = components.stream()
                .filter(ComponentHealth::isDegraded)
                .map(c -> c.component() + ": " + c.message())
                .collect(Collectors.joining("; "));
        return degraded.isEmpty() ? "OK" : degraded;
    }
}
