package com.reference.matching.health;

/**
 * Reports the state of one engine component.
 */
@FunctionalInterface
public interface HealthCheck {

    ComponentHealth check();
}
