package org.deepsymmetry.bmj;

/**
 * Tracks whether the authoritative clock is currently reachable, and therefore which source is producing ticks.
 */
public enum ConnectionState {
    /**
     * The authoritative clock is not available. While playing, the {@link FallbackScheduler} drives the beats
     * silently.
     */
    DISCONNECTED,

    /**
     * The authoritative clock is bound and is the only source of ticks; it has been told our full configuration.
     */
    CONNECTED
}
