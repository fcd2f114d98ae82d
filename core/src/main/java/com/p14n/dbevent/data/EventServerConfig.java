package com.p14n.dbevent.data;

import java.time.Duration;

/**
 * Configuration for an {@link com.p14n.dbevent.broker.EventServer}.
 * Every setting has a default, so implementations only override what they
 * need.
 */
public interface EventServerConfig {

    /**
     * How often the watchdog checks the notification source for attached
     * observers.
     *
     * @return the polling interval, 5 seconds by default
     */
    default Duration watchdogInterval() {
        return Duration.ofSeconds(5);
    }

    /**
     * How long the server waits before respawning a watchdog that died.
     *
     * @return the respawn cooldown, 60 seconds by default
     */
    default Duration watchdogRestartDelay() {
        return Duration.ofSeconds(60);
    }

    /**
     * Whether a watchdog is started at all.
     *
     * @return true by default
     */
    default boolean watchdogEnabled() {
        return true;
    }
}
