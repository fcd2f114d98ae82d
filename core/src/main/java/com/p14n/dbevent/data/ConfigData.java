package com.p14n.dbevent.data;

import java.time.Duration;
import java.util.Map;

public record ConfigData(Duration watchdogInterval,
        Duration watchdogRestartDelay,
        boolean watchdogEnabled) implements EventServerConfig {

    public static final String WATCHDOG_INTERVAL_ENV = "DBEVENT_WATCHDOG_INTERVAL_MS";
    public static final String WATCHDOG_RESTART_DELAY_ENV = "DBEVENT_WATCHDOG_RESTART_DELAY_MS";
    public static final String WATCHDOG_ENABLED_ENV = "DBEVENT_WATCHDOG_ENABLED";

    public ConfigData {
        if (watchdogInterval == null || watchdogInterval.isNegative() || watchdogInterval.isZero()) {
            throw new IllegalArgumentException("Watchdog interval must be positive");
        }
        if (watchdogRestartDelay == null || watchdogRestartDelay.isNegative()) {
            throw new IllegalArgumentException("Watchdog restart delay cannot be negative");
        }
    }

    public ConfigData() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(60), true);
    }

    /**
     * Builds a configuration from environment style variables, falling back to
     * the defaults for anything unset or blank.
     *
     * @param env variables, usually {@code System.getenv()}
     * @return the configuration
     * @throws IllegalArgumentException if a value is not a number
     */
    public static ConfigData fromEnvironment(Map<String, String> env) {
        var defaults = new ConfigData();
        return new ConfigData(
                millis(env, WATCHDOG_INTERVAL_ENV, defaults.watchdogInterval()),
                millis(env, WATCHDOG_RESTART_DELAY_ENV, defaults.watchdogRestartDelay()),
                flag(env, WATCHDOG_ENABLED_ENV, defaults.watchdogEnabled()));
    }

    private static Duration millis(Map<String, String> env, String name, Duration fallback) {
        var value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    private static boolean flag(Map<String, String> env, String name, boolean fallback) {
        var value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
