package com.p14n.dbevent.peruser;

import java.util.Map;

/**
 * Settings for the {@link PerUserProvisioner}.
 *
 * @param authDbName   database holding the user documents
 * @param userDbPrefix prefix of every per-user database name
 */
public record PerUserConfig(String authDbName, String userDbPrefix) {

    public static final String AUTH_DB_ENV = "DBEVENT_PERUSER_AUTH_DB";
    public static final String USERDB_PREFIX_ENV = "DBEVENT_PERUSER_DB_PREFIX";

    public PerUserConfig {
        if (authDbName == null || authDbName.isBlank()) {
            throw new IllegalArgumentException("Authentication database name cannot be empty");
        }
        if (userDbPrefix == null) {
            throw new IllegalArgumentException("User database prefix cannot be null");
        }
    }

    public PerUserConfig() {
        this("_users", "userdb-");
    }

    public static PerUserConfig fromEnvironment(Map<String, String> env) {
        var defaults = new PerUserConfig();
        return new PerUserConfig(
                env.getOrDefault(AUTH_DB_ENV, defaults.authDbName()),
                env.getOrDefault(USERDB_PREFIX_ENV, defaults.userDbPrefix()));
    }
}
