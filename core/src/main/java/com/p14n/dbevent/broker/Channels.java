package com.p14n.dbevent.broker;

/**
 * Reserved channel names.
 */
public final class Channels {

    /**
     * Wildcard channel. Listeners receive every publish whatever its channel.
     * Not a legal database name, so it cannot collide with one.
     */
    public static final String ALL_DBS = "*";

    private Channels() {
    }

    public static boolean isWildcard(String channel) {
        return ALL_DBS.equals(channel);
    }
}
