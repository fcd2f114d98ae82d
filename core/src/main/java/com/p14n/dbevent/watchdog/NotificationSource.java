package com.p14n.dbevent.watchdog;

/**
 * The external change notification source supervised by the {@link Watchdog}.
 * Whoever owns the source is expected to restart it after
 * {@link #terminate(String)}.
 */
public interface NotificationSource {

    /**
     * @return how many observers are currently attached to the source
     */
    int observerCount();

    /**
     * Forces the source to stop abnormally so its owner restarts it.
     *
     * @param reason the termination reason passed on to the owner
     */
    void terminate(String reason);
}
