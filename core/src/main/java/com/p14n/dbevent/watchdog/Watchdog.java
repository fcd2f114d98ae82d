package com.p14n.dbevent.watchdog;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically forces the {@link NotificationSource} to restart while it has
 * observers attached. A restart is the only recovery known to clear an
 * observer list that got stuck.
 *
 * <p>
 * {@link #run()} never returns normally. It ends only by throwing, either
 * because the source refused to terminate or because the thread was
 * interrupted, and whoever started it decides whether to start another.
 * </p>
 */
public class Watchdog {
    private static final Logger LOGGER = LoggerFactory.getLogger(Watchdog.class);

    /** Reason handed to the source when it is forced down. */
    public static final String FORCE_UPGRADE = "force_upgrade";

    private final NotificationSource source;
    private final Duration interval;
    private final Sleeper sleeper;

    public Watchdog(NotificationSource source, Duration interval, Sleeper sleeper) {
        if (source == null) {
            throw new IllegalArgumentException("Notification source cannot be null");
        }
        this.source = source;
        this.interval = interval;
        this.sleeper = sleeper;
    }

    /**
     * One inspection of the source.
     *
     * @return true if the source was forced down
     */
    public boolean check() {
        int observers = source.observerCount();
        if (observers > 0) {
            LOGGER.info("Notification source has {} observers, forcing restart", observers);
            source.terminate(FORCE_UPGRADE);
            return true;
        }
        return false;
    }

    public void run() throws InterruptedException {
        while (true) {
            check();
            sleeper.sleep(interval);
        }
    }
}
