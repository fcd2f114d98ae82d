package com.p14n.dbevent.broker;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Liveness token for one observation of a subscriber or of the watchdog.
 * Cancelling the token makes any termination notice already in flight for it
 * a no-op.
 */
final class MonitorRef {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id = SEQUENCE.incrementAndGet();
    private final Object target;
    private volatile boolean active = true;

    MonitorRef(Object target) {
        this.target = target;
    }

    boolean isActive() {
        return active;
    }

    void cancel() {
        active = false;
    }

    @Override
    public String toString() {
        return "MonitorRef[" + id + " " + target + "]";
    }
}
