package com.p14n.dbevent.broker;

/**
 * A synchronous request to the {@link EventServer} could not be completed.
 */
public class EventServerException extends RuntimeException {

    public EventServerException(String message) {
        super(message);
    }

    public EventServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
