package com.p14n.dbevent.broker;

/**
 * Replies to synchronous control requests.
 */
public enum Reply {
    OK,
    NOT_REGISTERED,
    IGNORED
}
