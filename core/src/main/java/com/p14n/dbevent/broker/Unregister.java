package com.p14n.dbevent.broker;

/**
 * Request to drop every registration a subscriber holds.
 *
 * @param subscriber the subscriber
 * @param <E>        The event payload type
 */
public record Unregister<E>(Subscriber<E> subscriber) {
}
