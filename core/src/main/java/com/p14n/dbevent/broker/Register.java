package com.p14n.dbevent.broker;

import java.util.Collection;

/**
 * Request to replace a subscriber's channel set.
 *
 * @param subscriber the subscriber
 * @param channels   channels it wants events for
 * @param <E>        The event payload type
 */
public record Register<E>(Subscriber<E> subscriber, Collection<String> channels) {
}
