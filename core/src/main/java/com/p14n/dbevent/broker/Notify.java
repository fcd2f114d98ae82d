package com.p14n.dbevent.broker;

/**
 * Request to deliver an event to the listeners of a channel.
 *
 * @param channel the channel the event belongs to
 * @param event   the payload
 * @param <E>     The event payload type
 */
public record Notify<E>(String channel, E event) {
}
