package com.p14n.dbevent.data;

/**
 * An event as it arrives in a subscriber's inbox, tagged with the channel it
 * was published on.
 *
 * <p>
 * Subscribers listening on the wildcard channel receive the channel name the
 * event was actually published to, never the wildcard itself.
 * </p>
 *
 * @param channel the database name the event was published for
 * @param event   the event payload
 * @param <E>     payload type
 */
public record ChannelEvent<E>(String channel, E event) {
}
