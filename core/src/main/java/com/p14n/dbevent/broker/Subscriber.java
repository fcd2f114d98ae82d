package com.p14n.dbevent.broker;

import java.util.concurrent.CompletionStage;

import com.p14n.dbevent.data.ChannelEvent;

/**
 * An independent consumer of channel events.
 *
 * <p>
 * Subscribers are identified by object identity. The {@link EventServer}
 * delivers to a subscriber with {@link #offer(ChannelEvent)}, which must never
 * block, and watches {@link #termination()} to drop the subscriber's
 * registrations when it goes away.
 * </p>
 *
 * @param <E> The event payload type
 */
public interface Subscriber<E> {

    /**
     * Hands an event to the subscriber's inbound queue without blocking.
     *
     * @param event the tagged event
     * @return true if the event was accepted, false if the subscriber refused it
     */
    boolean offer(ChannelEvent<E> event);

    /**
     * Completes exactly once when the subscriber terminates. Normal completion
     * is a clean exit, exceptional completion carries the reason.
     *
     * @return the termination stage
     */
    CompletionStage<Void> termination();
}
