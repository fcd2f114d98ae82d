package com.p14n.dbevent.broker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bidirectional index of subscriptions: subscriber to (token, channels) and
 * channel to listeners.
 *
 * <p>
 * For every subscriber S and channel C, S is a listener of C exactly when C is
 * in the channel set of S, and a channel entry exists only while it has at
 * least one listener. Every public operation leaves both properties intact.
 * </p>
 *
 * <p>
 * Not thread-safe. The owning {@link EventServer} confines all access to its
 * control loop.
 * </p>
 *
 * @param <S> The subscriber identity type
 * @param <T> The liveness token type
 */
public class ChannelRegistry<S, T> {

    private final Map<S, Registration<T>> bySubscriber = new HashMap<>();
    private final Map<String, Set<S>> byChannel = new HashMap<>();

    /**
     * Makes {@code channels} the complete channel set of {@code subscriber},
     * dropping whatever it was registered for before.
     *
     * @param subscriber the subscriber
     * @param token      liveness token to keep with the registration
     * @param channels   the new channel set, duplicates are collapsed
     */
    public void register(S subscriber, T token, Collection<String> channels) {
        if (bySubscriber.containsKey(subscriber)) {
            unregister(subscriber);
        }
        Set<String> channelSet = Collections.unmodifiableSet(new LinkedHashSet<>(channels));
        bySubscriber.put(subscriber, new Registration<>(token, channelSet));
        for (String channel : channelSet) {
            byChannel.computeIfAbsent(channel, k -> new HashSet<>()).add(subscriber);
        }
    }

    /**
     * Removes a subscriber and all of its reverse links, pruning channels left
     * without listeners.
     *
     * @param subscriber the subscriber
     * @return false if the subscriber was not registered
     * @throws RegistryCorruptedException if a reverse link is missing
     */
    public boolean unregister(S subscriber) {
        Registration<T> registration = bySubscriber.remove(subscriber);
        if (registration == null) {
            return false;
        }
        for (String channel : registration.channels()) {
            removeListener(channel, subscriber);
        }
        return true;
    }

    private void removeListener(String channel, S subscriber) {
        Set<S> listeners = byChannel.get(channel);
        if (listeners == null || !listeners.remove(subscriber)) {
            throw new RegistryCorruptedException(
                    "Channel " + channel + " has no reverse link to " + subscriber);
        }
        if (listeners.isEmpty()) {
            byChannel.remove(channel);
        }
    }

    public Optional<Registration<T>> lookup(S subscriber) {
        return Optional.ofNullable(bySubscriber.get(subscriber));
    }

    /**
     * Listeners of a channel. The returned set is a read-only view and must
     * not be held across mutations.
     *
     * @param channel the channel name
     * @return the listeners, empty if the channel has no entry
     */
    public Optional<Set<S>> listenersOf(String channel) {
        Set<S> listeners = byChannel.get(channel);
        return listeners == null ? Optional.empty() : Optional.of(Collections.unmodifiableSet(listeners));
    }

    public int subscriberCount() {
        return bySubscriber.size();
    }

    public Set<String> channels() {
        return Collections.unmodifiableSet(byChannel.keySet());
    }

    /**
     * Drops everything.
     *
     * @return the tokens of the registrations that were dropped
     */
    public List<T> clear() {
        List<T> tokens = new ArrayList<>(bySubscriber.size());
        for (Registration<T> registration : bySubscriber.values()) {
            tokens.add(registration.token());
        }
        bySubscriber.clear();
        byChannel.clear();
        return tokens;
    }

    /**
     * Checks both indexes against each other.
     *
     * @throws RegistryCorruptedException on the first mismatch found
     */
    public void verify() {
        int links = 0;
        for (Map.Entry<S, Registration<T>> entry : bySubscriber.entrySet()) {
            for (String channel : entry.getValue().channels()) {
                Set<S> listeners = byChannel.get(channel);
                if (listeners == null || !listeners.contains(entry.getKey())) {
                    throw new RegistryCorruptedException(
                            entry.getKey() + " lists " + channel + " but is not one of its listeners");
                }
                links++;
            }
        }
        int reverseLinks = 0;
        for (Map.Entry<String, Set<S>> entry : byChannel.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new RegistryCorruptedException("Channel " + entry.getKey() + " has no listeners");
            }
            reverseLinks += entry.getValue().size();
        }
        if (links != reverseLinks) {
            throw new RegistryCorruptedException(
                    "Found " + links + " subscriptions but " + reverseLinks + " listener entries");
        }
    }
}
