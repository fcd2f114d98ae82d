package com.p14n.dbevent.broker;

/**
 * Thrown when the two indexes of a {@link ChannelRegistry} no longer mirror
 * each other. The registry cannot be repaired in place once this happens.
 */
public class RegistryCorruptedException extends IllegalStateException {

    public RegistryCorruptedException(String message) {
        super(message);
    }
}
