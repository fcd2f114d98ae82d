package com.p14n.dbevent.broker;

import java.util.Set;

/**
 * What the registry holds for one subscriber.
 *
 * @param token    the liveness token of the subscriber's observation
 * @param channels the channels the subscriber currently listens on
 * @param <T>      The token type
 */
public record Registration<T>(T token, Set<String> channels) {
}
