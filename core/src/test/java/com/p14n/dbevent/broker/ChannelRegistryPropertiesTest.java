package com.p14n.dbevent.broker;

import net.jqwik.api.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChannelRegistryPropertiesTest {

    private static final List<String> SUBSCRIBERS = List.of("s1", "s2", "s3", "s4");
    private static final List<String> CHANNELS = List.of("db_a", "db_b", "db_c", Channels.ALL_DBS);

    record Op(boolean register, String subscriber, Set<String> channels) {
    }

    @Provide
    Arbitrary<List<Op>> operations() {
        Arbitrary<String> subscribers = Arbitraries.of(SUBSCRIBERS);
        Arbitrary<Set<String>> channels = Arbitraries.of(CHANNELS).set().ofMaxSize(CHANNELS.size());
        Arbitrary<Op> op = Combinators.combine(Arbitraries.of(true, false), subscribers, channels)
                .as(Op::new);
        return op.list().ofMaxSize(60);
    }

    @Property(tries = 200)
    void indexesMirrorEachOtherAfterEveryOperation(@ForAll("operations") List<Op> ops) {
        ChannelRegistry<String, Integer> registry = new ChannelRegistry<>();
        Map<String, Set<String>> expected = new HashMap<>();
        int token = 0;

        for (Op op : ops) {
            if (op.register()) {
                registry.register(op.subscriber(), token++, op.channels());
                expected.put(op.subscriber(), op.channels());
            } else {
                boolean wasRegistered = expected.remove(op.subscriber()) != null;
                assertEquals(wasRegistered, registry.unregister(op.subscriber()));
            }

            registry.verify();
            assertEquals(expected.size(), registry.subscriberCount());
            for (String subscriber : SUBSCRIBERS) {
                Optional<Set<String>> channels = registry.lookup(subscriber).map(Registration::channels);
                assertEquals(Optional.ofNullable(expected.get(subscriber)), channels);
            }
            for (String channel : CHANNELS) {
                Set<String> listeners = registry.listenersOf(channel).orElse(Set.of());
                for (String subscriber : SUBSCRIBERS) {
                    boolean subscribed = expected.getOrDefault(subscriber, Set.of()).contains(channel);
                    assertEquals(subscribed, listeners.contains(subscriber),
                            subscriber + " on " + channel);
                }
                assertEquals(!listeners.isEmpty(), registry.channels().contains(channel));
            }
        }
    }
}
