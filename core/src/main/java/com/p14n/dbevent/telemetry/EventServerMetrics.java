package com.p14n.dbevent.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for event server operations.
 *
 * <ul>
 * <li>events_published: events published per channel</li>
 * <li>events_delivered: events accepted by a subscriber inbox</li>
 * <li>events_dropped: events a subscriber inbox refused</li>
 * <li>active_subscribers: currently registered subscribers</li>
 * <li>watchdog_restarts: watchdogs respawned after dying</li>
 * <li>control_loop_crashes: registry resets after corruption</li>
 * </ul>
 */
public class EventServerMetrics {
        private static final AttributeKey<String> CHANNEL = AttributeKey.stringKey("channel");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongCounter droppedEvents;
        private final LongUpDownCounter activeSubscribers;
        private final LongCounter watchdogRestarts;
        private final LongCounter controlLoopCrashes;

        public EventServerMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events published")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events accepted by subscribers")
                                .build();

                droppedEvents = meter.counterBuilder("events_dropped")
                                .setDescription("Number of events refused by subscribers")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of registered subscribers")
                                .build();

                watchdogRestarts = meter.counterBuilder("watchdog_restarts")
                                .setDescription("Number of watchdog respawns")
                                .build();

                controlLoopCrashes = meter.counterBuilder("control_loop_crashes")
                                .setDescription("Number of registry resets after corruption")
                                .build();
        }

        public void recordPublished(String channel) {
                publishedEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordDelivered(String channel) {
                deliveredEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordDropped(String channel) {
                droppedEvents.add(1, Attributes.of(CHANNEL, channel));
        }

        public void recordSubscribersAdded(long count) {
                activeSubscribers.add(count);
        }

        public void recordSubscribersRemoved(long count) {
                activeSubscribers.add(-count);
        }

        public void recordWatchdogRestart() {
                watchdogRestarts.add(1);
        }

        public void recordControlLoopCrash() {
                controlLoopCrashes.add(1);
        }
}
