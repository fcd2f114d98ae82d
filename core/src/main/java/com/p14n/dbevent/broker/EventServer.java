package com.p14n.dbevent.broker;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.p14n.dbevent.data.ChannelEvent;
import com.p14n.dbevent.data.EventServerConfig;
import com.p14n.dbevent.telemetry.EventServerMetrics;
import com.p14n.dbevent.watchdog.NotificationSource;
import com.p14n.dbevent.watchdog.Sleeper;
import com.p14n.dbevent.watchdog.Watchdog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.dbevent.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Single authority for database event subscriptions.
 *
 * <p>
 * Subscribers register for a set of channels (database names, or
 * {@link Channels#ALL_DBS}) and receive {@link ChannelEvent}s in their own
 * inbox. Every registration, unregistration and publish is serialized through
 * one control loop thread, which is the only code that touches the
 * {@link ChannelRegistry}.
 * </p>
 *
 * <ul>
 * <li>{@link #register} and {@link #unregister} block the caller until the
 * loop has applied them</li>
 * <li>{@link #publish} returns immediately; delivery is a non-blocking offer to
 * each listener</li>
 * <li>a subscriber whose {@link Subscriber#termination()} completes is dropped
 * without any call on its part</li>
 * <li>a {@link Watchdog} polices the {@link NotificationSource} and is respawned
 * after a cooldown whenever it dies</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EventServer<DbEvent> server = new EventServer<DbEvent>(new ConfigData(), source, openTelemetry).start();
 * Mailbox<DbEvent> inbox = new Mailbox<>("indexer");
 * server.register(inbox, List.of("orders"));
 * server.publish("orders", DbEvent.updated());
 * ChannelEvent<DbEvent> received = inbox.take();
 * }</pre>
 *
 * @param <E> The event payload type
 */
public class EventServer<E> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventServer.class);
    private static final String NAME = "db-event-server";

    private record WatchdogHandle(Future<?> task, MonitorRef ref) {
    }

    /**
     * The single termination callback attached to a subscriber, pointing at
     * whichever registration is current. Null between unregister and the next
     * register.
     */
    private static final class Observation {
        private MonitorRef current;
    }

    private final EventServerConfig config;
    private final NotificationSource source;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;
    private final Sleeper sleeper;
    private final EventServerMetrics metrics;
    private final Tracer tracer;
    private final ControlLoop loop = new ControlLoop(NAME);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Confined to the control loop
    private final ChannelRegistry<Subscriber<E>, MonitorRef> registry = new ChannelRegistry<>();
    private final Map<Subscriber<E>, Observation> observations = new WeakHashMap<>();
    private WatchdogHandle watchdog;

    /**
     * Creates a server with its own executor for the watchdog and timers.
     *
     * @param config configuration
     * @param source notification source policed by the watchdog, may be null
     *               only when the watchdog is disabled
     * @param ot     OpenTelemetry instance for metrics and tracing
     */
    public EventServer(EventServerConfig config, NotificationSource source, OpenTelemetry ot) {
        this(config, source, new DefaultExecutor(1), true, Sleeper.SYSTEM, ot);
    }

    /**
     * Creates a server that runs the watchdog and timers on a caller owned
     * executor.
     *
     * @param config        configuration
     * @param source        notification source policed by the watchdog
     * @param asyncExecutor executor for the watchdog task and the respawn timer
     * @param ot            OpenTelemetry instance for metrics and tracing
     */
    public EventServer(EventServerConfig config, NotificationSource source, AsyncExecutor asyncExecutor,
            OpenTelemetry ot) {
        this(config, source, asyncExecutor, false, Sleeper.SYSTEM, ot);
    }

    public EventServer(EventServerConfig config, NotificationSource source, AsyncExecutor asyncExecutor,
            Sleeper sleeper, OpenTelemetry ot) {
        this(config, source, asyncExecutor, false, sleeper, ot);
    }

    private EventServer(EventServerConfig config, NotificationSource source, AsyncExecutor asyncExecutor,
            boolean ownsExecutor, Sleeper sleeper, OpenTelemetry ot) {
        if (config.watchdogEnabled() && source == null) {
            throw new IllegalArgumentException("A notification source is required when the watchdog is enabled");
        }
        this.config = config;
        this.source = source;
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
        this.sleeper = sleeper;
        this.metrics = new EventServerMetrics(ot.getMeter(NAME));
        this.tracer = ot.getTracer(NAME);
    }

    /**
     * Starts the watchdog. Calling it again has no effect.
     *
     * @return this server
     */
    public EventServer<E> start() {
        checkOpen();
        if (started.compareAndSet(false, true) && config.watchdogEnabled()) {
            loop.call(() -> {
                spawnWatchdog();
                return null;
            });
        }
        return this;
    }

    /**
     * Makes {@code channels} the complete set of channels {@code subscriber}
     * receives events for. Repeated calls replace, never merge. Liveness
     * observation starts with the first registration and is kept across
     * re-registrations.
     *
     * @param subscriber the subscriber
     * @param channels   database names and/or {@link Channels#ALL_DBS}
     * @return {@link Reply#OK}
     * @throws IllegalStateException    if the server is closed
     * @throws IllegalArgumentException if subscriber or channels are null
     */
    public Reply register(Subscriber<E> subscriber, Collection<String> channels) {
        checkOpen();
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        if (channels == null || channels.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Channels cannot be null");
        }
        List<String> channelList = List.copyOf(channels);
        return loop.call(guarded(() -> handleRegister(subscriber, channelList)));
    }

    /**
     * Drops every registration of {@code subscriber} and stops observing it.
     *
     * @param subscriber the subscriber
     * @return {@link Reply#OK}, or {@link Reply#NOT_REGISTERED} if there was
     *         nothing to drop
     * @throws IllegalStateException if the server is closed
     */
    public Reply unregister(Subscriber<E> subscriber) {
        checkOpen();
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        return loop.call(guarded(() -> handleUnregister(subscriber)));
    }

    /**
     * Queues {@code event} for every listener of {@code channel} and every
     * listener of {@link Channels#ALL_DBS}. A subscriber on both receives it
     * once. Returns without waiting for delivery.
     *
     * @param channel the database name the event belongs to
     * @param event   the payload
     * @throws IllegalStateException    if the server is closed
     * @throws IllegalArgumentException if channel or event is null
     */
    public void publish(String channel, E event) {
        checkOpen();
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (!loop.tryCast(guardedRun(() -> handleNotify(channel, event)))) {
            throw new IllegalStateException("Event server is closed");
        }
    }

    /**
     * Synchronous request entry point. Accepts {@link Register} and
     * {@link Unregister}; anything else is logged and answered with
     * {@link Reply#IGNORED}.
     *
     * @param request the request
     * @return the reply
     */
    @SuppressWarnings("unchecked")
    public Reply call(Object request) {
        if (request instanceof Register<?> r) {
            return register((Subscriber<E>) r.subscriber(), r.channels());
        }
        if (request instanceof Unregister<?> u) {
            return unregister((Subscriber<E>) u.subscriber());
        }
        LOGGER.info("{} ignoring call {} from {}", NAME, request, Thread.currentThread().getName());
        return Reply.IGNORED;
    }

    /**
     * Asynchronous request entry point. Accepts {@link Notify}; anything else
     * is logged and dropped.
     *
     * @param request the request
     */
    @SuppressWarnings("unchecked")
    public void cast(Object request) {
        if (request instanceof Notify<?> n) {
            publish(n.channel(), (E) n.event());
            return;
        }
        LOGGER.info("{} ignoring cast {}", NAME, request);
    }

    public Optional<Set<String>> channelsOf(Subscriber<E> subscriber) {
        checkOpen();
        return loop.call(() -> registry.lookup(subscriber).map(Registration::channels));
    }

    public Set<Subscriber<E>> listenersOf(String channel) {
        checkOpen();
        return loop.call(() -> registry.listenersOf(channel)
                .<Set<Subscriber<E>>>map(Set::copyOf)
                .orElse(Set.of()));
    }

    public int subscriberCount() {
        checkOpen();
        return loop.call(registry::subscriberCount);
    }

    public boolean watchdogRunning() {
        checkOpen();
        return loop.call(() -> watchdog != null);
    }

    /**
     * Runs {@code action} against the registry on the control loop.
     */
    <T> T onLoop(Function<ChannelRegistry<Subscriber<E>, MonitorRef>, T> action) {
        return loop.call(guarded(() -> action.apply(registry)));
    }

    /**
     * Asks the loop to respawn the watchdog, exactly as the cooldown timer
     * does.
     */
    void requestWatchdogRespawn() {
        loop.tryCast(this::respawnWatchdog);
    }

    private Reply handleRegister(Subscriber<E> subscriber, Collection<String> channels) {
        Optional<Registration<MonitorRef>> existing = registry.lookup(subscriber);
        if (existing.isPresent()) {
            registry.register(subscriber, existing.get().token(), channels);
            return Reply.OK;
        }
        MonitorRef ref = new MonitorRef(subscriber);
        registry.register(subscriber, ref, channels);
        metrics.recordSubscribersAdded(1);
        Observation observation = observations.get(subscriber);
        if (observation != null) {
            observation.current = ref;
            return Reply.OK;
        }
        observation = new Observation();
        observation.current = ref;
        observations.put(subscriber, observation);
        subscriber.termination().whenComplete((ignored, reason) -> loop.tryCast(
                guardedRun(() -> handleDown(subscriber, reason))));
        return Reply.OK;
    }

    private Reply handleUnregister(Subscriber<E> subscriber) {
        Optional<Registration<MonitorRef>> existing = registry.lookup(subscriber);
        if (existing.isEmpty()) {
            return Reply.NOT_REGISTERED;
        }
        registry.unregister(subscriber);
        existing.get().token().cancel();
        Observation observation = observations.get(subscriber);
        if (observation != null) {
            observation.current = null;
        }
        metrics.recordSubscribersRemoved(1);
        return Reply.OK;
    }

    private void handleDown(Subscriber<E> subscriber, Throwable reason) {
        // the termination future fires once, so a later register must observe afresh
        Observation observation = observations.remove(subscriber);
        MonitorRef ref = observation == null ? null : observation.current;
        if (ref == null || !ref.isActive()) {
            return;
        }
        ref.cancel();
        Optional<Registration<MonitorRef>> existing = registry.lookup(subscriber);
        if (existing.isPresent() && existing.get().token() == ref) {
            registry.unregister(subscriber);
            metrics.recordSubscribersRemoved(1);
            LOGGER.debug("{} terminated ({}), dropped channels {}", subscriber,
                    reason == null ? "normal" : reason, existing.get().channels());
        }
    }

    private void handleNotify(String channel, E event) {
        metrics.recordPublished(channel);
        processWithTelemetry(tracer, "publish_event", channel, () -> {
            Set<Subscriber<E>> targets = new LinkedHashSet<>();
            registry.listenersOf(Channels.ALL_DBS).ifPresent(targets::addAll);
            registry.listenersOf(channel).ifPresent(targets::addAll);
            if (!targets.isEmpty()) {
                ChannelEvent<E> message = new ChannelEvent<>(channel, event);
                for (Subscriber<E> subscriber : targets) {
                    deliver(subscriber, message);
                }
            }
            return null;
        });
    }

    private void deliver(Subscriber<E> subscriber, ChannelEvent<E> message) {
        try {
            if (subscriber.offer(message)) {
                metrics.recordDelivered(message.channel());
            } else {
                metrics.recordDropped(message.channel());
                LOGGER.debug("{} refused event on {}", subscriber, message.channel());
            }
        } catch (RuntimeException e) {
            metrics.recordDropped(message.channel());
            LOGGER.warn("{} failed to accept event on {}", subscriber, message.channel(), e);
        }
    }

    private void spawnWatchdog() {
        MonitorRef ref = new MonitorRef("watchdog");
        Watchdog dog = new Watchdog(source, config.watchdogInterval(), sleeper);
        Future<?> task = asyncExecutor.submit(() -> {
            Throwable reason = null;
            try {
                dog.run();
            } catch (InterruptedException | RuntimeException e) {
                reason = e;
            } catch (Error e) {
                reason = e;
                throw e;
            } finally {
                Throwable downReason = reason;
                loop.tryCast(() -> handleWatchdogDown(ref, downReason));
            }
            return null;
        });
        watchdog = new WatchdogHandle(task, ref);
    }

    private void handleWatchdogDown(MonitorRef ref, Throwable reason) {
        if (watchdog == null || watchdog.ref() != ref) {
            LOGGER.info("{} ignoring exit of stale {}", NAME, ref);
            return;
        }
        LOGGER.info("{} watchdog died: {}", NAME, reason == null ? "normal" : reason.toString());
        watchdog = null;
        if (closed.get()) {
            return;
        }
        try {
            asyncExecutor.schedule(this::requestWatchdogRespawn,
                    config.watchdogRestartDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("{} could not schedule watchdog respawn", NAME, e);
        }
    }

    private void respawnWatchdog() {
        if (closed.get()) {
            return;
        }
        if (watchdog != null) {
            LOGGER.info("{} ignoring watchdog respawn, one is already running", NAME);
            return;
        }
        spawnWatchdog();
        metrics.recordWatchdogRestart();
    }

    private <T> Callable<T> guarded(Callable<T> task) {
        return () -> {
            try {
                return task.call();
            } catch (RegistryCorruptedException e) {
                crash(e);
                throw e;
            }
        };
    }

    private Runnable guardedRun(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RegistryCorruptedException e) {
                crash(e);
            }
        };
    }

    private void crash(RegistryCorruptedException e) {
        LOGGER.error("{} registry corrupted, restarting with an empty registry", NAME, e);
        dropAll();
        metrics.recordControlLoopCrash();
    }

    private void dropAll() {
        List<MonitorRef> refs = registry.clear();
        refs.forEach(MonitorRef::cancel);
        metrics.recordSubscribersRemoved(refs.size());
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Event server is closed");
        }
    }

    /**
     * Stops the watchdog, forgets every subscriber and rejects further
     * requests.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            loop.call(() -> {
                if (watchdog != null) {
                    watchdog.task().cancel(true);
                    watchdog = null;
                }
                dropAll();
                return null;
            });
        } catch (EventServerException e) {
            LOGGER.warn("{} did not shut down cleanly", NAME, e);
        } finally {
            loop.close();
            if (ownsExecutor) {
                asyncExecutor.shutdownNow();
            }
        }
    }
}
