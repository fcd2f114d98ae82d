package com.p14n.dbevent.broker;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.p14n.dbevent.data.ChannelEvent;

/**
 * Queue backed {@link Subscriber}. Events are offered without blocking and
 * consumed with {@link #take()} or {@link #poll(long, TimeUnit)} by whoever
 * owns the mailbox.
 *
 * <p>
 * A mailbox with a capacity refuses events once full; the loss is the
 * subscriber's concern and never slows down publishers.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Mailbox<DbEvent> mailbox = Mailbox.spawn(executor, "indexer", m -> {
 *     while (true) {
 *         ChannelEvent<DbEvent> e = m.take();
 *         // handle e
 *     }
 * });
 * server.register(mailbox, List.of(Channels.ALL_DBS));
 * }</pre>
 *
 * @param <E> The event payload type
 */
public class Mailbox<E> implements Subscriber<E> {

    /**
     * Code run on behalf of a spawned mailbox.
     *
     * @param <E> The event payload type
     */
    @FunctionalInterface
    public interface Body<E> {
        void run(Mailbox<E> mailbox) throws Exception;
    }

    private final String name;
    private final BlockingQueue<ChannelEvent<E>> queue;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private volatile Future<?> task;

    public Mailbox(String name) {
        this(name, Integer.MAX_VALUE);
    }

    public Mailbox(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.name = name;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Creates a mailbox and runs {@code body} with it on the executor. The
     * mailbox terminates when the body returns, normally or by throwing.
     *
     * @param executor executor to run the body on
     * @param name     mailbox name, used in logs
     * @param body     the consumer code
     * @param <E>      The event payload type
     * @return the running mailbox
     */
    public static <E> Mailbox<E> spawn(AsyncExecutor executor, String name, Body<E> body) {
        Mailbox<E> mailbox = new Mailbox<>(name);
        mailbox.task = executor.submit(() -> {
            try {
                body.run(mailbox);
                mailbox.terminate();
            } catch (InterruptedException e) {
                mailbox.terminate(e);
                Thread.currentThread().interrupt();
            } catch (Exception | Error e) {
                mailbox.terminate(e);
                throw e;
            }
            return null;
        });
        return mailbox;
    }

    @Override
    public boolean offer(ChannelEvent<E> event) {
        if (terminated.isDone()) {
            return false;
        }
        return queue.offer(event);
    }

    @Override
    public CompletionStage<Void> termination() {
        return terminated;
    }

    public ChannelEvent<E> take() throws InterruptedException {
        return queue.take();
    }

    public ChannelEvent<E> poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public boolean isTerminated() {
        return terminated.isDone();
    }

    /**
     * Marks a clean exit.
     */
    public void terminate() {
        terminated.complete(null);
    }

    /**
     * Marks an abnormal exit.
     *
     * @param reason why the owner stopped
     */
    public void terminate(Throwable reason) {
        terminated.completeExceptionally(reason);
    }

    /**
     * Terminates the mailbox and interrupts its body if it was spawned.
     */
    public void stop() {
        terminate();
        Future<?> running = task;
        if (running != null) {
            running.cancel(true);
        }
    }

    @Override
    public String toString() {
        return "Mailbox[" + name + "]";
    }
}
