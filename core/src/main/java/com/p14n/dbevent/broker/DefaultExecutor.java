package com.p14n.dbevent.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;

/**
 * Default implementation of {@link AsyncExecutor} backed by a scheduled pool
 * for timers and a worker pool for long running tasks such as the watchdog and
 * spawned mailboxes.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;
        private final ExecutorService es;

        /**
         * Creates a new executor with a scheduled thread pool and an unbounded
         * cached worker pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createCachedExecutorService();
        }

        static ThreadFactory createNamedFactory(String nameFormat, ThreadFactory backingFactory) {
                AtomicLong count = (nameFormat != null) ? new AtomicLong(0) : null;
                return runnable -> {
                        Thread thread = backingFactory.newThread(runnable);
                        if (nameFormat != null) {
                                thread.setName(format(nameFormat, count.getAndIncrement()));
                        }
                        thread.setDaemon(true);
                        return thread;
                };
        }

        static ThreadFactory createNamedFactory(String nameFormat) {
                return createNamedFactory(nameFormat, Executors.defaultThreadFactory());
        }

        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                createNamedFactory("db-event-worker-%d"));
        }

        /**
         * Creates a scheduled thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a scheduled thread pool executor service
         */
        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                createNamedFactory("db-event-scheduled-%d"));
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
                return se.schedule(command, delay, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                var x = new ArrayList<Runnable>();
                x.addAll(es.shutdownNow());
                x.addAll(se.shutdownNow());
                return x;
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
