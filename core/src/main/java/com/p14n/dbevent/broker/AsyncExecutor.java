package com.p14n.dbevent.broker;

import java.util.List;
import java.util.concurrent.*;

/**
 * Interface for asynchronous task execution.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a one-shot task.
     *
     * @param command The task to execute
     * @param delay   The time to delay execution
     * @param unit    The time unit of the delay parameter
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit);

    /**
     * Shuts down the executor and returns a list of runnables that were not
     * executed.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    /**
     * Submits a task for execution and returns a Future representing the pending
     * result. Tasks may block for as long as they like.
     *
     * @param task The task to submit
     * @param <T>  The type of the task
     * @return A Future representing pending completion of the task
     */
    <T> Future<T> submit(Callable<T> task);

}
