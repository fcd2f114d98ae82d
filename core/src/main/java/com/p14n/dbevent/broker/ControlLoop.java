package com.p14n.dbevent.broker;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * A single thread that runs every task handed to it in submission order.
 * State touched only from inside the loop needs no locking.
 */
class ControlLoop implements AutoCloseable {

    private final ExecutorService executor;
    private volatile Thread thread;

    ControlLoop(String name) {
        var factory = DefaultExecutor.createNamedFactory(name + "-%d");
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = factory.newThread(runnable);
            thread = t;
            return t;
        });
    }

    boolean inLoop() {
        return Thread.currentThread() == thread;
    }

    /**
     * Queues a task without waiting for it.
     *
     * @param task the task
     * @return false if the loop has been shut down
     */
    boolean tryCast(Runnable task) {
        try {
            executor.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    /**
     * Runs a task on the loop and waits for its result. Called from the loop
     * itself the task runs inline.
     *
     * @param task the task
     * @param <T>  result type
     * @return the task's result
     * @throws EventServerException if the loop is shut down or the caller is
     *                              interrupted
     */
    <T> T call(Callable<T> task) {
        if (inLoop()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new EventServerException("Request failed", e);
            }
        }
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new EventServerException("Event server is closed", e);
        }
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new EventServerException("Event server closed before replying", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventServerException("Interrupted waiting for event server", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new EventServerException("Request failed", e.getCause());
        }
    }

    @Override
    public void close() {
        for (Runnable pending : executor.shutdownNow()) {
            if (pending instanceof Future<?> f) {
                f.cancel(false);
            }
        }
    }
}
