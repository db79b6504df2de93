package com.p14n.eventbroker.broker;

import java.util.concurrent.RejectedExecutionException;

/**
 * Runs delivery tasks one at a time, in submission order.
 */
public interface DeliveryExecutor extends AutoCloseable {

    /**
     * Queues a task behind every previously submitted one.
     *
     * @param task the task to run
     * @throws RejectedExecutionException if the executor is closing or closed
     */
    void execute(Runnable task);

    /**
     * Checks whether the calling thread is the one running this executor's
     * tasks.
     *
     * @return true when called from inside a task
     */
    boolean isWorkerThread();

    /**
     * Stops accepting tasks, runs every task already submitted and then stops,
     * blocking until the last one has finished.
     */
    @Override
    void close();
}
