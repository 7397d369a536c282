package com.configmirror.sdk;

import java.io.Closeable;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Internal abstraction for standardizing how asynchronous tasks are executed.
 */
interface TaskExecutor extends Closeable {
    /**
     * Schedules an action to be run repeatedly, waiting the given interval between the end of one
     * run and the start of the next.
     *
     * @param action the action to execute at each interval
     * @param initialDelayMillis milliseconds to wait before the first execution
     * @param intervalMillis milliseconds between executions
     * @return a ScheduledFuture that can be used to cancel the task
     */
    ScheduledFuture<?> startRepeatingTask(Runnable action, long initialDelayMillis, long intervalMillis);

    /**
     * Submits a one-off action to the worker pool used for fanning out ID list fetches. This must
     * not be the same pool that runs repeating tasks, since those wait on the results.
     *
     * @param action the action to execute
     * @return a Future that completes when the action has run
     */
    Future<?> submitWorkerTask(Runnable action);

    /**
     * Stops accepting new tasks. Tasks that are already running are allowed to finish.
     */
    @Override
    void close();
}
