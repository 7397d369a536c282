package com.configmirror.sdk;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Standard {@link TaskExecutor}: a small scheduler for the polling loops, and a separate bounded
 * pool for ID list fetches.
 */
final class DefaultTaskExecutor implements TaskExecutor {
    // one thread per polling loop
    private static final int SCHEDULER_THREADS = 2;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    DefaultTaskExecutor(int workerThreads) {
        BackgroundThreadExecutor factory = new BackgroundThreadExecutor("config-mirror");
        this.scheduler = factory.newScheduledThreadPool(SCHEDULER_THREADS);
        this.workers = factory.newFixedThreadPool(Math.max(1, workerThreads));
    }

    @Override
    public ScheduledFuture<?> startRepeatingTask(Runnable action, long initialDelayMillis, long intervalMillis) {
        return scheduler.scheduleWithFixedDelay(action, initialDelayMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
    }

    @Override
    public Future<?> submitWorkerTask(Runnable action) {
        return workers.submit(action);
    }

    @Override
    public void close() {
        scheduler.shutdown();
        workers.shutdown();
    }
}
