package com.configmirror.sdk;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates thread pools whose threads are named daemon threads, so an application that forgets to
 * close the client can still exit.
 */
class BackgroundThreadExecutor {

    private final ThreadFactory threadFactory;

    BackgroundThreadExecutor(String namePrefix) {
        this.threadFactory = new DaemonThreadFactory(namePrefix);
    }

    ExecutorService newFixedThreadPool(int nThreads) {
        return new ThreadPoolExecutor(nThreads, nThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<Runnable>(), threadFactory);
    }

    ScheduledExecutorService newScheduledThreadPool(int nThreads) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(nThreads, threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private static class DaemonThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger count = new AtomicInteger();

        DaemonThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(final Runnable runnable) {
            Thread thread = new Thread(runnable, namePrefix + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
