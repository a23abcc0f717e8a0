package com.example.opentelemetry.pipeline.util;

import org.slf4j.Logger;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class Threads {

    private Threads() {
    }

    /**
     * Daemon threads named {@code name} (or {@code name-N} when {@code numbered}) that log uncaught exceptions
     * to the given logger.
     */
    public static ThreadFactory daemonThreadFactory(String name, boolean numbered, Logger log) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, numbered ? name + "-" + counter.incrementAndGet() : name);
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in thread '{}':", t.getName(), e));
            return thread;
        };
    }

    public static ScheduledThreadPoolExecutor newScheduler(String name, Logger log) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        executor.setThreadFactory(daemonThreadFactory(name, false, log));
        return executor;
    }
}
