package com.hcltech.rebac.common.async;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pluggable factory for creating ExecutorService instances.
 * <p>
 * Example:
 *   ExecutorService workers = ExecutorServiceFactory.fixed().create(8, "rebac-worker");
 */
public interface ExecutorServiceFactory {

    /**
     * @param threads          desired concurrency (at least one thread is always created)
     * @param threadNamePrefix prefix for thread names
     */
    ExecutorService create(int threads, String threadNamePrefix);

    default String name() { return getClass().getSimpleName(); }

    /** Fixed thread pool of named daemon threads. */
    static ExecutorServiceFactory fixed() {
        return new FixedImpl();
    }

    final class FixedImpl implements ExecutorServiceFactory {
        @Override
        public ExecutorService create(int threads, String prefix) {
            int n = Math.max(1, threads);
            return Executors.newFixedThreadPool(n, namedDaemon(Objects.requireNonNullElse(prefix, "pool")));
        }

        @Override public String name() { return "fixed"; }

        private static ThreadFactory namedDaemon(String prefix) {
            AtomicInteger seq = new AtomicInteger(1);
            return r -> {
                Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
