package com.hcltech.rebac.service;

import com.hcltech.rebac.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Worker pool for inbound requests. Each request runs synchronously to completion on one worker;
 * the only blocking inside is the graph lock. Cancelling a returned future does not interrupt a
 * request that has already started.
 */
public final class RebacRequestExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RebacRequestExecutor.class);

    private final JsonRebacHandler handler;
    private final ExecutorService pool;

    public RebacRequestExecutor(JsonRebacHandler handler, ExecutorService pool) {
        this.handler = Objects.requireNonNull(handler);
        this.pool = Objects.requireNonNull(pool);
    }

    public CompletableFuture<ErrorsOr<String>> submit(String operation, String json, String callerId) {
        return submit(() -> handler.handle(operation, json, callerId));
    }

    public <T> CompletableFuture<T> submit(Supplier<T> request) {
        return CompletableFuture.supplyAsync(request, pool);
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Request pool did not drain in 10s, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
