package com.hcltech.rebac.graph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.hcltech.rebac.graph.TestGraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class MemoryRelationGraphConcurrencyTest {

    @Test
    void concurrentGrantsOfDistinctEdgesAreAllApplied() throws Exception {
        final int writers = 8;
        final int edgesPerWriter = 500;
        RelationGraph graph = new MemoryRelationGraph();
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                final int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < edgesPerWriter; i++)
                        graph.grant(new Entity("users", "u" + writer + "-" + i), FOO_READ);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(writers * edgesPerWriter, graph.edgeCount());
        assertEquals(writers * edgesPerWriter, graph.expand(FOO_READ).size());
    }

    @Test
    void readersNeverSeeAHalfAppliedEdge() throws Exception {
        RelationGraph graph = new MemoryRelationGraph();
        // a permanent path alice -> admins -> staff; the churned edges never remove it
        graph.grant(ALICE, ADMINS);
        graph.grant(ADMINS, STAFF);

        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < 2; w++) {
                final int writer = w;
                futures.add(pool.submit(() -> {
                    int i = 0;
                    while (running.get()) {
                        Entity user = new Entity("users", "churn" + writer + "-" + (i++ % 50));
                        graph.grant(user, ADMINS);
                        graph.grant(ANY_USER, AUDITORS);
                        graph.revoke(user, ADMINS);
                        graph.revoke(ANY_USER, AUDITORS);
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 4; r++) {
                futures.add(pool.submit(() -> {
                    while (running.get()) {
                        assertTrue(graph.isPermitted(ALICE, STAFF));
                        assertTrue(graph.exists(ADMINS, STAFF));
                        List<ExpandResult> staff = graph.expand(STAFF);
                        assertTrue(staff.contains(expanded(ALICE, ADMINS, STAFF)), staff.toString());
                        int edges = graph.edgeCount();
                        assertTrue(edges >= 2 && edges <= 5, "edgeCount " + edges);
                    }
                    return null;
                }));
            }
            Thread.sleep(500);
            running.set(false);
            // an assertion failure in a reader surfaces here as an ExecutionException
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            running.set(false);
            pool.shutdownNow();
        }

        assertEquals(2, graph.edgeCount());
        assertFalse(graph.isPermitted(CHARLIE, AUDITORS));
    }
}
