package com.hcltech.rebac.service;

import com.hcltech.rebac.graph.RelationGraph;

/** Everything one running instance needs, wired once. Close to stop the worker pool. */
public record RebacContainer(
        RebacConfig config,
        RelationGraph graph,
        RebacService service,
        JsonRebacHandler handler,
        RebacRequestExecutor executor) implements AutoCloseable {

    @Override
    public void close() {
        executor.close();
    }
}
