package com.hcltech.rebac.service;

import com.hcltech.rebac.common.IEnvGetter;
import com.hcltech.rebac.common.async.ExecutorServiceFactory;
import com.hcltech.rebac.common.errorsor.ErrorsOr;
import com.hcltech.rebac.graph.MemoryRelationGraph;
import com.hcltech.rebac.graph.RelationGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Builds a {@link RebacContainer} around a fresh, empty graph. */
public final class RebacContainerFactory {
    private static final Logger log = LoggerFactory.getLogger(RebacContainerFactory.class);

    private RebacContainerFactory() {}

    public static ErrorsOr<RebacContainer> create(IEnvGetter env) {
        return create(env, ExecutorServiceFactory.fixed());
    }

    public static ErrorsOr<RebacContainer> create(IEnvGetter env, ExecutorServiceFactory executors) {
        Objects.requireNonNull(env);
        Objects.requireNonNull(executors);
        return ErrorsOr.trying(() -> RebacConfig.fromEnv(env))
                .addPrefixIfError("Invalid configuration: ")
                .map(config -> create(config, executors));
    }

    public static RebacContainer create(RebacConfig config, ExecutorServiceFactory executors) {
        RelationGraph graph = new MemoryRelationGraph();
        RebacService service = new RebacService(graph, config);
        JsonRebacHandler handler = new JsonRebacHandler(service);
        RebacRequestExecutor executor = new RebacRequestExecutor(handler,
                executors.create(config.workerThreads(), "rebac-worker"));
        log.info("Started relation graph with {} {} workers, maxDepth={}, default subject namespace '{}'",
                config.workerThreads(), executors.name(), config.maxDepth(), config.defaultSubjectNamespace());
        return new RebacContainer(config, graph, service, handler, executor);
    }
}
