package com.hcltech.rebac.service;

import com.hcltech.rebac.common.errorsor.ErrorsOr;
import com.hcltech.rebac.graph.Edge;
import com.hcltech.rebac.graph.Entity;
import com.hcltech.rebac.graph.RelationGraph;
import com.hcltech.rebac.service.messages.EmptyResponse;
import com.hcltech.rebac.service.messages.ExistsResponse;
import com.hcltech.rebac.service.messages.ExpandRequest;
import com.hcltech.rebac.service.messages.ExpandResponse;
import com.hcltech.rebac.service.messages.IsPermittedResponse;
import com.hcltech.rebac.service.messages.RelationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The five RPC operations over a {@link RelationGraph}. Bad requests come back as errors, nothing
 * is thrown for them. The graph is injected, so independent services never share state.
 * <p>
 * {@code callerId} is the authenticated caller as given by the transport, or null. When a request
 * has no {@code src} the caller, in the configured default subject namespace, is used instead.
 */
public class RebacService {
    private static final Logger log = LoggerFactory.getLogger(RebacService.class);

    private final RelationGraph graph;
    private final RebacConfig config;

    public RebacService(RelationGraph graph, RebacConfig config) {
        this.graph = Objects.requireNonNull(graph);
        this.config = Objects.requireNonNull(config);
    }

    public ErrorsOr<EmptyResponse> grant(RelationRequest request, String callerId) {
        return edge("Grant", request, callerId).map(e -> {
            if (graph.grant(e.source(), e.destination()))
                log.info("created relation {} for {}", e, callerOrAnonymous(callerId));
            else
                log.debug("relation {} already present", e);
            return EmptyResponse.INSTANCE;
        });
    }

    public ErrorsOr<EmptyResponse> revoke(RelationRequest request, String callerId) {
        return edge("Revoke", request, callerId).map(e -> {
            if (graph.revoke(e.source(), e.destination()))
                log.info("deleted relation {} for {}", e, callerOrAnonymous(callerId));
            else
                log.debug("relation {} was not present", e);
            return EmptyResponse.INSTANCE;
        });
    }

    public ErrorsOr<ExistsResponse> exists(RelationRequest request, String callerId) {
        return edge("Exists", request, callerId)
                .map(e -> new ExistsResponse(graph.exists(e.source(), e.destination())));
    }

    public ErrorsOr<IsPermittedResponse> isPermitted(RelationRequest request, String callerId) {
        return edge("IsPermitted", request, callerId)
                .map(e -> new IsPermittedResponse(graph.isPermitted(e.source(), e.destination(), config.maxDepth())));
    }

    public ErrorsOr<ExpandResponse> expand(ExpandRequest request) {
        if (request == null) return rejected("Expand", ErrorsOr.error("request must be set"));
        return rejected("Expand", RebacMessages.destination(request.dst()))
                .map(dst -> new ExpandResponse(graph.expand(dst).stream().map(RebacMessages::toItem).toList()));
    }

    private ErrorsOr<Edge> edge(String operation, RelationRequest request, String callerId) {
        if (request == null) return rejected(operation, ErrorsOr.error("request must be set"));
        Entity defaultSubject = callerId == null ? null : new Entity(config.defaultSubjectNamespace(), callerId);
        return rejected(operation, ErrorsOr.combine(
                RebacMessages.source(request, defaultSubject),
                RebacMessages.destination(request.dst()),
                Edge::new));
    }

    private static <T> ErrorsOr<T> rejected(String operation, ErrorsOr<T> result) {
        result.ifError(errors -> log.warn("{} rejected: {}", operation, errors));
        return result;
    }

    private static String callerOrAnonymous(String callerId) {
        return callerId == null ? "anonymous" : callerId;
    }
}
