package com.hcltech.rebac.service;

import com.hcltech.rebac.common.codec.Codec;
import com.hcltech.rebac.common.errorsor.ErrorsOr;
import com.hcltech.rebac.service.messages.EmptyResponse;
import com.hcltech.rebac.service.messages.ExistsResponse;
import com.hcltech.rebac.service.messages.ExpandRequest;
import com.hcltech.rebac.service.messages.ExpandResponse;
import com.hcltech.rebac.service.messages.IsPermittedResponse;
import com.hcltech.rebac.service.messages.RelationRequest;

import java.util.Objects;
import java.util.function.Function;

/**
 * Decodes a JSON request, runs it on {@link RebacService} and encodes the JSON response.
 * A transport only has to supply the operation name, the body and the caller.
 */
public class JsonRebacHandler {
    private final RebacService service;
    private final Codec<RelationRequest, String> relationRequestCodec = Codec.clazzCodec(RelationRequest.class);
    private final Codec<ExpandRequest, String> expandRequestCodec = Codec.clazzCodec(ExpandRequest.class);
    private final Codec<EmptyResponse, String> emptyResponseCodec = Codec.clazzCodec(EmptyResponse.class);
    private final Codec<ExistsResponse, String> existsResponseCodec = Codec.clazzCodec(ExistsResponse.class);
    private final Codec<IsPermittedResponse, String> isPermittedResponseCodec = Codec.clazzCodec(IsPermittedResponse.class);
    private final Codec<ExpandResponse, String> expandResponseCodec = Codec.clazzCodec(ExpandResponse.class);

    public JsonRebacHandler(RebacService service) {
        this.service = Objects.requireNonNull(service);
    }

    public ErrorsOr<String> handle(String operation, String json, String callerId) {
        return RebacOperation.fromWireName(operation)
                .map(op -> handle(op, json, callerId))
                .orElseGet(() -> ErrorsOr.error("Unknown operation: " + operation));
    }

    public ErrorsOr<String> handle(RebacOperation operation, String json, String callerId) {
        return switch (operation) {
            case GRANT -> relation(json, r -> service.grant(r, callerId), emptyResponseCodec);
            case REVOKE -> relation(json, r -> service.revoke(r, callerId), emptyResponseCodec);
            case EXISTS -> relation(json, r -> service.exists(r, callerId), existsResponseCodec);
            case IS_PERMITTED -> relation(json, r -> service.isPermitted(r, callerId), isPermittedResponseCodec);
            case EXPAND -> expandRequestCodec.decode(json)
                    .flatMap(service::expand)
                    .flatMap(expandResponseCodec::encode);
        };
    }

    private <Res> ErrorsOr<String> relation(String json,
                                            Function<RelationRequest, ErrorsOr<Res>> call,
                                            Codec<Res, String> responseCodec) {
        return relationRequestCodec.decode(json).flatMap(call).flatMap(responseCodec::encode);
    }
}
