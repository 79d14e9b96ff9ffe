package com.hcltech.rebac.service;

import com.hcltech.rebac.common.errorsor.ErrorsOr;
import com.hcltech.rebac.graph.Entity;
import com.hcltech.rebac.graph.ExpandResult;
import com.hcltech.rebac.graph.Node;
import com.hcltech.rebac.graph.NodeValidation;
import com.hcltech.rebac.graph.PermissionSet;
import com.hcltech.rebac.service.messages.EntityMessage;
import com.hcltech.rebac.service.messages.ExpandItem;
import com.hcltech.rebac.service.messages.RelationRequest;
import com.hcltech.rebac.service.messages.SetMessage;

import java.util.Objects;

/** Converts between wire messages and graph nodes. Absent strings are treated as empty. */
public final class RebacMessages {
    private RebacMessages() {}

    /**
     * @param defaultSubject used when the request carries no {@code src}; may be null
     */
    public static ErrorsOr<Node> source(RelationRequest request, Entity defaultSubject) {
        if (request.srcObj() != null && request.srcSet() != null)
            return ErrorsOr.error("src must be one of src_obj or src_set, not both");
        if (request.srcObj() != null)
            return NodeValidation.validate("src", toEntity(request.srcObj()));
        if (request.srcSet() != null)
            return NodeValidation.validate("src", toPermissionSet(request.srcSet()));
        if (defaultSubject != null)
            return NodeValidation.validate("src", defaultSubject);
        return ErrorsOr.error("src must be set");
    }

    public static ErrorsOr<PermissionSet> destination(SetMessage dst) {
        if (dst == null) return ErrorsOr.error("dst must be set");
        return NodeValidation.validate("dst", toPermissionSet(dst));
    }

    public static Entity toEntity(EntityMessage message) {
        return new Entity(orEmpty(message.namespace()), orEmpty(message.id()));
    }

    public static PermissionSet toPermissionSet(SetMessage message) {
        return new PermissionSet(orEmpty(message.namespace()), orEmpty(message.id()), orEmpty(message.relation()));
    }

    public static EntityMessage toMessage(Entity entity) {
        return new EntityMessage(entity.namespace(), entity.id());
    }

    public static SetMessage toMessage(PermissionSet set) {
        return new SetMessage(set.namespace(), set.id(), set.relation());
    }

    public static ExpandItem toItem(ExpandResult result) {
        return new ExpandItem(toMessage(result.entity()), result.path().stream().map(RebacMessages::toMessage).toList());
    }

    private static String orEmpty(String s) {
        return Objects.requireNonNullElse(s, "");
    }
}
