package com.hcltech.rebac.graph;

import com.hcltech.rebac.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;

/**
 * Field checks shared by the graph and the request layer. Namespace, id and relation must be
 * non-empty. Only an id of exactly {@value Node#WILDCARD_ID} is special; any other id is taken literally.
 */
public interface NodeValidation {

    /** @param field prefix for messages, e.g. {@code "src"} gives {@code "src.id must be set"} */
    static <N extends Node> ErrorsOr<N> validate(String field, N node) {
        List<String> errors = new ArrayList<>();
        checkSet(errors, field + ".namespace", node.namespace());
        checkSet(errors, field + ".id", node.id());
        if (node instanceof PermissionSet set)
            checkSet(errors, field + ".relation", set.relation());
        return errors.isEmpty() ? ErrorsOr.lift(node) : ErrorsOr.errors(errors);
    }

    static ErrorsOr<Edge> validate(Node src, PermissionSet dst) {
        return ErrorsOr.combine(validate("src", src), validate("dst", dst), Edge::new);
    }

    static void requireValid(Node src, PermissionSet dst) {
        validate(src, dst).ifError(errors -> {
            throw new InvalidArgumentException(errors);
        });
    }

    static void requireValid(PermissionSet dst) {
        validate("dst", dst).ifError(errors -> {
            throw new InvalidArgumentException(errors);
        });
    }

    private static void checkSet(List<String> errors, String field, String value) {
        if (value.isEmpty()) errors.add(field + " must be set");
    }
}
