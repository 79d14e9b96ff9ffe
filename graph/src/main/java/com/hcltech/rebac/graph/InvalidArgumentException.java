package com.hcltech.rebac.graph;

import java.util.List;

/** Malformed input to the relation graph. Never retried. */
public class InvalidArgumentException extends IllegalArgumentException {
    private final List<String> errors;

    public InvalidArgumentException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
