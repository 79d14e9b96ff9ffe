package com.hcltech.rebac.service;

import java.util.Arrays;
import java.util.Optional;

/** RPC method names as they appear on the wire. */
public enum RebacOperation {
    GRANT("Grant"),
    REVOKE("Revoke"),
    EXISTS("Exists"),
    IS_PERMITTED("IsPermitted"),
    EXPAND("Expand");

    private final String wireName;

    RebacOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RebacOperation> fromWireName(String name) {
        return Arrays.stream(values()).filter(op -> op.wireName.equals(name)).findFirst();
    }
}
