package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExpandResponse(@JsonProperty("expanded") List<ExpandItem> expanded) {
    public ExpandResponse {
        expanded = expanded == null ? List.of() : List.copyOf(expanded);
    }
}
