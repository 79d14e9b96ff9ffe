package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One entity holding the expanded set, and the sets crossed to reach it. */
public record ExpandItem(
        @JsonProperty("src") EntityMessage src,
        @JsonProperty("path") List<SetMessage> path) {
    public ExpandItem {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
