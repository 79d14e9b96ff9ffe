package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire form of a permission set. */
public record SetMessage(
        @JsonProperty("namespace") String namespace,
        @JsonProperty("id") String id,
        @JsonProperty("relation") String relation) {
}
