package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire form of an entity: {@code {"namespace": ..., "id": ...}}. */
public record EntityMessage(
        @JsonProperty("namespace") String namespace,
        @JsonProperty("id") String id) {
}
