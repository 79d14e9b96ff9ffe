package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExpandRequest(@JsonProperty("dst") SetMessage dst) {
}
