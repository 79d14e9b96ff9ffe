package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExistsResponse(@JsonProperty("exists") boolean exists) {
}
