package com.hcltech.rebac.service.messages;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IsPermittedResponse(@JsonProperty("permitted") boolean permitted) {
}
