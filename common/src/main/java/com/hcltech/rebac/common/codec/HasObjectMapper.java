package com.hcltech.rebac.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;

public interface HasObjectMapper {
    ObjectMapper objectMapper();
}
