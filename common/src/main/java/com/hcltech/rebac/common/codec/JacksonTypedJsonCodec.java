package com.hcltech.rebac.common.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hcltech.rebac.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON codec for one concrete class. Unknown properties are rejected; empty objects encode as {@code {}}. */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String>, HasObjectMapper {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode " + klass.getSimpleName() + " to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null || json.isBlank())
            return ErrorsOr.error("Failed to decode " + klass.getSimpleName() + " from JSON: empty input");
        try {
            return ErrorsOr.lift(mapper.readValue(json, klass));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode " + klass.getSimpleName() + " from JSON: " + e.getMessage());
        }
    }

    @Override
    public ObjectMapper objectMapper() {
        return mapper;
    }
}
