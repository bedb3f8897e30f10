package com.ciro.jlive.runtime;

import com.ciro.jlive.diff.Patch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serializa parches al formato JSON del cable. Los valores de los huecos ya
 * son strings escapados; aquí solo se codifica la estructura.
 */
public final class PatchEncoder {

    private final ObjectMapper mapper;

    public PatchEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public PatchEncoder() {
        this(ObjectMapperFactory.create());
    }

    public String encode(Patch patch) {
        try {
            return mapper.writeValueAsString(patch.toWire());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode patch " + patch, e);
        }
    }

    public JsonNode toTree(Patch patch) {
        return mapper.valueToTree(patch.toWire());
    }
}
