package com.olo.kernel.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.olo.kernel.error.KernelException;

import java.util.Map;

/**
 * JSON (de)serialization of {@link PipelineConfig}. Unknown fields are ignored so workers can send richer
 * configs than the kernel needs.
 */
public final class PipelineConfigJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PipelineConfigJson() {
    }

    /**
     * @throws KernelException VALIDATION on malformed JSON
     */
    public static PipelineConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, PipelineConfig.class);
        } catch (JsonProcessingException e) {
            throw KernelException.validation("invalid pipeline config: %s", e.getOriginalMessage());
        }
    }

    /**
     * @throws KernelException VALIDATION when the map does not describe a pipeline config
     */
    public static PipelineConfig fromMap(Map<String, Object> map) {
        if (map == null) {
            throw KernelException.validation("pipeline_config is required");
        }
        try {
            return MAPPER.convertValue(map, PipelineConfig.class);
        } catch (IllegalArgumentException e) {
            throw KernelException.validation("invalid pipeline config: %s", e.getMessage());
        }
    }

    public static String toJson(PipelineConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw KernelException.internal("failed to serialize pipeline config " + config.getName(), e);
        }
    }
}
