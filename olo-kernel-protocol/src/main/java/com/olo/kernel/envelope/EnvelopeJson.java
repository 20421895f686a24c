package com.olo.kernel.envelope;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.olo.kernel.error.KernelException;

import java.util.Map;

/**
 * Conversion between {@link Envelope} and its wire form (a JSON-compatible map with snake_case keys).
 * Timestamps are ISO-8601 strings; nulls are omitted.
 */
public final class EnvelopeJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private EnvelopeJson() {
    }

    public static Map<String, Object> toMap(Envelope envelope) {
        return MAPPER.convertValue(envelope, MAP_TYPE);
    }

    /**
     * @throws KernelException VALIDATION when the map is not a valid envelope
     */
    public static Envelope fromMap(Map<String, Object> map) {
        if (map == null) {
            throw KernelException.validation("envelope is required");
        }
        try {
            return MAPPER.convertValue(map, Envelope.class);
        } catch (IllegalArgumentException e) {
            throw KernelException.validation("invalid envelope: %s", e.getMessage());
        }
    }

    /** Deep copy through the wire form. */
    public static Envelope copy(Envelope envelope) {
        return MAPPER.convertValue(toMap(envelope), Envelope.class);
    }

    /** Deep copy under a new envelope id; termination and audit state are carried over unchanged. */
    public static Envelope copyWithId(Envelope envelope, String newEnvelopeId) {
        Map<String, Object> map = toMap(envelope);
        map.put("envelope_id", newEnvelopeId);
        return MAPPER.convertValue(map, Envelope.class);
    }
}
