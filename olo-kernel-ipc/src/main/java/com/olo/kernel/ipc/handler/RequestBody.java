package com.olo.kernel.ipc.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.olo.kernel.error.KernelException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed, validating view of a request body. Missing or ill-typed fields raise VALIDATION. Structured fields
 * ({@link #object}, {@link #convert}) accept either a JSON object or a string holding JSON.
 */
public final class RequestBody {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectNode node;
    private final ObjectMapper mapper;

    public RequestBody(JsonNode node, ObjectMapper mapper) {
        if (node != null && !node.isNull() && !node.isObject()) {
            throw KernelException.validation("request body must be an object");
        }
        this.node = node != null && node.isObject() ? (ObjectNode) node : JsonNodeFactory.instance.objectNode();
        this.mapper = mapper;
    }

    public boolean has(String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    /** Non-blank string or VALIDATION. */
    public String requireText(String field) {
        String value = text(field);
        if (value == null) {
            throw KernelException.validation("Missing required field: %s", field);
        }
        return value;
    }

    /** Null when absent, null or blank. */
    public String text(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw KernelException.validation("Field %s must be a string", field);
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    public String text(String field, String defaultValue) {
        String value = text(field);
        return value != null ? value : defaultValue;
    }

    public int intValue(String field, int defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt()) {
            throw KernelException.validation("Field %s must be an integer", field);
        }
        return value.intValue();
    }

    public long longValue(String field, long defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToLong()) {
            throw KernelException.validation("Field %s must be an integer", field);
        }
        return value.longValue();
    }

    public boolean bool(String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw KernelException.validation("Field %s must be a boolean", field);
        }
        return value.booleanValue();
    }

    public List<String> textList(String field) {
        JsonNode value = node.get(field);
        List<String> result = new ArrayList<>();
        if (value == null || value.isNull()) {
            return result;
        }
        if (!value.isArray()) {
            throw KernelException.validation("Field %s must be an array", field);
        }
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw KernelException.validation("Field %s must contain strings", field);
            }
            result.add(item.asText());
        }
        return result;
    }

    /** Object field as a map; null when absent. */
    public Map<String, Object> object(String field) {
        JsonNode value = structured(field);
        return value != null ? mapper.convertValue(value, MAP_TYPE) : null;
    }

    /** Object field bound to {@code type}; null when absent. */
    public <T> T convert(String field, Class<T> type) {
        JsonNode value = structured(field);
        if (value == null) {
            return null;
        }
        try {
            return mapper.treeToValue(value, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw KernelException.validation("Invalid %s: %s", field, e.getMessage());
        }
    }

    private JsonNode structured(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            String text = value.asText();
            if (text.isBlank()) {
                return null;
            }
            try {
                value = mapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw KernelException.validation("Invalid %s: %s", field, e.getOriginalMessage());
            }
        }
        if (!value.isObject()) {
            throw KernelException.validation("Field %s must be an object", field);
        }
        return value;
    }
}
