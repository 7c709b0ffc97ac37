package com.anthem.authguard.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * JSON / YAML helpers shared by authguard services.
 */
public final class JsonUtils {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonUtils() {
    }

    /**
     * Parse a YAML or JSON document. Blank content yields a missing node.
     */
    public static JsonNode parseDocument(String content) {
        if (content == null || content.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            JsonNode node = YAML_MAPPER.readTree(content);
            return node == null ? MissingNode.getInstance() : node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Template-style truthiness: missing, null, false, zero, empty strings,
     * empty sequences and empty mappings are all false.
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0d;
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    /**
     * True for a mapping with at least one entry.
     */
    public static boolean isNonEmptyObject(JsonNode node) {
        return node != null && node.isObject() && node.size() > 0;
    }
}
