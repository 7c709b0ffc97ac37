package com.anthem.authguard.checker.provider;

import com.anthem.authguard.core.model.Stack;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves {@code Ref} intrinsics to literal values.
 *
 * A reference to a parameter yields the deploy-time override, else the parameter's
 * default. Any other reference, which is how functions point at API resources,
 * yields the referenced logical id. {@code Ref: AWS::NoValue} removes the
 * enclosing key. Every other intrinsic is left untouched.
 */
public class IntrinsicResolver {

    static final String REF = "Ref";
    static final String NO_VALUE = "AWS::NoValue";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Map<String, String> parameterValues;

    public IntrinsicResolver(Map<String, String> parameterValues) {
        this.parameterValues = parameterValues == null
                ? Collections.emptyMap()
                : Map.copyOf(parameterValues);
    }

    public static IntrinsicResolver forStack(Stack stack) {
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode parameters = stack.getTemplate() == null
                ? MissingNode.getInstance()
                : stack.getTemplate().path("Parameters");

        Iterator<Map.Entry<String, JsonNode>> fields = parameters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> parameter = fields.next();
            JsonNode defaultValue = parameter.getValue().path("Default");
            if (defaultValue.isValueNode()) {
                values.put(parameter.getKey(), defaultValue.asText());
            }
        }
        if (stack.getParameterOverrides() != null) {
            values.putAll(stack.getParameterOverrides());
        }
        return new IntrinsicResolver(values);
    }

    /**
     * Returns a resolved copy; the input is not modified.
     */
    public JsonNode resolve(JsonNode node) {
        if (node == null) {
            return MissingNode.getInstance();
        }
        if (node.isObject()) {
            if (isRef(node)) {
                return resolveRef(node.get(REF).textValue());
            }
            ObjectNode resolved = NODES.objectNode();
            node.fields().forEachRemaining(field -> {
                if (!isNoValue(field.getValue())) {
                    resolved.set(field.getKey(), resolve(field.getValue()));
                }
            });
            return resolved;
        }
        if (node.isArray()) {
            ArrayNode resolved = NODES.arrayNode();
            for (JsonNode element : node) {
                if (!isNoValue(element)) {
                    resolved.add(resolve(element));
                }
            }
            return resolved;
        }
        return node;
    }

    private JsonNode resolveRef(String name) {
        if (NO_VALUE.equals(name)) {
            return MissingNode.getInstance();
        }
        String value = parameterValues.get(name);
        return NODES.textNode(value != null ? value : name);
    }

    private static boolean isRef(JsonNode node) {
        return node.size() == 1 && node.path(REF).isTextual();
    }

    private static boolean isNoValue(JsonNode node) {
        return node.isObject() && isRef(node) && NO_VALUE.equals(node.get(REF).textValue());
    }
}
