package com.anthem.authguard.checker.provider;

import com.anthem.authguard.core.model.ServerlessFunction;
import com.anthem.authguard.core.model.Stack;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Function provider over already-parsed stacks.
 *
 * Resources of every stack are resolved once, up front, and indexed by stack path,
 * so callers never walk the nesting tree themselves. Api and HttpApi resources inherit
 * the template's {@code Globals.Api} / {@code Globals.HttpApi} properties.
 */
public class TemplateFunctionProvider implements FunctionProvider {

    private static final Logger log = LoggerFactory.getLogger(TemplateFunctionProvider.class);

    public static final String SERVERLESS_FUNCTION = "AWS::Serverless::Function";
    public static final String LAMBDA_FUNCTION = "AWS::Lambda::Function";

    private static final Map<String, String> GLOBALS_SECTION_BY_TYPE = Map.of(
            "AWS::Serverless::Api", "Api",
            "AWS::Serverless::HttpApi", "HttpApi"
    );

    private final List<ServerlessFunction> functions = new ArrayList<>();
    private final Map<String, Map<String, JsonNode>> resourcesByStackPath = new LinkedHashMap<>();

    public TemplateFunctionProvider(List<Stack> stacks) {
        for (Stack stack : stacks) {
            String stackPath = stack.getStackPath() == null ? Stack.ROOT_PATH : stack.getStackPath();
            if (resourcesByStackPath.containsKey(stackPath)) {
                log.warn("Duplicate stack path ignored: stackPath='{}'", stackPath);
                continue;
            }
            Map<String, JsonNode> resources = resolveResources(stack);
            resourcesByStackPath.put(stackPath, Collections.unmodifiableMap(resources));
            collectFunctions(stack, stackPath, resources);
        }
        log.debug("Loaded {} functions from {} stacks", functions.size(), resourcesByStackPath.size());
    }

    @Override
    public List<ServerlessFunction> getAll() {
        return Collections.unmodifiableList(functions);
    }

    @Override
    public Map<String, JsonNode> getResourcesByStackPath(String stackPath) {
        return resourcesByStackPath.getOrDefault(stackPath == null ? Stack.ROOT_PATH : stackPath, Map.of());
    }

    private Map<String, JsonNode> resolveResources(Stack stack) {
        Map<String, JsonNode> resources = new LinkedHashMap<>();
        JsonNode template = stack.getTemplate();
        if (template == null || !template.path("Resources").isObject()) {
            return resources;
        }

        IntrinsicResolver resolver = IntrinsicResolver.forStack(stack);
        JsonNode globals = template.path("Globals");

        Iterator<Map.Entry<String, JsonNode>> entries = template.path("Resources").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode resource = applyGlobals(entry.getValue(), globals);
            resources.put(entry.getKey(), resolver.resolve(resource));
        }
        return resources;
    }

    private JsonNode applyGlobals(JsonNode resource, JsonNode globals) {
        String section = GLOBALS_SECTION_BY_TYPE.get(resource.path("Type").asText());
        if (section == null || !globals.path(section).isObject() || !resource.isObject()) {
            return resource;
        }
        ObjectNode merged = resource.deepCopy();
        JsonNode properties = resource.path("Properties");
        ObjectNode mergedProperties = properties.isObject()
                ? merge(globals.get(section), properties)
                : globals.get(section).deepCopy();
        merged.set("Properties", mergedProperties);
        return merged;
    }

    /**
     * Mappings merge key by key with the resource winning; any other value is replaced.
     */
    private static ObjectNode merge(JsonNode global, JsonNode local) {
        ObjectNode result = global.deepCopy();
        local.fields().forEachRemaining(field -> {
            JsonNode existing = result.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                result.set(field.getKey(), merge(existing, field.getValue()));
            } else {
                result.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        return result;
    }

    private void collectFunctions(Stack stack, String stackPath, Map<String, JsonNode> resources) {
        for (Map.Entry<String, JsonNode> entry : resources.entrySet()) {
            String type = entry.getValue().path("Type").asText();
            if (!SERVERLESS_FUNCTION.equals(type) && !LAMBDA_FUNCTION.equals(type)) {
                continue;
            }

            Map<String, JsonNode> events = new LinkedHashMap<>();
            JsonNode declared = entry.getValue().path("Properties").path("Events");
            if (SERVERLESS_FUNCTION.equals(type) && declared.isObject()) {
                declared.fields().forEachRemaining(event -> events.put(event.getKey(), event.getValue()));
            }

            functions.add(ServerlessFunction.builder()
                    .name(entry.getKey())
                    .fullPath(stack.childPath(entry.getKey()))
                    .stackPath(stackPath)
                    .resourceType(type)
                    .events(events)
                    .build());
        }
    }
}
