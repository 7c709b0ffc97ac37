package com.anthem.authguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A deployable function with its trigger events already resolved to literal values.
 * Event iteration order follows the template.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServerlessFunction {

    /** Logical id of the function within its stack. */
    private String name;

    /** Logical id prefixed with the owning stack path. */
    private String fullPath;

    @Builder.Default
    private String stackPath = Stack.ROOT_PATH;

    private String resourceType;

    @Builder.Default
    private Map<String, JsonNode> events = new LinkedHashMap<>();

    public Map<String, JsonNode> getEvents() {
        return events == null ? Map.of() : Collections.unmodifiableMap(events);
    }

    public boolean hasEvents() {
        return events != null && !events.isEmpty();
    }
}
