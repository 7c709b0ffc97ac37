package com.anthem.authguard.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parsed template together with its position in the nesting tree.
 * The root template has an empty stack path; a nested application
 * {@code Child} declared in the root has path {@code Child}, and deeper
 * levels join logical ids with {@code /}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Stack {

    public static final String ROOT_PATH = "";

    @Builder.Default
    private String stackPath = ROOT_PATH;

    private JsonNode template;

    /**
     * Parameter values supplied at deploy time. Take precedence over parameter defaults.
     */
    @Builder.Default
    private Map<String, String> parameterOverrides = new LinkedHashMap<>();

    public boolean isRoot() {
        return stackPath == null || stackPath.isEmpty();
    }

    /**
     * Path of a resource or function declared directly in this stack.
     */
    public String childPath(String logicalId) {
        return isRoot() ? logicalId : stackPath + "/" + logicalId;
    }
}
