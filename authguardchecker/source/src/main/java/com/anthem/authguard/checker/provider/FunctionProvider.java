package com.anthem.authguard.checker.provider;

import com.anthem.authguard.core.model.ServerlessFunction;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Source of functions and resources across a root template and its nested applications.
 */
public interface FunctionProvider {

    /**
     * All functions of every stack, with intrinsics in their events already resolved.
     * Order is stable: stack order, then declaration order within a stack.
     */
    List<ServerlessFunction> getAll();

    /**
     * Resolved resources declared directly in the stack at the given path,
     * keyed by logical id. Unknown paths yield an empty map.
     */
    Map<String, JsonNode> getResourcesByStackPath(String stackPath);
}
