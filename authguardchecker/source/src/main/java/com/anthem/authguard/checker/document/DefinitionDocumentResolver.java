package com.anthem.authguard.checker.document;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns an API resource's inline definition body or definition location into a parsed document.
 */
public interface DefinitionDocumentResolver {

    /**
     * Resolve the definition document of an API resource.
     * An inline body takes precedence over a location.
     *
     * @param definitionBody the resource's DefinitionBody, may be missing
     * @param definitionUri  the resource's DefinitionUri, may be missing
     * @return the parsed document, or a missing node when nothing could be read.
     *         Implementations never throw for unreachable or malformed sources.
     */
    JsonNode resolve(JsonNode definitionBody, JsonNode definitionUri);
}
