package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.document.DefinitionDocumentResolver;
import com.anthem.authguard.checker.model.ResourceAuthorization;
import com.anthem.authguard.checker.model.ScanResult;
import com.anthem.authguard.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Looks up the API resource an event points at and reports its authorization signals.
 * A missing identifier, a missing resource and a resource without properties all
 * resolve to "no signal".
 */
@Component
public class ResourceAuthorizationLookup {

    private static final Logger log = LoggerFactory.getLogger(ResourceAuthorizationLookup.class);

    private final DefinitionDocumentResolver documentResolver;
    private final DocumentSecurityScanner scanner;

    public ResourceAuthorizationLookup(DefinitionDocumentResolver documentResolver,
                                       DocumentSecurityScanner scanner) {
        this.documentResolver = Objects.requireNonNull(documentResolver, "documentResolver");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    /**
     * @param resources       resolved resources of the event's stack
     * @param eventProperties Properties of the function event
     * @param identifierKey   event property naming the API resource ({@code RestApiId} or {@code ApiId})
     * @return whether the referenced API declares Auth or a secured definition document
     */
    public boolean isAuthorized(Map<String, JsonNode> resources, JsonNode eventProperties, String identifierKey) {
        return evaluate(resources, eventProperties, identifierKey).isAuthorized();
    }

    /**
     * Same lookup as {@link #isAuthorized}, keeping the individual signals.
     * The definition document is only read when the resource has no Auth block.
     */
    public ResourceAuthorization evaluate(Map<String, JsonNode> resources, JsonNode eventProperties,
                                          String identifierKey) {
        String resourceName = eventProperties == null
                ? ""
                : eventProperties.path(identifierKey).asText("");
        JsonNode resource = resources == null
                ? MissingNode.getInstance()
                : Objects.requireNonNullElse(resources.get(resourceName), MissingNode.getInstance());
        JsonNode properties = resource.path("Properties");

        if (JsonUtils.isTruthy(properties.path("Auth"))) {
            log.debug("Auth declared on API resource: resource={}", resourceName);
            return new ResourceAuthorization(resourceName, true, false, List.of());
        }

        JsonNode document = documentResolver.resolve(
                properties.path("DefinitionBody"),
                properties.path("DefinitionUri"));
        ScanResult scan = scanner.scan(document);

        List<String> advisories = scan.exhaustive()
                ? List.of()
                : List.of(resourceName + ": " + scan.advisory());
        log.debug("Definition document scanned: resource={}, secured={}", resourceName, scan.secured());
        return new ResourceAuthorization(resourceName, false, scan.secured(), advisories);
    }
}
