package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.model.ScanResult;
import com.anthem.authguard.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Iterator;

/**
 * Detects whether an API definition document declares any security requirement.
 *
 * This is a presence check: a truthy {@code security} on any operation, or on the
 * document itself, counts. Schemes are not validated against securityDefinitions.
 */
@Component
public class DocumentSecurityScanner {

    private static final Logger log = LoggerFactory.getLogger(DocumentSecurityScanner.class);

    static final String PATHS = "paths";
    static final String SECURITY = "security";

    public ScanResult scan(JsonNode document) {
        // anything other than a populated mapping is an empty document
        if (!JsonUtils.isNonEmptyObject(document)) {
            return ScanResult.empty();
        }

        boolean secured = JsonUtils.isTruthy(document.path(SECURITY));

        Iterator<JsonNode> pathItems = document.path(PATHS).elements();
        while (!secured && pathItems.hasNext()) {
            JsonNode pathItem = pathItems.next();
            if (!pathItem.isObject()) {
                continue;
            }
            for (JsonNode operation : pathItem) {
                // path-level parameters, $ref strings and similar are not operations
                if (operation.isObject() && JsonUtils.isTruthy(operation.path(SECURITY))) {
                    secured = true;
                    break;
                }
            }
        }

        log.debug(ScanResult.NOT_EXHAUSTIVE_ADVISORY);
        return new ScanResult(secured, false);
    }
}
