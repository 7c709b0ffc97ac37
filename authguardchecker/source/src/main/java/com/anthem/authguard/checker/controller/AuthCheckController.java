package com.anthem.authguard.checker.controller;

import com.anthem.authguard.checker.model.AuthorizationResult;
import com.anthem.authguard.checker.service.AuthorizationReporter;
import com.anthem.authguard.checker.service.AuthorizationResolutionService;
import com.anthem.authguard.core.model.Stack;
import com.anthem.authguard.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for the authorization audit.
 *
 * Accepts templates that were already loaded by the caller; nested applications are
 * passed as additional stacks keyed by their stack path.
 */
@RestController
@RequestMapping("/authguard/api/v1")
public class AuthCheckController {

    private static final Logger log = LoggerFactory.getLogger(AuthCheckController.class);

    private final AuthorizationResolutionService resolutionService;
    private final AuthorizationReporter reporter;
    private final ObjectMapper objectMapper;

    public AuthCheckController(AuthorizationResolutionService resolutionService,
                               AuthorizationReporter reporter,
                               ObjectMapper objectMapper) {
        this.resolutionService = resolutionService;
        this.reporter = reporter;
        this.objectMapper = objectMapper;
    }

    /**
     * Audit one or more stacks.
     *
     * Expected request body, either:
     * {
     *   "template": { ... } | "yaml text",
     *   "parameterOverrides": { "Name": "value" }
     * }
     * or:
     * {
     *   "stacks": [
     *     { "stackPath": "", "template": { ... } },
     *     { "stackPath": "ChildApp", "template": { ... } }
     *   ]
     * }
     */
    @PostMapping(
            value = "/check",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<Map<String, Object>> check(@RequestBody String requestBody) {
        try {
            List<Stack> stacks = parseStacks(requestBody);
            log.info("Received authorization audit request: stacks={}", stacks.size());

            AuthorizationResult result = resolutionService.audit(stacks);
            return ResponseEntity.ok(reporter.toResponse(result));

        } catch (InvalidTemplateRequestException e) {
            log.warn("Rejected audit request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Authorization audit failed", e);
            return ResponseEntity.status(500).body(Map.of("error", "Authorization audit failed: " + e.getMessage()));
        }
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "service", "authguardchecker"));
    }

    private List<Stack> parseStacks(String requestBody) {
        JsonNode request;
        try {
            request = objectMapper.readTree(requestBody);
        } catch (JsonProcessingException e) {
            throw new InvalidTemplateRequestException("Request body is not valid JSON", e);
        }
        if (request == null || !request.isObject()) {
            throw new InvalidTemplateRequestException("Request body must be a JSON object");
        }

        List<Stack> stacks = new ArrayList<>();
        if (request.path("stacks").isArray()) {
            for (JsonNode stack : request.path("stacks")) {
                stacks.add(toStack(stack, stack.path("stackPath").asText(Stack.ROOT_PATH)));
            }
        } else if (request.has("template")) {
            stacks.add(toStack(request, Stack.ROOT_PATH));
        }

        if (stacks.isEmpty()) {
            throw new InvalidTemplateRequestException("Request must carry a 'template' or a non-empty 'stacks' array");
        }
        return stacks;
    }

    private Stack toStack(JsonNode node, String stackPath) {
        JsonNode template = node.path("template");
        if (template.isTextual()) {
            try {
                template = JsonUtils.parseDocument(template.textValue());
            } catch (IllegalArgumentException e) {
                throw new InvalidTemplateRequestException("Template of stack '" + stackPath + "' is not valid YAML or JSON", e);
            }
        }
        if (!template.isObject()) {
            throw new InvalidTemplateRequestException("Template of stack '" + stackPath + "' must be a mapping");
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        node.path("parameterOverrides").fields()
                .forEachRemaining(field -> overrides.put(field.getKey(), field.getValue().asText()));

        return Stack.builder()
                .stackPath(stackPath)
                .template(template)
                .parameterOverrides(overrides)
                .build();
    }
}
