package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.model.AuthorizationResult;
import com.anthem.authguard.core.model.AuthorizationOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders audit results. Outcomes keep engine order and are never merged,
 * so a function with two API events appears twice.
 */
@Component
public class AuthorizationReporter {

    public List<String> format(AuthorizationResult result) {
        List<String> lines = new ArrayList<>();
        for (AuthorizationOutcome outcome : result.getOutcomes()) {
            lines.add(outcome.isAuthorized()
                    ? outcome.getFunctionName() + " has authorization defined."
                    : outcome.getFunctionName() + " may not have authorization defined.");
        }
        lines.addAll(result.getAdvisories());
        return lines;
    }

    /**
     * Names of functions with an unauthorized outcome, one entry per outcome.
     */
    public List<String> unauthorizedFunctions(AuthorizationResult result) {
        return result.getOutcomes().stream()
                .filter(outcome -> !outcome.isAuthorized())
                .map(AuthorizationOutcome::getFunctionName)
                .toList();
    }

    public Map<String, Object> toResponse(AuthorizationResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("outcomes", result.getOutcomes());
        response.put("unauthorized", unauthorizedFunctions(result));
        response.put("advisories", result.getAdvisories());
        response.put("report", format(result));
        return response;
    }
}
