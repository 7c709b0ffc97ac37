package com.anthem.authguard.checker.model;

import com.anthem.authguard.core.model.AuthorizationOutcome;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered outcomes of an authorization audit plus the caveats raised while producing them.
 */
public class AuthorizationResult {

    private final List<AuthorizationOutcome> outcomes = new ArrayList<>();
    private final Set<String> advisories = new LinkedHashSet<>();

    public void addOutcome(AuthorizationOutcome outcome) {
        outcomes.add(outcome);
    }

    public void addAdvisories(List<String> messages) {
        advisories.addAll(messages);
    }

    public List<AuthorizationOutcome> getOutcomes() {
        return List.copyOf(outcomes);
    }

    public List<String> getAdvisories() {
        return List.copyOf(advisories);
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }
}
