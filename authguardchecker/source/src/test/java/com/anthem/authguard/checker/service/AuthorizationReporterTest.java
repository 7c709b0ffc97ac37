package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.model.AuthorizationResult;
import com.anthem.authguard.core.model.AuthorizationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorizationReporterTest {

    private final AuthorizationReporter reporter = new AuthorizationReporter();

    private AuthorizationResult result;

    @BeforeEach
    void setUp() {
        result = new AuthorizationResult();
        result.addOutcome(AuthorizationOutcome.of("Orders", false));
        result.addOutcome(AuthorizationOutcome.of("Users", true));
        result.addOutcome(AuthorizationOutcome.of("Orders", false));
        result.addAdvisories(List.of("OrdersApi: not exhaustive", "OrdersApi: not exhaustive"));
    }

    @Test
    void testFormat_keepsOrderAndDuplicates() {
        assertThat(reporter.format(result)).containsExactly(
                "Orders may not have authorization defined.",
                "Users has authorization defined.",
                "Orders may not have authorization defined.",
                "OrdersApi: not exhaustive");
    }

    @Test
    void testUnauthorizedFunctions() {
        assertThat(reporter.unauthorizedFunctions(result)).containsExactly("Orders", "Orders");
    }

    @Test
    void testToResponse() {
        Map<String, Object> response = reporter.toResponse(result);

        assertThat(response).containsOnlyKeys("outcomes", "unauthorized", "advisories", "report");
        assertThat((List<?>) response.get("outcomes")).hasSize(3);
        assertThat((List<?>) response.get("advisories")).hasSize(1);
    }

    @Test
    void testFormat_emptyResult() {
        AuthorizationResult empty = new AuthorizationResult();

        assertThat(reporter.format(empty)).isEmpty();
        assertThat(reporter.unauthorizedFunctions(empty)).isEmpty();
    }
}
