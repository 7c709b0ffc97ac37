package com.anthem.authguard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved authorization of one API-trigger event of a function.
 * A function with several API-trigger events yields one outcome per event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthorizationOutcome {

    private String functionName;

    private boolean authorized;

    private String stackPath;

    /** Logical name of the event inside the function's Events block. */
    private String eventName;

    /** Declared event type, {@code Api} or {@code HttpApi}. */
    private String eventType;

    /**
     * Which layer supplied the decision: EVENT_AUTH, API_AUTH, DEFINITION_SECURITY or NONE.
     */
    private String source;

    public static AuthorizationOutcome of(String functionName, boolean authorized) {
        return AuthorizationOutcome.builder()
                .functionName(functionName)
                .authorized(authorized)
                .build();
    }
}
