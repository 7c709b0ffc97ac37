package com.anthem.authguard.checker.model;

/**
 * Layer that decided a function event's authorization, highest precedence first.
 */
public enum AuthorizationSource {
    /** Auth declared directly on the function's event. */
    EVENT_AUTH,
    /** Auth declared on the referenced API resource. */
    API_AUTH,
    /** Security requirement found in the API's definition document. */
    DEFINITION_SECURITY,
    /** No authorization signal at any layer. */
    NONE;

    public boolean isAuthorized() {
        return this != NONE;
    }
}
