package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.model.AuthorizationSource;

/**
 * Merge policy for the three authorization signals of a function event.
 *
 * <ol>
 *   <li>Auth on the function event</li>
 *   <li>Auth on the referenced API resource</li>
 *   <li>security in the API's definition document</li>
 *   <li>otherwise unauthorized</li>
 * </ol>
 */
public final class AuthorizationPrecedence {

    private AuthorizationPrecedence() {
    }

    public static AuthorizationSource decide(boolean eventAuth, boolean apiAuth, boolean definitionSecured) {
        if (eventAuth) {
            return AuthorizationSource.EVENT_AUTH;
        }
        if (apiAuth) {
            return AuthorizationSource.API_AUTH;
        }
        if (definitionSecured) {
            return AuthorizationSource.DEFINITION_SECURITY;
        }
        return AuthorizationSource.NONE;
    }
}
