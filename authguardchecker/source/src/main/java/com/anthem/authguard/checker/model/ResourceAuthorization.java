package com.anthem.authguard.checker.model;

import java.util.List;

/**
 * Authorization signals gathered from one API resource.
 *
 * @param resourceName      logical id the event referenced, empty when the event names none
 * @param apiAuth           the resource declares a truthy Auth block
 * @param definitionSecured the resource's definition document declares security
 * @param advisories        caveats raised while inspecting the resource
 */
public record ResourceAuthorization(
        String resourceName,
        boolean apiAuth,
        boolean definitionSecured,
        List<String> advisories) {

    public boolean isAuthorized() {
        return apiAuth || definitionSecured;
    }
}
