package com.anthem.authguard.checker.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A function event classified as an API trigger.
 *
 * @param eventName  logical name of the event in the function's Events block
 * @param eventType  matched API event type
 * @param properties the event's Properties mapping, a missing node when absent
 */
public record ApiTriggerEvent(String eventName, ApiEventType eventType, JsonNode properties) {

    public String identifierKey() {
        return eventType.getIdentifierKey();
    }
}
