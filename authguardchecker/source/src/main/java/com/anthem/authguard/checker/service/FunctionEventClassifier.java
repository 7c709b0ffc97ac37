package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.model.ApiEventType;
import com.anthem.authguard.checker.model.ApiTriggerEvent;
import com.anthem.authguard.core.model.ServerlessFunction;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Picks out the events of a function that bind it to an API.
 */
@Component
public class FunctionEventClassifier {

    /**
     * @return one entry per Api or HttpApi event, in event declaration order
     */
    public List<ApiTriggerEvent> classify(ServerlessFunction function) {
        List<ApiTriggerEvent> apiEvents = new ArrayList<>();
        for (Map.Entry<String, JsonNode> event : function.getEvents().entrySet()) {
            JsonNode body = event.getValue();
            if (body == null) {
                continue;
            }
            String type = body.path("Type").asText();
            for (ApiEventType apiEventType : ApiEventType.values()) {
                if (apiEventType.getType().equals(type)) {
                    apiEvents.add(new ApiTriggerEvent(event.getKey(), apiEventType, body.path("Properties")));
                }
            }
        }
        return apiEvents;
    }
}
