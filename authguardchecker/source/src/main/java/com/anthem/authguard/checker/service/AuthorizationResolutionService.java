package com.anthem.authguard.checker.service;

import com.anthem.authguard.checker.model.ApiTriggerEvent;
import com.anthem.authguard.checker.model.AuthorizationResult;
import com.anthem.authguard.checker.model.AuthorizationSource;
import com.anthem.authguard.checker.model.ResourceAuthorization;
import com.anthem.authguard.checker.provider.FunctionProvider;
import com.anthem.authguard.checker.provider.TemplateFunctionProvider;
import com.anthem.authguard.core.model.AuthorizationOutcome;
import com.anthem.authguard.core.model.ServerlessFunction;
import com.anthem.authguard.core.model.Stack;
import com.anthem.authguard.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves, for every API-triggered function event, whether the invocation path is
 * protected by some authorization mechanism.
 */
@Service
public class AuthorizationResolutionService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationResolutionService.class);

    private final FunctionEventClassifier classifier;
    private final ResourceAuthorizationLookup lookup;

    public AuthorizationResolutionService(FunctionEventClassifier classifier, ResourceAuthorizationLookup lookup) {
        this.classifier = classifier;
        this.lookup = lookup;
    }

    /**
     * Audit already-parsed stacks.
     *
     * @param stacks root stack and nested application stacks
     * @return one outcome per API-trigger event, in function then event order
     */
    public AuthorizationResult audit(List<Stack> stacks) {
        return resolve(new TemplateFunctionProvider(stacks));
    }

    /**
     * Resolve authorization for every function the provider lists.
     * Functions without events, or without API-trigger events, produce no outcome.
     */
    public AuthorizationResult resolve(FunctionProvider provider) {
        AuthorizationResult result = new AuthorizationResult();

        for (ServerlessFunction function : provider.getAll()) {
            if (!function.hasEvents()) {
                continue;
            }
            for (ApiTriggerEvent event : classifier.classify(function)) {
                result.addOutcome(resolveEvent(provider, function, event, result));
            }
        }

        log.info("Authorization audit completed: outcomes={}, unauthorized={}",
                result.getOutcomes().size(),
                result.getOutcomes().stream().filter(o -> !o.isAuthorized()).count());
        return result;
    }

    private AuthorizationOutcome resolveEvent(FunctionProvider provider, ServerlessFunction function,
                                              ApiTriggerEvent event, AuthorizationResult result) {
        boolean eventAuth = JsonUtils.isTruthy(event.properties().path("Auth"));

        boolean apiAuth = false;
        boolean definitionSecured = false;
        if (!eventAuth) {
            ResourceAuthorization resource = lookup.evaluate(
                    provider.getResourcesByStackPath(function.getStackPath()),
                    event.properties(),
                    event.identifierKey());
            apiAuth = resource.apiAuth();
            definitionSecured = resource.definitionSecured();
            result.addAdvisories(resource.advisories());
        }

        AuthorizationSource source = AuthorizationPrecedence.decide(eventAuth, apiAuth, definitionSecured);
        log.debug("Resolved event authorization: function={}, event={}, type={}, source={}",
                function.getFullPath(), event.eventName(), event.eventType().getType(), source);

        return AuthorizationOutcome.builder()
                .functionName(function.getName())
                .authorized(source.isAuthorized())
                .stackPath(function.getStackPath())
                .eventName(event.eventName())
                .eventType(event.eventType().getType())
                .source(source.name())
                .build();
    }
}
