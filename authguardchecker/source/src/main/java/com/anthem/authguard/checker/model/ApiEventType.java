package com.anthem.authguard.checker.model;

/**
 * Function event types that bind a function to an API resource.
 * Each type names the event property that carries the API's logical id.
 */
public enum ApiEventType {

    /** REST API binding, references an AWS::Serverless::Api. */
    REST_API("Api", "RestApiId"),

    /** HTTP API binding, references an AWS::Serverless::HttpApi. */
    HTTP_API("HttpApi", "ApiId");

    private final String type;
    private final String identifierKey;

    ApiEventType(String type, String identifierKey) {
        this.type = type;
        this.identifierKey = identifierKey;
    }

    public String getType() {
        return type;
    }

    public String getIdentifierKey() {
        return identifierKey;
    }
}
