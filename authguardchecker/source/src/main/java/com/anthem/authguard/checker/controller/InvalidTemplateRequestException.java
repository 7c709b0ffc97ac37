package com.anthem.authguard.checker.controller;

/**
 * Raised when an audit request does not carry a usable template.
 */
public class InvalidTemplateRequestException extends RuntimeException {

    public InvalidTemplateRequestException(String message) {
        super(message);
    }

    public InvalidTemplateRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
