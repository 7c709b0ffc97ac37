package com.anthem.authguard.checker.model;

/**
 * Outcome of scanning an API definition document for security requirements.
 *
 * @param secured    at least one operation, or the document itself, declares security
 * @param exhaustive false whenever a non-empty document was inspected; the scan only
 *                   detects presence of a security requirement and does not validate it
 */
public record ScanResult(boolean secured, boolean exhaustive) {

    public static final String NOT_EXHAUSTIVE_ADVISORY =
            "Auth checks done on the definition document are not exhaustive!";

    public static ScanResult empty() {
        return new ScanResult(false, true);
    }

    public String advisory() {
        return exhaustive ? null : NOT_EXHAUSTIVE_ADVISORY;
    }
}
