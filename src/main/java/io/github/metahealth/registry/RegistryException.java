package io.github.metahealth.registry;

import io.github.metahealth.MetadataHealthException;

/**
 * Thrown when provider or client listings cannot be obtained.
 */
public class RegistryException extends MetadataHealthException {

    private final int statusCode;

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public RegistryException(String endpoint, int statusCode) {
        super(endpoint, "API request failed: " + statusCode, null);
        this.statusCode = statusCode;
    }

    public RegistryException(String endpoint, String message, Throwable cause) {
        super(endpoint, message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed request, or -1 when the request did not complete.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
