package io.github.metahealth.output;

import io.github.metahealth.MetadataHealthException;

/**
 * Thrown when the output documents fail validation or cannot be written.
 */
public class OutputWriteException extends MetadataHealthException {

    public OutputWriteException(String message) {
        super(message);
    }

    public OutputWriteException(String document, String message, Throwable cause) {
        super(document, message, cause);
    }
}
