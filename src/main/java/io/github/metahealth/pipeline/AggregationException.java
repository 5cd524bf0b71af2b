package io.github.metahealth.pipeline;

import io.github.metahealth.MetadataHealthException;

/**
 * Thrown when a statistics run cannot be completed, for example because the reducing thread
 * was interrupted.
 */
public class AggregationException extends MetadataHealthException {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
