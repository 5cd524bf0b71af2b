package io.github.metahealth;

/**
 * Base exception for failures that stop a statistics run.
 */
public class MetadataHealthException extends RuntimeException {

    private final String context;

    public MetadataHealthException(String message) {
        super(message);
        this.context = null;
    }

    public MetadataHealthException(String message, Throwable cause) {
        super(message, cause);
        this.context = null;
    }

    public MetadataHealthException(String context, String message, Throwable cause) {
        super(message, cause);
        this.context = context;
    }

    /**
     * Returns what was being worked on when the error occurred (an endpoint, a file), if known.
     */
    public String getContext() {
        return context;
    }

    @Override
    public String getMessage() {
        if (context != null && !context.isEmpty()) {
            return "[" + context + "] " + super.getMessage();
        }
        return super.getMessage();
    }
}
