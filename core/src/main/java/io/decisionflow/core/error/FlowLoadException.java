package io.decisionflow.core.error;

/**
 * Thrown when a flow document, rule table, function body or request input cannot be read or
 * does not have the expected structure. Carries the file or resource that caused the error.
 */
public final class FlowLoadException extends FlowException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public FlowLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public FlowLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} for inline input. */
    public String source() {
        return source;
    }
}
