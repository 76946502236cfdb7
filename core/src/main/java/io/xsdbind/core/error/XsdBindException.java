package io.xsdbind.core.error;

/**
 * Abstract base for all xsd-bind exceptions. Never thrown directly: use the concrete subclasses
 * under {@link SchemaBuildException} or {@link InstanceException}.
 */
public abstract class XsdBindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        BUILD,
        INSTANCE
    }

    private final String component;
    private final Phase phase;

    protected XsdBindException(String message, String component, Phase phase) {
        super(message);
        this.component = component;
        this.phase = phase;
    }

    protected XsdBindException(String message, Throwable cause, String component, Phase phase) {
        super(message, cause);
        this.component = component;
        this.phase = phase;
    }

    /** The schema component that triggered the error, or {@code null} if not identified. */
    public String component() {
        return component;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
