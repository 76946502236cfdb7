package io.xsdbind.core.error;

/**
 * Abstract parent for schema build errors. Thrown while a schema document is read or while the
 * component graph is resolved and checked. Carries a {@code source} field identifying the document
 * that caused the error.
 */
public abstract class SchemaBuildException extends XsdBindException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaBuildException(String message, String component, String source) {
        super(message, component, Phase.BUILD);
        this.source = source;
    }

    protected SchemaBuildException(String message, Throwable cause, String component, String source) {
        super(message, cause, component, Phase.BUILD);
        this.source = source;
    }

    /** The document path or resource identifier, or {@code null} for programmatic builds. */
    public String source() {
        return source;
    }
}
