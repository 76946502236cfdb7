package io.xsdbind.core.error;

/**
 * Thrown when a declaration is malformed, a derivation is inconsistent, a facet combination is
 * impossible, or a reference names an undefined component.
 */
public final class SchemaParseException extends SchemaBuildException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String component, String source) {
        super(message, component, source);
    }

    public SchemaParseException(String message, Throwable cause, String component, String source) {
        super(message, cause, component, source);
    }
}
