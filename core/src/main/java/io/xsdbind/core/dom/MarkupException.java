package io.xsdbind.core.dom;

/** Thrown when a markup document cannot be parsed or serialized. */
public final class MarkupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MarkupException(String message, Throwable cause) {
        super(message, cause);
    }
}
