package io.xsdbind.core.error;

import io.xsdbind.core.model.ValidationError;

/** Thrown in strict mode when a facet, attribute or content model check fails. */
public final class ValidationFailedException extends InstanceException {

    private static final long serialVersionUID = 1L;

    public ValidationFailedException(ValidationError error) {
        super(error);
    }
}
