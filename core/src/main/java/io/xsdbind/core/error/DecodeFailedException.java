package io.xsdbind.core.error;

import io.xsdbind.core.model.ValidationError;

/** Thrown in strict mode when text cannot be converted to the native value of its type. */
public final class DecodeFailedException extends InstanceException {

    private static final long serialVersionUID = 1L;

    public DecodeFailedException(ValidationError error) {
        super(error);
    }
}
