package io.xsdbind.core.error;

import io.xsdbind.core.model.ValidationError;

/** Thrown in strict mode when a native value is incompatible with its declaring type. */
public final class EncodeFailedException extends InstanceException {

    private static final long serialVersionUID = 1L;

    public EncodeFailedException(ValidationError error) {
        super(error);
    }
}
