package io.xsdbind.core.error;

import io.xsdbind.core.model.ValidationError;
import java.util.Objects;

/**
 * Abstract parent for instance-time errors, raised only in strict mode. Wraps the
 * {@link ValidationError} record that stopped the run.
 */
public abstract class InstanceException extends XsdBindException {

    private static final long serialVersionUID = 1L;

    private final transient ValidationError error;

    protected InstanceException(ValidationError error) {
        super(Objects.requireNonNull(error, "error must not be null").toString(), error.component(), Phase.INSTANCE);
        this.error = error;
    }

    /** The structured error record. */
    public ValidationError error() {
        return error;
    }

    /**
     * Wraps an error record into the exception matching its kind.
     *
     * @param error the error to raise
     * @return the exception to throw
     */
    public static InstanceException of(ValidationError error) {
        return switch (error.kind()) {
            case DECODE -> new DecodeFailedException(error);
            case ENCODE -> new EncodeFailedException(error);
            case VALIDATION -> new ValidationFailedException(error);
        };
    }
}
