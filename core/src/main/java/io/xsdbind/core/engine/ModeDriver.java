package io.xsdbind.core.engine;

import io.xsdbind.core.error.InstanceException;
import io.xsdbind.core.model.BindingResult;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.model.ValidationMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** Runs a step stream to its end under one validation mode. */
final class ModeDriver {

    private ModeDriver() {}

    /**
     * @throws InstanceException in strict mode, for the first error of the stream
     */
    static <T> BindingResult<T> drive(Iterator<Result<T>> steps, ValidationMode mode) {
        List<ValidationError> errors = new ArrayList<>();
        T value = null;
        while (steps.hasNext()) {
            Result<T> step = steps.next();
            if (step instanceof Result.Value<T> v) {
                value = v.value();
            } else if (step instanceof Result.Error<T> e) {
                switch (mode) {
                    case STRICT -> throw InstanceException.of(e.error());
                    case LAX -> errors.add(e.error());
                    case SKIP -> {
                        // errors are not reported in skip mode
                    }
                }
            }
        }
        return new BindingResult<>(value, errors);
    }
}
