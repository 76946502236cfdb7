package io.xsdbind.core.model;

import java.util.List;

/**
 * Outcome of a decode or encode call: the produced value plus every error collected on the way.
 * In strict mode the error list is always empty (the first error is raised instead); in lax mode
 * the value is a best-effort result next to the errors; in skip mode the list is empty.
 *
 * @param value  decoded native value or encoded element, may be {@code null}
 * @param errors collected errors in the order they were produced
 * @param <T>    value type
 */
public record BindingResult<T>(T value, List<ValidationError> errors) {

    public BindingResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /** Returns {@code true} if no error was collected. */
    public boolean isValid() {
        return errors.isEmpty();
    }
}
