package io.xsdbind.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One instance-time failure. Records are produced into the decode/encode result streams and are
 * raised, wrapped in an {@link io.xsdbind.core.error.InstanceException}, only in strict mode.
 *
 * @param kind      failure kind
 * @param reason    human-readable reason
 * @param component description of the originating schema component (e.g. {@code element 'item'})
 * @param path      slash-separated location in the instance (e.g. {@code /order/item[2]})
 * @param obj       the offending node or value, may be {@code null}
 */
public record ValidationError(ErrorKind kind, String reason, String component, String path, Object obj) {

    public ValidationError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static ValidationError validation(String reason, String component, String path, Object obj) {
        return new ValidationError(ErrorKind.VALIDATION, reason, component, path, obj);
    }

    public static ValidationError decode(String reason, String component, String path, Object obj) {
        return new ValidationError(ErrorKind.DECODE, reason, component, path, obj);
    }

    public static ValidationError encode(String reason, String component, String path, Object obj) {
        return new ValidationError(ErrorKind.ENCODE, reason, component, path, obj);
    }

    /** Returns a copy located at the given instance path. */
    public ValidationError at(String newPath) {
        return new ValidationError(kind, reason, component, newPath, obj);
    }

    /** Returns a copy attributed to the given component, unless one is already set. */
    public ValidationError withComponent(String newComponent) {
        return component != null ? this : new ValidationError(kind, reason, newComponent, path, obj);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name().toLowerCase(Locale.ROOT)).append(" error");
        if (path != null) {
            sb.append(" at ").append(path);
        }
        sb.append(": ").append(reason);
        if (component != null) {
            sb.append(" (").append(component).append(')');
        }
        return sb.toString();
    }
}
