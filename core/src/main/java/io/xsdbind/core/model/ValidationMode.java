package io.xsdbind.core.model;

import java.util.Locale;

/**
 * Failure-tolerance mode, used both when a schema is built and when an instance is decoded or
 * encoded.
 *
 * <ul>
 *   <li>{@link #STRICT}: stop at the first error and raise it.
 *   <li>{@link #LAX}: collect every error, continue with fallbacks and return them alongside the
 *       best-effort result.
 *   <li>{@link #SKIP}: suppress the checks and return a best-effort result with no errors.
 * </ul>
 */
public enum ValidationMode {
    STRICT,
    LAX,
    SKIP;

    /**
     * Parses a mode name, case-insensitively.
     *
     * @param name "strict", "lax" or "skip"
     * @return the matching mode
     * @throws IllegalArgumentException if the name is not a known mode
     */
    public static ValidationMode fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("validation mode must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown validation mode '" + name + "'; expected one of: strict, lax, skip", e);
        }
    }

    /** Returns {@code true} if checks are performed in this mode. */
    public boolean checks() {
        return this != SKIP;
    }
}
