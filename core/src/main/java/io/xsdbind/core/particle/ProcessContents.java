package io.xsdbind.core.particle;

import java.util.Locale;

/** How content admitted by a wildcard is validated. */
public enum ProcessContents {
    /** No validation: any element in an allowed namespace matches. */
    SKIP,
    /** Validate against a global declaration when one exists. */
    LAX,
    /** A global declaration must exist. */
    STRICT;

    public static ProcessContents fromName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("processContents must be one of skip, lax, strict, got: '" + name + "'", e);
        }
    }
}
