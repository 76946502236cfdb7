package io.xsdbind.core.type;

import java.util.Locale;

/** The {@code use} of an attribute declaration. */
public enum AttributeUse {
    OPTIONAL,
    REQUIRED,
    PROHIBITED;

    public static AttributeUse fromName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("use must be one of optional, required, prohibited, got: '" + name + "'", e);
        }
    }
}
