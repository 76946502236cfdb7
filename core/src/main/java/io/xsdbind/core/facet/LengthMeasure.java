package io.xsdbind.core.facet;

import java.util.Collection;

/** How the length family of facets measures a value. */
public enum LengthMeasure {
    /** Number of Unicode code points. */
    CODE_POINTS,
    /** Number of octets encoded by a hexBinary literal. */
    HEX_OCTETS,
    /** Number of octets encoded by a base64Binary literal. */
    BASE64_OCTETS,
    /** Number of list items. */
    ITEMS;

    public int lengthOf(Object value) {
        if (value instanceof Collection<?> c) {
            return c.size();
        }
        String s = String.valueOf(value);
        return switch (this) {
            case HEX_OCTETS -> s.length() / 2;
            case BASE64_OCTETS -> base64Octets(s);
            case ITEMS -> s.isBlank() ? 0 : s.trim().split("\\s+").length;
            case CODE_POINTS -> s.codePointCount(0, s.length());
        };
    }

    private static int base64Octets(String s) {
        int chars = 0;
        int padding = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '=') {
                padding++;
            } else if (!Character.isWhitespace(c)) {
                chars++;
            }
        }
        return (chars + padding) / 4 * 3 - padding;
    }
}
