package io.xsdbind.core.facet;

/**
 * The {@code whiteSpace} facet. Normalization runs before any other facet and before conversion.
 * Restriction may keep or tighten the base value, never relax it.
 */
public enum WhiteSpace {
    PRESERVE("preserve"),
    REPLACE("replace"),
    COLLAPSE("collapse");

    private final String xsdName;

    WhiteSpace(String xsdName) {
        this.xsdName = xsdName;
    }

    public String xsdName() {
        return xsdName;
    }

    /**
     * @throws IllegalArgumentException if the name is not preserve, replace or collapse
     */
    public static WhiteSpace fromName(String name) {
        for (WhiteSpace ws : values()) {
            if (ws.xsdName.equals(name)) {
                return ws;
            }
        }
        throw new IllegalArgumentException("whiteSpace must be one of preserve, replace, collapse, got: '" + name + "'");
    }

    /** Returns {@code true} if this value is at least as strict as {@code other}. */
    public boolean narrows(WhiteSpace other) {
        return ordinal() >= other.ordinal();
    }

    public String normalize(String text) {
        if (text == null || this == PRESERVE) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(c == '\t' || c == '\n' || c == '\r' ? ' ' : c);
        }
        if (this == REPLACE) {
            return sb.toString();
        }
        // only #x20 is stripped; other control characters are content
        int start = 0;
        int end = sb.length();
        while (start < end && sb.charAt(start) == ' ') {
            start++;
        }
        while (end > start && sb.charAt(end - 1) == ' ') {
            end--;
        }
        StringBuilder collapsed = new StringBuilder(end - start);
        boolean space = false;
        for (int i = start; i < end; i++) {
            char c = sb.charAt(i);
            if (c == ' ') {
                if (!space) {
                    collapsed.append(c);
                }
                space = true;
            } else {
                collapsed.append(c);
                space = false;
            }
        }
        return collapsed.toString();
    }
}
