package io.xsdbind.core.model;

/**
 * Schema language version. Selects version-specific rules as configuration data: the admitted
 * facet set and whether {@code all} groups may repeat their members.
 */
public enum XsdVersion {
    V1_0("1.0"),
    V1_1("1.1");

    private final String label;

    XsdVersion(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parses "1.0" or "1.1".
     *
     * @throws IllegalArgumentException for any other value
     */
    public static XsdVersion fromLabel(String label) {
        for (XsdVersion v : values()) {
            if (v.label.equals(label)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unsupported XSD version '" + label + "'; expected 1.0 or 1.1");
    }
}
