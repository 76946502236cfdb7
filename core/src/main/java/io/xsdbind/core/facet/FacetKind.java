package io.xsdbind.core.facet;

import java.util.Optional;

/** Constraining facet kinds, keyed by their schema names. */
public enum FacetKind {
    LENGTH("length"),
    MIN_LENGTH("minLength"),
    MAX_LENGTH("maxLength"),
    PATTERN("pattern"),
    ENUMERATION("enumeration"),
    WHITE_SPACE("whiteSpace"),
    MAX_INCLUSIVE("maxInclusive"),
    MAX_EXCLUSIVE("maxExclusive"),
    MIN_INCLUSIVE("minInclusive"),
    MIN_EXCLUSIVE("minExclusive"),
    TOTAL_DIGITS("totalDigits"),
    FRACTION_DIGITS("fractionDigits"),
    EXPLICIT_TIMEZONE("explicitTimezone");

    private final String xsdName;

    FacetKind(String xsdName) {
        this.xsdName = xsdName;
    }

    /** The facet's name as written in a schema document. */
    public String xsdName() {
        return xsdName;
    }

    public static Optional<FacetKind> fromName(String name) {
        for (FacetKind kind : values()) {
            if (kind.xsdName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    boolean isLowerBound() {
        return this == MIN_INCLUSIVE || this == MIN_EXCLUSIVE;
    }

    boolean isUpperBound() {
        return this == MAX_INCLUSIVE || this == MAX_EXCLUSIVE;
    }

    boolean isExclusive() {
        return this == MIN_EXCLUSIVE || this == MAX_EXCLUSIVE;
    }

    @Override
    public String toString() {
        return xsdName;
    }
}
