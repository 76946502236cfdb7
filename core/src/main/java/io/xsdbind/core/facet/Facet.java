package io.xsdbind.core.facet;

import java.util.Optional;

/**
 * One compiled constraining facet. Facets never change a value: they only report whether it
 * passes.
 */
public sealed interface Facet
        permits LengthFacet, BoundFacet, DigitsFacet, EnumerationFacet, PatternFacet, ExplicitTimezoneFacet {

    FacetKind kind();

    /**
     * Checks a value.
     *
     * @param value native value, or normalized text for lexical facets
     * @return the violation reason, or empty if the value passes
     */
    Optional<String> violation(Object value);

    /** Returns {@code true} if the facet applies to the normalized text rather than the value. */
    default boolean lexical() {
        return false;
    }
}
