package io.xsdbind.core.facet;

import java.util.Objects;

/**
 * A facet as declared in a schema document, before compilation against its base type.
 *
 * @param kind  facet kind
 * @param value literal value
 * @param fixed {@code true} if derived types may not change the value
 */
public record FacetDecl(FacetKind kind, String value, boolean fixed) {

    public FacetDecl {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value of facet '" + kind + "' must not be null");
    }

    public static FacetDecl of(FacetKind kind, String value) {
        return new FacetDecl(kind, value, false);
    }
}
