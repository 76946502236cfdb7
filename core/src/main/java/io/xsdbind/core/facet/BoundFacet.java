package io.xsdbind.core.facet;

import java.util.Objects;
import java.util.Optional;

/** One of the four range facets. Ordering follows {@link ValueOrder}. */
public record BoundFacet(FacetKind kind, Object value, String literal) implements Facet {

    public BoundFacet {
        if (!kind.isLowerBound() && !kind.isUpperBound()) {
            throw new IllegalArgumentException("not a range facet: " + kind);
        }
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public Optional<String> violation(Object v) {
        Integer cmp = ValueOrder.compare(v, value);
        if (cmp == null) {
            return Optional.of("value " + v + " is not comparable with " + kind + " " + literal);
        }
        boolean ok = switch (kind) {
            case MIN_INCLUSIVE -> cmp >= 0;
            case MIN_EXCLUSIVE -> cmp > 0;
            case MAX_INCLUSIVE -> cmp <= 0;
            default -> cmp < 0;
        };
        if (ok) {
            return Optional.empty();
        }
        String relation = switch (kind) {
            case MIN_INCLUSIVE -> "greater or equal than";
            case MIN_EXCLUSIVE -> "greater than";
            case MAX_INCLUSIVE -> "lesser or equal than";
            default -> "lesser than";
        };
        return Optional.of("value has to be " + relation + " " + literal);
    }
}
