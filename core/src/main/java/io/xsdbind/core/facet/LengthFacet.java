package io.xsdbind.core.facet;

import java.util.Objects;
import java.util.Optional;

/** {@code length}, {@code minLength} or {@code maxLength}. */
public record LengthFacet(FacetKind kind, int value, LengthMeasure measure) implements Facet {

    public LengthFacet {
        if (kind != FacetKind.LENGTH && kind != FacetKind.MIN_LENGTH && kind != FacetKind.MAX_LENGTH) {
            throw new IllegalArgumentException("not a length facet: " + kind);
        }
        if (value < 0) {
            throw new IllegalArgumentException(kind + " must be non-negative, got: " + value);
        }
        Objects.requireNonNull(measure, "measure must not be null");
    }

    @Override
    public Optional<String> violation(Object v) {
        int length = measure.lengthOf(v);
        return switch (kind) {
            case LENGTH -> length != value
                    ? Optional.of("length has to be " + value + ", got " + length)
                    : Optional.empty();
            case MIN_LENGTH -> length < value
                    ? Optional.of("length cannot be lesser than " + value + ", got " + length)
                    : Optional.empty();
            default -> length > value
                    ? Optional.of("length cannot be greater than " + value + ", got " + length)
                    : Optional.empty();
        };
    }
}
