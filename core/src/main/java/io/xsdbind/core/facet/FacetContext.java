package io.xsdbind.core.facet;

import io.xsdbind.core.spi.PatternCompiler;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * What a facet derivation needs to know about the type being restricted.
 *
 * @param component   name of the derived type, used in build errors
 * @param admitted    facet kinds admitted by the primitive ancestor under the schema version
 * @param valueParser decodes a bound or enumeration literal with the base type; throws
 *                    {@link IllegalArgumentException} for an invalid literal
 * @param measure     length measure of the base type's values
 * @param integral    {@code true} for integer-derived types
 * @param patterns    compiler for pattern literals
 * @param checks      {@code false} in skip build mode: structural checks are not run
 */
public record FacetContext(
        String component,
        Set<FacetKind> admitted,
        Function<String, Object> valueParser,
        LengthMeasure measure,
        boolean integral,
        PatternCompiler patterns,
        boolean checks) {

    public FacetContext {
        admitted = Set.copyOf(admitted);
        Objects.requireNonNull(valueParser, "valueParser must not be null");
        Objects.requireNonNull(measure, "measure must not be null");
        Objects.requireNonNull(patterns, "patterns must not be null");
    }
}
