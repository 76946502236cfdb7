package io.xsdbind.core.facet;

import io.xsdbind.core.spi.PatternMatcher;
import java.util.List;
import java.util.Optional;

/**
 * The {@code pattern} values declared in one derivation step. Alternatives within a step are
 * ORed; the steps of a derivation chain are ANDed by {@link FacetSet}.
 */
public record PatternFacet(List<String> literals, List<PatternMatcher> matchers) implements Facet {

    public PatternFacet {
        literals = List.copyOf(literals);
        matchers = List.copyOf(matchers);
        if (literals.size() != matchers.size() || literals.isEmpty()) {
            throw new IllegalArgumentException("pattern literals and matchers must be non-empty and aligned");
        }
    }

    @Override
    public FacetKind kind() {
        return FacetKind.PATTERN;
    }

    @Override
    public boolean lexical() {
        return true;
    }

    @Override
    public Optional<String> violation(Object value) {
        String text = String.valueOf(value);
        for (PatternMatcher matcher : matchers) {
            if (matcher.search(text)) {
                return Optional.empty();
            }
        }
        return Optional.of(literals.size() == 1
                ? "value doesn't match the pattern '" + literals.get(0) + "'"
                : "value doesn't match any pattern of " + literals);
    }
}
