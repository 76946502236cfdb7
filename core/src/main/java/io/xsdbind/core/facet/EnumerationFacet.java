package io.xsdbind.core.facet;

import java.util.List;
import java.util.Optional;

/** {@code enumeration}: membership in a set of literals decoded with the base type. */
public record EnumerationFacet(List<Object> values, List<String> literals) implements Facet {

    public EnumerationFacet {
        values = List.copyOf(values);
        literals = List.copyOf(literals);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("enumeration must have at least one value");
        }
    }

    @Override
    public FacetKind kind() {
        return FacetKind.ENUMERATION;
    }

    @Override
    public Optional<String> violation(Object v) {
        for (Object candidate : values) {
            if (matches(candidate, v)) {
                return Optional.empty();
            }
        }
        return Optional.of("value must be one of " + literals);
    }

    private static boolean matches(Object candidate, Object v) {
        if (candidate instanceof List<?> cl && v instanceof List<?> vl) {
            if (cl.size() != vl.size()) {
                return false;
            }
            for (int i = 0; i < cl.size(); i++) {
                if (!ValueOrder.sameValue(cl.get(i), vl.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return ValueOrder.sameValue(candidate, v);
    }
}
