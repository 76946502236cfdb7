package io.xsdbind.core.type;

import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.FacetSet;
import io.xsdbind.core.facet.LengthMeasure;
import io.xsdbind.core.facet.WhiteSpace;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.spi.PatternCompiler;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.xml.namespace.QName;

/**
 * A list type: whitespace-separated items of an atomic or union item type. The native value is a
 * {@code List}. Length, enumeration and pattern facets apply to the whole list.
 */
public final class ListType extends SimpleType {

    private static final FacetSet LIST_FACETS = FacetSet.ofWhiteSpace(WhiteSpace.COLLAPSE, true);

    private final SimpleType itemType;

    ListType(QName name, SimpleType base, SimpleType itemType, FacetSet facets) {
        super(name, base, facets);
        this.itemType = Objects.requireNonNull(itemType, "itemType must not be null");
        if (itemType instanceof ListType) {
            throw new IllegalArgumentException("the item type of a list cannot be a list type");
        }
    }

    /** A list of {@code itemType} derived from {@code anySimpleType}. */
    public static ListType of(QName name, SimpleType itemType) {
        return new ListType(name, Builtins.anySimpleType(), itemType, LIST_FACETS);
    }

    public SimpleType itemType() {
        return itemType;
    }

    @Override
    public Variety variety() {
        return Variety.LIST;
    }

    @Override
    public List<Result<Object>> decode(String text, boolean checks) {
        String normalized = facets().normalize(text == null ? "" : text);
        List<Result<Object>> out = newSteps();
        if (checks) {
            checkLexical(normalized, out);
        }
        List<Object> items = new ArrayList<>();
        if (!normalized.isEmpty()) {
            for (String token : normalized.split(" ")) {
                List<Result<Object>> steps = itemType.decode(token, checks);
                for (Result<Object> step : steps) {
                    if (!step.isValue()) {
                        out.add(step);
                    }
                }
                items.add(lastValue(steps));
            }
        }
        List<Object> value = List.copyOf(items);
        if (checks) {
            checkValue(value, out);
        }
        out.add(Result.value(value));
        return out;
    }

    @Override
    public List<Result<String>> encode(Object value, boolean checks) {
        if (value instanceof String text) {
            List<Result<String>> out = newSteps();
            List<Result<Object>> decoded = decode(text, checks);
            for (Result<Object> step : decoded) {
                if (step instanceof Result.Error<Object> e) {
                    out.add(Result.error(e.error()));
                }
            }
            List<?> items = (List<?>) lastValue(decoded);
            return joinItems(items, false, out);
        }
        List<Result<String>> out = newSteps();
        List<?> items = value instanceof Collection<?> c ? new ArrayList<>(c) : List.of(value);
        if (checks) {
            checkValue(items, out);
        }
        return joinItems(items, checks, out);
    }

    private List<Result<String>> joinItems(List<?> items, boolean checks, List<Result<String>> out) {
        List<String> texts = new ArrayList<>(items.size());
        for (Object item : items) {
            List<Result<String>> steps = itemType.encode(item, checks);
            for (Result<String> step : steps) {
                if (!step.isValue()) {
                    out.add(step);
                }
            }
            texts.add(lastValue(steps));
        }
        out.add(Result.value(String.join(" ", texts)));
        return out;
    }

    @Override
    public ListType restrict(
            QName derivedName, List<FacetDecl> decls, XsdVersion version, PatternCompiler patterns, boolean checks) {
        return new ListType(derivedName, this, itemType, deriveFacets(derivedName, decls, version, patterns, checks));
    }

    @Override
    Set<FacetKind> admittedFacets(XsdVersion version) {
        return EnumSet.of(
                FacetKind.LENGTH,
                FacetKind.MIN_LENGTH,
                FacetKind.MAX_LENGTH,
                FacetKind.PATTERN,
                FacetKind.ENUMERATION,
                FacetKind.WHITE_SPACE);
    }

    @Override
    LengthMeasure lengthMeasure() {
        return LengthMeasure.ITEMS;
    }
}
