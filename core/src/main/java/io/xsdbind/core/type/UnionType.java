package io.xsdbind.core.type;

import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.FacetSet;
import io.xsdbind.core.facet.LengthMeasure;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.spi.PatternCompiler;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.xml.namespace.QName;

/**
 * A union type. Members are tried left to right; the first member that decodes (or encodes)
 * without errors is committed to.
 */
public final class UnionType extends SimpleType {

    private final List<SimpleType> members;

    UnionType(QName name, SimpleType base, List<SimpleType> members, FacetSet facets) {
        super(name, base, facets);
        this.members = List.copyOf(members);
        if (this.members.isEmpty()) {
            throw new IllegalArgumentException("a union type must have at least one member type");
        }
    }

    public static UnionType of(QName name, List<SimpleType> members) {
        return new UnionType(name, Builtins.anySimpleType(), members, FacetSet.EMPTY);
    }

    public List<SimpleType> members() {
        return members;
    }

    @Override
    public Variety variety() {
        return Variety.UNION;
    }

    @Override
    public List<Result<Object>> decode(String text, boolean checks) {
        String raw = text == null ? "" : text;
        List<Result<Object>> out = newSteps();
        for (SimpleType member : members) {
            List<Result<Object>> steps = member.decode(raw, true);
            if (!hasErrors(steps)) {
                Object value = lastValue(steps);
                if (checks) {
                    checkLexical(member.facets().normalize(raw), out);
                    checkValue(value, out);
                }
                out.add(Result.value(value));
                return out;
            }
        }
        out.add(Result.error(decodeError(
                "value '" + raw.strip() + "' doesn't match any member type of " + memberNames(), raw)));
        out.add(Result.value(raw.strip()));
        return out;
    }

    @Override
    public List<Result<String>> encode(Object value, boolean checks) {
        List<Result<String>> out = newSteps();
        for (SimpleType member : members) {
            List<Result<String>> steps = member.encode(value, true);
            if (!hasErrors(steps)) {
                String text = lastValue(steps);
                if (checks) {
                    checkLexical(text, out);
                    if (!(value instanceof String)) {
                        checkValue(value, out);
                    }
                }
                out.add(Result.value(text));
                return out;
            }
        }
        out.add(Result.error(encodeError("value " + value + " doesn't match any member type of " + memberNames(), value)));
        out.add(Result.value(String.valueOf(value)));
        return out;
    }

    private String memberNames() {
        return members.stream().map(SimpleType::describe).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public UnionType restrict(
            QName derivedName, List<FacetDecl> decls, XsdVersion version, PatternCompiler patterns, boolean checks) {
        return new UnionType(derivedName, this, members, deriveFacets(derivedName, decls, version, patterns, checks));
    }

    @Override
    Set<FacetKind> admittedFacets(XsdVersion version) {
        return EnumSet.of(FacetKind.PATTERN, FacetKind.ENUMERATION);
    }

    @Override
    LengthMeasure lengthMeasure() {
        return LengthMeasure.CODE_POINTS;
    }
}
