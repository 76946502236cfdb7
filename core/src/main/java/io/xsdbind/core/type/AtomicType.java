package io.xsdbind.core.type;

import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.FacetSet;
import io.xsdbind.core.facet.LengthMeasure;
import io.xsdbind.core.model.ErrorKind;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.spi.PatternCompiler;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.xml.namespace.QName;

/** An atomic simple type: a primitive value space narrowed by facets. */
public final class AtomicType extends SimpleType {

    private final Primitive primitive;

    AtomicType(QName name, SimpleType base, Primitive primitive, FacetSet facets) {
        super(name, base, facets);
        this.primitive = Objects.requireNonNull(primitive, "primitive must not be null");
    }

    public Primitive primitive() {
        return primitive;
    }

    @Override
    public Variety variety() {
        return Variety.ATOMIC;
    }

    @Override
    public List<Result<Object>> decode(String text, boolean checks) {
        String normalized = facets().normalize(text == null ? "" : text);
        List<Result<Object>> out = newSteps();
        if (checks) {
            checkLexical(normalized, out);
        }
        Object value;
        try {
            value = primitive.parse(normalized);
        } catch (IllegalArgumentException e) {
            out.add(Result.error(decodeError(e.getMessage(), normalized)));
            out.add(Result.value(normalized));
            return out;
        }
        if (checks) {
            checkValue(value, out);
        }
        out.add(Result.value(value));
        return out;
    }

    @Override
    public List<Result<String>> encode(Object value, boolean checks) {
        List<Result<String>> out = newSteps();
        if (value == null) {
            out.add(Result.error(encodeError("cannot encode a null value", null)));
            out.add(Result.value(""));
            return out;
        }
        if (value instanceof String text) {
            List<Result<Object>> decoded = decode(text, checks);
            boolean converted = true;
            for (Result<Object> step : decoded) {
                if (step instanceof Result.Error<Object> e) {
                    out.add(Result.error(e.error()));
                    converted &= e.error().kind() != ErrorKind.DECODE;
                }
            }
            Object nativeValue = lastValue(decoded);
            out.add(Result.value(converted ? primitive.format(nativeValue) : String.valueOf(nativeValue)));
            return out;
        }
        Object coerced;
        try {
            coerced = primitive.coerce(value);
        } catch (IllegalArgumentException e) {
            out.add(Result.error(encodeError(e.getMessage(), value)));
            out.add(Result.value(String.valueOf(value)));
            return out;
        }
        String text = primitive.format(coerced);
        if (checks) {
            checkLexical(text, out);
            checkValue(coerced, out);
        }
        out.add(Result.value(text));
        return out;
    }

    @Override
    public AtomicType restrict(
            QName derivedName, List<FacetDecl> decls, XsdVersion version, PatternCompiler patterns, boolean checks) {
        return new AtomicType(derivedName, this, primitive, deriveFacets(derivedName, decls, version, patterns, checks));
    }

    @Override
    Set<FacetKind> admittedFacets(XsdVersion version) {
        return primitive.admittedFacets(version);
    }

    @Override
    LengthMeasure lengthMeasure() {
        return primitive.lengthMeasure();
    }

    @Override
    boolean isIntegral() {
        return primitive.isIntegral();
    }
}
