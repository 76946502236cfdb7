package io.xsdbind.core.type;

import io.xsdbind.core.facet.FacetContext;
import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.FacetSet;
import io.xsdbind.core.facet.LengthMeasure;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.spi.PatternCompiler;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.xml.namespace.QName;

/**
 * A simple type: atomic, list or union. Decoding and encoding return a short list of steps: any
 * number of errors followed by exactly one value. When conversion fails the fallback value is the
 * normalized text, so callers in lax mode always have something to continue with.
 *
 * <p>Immutable and thread-safe.
 */
public abstract sealed class SimpleType implements XsdType permits AtomicType, ListType, UnionType {

    /** Closed set of simple type varieties. */
    public enum Variety {
        ATOMIC,
        LIST,
        UNION
    }

    private final QName name;
    private final SimpleType base;
    private final FacetSet facets;

    SimpleType(QName name, SimpleType base, FacetSet facets) {
        this.name = name;
        this.base = base;
        this.facets = facets;
    }

    @Override
    public QName name() {
        return name;
    }

    /** Base type of the restriction chain, {@code null} for {@code anySimpleType}. */
    public SimpleType base() {
        return base;
    }

    public FacetSet facets() {
        return facets;
    }

    @Override
    public boolean isSimple() {
        return true;
    }

    public abstract Variety variety();

    /**
     * Decodes text into a native value.
     *
     * @param text   raw text, {@code null} is treated as empty
     * @param checks {@code false} to skip facet checks (skip mode); conversion errors are still
     *               reported
     * @return errors (if any) followed by the value
     */
    public abstract List<Result<Object>> decode(String text, boolean checks);

    /**
     * Encodes a native value into its lexical form. A {@code String} is accepted as a lexical form
     * for any type.
     *
     * @return errors (if any) followed by the text
     */
    public abstract List<Result<String>> encode(Object value, boolean checks);

    /** Facets admitted on restrictions of this type. */
    abstract Set<FacetKind> admittedFacets(XsdVersion version);

    abstract LengthMeasure lengthMeasure();

    /**
     * Derives a new type by restriction.
     *
     * @param derivedName name of the new type, {@code null} for an anonymous type
     * @param decls       facets declared on the new type
     * @param version     schema version, selects the admitted facet set
     * @param patterns    compiler for pattern facets
     * @param checks      {@code false} in skip build mode
     * @throws io.xsdbind.core.error.SchemaParseException if the facets are invalid
     */
    public abstract SimpleType restrict(
            QName derivedName, List<FacetDecl> decls, XsdVersion version, PatternCompiler patterns, boolean checks);

    /** Builds the derivation context for a restriction of this type. */
    FacetSet deriveFacets(
            QName derivedName, List<FacetDecl> decls, XsdVersion version, PatternCompiler patterns, boolean checks) {
        String component = derivedName != null
                ? "simpleType '" + XsdNames.display(derivedName) + "'"
                : "anonymous restriction of " + describe();
        FacetContext ctx = new FacetContext(
                component,
                admittedFacets(version),
                this::parse,
                lengthMeasure(),
                isIntegral(),
                patterns,
                checks);
        return facets.derive(ctx).addAll(decls).build();
    }

    boolean isIntegral() {
        return false;
    }

    /**
     * Decodes text with every check on.
     *
     * @throws IllegalArgumentException with the first error's reason if the text is not valid
     */
    public Object parse(String text) {
        List<Result<Object>> steps = decode(text, true);
        for (Result<Object> step : steps) {
            if (step instanceof Result.Error<Object> e) {
                throw new IllegalArgumentException(e.error().reason());
            }
        }
        return ((Result.Value<Object>) steps.get(steps.size() - 1)).value();
    }

    /** Returns {@code true} if this type is {@code other} or is derived from it. */
    public boolean isDerivedFrom(SimpleType other) {
        for (SimpleType t = this; t != null; t = t.base) {
            if (t == other) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String describe() {
        return name != null ? "simpleType '" + XsdNames.display(name) + "'" : "anonymous " + variety().name().toLowerCase(Locale.ROOT) + " type";
    }

    @Override
    public String toString() {
        return describe();
    }

    ValidationError validationError(String reason, Object obj) {
        return ValidationError.validation(reason, describe(), null, obj);
    }

    ValidationError decodeError(String reason, Object obj) {
        return ValidationError.decode(reason, describe(), null, obj);
    }

    ValidationError encodeError(String reason, Object obj) {
        return ValidationError.encode(reason, describe(), null, obj);
    }

    /** Appends one validation error per facet violation of the converted value. */
    <T> void checkValue(Object value, List<Result<T>> out) {
        for (String reason : facets.valueViolations(value)) {
            out.add(Result.error(validationError(reason, value)));
        }
    }

    <T> void checkLexical(String text, List<Result<T>> out) {
        for (String reason : facets.lexicalViolations(text)) {
            out.add(Result.error(validationError(reason, text)));
        }
    }

    static <T> boolean hasErrors(List<Result<T>> steps) {
        for (Result<T> r : steps) {
            if (!r.isValue()) {
                return true;
            }
        }
        return false;
    }

    static <T> T lastValue(List<Result<T>> steps) {
        return ((Result.Value<T>) steps.get(steps.size() - 1)).value();
    }

    static <T> List<Result<T>> newSteps() {
        return new ArrayList<>(2);
    }
}
