package io.xsdbind.core.type;

import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.FacetSet;
import io.xsdbind.core.facet.JdkPatternCompiler;
import io.xsdbind.core.facet.WhiteSpace;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.NamespaceConstraint;
import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.particle.ProcessContents;
import io.xsdbind.core.particle.Wildcard;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.xml.namespace.QName;

/**
 * The builtin types of the schema namespace. Built once per JVM and shared by every schema.
 */
public final class Builtins {

    private static final AtomicType ANY_SIMPLE =
            new AtomicType(XsdNames.ANY_SIMPLE_TYPE, null, Primitive.ANY_SIMPLE, FacetSet.EMPTY);

    private static final ComplexType ANY_TYPE = ComplexType.builder(XsdNames.ANY_TYPE)
            .group(new ModelGroup(
                    ModelGroup.Compositor.SEQUENCE,
                    List.of(new Wildcard(NamespaceConstraint.any(), ProcessContents.LAX, Occurs.ANY_NUMBER)),
                    Occurs.ONCE))
            .attributes(new AttributeGroup(
                    null, Map.of(), new AnyAttribute(NamespaceConstraint.any(), ProcessContents.LAX)))
            .mixed(true)
            .build();

    private static final Map<QName, XsdType> TYPES;

    static {
        Map<QName, XsdType> types = new LinkedHashMap<>();
        types.put(ANY_TYPE.name(), ANY_TYPE);
        types.put(ANY_SIMPLE.name(), ANY_SIMPLE);
        AtomicType anyAtomic = new AtomicType(XsdNames.xsd("anyAtomicType"), ANY_SIMPLE, Primitive.ANY_SIMPLE, FacetSet.EMPTY);
        types.put(anyAtomic.name(), anyAtomic);

        FacetSet collapse = FacetSet.ofWhiteSpace(WhiteSpace.COLLAPSE, true);
        AtomicType string = primitive(types, anyAtomic, "string", Primitive.STRING, FacetSet.ofWhiteSpace(WhiteSpace.PRESERVE, false));
        primitive(types, anyAtomic, "boolean", Primitive.BOOLEAN, collapse);
        AtomicType decimal = primitive(types, anyAtomic, "decimal", Primitive.DECIMAL, collapse);
        primitive(types, anyAtomic, "float", Primitive.FLOAT, collapse);
        primitive(types, anyAtomic, "double", Primitive.DOUBLE, collapse);
        primitive(types, anyAtomic, "duration", Primitive.DURATION, collapse);
        primitive(types, anyAtomic, "dateTime", Primitive.DATE_TIME, collapse);
        primitive(types, anyAtomic, "time", Primitive.TIME, collapse);
        primitive(types, anyAtomic, "date", Primitive.DATE, collapse);
        primitive(types, anyAtomic, "gYearMonth", Primitive.G_YEAR_MONTH, collapse);
        primitive(types, anyAtomic, "gYear", Primitive.G_YEAR, collapse);
        primitive(types, anyAtomic, "gMonthDay", Primitive.G_MONTH_DAY, collapse);
        primitive(types, anyAtomic, "gDay", Primitive.G_DAY, collapse);
        primitive(types, anyAtomic, "gMonth", Primitive.G_MONTH, collapse);
        primitive(types, anyAtomic, "hexBinary", Primitive.HEX_BINARY, collapse);
        primitive(types, anyAtomic, "base64Binary", Primitive.BASE64_BINARY, collapse);
        primitive(types, anyAtomic, "anyURI", Primitive.ANY_URI, collapse);
        primitive(types, anyAtomic, "QName", Primitive.QNAME, collapse);
        primitive(types, anyAtomic, "NOTATION", Primitive.NOTATION, collapse);

        SimpleType normalized = derive(types, string, "normalizedString", facet(FacetKind.WHITE_SPACE, "replace"));
        SimpleType token = derive(types, normalized, "token", facet(FacetKind.WHITE_SPACE, "collapse"));
        derive(types, token, "language", facet(FacetKind.PATTERN, "[a-zA-Z]{1,8}(-[a-zA-Z0-9]{1,8})*"));
        SimpleType nmtoken = derive(types, token, "NMTOKEN", facet(FacetKind.PATTERN, "\\c+"));
        SimpleType name = derive(types, token, "Name", facet(FacetKind.PATTERN, "\\i\\c*"));
        SimpleType ncname = derive(types, name, "NCName", facet(FacetKind.PATTERN, "[\\i-[:]][\\c-[:]]*"));
        derive(types, ncname, "ID");
        SimpleType idref = derive(types, ncname, "IDREF");
        SimpleType entity = derive(types, ncname, "ENTITY");

        QName integerName = XsdNames.xsd("integer");
        AtomicType integer = new AtomicType(
                integerName,
                decimal,
                Primitive.INTEGER,
                decimal.deriveFacets(
                        integerName,
                        List.of(new FacetDecl(FacetKind.FRACTION_DIGITS, "0", true)),
                        XsdVersion.V1_0,
                        JdkPatternCompiler.INSTANCE,
                        true));
        types.put(integerName, integer);
        SimpleType nonPositive = derive(types, integer, "nonPositiveInteger", facet(FacetKind.MAX_INCLUSIVE, "0"));
        derive(types, nonPositive, "negativeInteger", facet(FacetKind.MAX_INCLUSIVE, "-1"));
        SimpleType lng = derive(types, integer, "long", range("-9223372036854775808", "9223372036854775807"));
        SimpleType itg = derive(types, lng, "int", range("-2147483648", "2147483647"));
        SimpleType shrt = derive(types, itg, "short", range("-32768", "32767"));
        derive(types, shrt, "byte", range("-128", "127"));
        SimpleType nonNegative = derive(types, integer, "nonNegativeInteger", facet(FacetKind.MIN_INCLUSIVE, "0"));
        SimpleType ulong = derive(types, nonNegative, "unsignedLong", facet(FacetKind.MAX_INCLUSIVE, "18446744073709551615"));
        SimpleType uint = derive(types, ulong, "unsignedInt", facet(FacetKind.MAX_INCLUSIVE, "4294967295"));
        SimpleType ushort = derive(types, uint, "unsignedShort", facet(FacetKind.MAX_INCLUSIVE, "65535"));
        derive(types, ushort, "unsignedByte", facet(FacetKind.MAX_INCLUSIVE, "255"));
        derive(types, nonNegative, "positiveInteger", facet(FacetKind.MIN_INCLUSIVE, "1"));

        builtinList(types, "NMTOKENS", nmtoken);
        builtinList(types, "IDREFS", idref);
        builtinList(types, "ENTITIES", entity);

        TYPES = Collections.unmodifiableMap(types);
    }

    private Builtins() {}

    public static Optional<XsdType> lookup(QName name) {
        return Optional.ofNullable(TYPES.get(name));
    }

    /** Returns {@code true} if the name is in the schema namespace and denotes a builtin type. */
    public static boolean isBuiltin(QName name) {
        return TYPES.containsKey(name);
    }

    public static Collection<XsdType> all() {
        return TYPES.values();
    }

    public static SimpleType anySimpleType() {
        return ANY_SIMPLE;
    }

    public static ComplexType anyType() {
        return ANY_TYPE;
    }

    /**
     * Returns a builtin simple type by local name, e.g. {@code simple("int")}.
     *
     * @throws IllegalArgumentException if no such simple type exists
     */
    public static SimpleType simple(String localName) {
        XsdType t = TYPES.get(XsdNames.xsd(localName));
        if (t instanceof SimpleType st) {
            return st;
        }
        throw new IllegalArgumentException("no builtin simple type 'xs:" + localName + "'");
    }

    private static AtomicType primitive(
            Map<QName, XsdType> types, SimpleType base, String localName, Primitive primitive, FacetSet facets) {
        AtomicType t = new AtomicType(XsdNames.xsd(localName), base, primitive, facets);
        types.put(t.name(), t);
        return t;
    }

    private static SimpleType derive(Map<QName, XsdType> types, SimpleType base, String localName, FacetDecl... decls) {
        SimpleType t = base.restrict(XsdNames.xsd(localName), List.of(decls), XsdVersion.V1_0, JdkPatternCompiler.INSTANCE, true);
        types.put(t.name(), t);
        return t;
    }

    private static void builtinList(Map<QName, XsdType> types, String localName, SimpleType item) {
        ListType list = ListType.of(null, item)
                .restrict(XsdNames.xsd(localName), List.of(facet(FacetKind.MIN_LENGTH, "1")), XsdVersion.V1_0, JdkPatternCompiler.INSTANCE, true);
        types.put(list.name(), list);
    }

    private static FacetDecl facet(FacetKind kind, String value) {
        return FacetDecl.of(kind, value);
    }

    private static FacetDecl[] range(String min, String max) {
        return new FacetDecl[] {facet(FacetKind.MIN_INCLUSIVE, min), facet(FacetKind.MAX_INCLUSIVE, max)};
    }
}
