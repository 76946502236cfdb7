package io.xsdbind.core.facet;

import io.xsdbind.core.error.SchemaParseException;
import io.xsdbind.core.spi.PatternMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The effective facets of one simple type: those declared on it plus those inherited along its
 * restriction chain. Immutable and thread-safe.
 *
 * <p>Application order: {@link #normalize(String)}, then {@link #lexicalViolations(String)} on the
 * normalized text, then conversion (done by the type), then {@link #valueViolations(Object)}.
 */
public final class FacetSet {

    /** No facets, whitespace preserved. */
    public static final FacetSet EMPTY =
            new FacetSet(WhiteSpace.PRESERVE, new EnumMap<>(FacetKind.class), List.of(), EnumSet.noneOf(FacetKind.class));

    private static final List<FacetKind> VALUE_ORDER = List.of(
            FacetKind.LENGTH,
            FacetKind.MIN_LENGTH,
            FacetKind.MAX_LENGTH,
            FacetKind.MIN_INCLUSIVE,
            FacetKind.MIN_EXCLUSIVE,
            FacetKind.MAX_INCLUSIVE,
            FacetKind.MAX_EXCLUSIVE,
            FacetKind.TOTAL_DIGITS,
            FacetKind.FRACTION_DIGITS,
            FacetKind.ENUMERATION,
            FacetKind.EXPLICIT_TIMEZONE);

    private final WhiteSpace whiteSpace;
    private final Map<FacetKind, Facet> facets;
    private final List<PatternFacet> patterns;
    private final Set<FacetKind> fixed;

    private FacetSet(
            WhiteSpace whiteSpace, Map<FacetKind, Facet> facets, List<PatternFacet> patterns, Set<FacetKind> fixed) {
        this.whiteSpace = whiteSpace;
        Map<FacetKind, Facet> copy = new EnumMap<>(FacetKind.class);
        copy.putAll(facets);
        this.facets = Collections.unmodifiableMap(copy);
        this.patterns = List.copyOf(patterns);
        Set<FacetKind> fixedCopy = EnumSet.noneOf(FacetKind.class);
        fixedCopy.addAll(fixed);
        this.fixed = Collections.unmodifiableSet(fixedCopy);
    }

    /** A facet set with only a whitespace rule, as used by builtin primitives. */
    public static FacetSet ofWhiteSpace(WhiteSpace ws, boolean fixed) {
        return new FacetSet(
                ws,
                new EnumMap<>(FacetKind.class),
                List.of(),
                fixed ? EnumSet.of(FacetKind.WHITE_SPACE) : EnumSet.noneOf(FacetKind.class));
    }

    public WhiteSpace whiteSpace() {
        return whiteSpace;
    }

    public Optional<Facet> get(FacetKind kind) {
        return Optional.ofNullable(facets.get(kind));
    }

    public List<PatternFacet> patterns() {
        return patterns;
    }

    public boolean isFixed(FacetKind kind) {
        return fixed.contains(kind);
    }

    public boolean isEmpty() {
        return facets.isEmpty() && patterns.isEmpty();
    }

    public String normalize(String text) {
        return whiteSpace.normalize(text);
    }

    /** Runs the pattern facets of every derivation step on normalized text. */
    public List<String> lexicalViolations(String text) {
        List<String> reasons = new ArrayList<>(1);
        for (PatternFacet p : patterns) {
            p.violation(text).ifPresent(reasons::add);
        }
        return reasons;
    }

    /** Runs the value facets on a converted native value. */
    public List<String> valueViolations(Object value) {
        List<String> reasons = new ArrayList<>(1);
        for (FacetKind kind : VALUE_ORDER) {
            Facet f = facets.get(kind);
            if (f != null) {
                f.violation(value).ifPresent(reasons::add);
            }
        }
        return reasons;
    }

    /** Starts a restriction of this facet set. */
    public Derivation derive(FacetContext context) {
        return new Derivation(this, context);
    }

    @Override
    public String toString() {
        return "FacetSet[whiteSpace=" + whiteSpace + ", facets=" + facets.keySet() + ", patterns=" + patterns.size() + "]";
    }

    /**
     * One restriction step. Collects the facets declared on the derived type and, on
     * {@link #build()}, compiles them, checks them against each other and against the base, and
     * merges them into a new set.
     */
    public static final class Derivation {

        private final FacetSet base;
        private final FacetContext ctx;
        private final List<FacetDecl> decls = new ArrayList<>();

        private Derivation(FacetSet base, FacetContext ctx) {
            this.base = base;
            this.ctx = ctx;
        }

        public Derivation add(FacetDecl decl) {
            decls.add(decl);
            return this;
        }

        public Derivation addAll(List<FacetDecl> all) {
            decls.addAll(all);
            return this;
        }

        /**
         * @throws SchemaParseException if a facet is not admitted, has an invalid value,
         *     contradicts another facet or widens a base facet (checks are skipped when the
         *     context says so, invalid literals are always rejected)
         */
        public FacetSet build() {
            WhiteSpace ws = base.whiteSpace;
            Map<FacetKind, Facet> own = new EnumMap<>(FacetKind.class);
            Set<FacetKind> fixed = EnumSet.noneOf(FacetKind.class);
            fixed.addAll(base.fixed);
            List<String> patternLiterals = new ArrayList<>();
            List<PatternMatcher> patternMatchers = new ArrayList<>();
            List<Object> enumValues = new ArrayList<>();
            List<String> enumLiterals = new ArrayList<>();
            Set<FacetKind> seen = EnumSet.noneOf(FacetKind.class);

            for (FacetDecl decl : decls) {
                FacetKind kind = decl.kind();
                if (ctx.checks() && !ctx.admitted().contains(kind)) {
                    throw fail("facet '" + kind + "' is not applicable to this type");
                }
                if (kind != FacetKind.PATTERN && kind != FacetKind.ENUMERATION && !seen.add(kind)) {
                    throw fail("facet '" + kind + "' is declared more than once");
                }
                if (decl.fixed()) {
                    fixed.add(kind);
                }
                switch (kind) {
                    case WHITE_SPACE -> {
                        WhiteSpace declared = parse(decl, () -> WhiteSpace.fromName(decl.value()));
                        if (ctx.checks() && !declared.narrows(base.whiteSpace)) {
                            throw fail("whiteSpace '" + declared.xsdName() + "' relaxes the base value '"
                                    + base.whiteSpace.xsdName() + "'");
                        }
                        if (ctx.checks() && base.isFixed(kind) && declared != base.whiteSpace) {
                            throw fail("'whiteSpace' facet is fixed in the base type");
                        }
                        ws = declared;
                    }
                    case LENGTH, MIN_LENGTH, MAX_LENGTH -> own.put(
                            kind, new LengthFacet(kind, parseCount(decl), ctx.measure()));
                    case TOTAL_DIGITS, FRACTION_DIGITS -> own.put(kind, parse(decl, () -> new DigitsFacet(kind, parseCount(decl))));
                    case MIN_INCLUSIVE, MIN_EXCLUSIVE, MAX_INCLUSIVE, MAX_EXCLUSIVE -> own.put(
                            kind, new BoundFacet(kind, parseValue(decl), decl.value()));
                    case ENUMERATION -> {
                        enumValues.add(parseValue(decl));
                        enumLiterals.add(decl.value());
                    }
                    case PATTERN -> {
                        patternLiterals.add(decl.value());
                        patternMatchers.add(parse(decl, () -> ctx.patterns().compile(decl.value())));
                    }
                    case EXPLICIT_TIMEZONE -> own.put(
                            kind, new ExplicitTimezoneFacet(parse(decl, () -> ExplicitTimezoneFacet.Presence.fromName(decl.value()))));
                    default -> throw fail("unsupported facet '" + kind + "'");
                }
            }
            if (!enumValues.isEmpty()) {
                own.put(FacetKind.ENUMERATION, new EnumerationFacet(enumValues, enumLiterals));
            }

            if (ctx.checks()) {
                checkFixed(own);
                checkContradictions(own);
                checkNarrowing(own);
            }

            Map<FacetKind, Facet> merged = new EnumMap<>(FacetKind.class);
            merged.putAll(base.facets);
            merged.putAll(own);
            List<PatternFacet> patterns = new ArrayList<>(base.patterns);
            if (!patternLiterals.isEmpty()) {
                patterns.add(new PatternFacet(patternLiterals, patternMatchers));
            }
            return new FacetSet(ws, merged, patterns, fixed);
        }

        private void checkFixed(Map<FacetKind, Facet> own) {
            for (Map.Entry<FacetKind, Facet> e : own.entrySet()) {
                Facet inherited = base.facets.get(e.getKey());
                if (inherited != null && base.isFixed(e.getKey()) && !inherited.equals(e.getValue())) {
                    throw fail("'" + e.getKey() + "' facet is fixed in the base type");
                }
            }
        }

        private void checkContradictions(Map<FacetKind, Facet> own) {
            Map<FacetKind, Facet> eff = new EnumMap<>(FacetKind.class);
            eff.putAll(base.facets);
            eff.putAll(own);

            Integer length = intValue(eff.get(FacetKind.LENGTH));
            Integer minLength = intValue(eff.get(FacetKind.MIN_LENGTH));
            Integer maxLength = intValue(eff.get(FacetKind.MAX_LENGTH));
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw fail("'minLength' has a greater value than 'maxLength'");
            }
            if (length != null && minLength != null && minLength > length) {
                throw fail("'minLength' has a greater value than 'length'");
            }
            if (length != null && maxLength != null && maxLength < length) {
                throw fail("'maxLength' has a lesser value than 'length'");
            }

            if (own.containsKey(FacetKind.MIN_INCLUSIVE) && own.containsKey(FacetKind.MIN_EXCLUSIVE)) {
                throw fail("'minInclusive' and 'minExclusive' cannot be specified together");
            }
            if (own.containsKey(FacetKind.MAX_INCLUSIVE) && own.containsKey(FacetKind.MAX_EXCLUSIVE)) {
                throw fail("'maxInclusive' and 'maxExclusive' cannot be specified together");
            }
            for (FacetKind lower : List.of(FacetKind.MIN_INCLUSIVE, FacetKind.MIN_EXCLUSIVE)) {
                for (FacetKind upper : List.of(FacetKind.MAX_INCLUSIVE, FacetKind.MAX_EXCLUSIVE)) {
                    BoundFacet lo = (BoundFacet) eff.get(lower);
                    BoundFacet hi = (BoundFacet) eff.get(upper);
                    if (lo == null || hi == null || !(own.containsKey(lower) || own.containsKey(upper))) {
                        continue;
                    }
                    Integer cmp = ValueOrder.compare(lo.value(), hi.value());
                    if (cmp != null && (cmp > 0 || (cmp == 0 && (lower.isExclusive() || upper.isExclusive())))) {
                        throw fail("'" + lower + "' has a greater value than '" + upper + "'");
                    }
                }
            }

            Integer total = intValue(eff.get(FacetKind.TOTAL_DIGITS));
            Integer fraction = intValue(eff.get(FacetKind.FRACTION_DIGITS));
            if (total != null && fraction != null && fraction > total) {
                throw fail("'fractionDigits' has a greater value than 'totalDigits'");
            }
            if (ctx.integral() && fraction != null && fraction > 0) {
                throw fail("'fractionDigits' must be 0 for an integer-derived type");
            }
        }

        private void checkNarrowing(Map<FacetKind, Facet> own) {
            Integer baseLength = intValue(base.facets.get(FacetKind.LENGTH));
            Integer baseMin = intValue(base.facets.get(FacetKind.MIN_LENGTH));
            Integer baseMax = intValue(base.facets.get(FacetKind.MAX_LENGTH));

            Integer length = intValue(own.get(FacetKind.LENGTH));
            if (length != null) {
                if (baseLength != null && !baseLength.equals(length)) {
                    throw fail("'length' has a different value than parent 'length'");
                }
                if (baseMin != null && length < baseMin) {
                    throw fail("'length' has a lesser value than parent 'minLength'");
                }
                if (baseMax != null && length > baseMax) {
                    throw fail("'length' has a greater value than parent 'maxLength'");
                }
            }
            Integer minLength = intValue(own.get(FacetKind.MIN_LENGTH));
            if (minLength != null) {
                if (baseMin != null && minLength < baseMin) {
                    throw fail("'minLength' has a lesser value than parent 'minLength'");
                }
                if (baseMax != null && minLength > baseMax) {
                    throw fail("'minLength' has a greater value than parent 'maxLength'");
                }
                if (baseLength != null && minLength > baseLength) {
                    throw fail("'minLength' has a greater value than parent 'length'");
                }
            }
            Integer maxLength = intValue(own.get(FacetKind.MAX_LENGTH));
            if (maxLength != null) {
                if (baseMax != null && maxLength > baseMax) {
                    throw fail("'maxLength' has a greater value than parent 'maxLength'");
                }
                if (baseMin != null && maxLength < baseMin) {
                    throw fail("'maxLength' has a lesser value than parent 'minLength'");
                }
                if (baseLength != null && maxLength < baseLength) {
                    throw fail("'maxLength' has a lesser value than parent 'length'");
                }
            }

            for (FacetKind kind : List.of(
                    FacetKind.MIN_INCLUSIVE, FacetKind.MIN_EXCLUSIVE, FacetKind.MAX_INCLUSIVE, FacetKind.MAX_EXCLUSIVE)) {
                BoundFacet bound = (BoundFacet) own.get(kind);
                if (bound != null) {
                    checkBoundWithinBase(bound);
                }
            }

            for (FacetKind kind : List.of(FacetKind.TOTAL_DIGITS, FacetKind.FRACTION_DIGITS)) {
                Integer mine = intValue(own.get(kind));
                Integer inherited = intValue(base.facets.get(kind));
                if (mine != null && inherited != null && mine > inherited) {
                    throw fail("'" + kind + "' has a greater value than parent '" + kind + "'");
                }
            }

            EnumerationFacet enumeration = (EnumerationFacet) own.get(FacetKind.ENUMERATION);
            if (enumeration != null) {
                for (int i = 0; i < enumeration.values().size(); i++) {
                    Object v = enumeration.values().get(i);
                    if (!base.valueViolations(v).isEmpty()) {
                        throw fail("enumeration value '" + enumeration.literals().get(i) + "' is not valid for the base type");
                    }
                }
            }

            ExplicitTimezoneFacet tz = (ExplicitTimezoneFacet) own.get(FacetKind.EXPLICIT_TIMEZONE);
            ExplicitTimezoneFacet baseTz = (ExplicitTimezoneFacet) base.facets.get(FacetKind.EXPLICIT_TIMEZONE);
            if (tz != null && baseTz != null
                    && baseTz.value() != ExplicitTimezoneFacet.Presence.OPTIONAL
                    && tz.value() != baseTz.value()) {
                throw fail("'explicitTimezone' cannot relax the base value '"
                        + baseTz.value().name().toLowerCase(Locale.ROOT) + "'");
            }
        }

        private void checkBoundWithinBase(BoundFacet bound) {
            for (FacetKind baseKind : List.of(
                    FacetKind.MIN_INCLUSIVE, FacetKind.MIN_EXCLUSIVE, FacetKind.MAX_INCLUSIVE, FacetKind.MAX_EXCLUSIVE)) {
                BoundFacet baseBound = (BoundFacet) base.facets.get(baseKind);
                if (baseBound == null) {
                    continue;
                }
                Integer cmp = ValueOrder.compare(bound.value(), baseBound.value());
                if (cmp == null) {
                    continue;
                }
                boolean loose = baseKind.isExclusive()
                        ? bound.kind() == baseKind
                        : !(bound.kind().isExclusive() && bound.kind().isLowerBound() != baseKind.isLowerBound());
                boolean ok = baseKind.isLowerBound()
                        ? (loose ? cmp >= 0 : cmp > 0)
                        : (loose ? cmp <= 0 : cmp < 0);
                if (!ok) {
                    throw fail("'" + bound.kind() + "' value " + bound.literal()
                            + " is outside the range of parent '" + baseKind + "' " + baseBound.literal());
                }
            }
        }

        private int parseCount(FacetDecl decl) {
            try {
                int n = Integer.parseInt(decl.value().trim());
                if (n < 0) {
                    throw fail("facet '" + decl.kind() + "' must be a non-negative integer, got '" + decl.value() + "'");
                }
                return n;
            } catch (NumberFormatException e) {
                throw new SchemaParseException(
                        "facet '" + decl.kind() + "' must be a non-negative integer, got '" + decl.value() + "'",
                        e,
                        ctx.component(),
                        null);
            }
        }

        private Object parseValue(FacetDecl decl) {
            return parse(decl, () -> ctx.valueParser().apply(decl.value()));
        }

        private <T> T parse(FacetDecl decl, Supplier<T> parser) {
            try {
                return parser.get();
            } catch (IllegalArgumentException e) {
                throw new SchemaParseException(
                        "invalid value '" + decl.value() + "' for facet '" + decl.kind() + "': " + e.getMessage(),
                        e,
                        ctx.component(),
                        null);
            }
        }

        private static Integer intValue(Facet f) {
            if (f instanceof LengthFacet lf) {
                return lf.value();
            }
            if (f instanceof DigitsFacet df) {
                return df.value();
            }
            return null;
        }

        private SchemaParseException fail(String message) {
            return new SchemaParseException(message, ctx.component(), null);
        }
    }
}
