package io.xsdbind.core.schema;

import io.xsdbind.core.error.SchemaBuildException;
import io.xsdbind.core.error.SchemaParseException;
import io.xsdbind.core.facet.JdkPatternCompiler;
import io.xsdbind.core.model.BuildOptions;
import io.xsdbind.core.model.ValidationMode;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.particle.Particle;
import io.xsdbind.core.particle.Wildcard;
import io.xsdbind.core.spi.PatternCompiler;
import io.xsdbind.core.type.AnyAttribute;
import io.xsdbind.core.type.AttributeDecl;
import io.xsdbind.core.type.AttributeGroup;
import io.xsdbind.core.type.AttributeUse;
import io.xsdbind.core.type.Builtins;
import io.xsdbind.core.type.ComplexType;
import io.xsdbind.core.type.ContentKind;
import io.xsdbind.core.type.Derivation;
import io.xsdbind.core.type.ListType;
import io.xsdbind.core.type.SimpleType;
import io.xsdbind.core.type.UnionType;
import io.xsdbind.core.type.XsdNames;
import io.xsdbind.core.type.XsdType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import javax.xml.namespace.QName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Schema} from drafts in three phases:
 *
 * <ol>
 *   <li><b>register</b>: drafts are added by name ({@code add*} methods);
 *   <li><b>resolve</b>: every draft is turned into its immutable component, following name
 *       references recursively. Base-type, group and attribute-group cycles are build errors;
 *       element references stay references, so recursive content models are legal;
 *   <li><b>check</b>: structural rules that need the whole graph (restriction content kinds,
 *       {@code all} groups, model depth, default and fixed values). Each pass gets a fresh
 *       {@link BuildGeneration}; a draft is checked at most once per generation.
 * </ol>
 *
 * <p>Failure handling follows {@link BuildOptions#mode()}: strict throws the first
 * {@link SchemaParseException}; lax collects errors (see {@link Schema#buildErrors()}) and falls
 * back to {@code anyType}/{@code anySimpleType}; skip omits the check phase and falls back
 * silently.
 *
 * <p>Not thread-safe. The schema it builds is.
 */
public final class SchemaBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaBuilder.class);

    private final String targetNamespace;
    private final BuildOptions options;
    private String source;
    private PatternCompiler patternCompiler = JdkPatternCompiler.INSTANCE;

    private final Map<QName, SimpleTypeDraft> simpleTypes = new LinkedHashMap<>();
    private final Map<QName, ComplexTypeDraft> complexTypes = new LinkedHashMap<>();
    private final Map<QName, ElementDraft> elements = new LinkedHashMap<>();
    private final Map<QName, ModelGroupDraft> groups = new LinkedHashMap<>();
    private final Map<QName, AttributeGroupDraft> attributeGroups = new LinkedHashMap<>();
    private final Map<QName, AttributeDraft> attributes = new LinkedHashMap<>();

    private final List<SchemaBuildException> errors = new ArrayList<>();
    private final List<SchemaBuildException> registrationErrors = new ArrayList<>();
    private BuildGeneration generation;

    public SchemaBuilder(String targetNamespace, BuildOptions options) {
        this.targetNamespace = targetNamespace == null ? "" : targetNamespace;
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /** Names the document the drafts come from; reported as the source of build errors. */
    public SchemaBuilder source(String source) {
        this.source = source;
        return this;
    }

    public SchemaBuilder patternCompiler(PatternCompiler compiler) {
        this.patternCompiler = Objects.requireNonNull(compiler, "compiler must not be null");
        return this;
    }

    public String targetNamespace() {
        return targetNamespace;
    }

    public BuildOptions options() {
        return options;
    }

    /** Generation token of the last completed check pass, {@code null} before the first one. */
    public BuildGeneration generation() {
        return generation;
    }

    // --- phase 1: register ---

    public SchemaBuilder addSimpleType(SimpleTypeDraft draft) {
        requireNamed(draft);
        checkTypeNameFree(draft.name, draft.describe());
        simpleTypes.put(draft.name, draft);
        return this;
    }

    public SchemaBuilder addComplexType(ComplexTypeDraft draft) {
        requireNamed(draft);
        checkTypeNameFree(draft.name, draft.describe());
        complexTypes.put(draft.name, draft);
        return this;
    }

    public SchemaBuilder addElement(ElementDraft draft) {
        requireNamed(draft);
        if (!draft.global || draft.ref != null) {
            throw new IllegalArgumentException(draft.describe() + " is not a global declaration");
        }
        register(elements, draft);
        return this;
    }

    public SchemaBuilder addGroup(ModelGroupDraft draft) {
        requireNamed(draft);
        register(groups, draft);
        return this;
    }

    public SchemaBuilder addAttributeGroup(AttributeGroupDraft draft) {
        requireNamed(draft);
        register(attributeGroups, draft);
        return this;
    }

    public SchemaBuilder addAttribute(AttributeDraft draft) {
        requireNamed(draft);
        if (draft.ref != null) {
            throw new IllegalArgumentException(draft.describe() + " is a reference, not a global declaration");
        }
        register(attributes, draft);
        return this;
    }

    /**
     * Reports a problem found outside the builder, such as a malformed schema document entry.
     * Strict mode throws it; lax mode keeps it in {@link Schema#buildErrors()}.
     *
     * @throws SchemaParseException in strict mode
     */
    public SchemaBuilder reportError(SchemaParseException e) {
        fail(e);
        if (options.mode() == ValidationMode.LAX) {
            registrationErrors.add(e);
        }
        return this;
    }

    private static void requireNamed(Draft<?> draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        if (draft.name == null) {
            throw new IllegalArgumentException("global components must be named");
        }
    }

    private <D extends Draft<?>> void register(Map<QName, D> map, D draft) {
        if (map.containsKey(draft.name)) {
            SchemaParseException e = error(draft.describe() + " is declared more than once", draft.describe());
            fail(e);
            if (options.mode() == ValidationMode.LAX) {
                registrationErrors.add(e);
            }
            return;
        }
        map.put(draft.name, draft);
    }

    private void checkTypeNameFree(QName name, String component) {
        if (simpleTypes.containsKey(name) || complexTypes.containsKey(name)) {
            throw error(component + " is declared more than once", component);
        }
        if (Builtins.isBuiltin(name)) {
            throw error(component + " redefines a builtin type", component);
        }
    }

    // --- build ---

    /**
     * Resolves and checks every registered draft.
     *
     * @return the built schema
     * @throws SchemaParseException in strict mode, at the first build error
     */
    public Schema build() {
        errors.clear();
        errors.addAll(registrationErrors);
        Map<QName, XsdType> types = new LinkedHashMap<>();
        for (SimpleTypeDraft d : simpleTypes.values()) {
            types.put(d.name, resolveSimple(d));
        }
        for (ComplexTypeDraft d : complexTypes.values()) {
            types.put(d.name, resolveComplex(d));
        }
        Map<QName, ModelGroup> builtGroups = new LinkedHashMap<>();
        for (ModelGroupDraft d : groups.values()) {
            ModelGroup group = resolveNamedGroup(d.name, d.describe());
            if (group != null) {
                builtGroups.put(d.name, group);
            }
        }
        Map<QName, AttributeGroup> builtAttributeGroups = new LinkedHashMap<>();
        for (AttributeGroupDraft d : attributeGroups.values()) {
            builtAttributeGroups.put(d.name, resolveAttributeGroup(d));
        }
        Map<QName, AttributeDecl> builtAttributes = new LinkedHashMap<>();
        for (AttributeDraft d : attributes.values()) {
            AttributeDecl decl = resolveAttribute(d);
            if (decl != null) {
                builtAttributes.put(d.name, decl);
            }
        }
        Map<QName, ElementDecl> builtElements = new LinkedHashMap<>();
        for (ElementDraft d : elements.values()) {
            builtElements.put(d.name, resolveElement(d));
        }

        if (options.mode().checks()) {
            generation = new BuildGeneration();
            LOG.debug("Checking {} complex types and {} elements in {}", complexTypes.size(), elements.size(), generation);
            for (ComplexTypeDraft d : complexTypes.values()) {
                checkComplex(d);
            }
            for (ElementDraft d : elements.values()) {
                checkElement(d);
            }
            for (AttributeDraft d : attributes.values()) {
                checkAttribute(d);
            }
        }

        Schema schema = new Schema(
                targetNamespace,
                options.version(),
                source,
                types,
                builtElements,
                builtGroups,
                builtAttributeGroups,
                builtAttributes,
                errors);
        LOG.info(
                "Built schema '{}' ({}): {} types, {} elements, {} groups, {} build errors",
                targetNamespace,
                source != null ? source : "programmatic",
                types.size(),
                builtElements.size(),
                builtGroups.size(),
                errors.size());
        return schema;
    }

    // --- phase 2: resolve ---

    private SimpleType resolveSimple(SimpleTypeDraft d) {
        if (d.built != null) {
            return d.built;
        }
        if (d.resolving) {
            fail("circular definition of " + d.describe(), d.describe());
            return Builtins.anySimpleType();
        }
        d.resolving = true;
        try {
            SimpleType result = switch (d.method) {
                case RESTRICTION -> {
                    SimpleType base = d.inlineBase != null
                            ? resolveSimple(d.inlineBase)
                            : simpleTypeByName(d.baseName, d.describe());
                    yield restrictSimple(base, d);
                }
                case LIST -> {
                    SimpleType item = d.inlineItem != null
                            ? resolveSimple(d.inlineItem)
                            : simpleTypeByName(d.itemName, d.describe());
                    if (item instanceof ListType) {
                        fail(d.describe() + ": the item type of a list cannot be a list type", d.describe());
                        yield Builtins.anySimpleType();
                    }
                    yield ListType.of(d.name, item);
                }
                case UNION -> {
                    List<SimpleType> members = new ArrayList<>();
                    for (QName member : d.memberNames) {
                        members.add(simpleTypeByName(member, d.describe()));
                    }
                    for (SimpleTypeDraft inline : d.inlineMembers) {
                        members.add(resolveSimple(inline));
                    }
                    if (members.isEmpty()) {
                        fail(d.describe() + ": a union needs at least one member type", d.describe());
                        yield Builtins.anySimpleType();
                    }
                    yield UnionType.of(d.name, members);
                }
            };
            if (d.method != SimpleTypeDraft.Method.RESTRICTION && !d.facets.isEmpty()) {
                result = restrictSimple(result, d);
            }
            d.built = result;
            LOG.debug("Resolved {}", d.describe());
            return result;
        } finally {
            d.resolving = false;
        }
    }

    private SimpleType restrictSimple(SimpleType base, SimpleTypeDraft d) {
        try {
            return base.restrict(d.name, d.facets, options.version(), patternCompiler, options.mode().checks());
        } catch (SchemaParseException e) {
            fail(e);
            return Builtins.anySimpleType();
        }
    }

    private SimpleType simpleTypeByName(QName name, String component) {
        if (name == null) {
            fail(component + ": missing base or item type", component);
            return Builtins.anySimpleType();
        }
        SimpleTypeDraft draft = simpleTypes.get(name);
        if (draft != null) {
            return resolveSimple(draft);
        }
        if (complexTypes.containsKey(name)) {
            fail(component + ": '" + XsdNames.display(name) + "' is not a simple type", component);
            return Builtins.anySimpleType();
        }
        XsdType builtin = Builtins.lookup(name).orElse(null);
        if (builtin instanceof SimpleType st) {
            return st;
        }
        fail(component + ": unknown simple type '" + XsdNames.display(name) + "'", component);
        return Builtins.anySimpleType();
    }

    private XsdType typeByName(QName name, String component) {
        SimpleTypeDraft simple = simpleTypes.get(name);
        if (simple != null) {
            return resolveSimple(simple);
        }
        ComplexTypeDraft complex = complexTypes.get(name);
        if (complex != null) {
            return resolveComplex(complex);
        }
        return Builtins.lookup(name).orElseGet(() -> {
            fail(component + ": unknown type '" + XsdNames.display(name) + "'", component);
            return Builtins.anyType();
        });
    }

    private ComplexType resolveComplex(ComplexTypeDraft d) {
        if (d.built != null) {
            return d.built;
        }
        if (d.resolving) {
            fail("circular derivation of " + d.describe(), d.describe());
            return Builtins.anyType();
        }
        d.resolving = true;
        try {
            ComplexType result;
            try {
                result = switch (d.contentMode) {
                    case DIRECT -> ComplexType.builder(d.name)
                            .group(d.group != null ? resolveGroup(d.group) : null)
                            .attributes(resolveAttributeGroup(d.attributes))
                            .mixed(d.mixed)
                            .isAbstract(d.isAbstract)
                            .build();
                    case SIMPLE_CONTENT -> resolveSimpleContent(d);
                    case COMPLEX_CONTENT -> resolveComplexContent(d);
                };
            } catch (IllegalArgumentException e) {
                fail(new SchemaParseException(e.getMessage(), e, d.describe(), source));
                result = Builtins.anyType();
            }
            d.built = result;
            LOG.debug("Resolved {} ({})", d.describe(), result.contentKind());
            return result;
        } finally {
            d.resolving = false;
        }
    }

    private ComplexType resolveSimpleContent(ComplexTypeDraft d) {
        XsdType base = typeByName(d.baseName, d.describe());
        AttributeGroup own = resolveAttributeGroup(d.attributes);
        ComplexType.Builder b = ComplexType.builder(d.name)
                .derivation(d.derivation, d.baseName)
                .isAbstract(d.isAbstract);
        if (d.derivation == Derivation.EXTENSION) {
            if (base instanceof SimpleType st) {
                return b.simpleContent(st).attributes(own).build();
            }
            ComplexType ct = (ComplexType) base;
            if (!ct.hasSimpleContent()) {
                fail(d.describe() + ": the base of a simpleContent extension must have simple content", d.describe());
                return Builtins.anyType();
            }
            return b.simpleContent(ct.simpleContent()).attributes(ct.attributes().union(own)).build();
        }
        if (!(base instanceof ComplexType ct) || !ct.hasSimpleContent()) {
            fail(d.describe() + ": the base of a simpleContent restriction must be a complex type with simple content",
                    d.describe());
            return Builtins.anyType();
        }
        SimpleType content = ct.simpleContent();
        if (!d.facets.isEmpty()) {
            try {
                content = content.restrict(null, d.facets, options.version(), patternCompiler, options.mode().checks());
            } catch (SchemaParseException e) {
                fail(e);
                content = Builtins.anySimpleType();
            }
        }
        return b.simpleContent(content).attributes(ct.attributes().restrict(own)).build();
    }

    private ComplexType resolveComplexContent(ComplexTypeDraft d) {
        XsdType baseType = typeByName(d.baseName, d.describe());
        if (!(baseType instanceof ComplexType base)) {
            fail(d.describe() + ": the base of a complexContent derivation must be a complex type", d.describe());
            return Builtins.anyType();
        }
        if (base.hasSimpleContent()) {
            fail(d.describe() + ": a complexContent derivation cannot have a base with simple content", d.describe());
            return Builtins.anyType();
        }
        ModelGroup own = d.group != null ? resolveGroup(d.group) : null;
        AttributeGroup ownAttributes = resolveAttributeGroup(d.attributes);
        ComplexType.Builder b = ComplexType.builder(d.name)
                .derivation(d.derivation, d.baseName)
                .isAbstract(d.isAbstract);
        if (d.derivation == Derivation.EXTENSION) {
            return b.group(extendGroup(base.group(), own))
                    .attributes(base.attributes().union(ownAttributes))
                    .mixed(d.mixed || base.isMixed())
                    .build();
        }
        return b.group(own)
                .attributes(base.attributes().restrict(ownAttributes))
                .mixed(d.mixed)
                .build();
    }

    /** Base content first, then the extension's own particles. */
    private static ModelGroup extendGroup(ModelGroup base, ModelGroup own) {
        if (base == null || base.isEmpty()) {
            return own;
        }
        if (own == null || own.isEmpty()) {
            return base;
        }
        if (base.compositor() == ModelGroup.Compositor.SEQUENCE
                && base.occurs().equals(Occurs.ONCE)
                && own.compositor() == ModelGroup.Compositor.SEQUENCE
                && own.occurs().equals(Occurs.ONCE)) {
            return base.append(own.particles());
        }
        return new ModelGroup(ModelGroup.Compositor.SEQUENCE, List.of(base, own), Occurs.ONCE);
    }

    private ModelGroup resolveGroup(ModelGroupDraft d) {
        if (d.built != null) {
            return d.built;
        }
        List<Particle> particles = new ArrayList<>();
        for (ParticleDraft p : d.particles) {
            Particle resolved = resolveParticle(p, d);
            if (resolved != null) {
                particles.add(resolved);
            }
        }
        d.built = new ModelGroup(d.compositor, particles, d.occurs);
        return d.built;
    }

    private Particle resolveParticle(ParticleDraft p, ModelGroupDraft owner) {
        if (p instanceof ElementDraft e) {
            if (e.ref != null) {
                if (!elements.containsKey(e.ref)) {
                    fail(owner.describe() + ": reference to unknown element '" + XsdNames.display(e.ref) + "'",
                            owner.describe());
                }
                return ElementDecl.reference(e.ref, e.occurs);
            }
            return resolveElement(e);
        }
        if (p instanceof WildcardDraft w) {
            return w.wildcard();
        }
        if (p instanceof ModelGroupDraft g) {
            return resolveGroup(g);
        }
        GroupRefDraft ref = (GroupRefDraft) p;
        ModelGroup named = resolveNamedGroup(ref.ref(), owner.describe());
        return named == null ? null : named.withOccurs(ref.occurs());
    }

    private ModelGroup resolveNamedGroup(QName name, String component) {
        ModelGroupDraft d = groups.get(name);
        if (d == null) {
            fail(component + ": reference to unknown group '" + XsdNames.display(name) + "'", component);
            return null;
        }
        if (d.built != null) {
            return d.built;
        }
        if (d.resolving) {
            fail("circular reference to " + d.describe(), d.describe());
            return null;
        }
        d.resolving = true;
        try {
            return resolveGroup(d);
        } finally {
            d.resolving = false;
        }
    }

    private ElementDecl resolveElement(ElementDraft d) {
        if (d.built != null) {
            return d.built;
        }
        d.resolving = true;
        try {
            d.built = buildElement(d);
            return d.built;
        } finally {
            d.resolving = false;
        }
    }

    private ElementDecl buildElement(ElementDraft d) {
        ElementDecl.Builder b = ElementDecl.builder(d.name)
                .occurs(d.occurs)
                .nillable(d.nillable)
                .defaultValue(d.defaultValue)
                .fixedValue(d.fixedValue)
                .substitutionGroup(d.substitutionGroup)
                .isAbstract(d.isAbstract)
                .global(d.global);
        if (d.inlineSimpleType != null) {
            b.inlineType(resolveSimple(d.inlineSimpleType));
        } else if (d.inlineComplexType != null) {
            b.inlineType(resolveComplex(d.inlineComplexType));
        } else if (d.typeName != null) {
            if (isKnownType(d.typeName)) {
                b.typeName(d.typeName);
            } else {
                fail(d.describe() + ": unknown type '" + XsdNames.display(d.typeName) + "'", d.describe());
                b.typeName(XsdNames.ANY_TYPE);
            }
        } else if (d.substitutionGroup != null && elements.containsKey(d.substitutionGroup)) {
            ElementDraft head = elements.get(d.substitutionGroup);
            b.typeName(head.typeName);
            if (head.typeName == null && !head.resolving) {
                ElementDecl headDecl = resolveElement(head);
                b.inlineType(headDecl.inlineType());
            }
        }
        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            fail(new SchemaParseException(e.getMessage(), e, d.describe(), source));
            return ElementDecl.builder(d.name).occurs(d.occurs).global(d.global).build();
        }
    }

    private boolean isKnownType(QName name) {
        return simpleTypes.containsKey(name) || complexTypes.containsKey(name) || Builtins.isBuiltin(name);
    }

    private AttributeGroup resolveAttributeGroup(AttributeGroupDraft d) {
        if (d.built != null) {
            return d.built;
        }
        if (d.resolving) {
            fail("circular reference to " + d.describe(), d.describe());
            return AttributeGroup.EMPTY;
        }
        d.resolving = true;
        try {
            Map<QName, AttributeDecl> decls = new LinkedHashMap<>();
            AnyAttribute wildcard = null;
            for (QName ref : d.groupRefs) {
                AttributeGroupDraft referenced = attributeGroups.get(ref);
                if (referenced == null) {
                    fail("reference to unknown attributeGroup '" + XsdNames.display(ref) + "'", d.describe());
                    continue;
                }
                AttributeGroup group = resolveAttributeGroup(referenced);
                for (AttributeDecl decl : group.attributes().values()) {
                    addAttribute(decls, decl, d);
                }
                if (group.wildcard().isPresent()) {
                    wildcard = group.wildcard().get();
                }
            }
            for (AttributeDraft a : d.attributes) {
                AttributeDecl decl = resolveAttribute(a);
                if (decl != null) {
                    addAttribute(decls, decl, d);
                }
            }
            if (d.anyAttribute != null) {
                wildcard = d.anyAttribute;
            }
            d.built = decls.isEmpty() && wildcard == null && d.name == null
                    ? AttributeGroup.EMPTY
                    : new AttributeGroup(d.name, decls, wildcard);
            return d.built;
        } finally {
            d.resolving = false;
        }
    }

    private void addAttribute(Map<QName, AttributeDecl> decls, AttributeDecl decl, AttributeGroupDraft owner) {
        if (decls.putIfAbsent(decl.name(), decl) != null) {
            String component = owner.name != null ? owner.describe() : decl.describe();
            fail("duplicate " + decl.describe(), component);
        }
    }

    private AttributeDecl resolveAttribute(AttributeDraft d) {
        if (d.built != null) {
            return d.built;
        }
        try {
            if (d.ref != null) {
                AttributeDraft global = attributes.get(d.ref);
                if (global == null) {
                    fail("reference to unknown attribute '" + XsdNames.display(d.ref) + "'", d.describe());
                    return null;
                }
                AttributeDecl target = resolveAttribute(global);
                if (target == null) {
                    return null;
                }
                String fixed = d.fixedValue != null ? d.fixedValue : target.fixedValue();
                String dflt = d.defaultValue != null
                        ? d.defaultValue
                        : (fixed == null && d.use == AttributeUse.OPTIONAL ? target.defaultValue() : null);
                d.built = new AttributeDecl(target.name(), target.type(), d.use, dflt, fixed);
                return d.built;
            }
            SimpleType type = d.inlineType != null
                    ? resolveSimple(d.inlineType)
                    : d.typeName != null ? simpleTypeByName(d.typeName, d.describe()) : Builtins.anySimpleType();
            d.built = new AttributeDecl(d.name, type, d.use, d.defaultValue, d.fixedValue);
            return d.built;
        } catch (IllegalArgumentException e) {
            fail(new SchemaParseException(e.getMessage(), e, d.describe(), source));
            return null;
        }
    }

    // --- phase 3: check ---

    /**
     * Checks one complex type. A type reached again while its own check is still running (a
     * recursive content model) is answered "not yet known" and skipped; it is completed by the
     * outer call.
     */
    private void checkComplex(ComplexTypeDraft d) {
        if (d.checked == generation || d.built == null) {
            return;
        }
        if (d.checking) {
            return;
        }
        d.checking = true;
        try {
            ComplexType type = d.built;
            if (type.derivation() == Derivation.RESTRICTION && type.baseName() != null) {
                checkRestriction(d, type);
            }
            if (d.group != null) {
                checkGroup(d.group, d.group.built, 1, d.describe());
            }
            d.checked = generation;
        } finally {
            d.checking = false;
        }
    }

    private void checkRestriction(ComplexTypeDraft d, ComplexType type) {
        XsdType baseType = lookupBuilt(type.baseName());
        if (!(baseType instanceof ComplexType base) || base == Builtins.anyType()) {
            return;
        }
        ComplexTypeDraft baseDraft = complexTypes.get(type.baseName());
        if (baseDraft != null) {
            checkComplex(baseDraft);
        }
        if (type.hasSimpleContent()) {
            return;
        }
        ModelGroup restricting = type.group();
        ModelGroup restricted = base.group();
        if (restricting == null || restricting.isEmpty()) {
            if (restricted != null && !restricted.isEmptiable()) {
                fail(d.describe() + ": an empty restriction requires an emptiable base content", d.describe());
            }
            return;
        }
        if (restricted == null || restricted.isEmpty()) {
            fail(d.describe() + ": cannot restrict the empty content of the base type", d.describe());
            return;
        }
        if (restricting.compositor() != restricted.compositor() && restricting.particles().size() != 1) {
            fail(d.describe() + ": content model '" + restricting.compositor().name().toLowerCase(Locale.ROOT)
                    + "' is not a restriction of the base content model '"
                    + restricted.compositor().name().toLowerCase(Locale.ROOT) + "'", d.describe());
        }
        if (type.isMixed() && base.contentKind() != ContentKind.MIXED) {
            fail(d.describe() + ": a restriction of element-only content cannot be mixed", d.describe());
        }
    }

    private void checkGroup(ModelGroupDraft draft, ModelGroup group, int depth, String component) {
        if (group == null) {
            return;
        }
        if (depth > options.maxModelDepth()) {
            fail(component + ": model group nesting exceeds the limit of " + options.maxModelDepth(), component);
            return;
        }
        if (group.compositor() == ModelGroup.Compositor.ALL) {
            checkAllGroup(group, depth, component);
        }
        for (ParticleDraft p : draft.particles) {
            if (p instanceof ModelGroupDraft nested) {
                checkGroup(nested, nested.built, depth + 1, component);
            } else if (p instanceof GroupRefDraft ref) {
                ModelGroupDraft named = groups.get(ref.ref());
                if (named != null && named.checked != generation) {
                    named.checked = generation;
                    checkGroup(named, named.built, depth + 1, named.describe());
                }
            } else if (p instanceof ElementDraft e && e.ref == null) {
                checkElement(e);
            }
        }
    }

    private void checkAllGroup(ModelGroup group, int depth, String component) {
        if (options.version() == XsdVersion.V1_0) {
            if (group.occurs().max() == null || group.occurs().max() > 1) {
                fail(component + ": maxOccurs of an 'all' group must be 0 or 1", component);
            }
            if (depth > 1) {
                fail(component + ": an 'all' group must be the whole content model", component);
            }
        }
        for (Particle p : group.particles()) {
            if (p instanceof ModelGroup) {
                fail(component + ": an 'all' group can contain only element particles", component);
            } else if (p instanceof Wildcard && options.version() == XsdVersion.V1_0) {
                fail(component + ": an 'all' group can contain only element particles", component);
            } else if (options.version() == XsdVersion.V1_0
                    && (p.occurs().max() == null || p.occurs().max() > 1)) {
                fail(component + ": maxOccurs of an 'all' group member must be 0 or 1", component);
            }
        }
    }

    private void checkElement(ElementDraft d) {
        if (d.checked == generation || d.built == null) {
            return;
        }
        d.checked = generation;
        ElementDecl decl = d.built;
        if (d.inlineComplexType != null) {
            checkComplex(d.inlineComplexType);
        } else if (d.typeName != null && complexTypes.containsKey(d.typeName)) {
            checkComplex(complexTypes.get(d.typeName));
        }
        if (d.substitutionGroup != null) {
            if (!elements.containsKey(d.substitutionGroup)) {
                fail(d.describe() + ": unknown substitution group head '" + XsdNames.display(d.substitutionGroup) + "'",
                        d.describe());
            } else if (d.substitutionGroup.equals(d.name)) {
                fail(d.describe() + ": an element cannot be the head of its own substitution group", d.describe());
            }
        }
        String constraint = decl.valueConstraint();
        if (constraint == null) {
            return;
        }
        XsdType type = decl.inlineType() != null ? decl.inlineType() : lookupBuilt(decl.typeName());
        SimpleType textType = null;
        if (type instanceof SimpleType st) {
            textType = st;
        } else if (type instanceof ComplexType ct) {
            if (ct.hasSimpleContent()) {
                textType = ct.simpleContent();
            } else if (!ct.isMixed() || !ct.isEmptiable()) {
                fail(d.describe() + ": a value constraint requires simple or emptiable mixed content", d.describe());
                return;
            }
        }
        if (textType != null) {
            try {
                textType.parse(constraint);
            } catch (IllegalArgumentException e) {
                fail(d.describe() + ": invalid value constraint '" + constraint + "': " + e.getMessage(), d.describe());
            }
        }
    }

    private void checkAttribute(AttributeDraft d) {
        if (d.checked == generation || d.built == null) {
            return;
        }
        d.checked = generation;
        String constraint = d.built.valueConstraint();
        if (constraint != null) {
            try {
                d.built.type().parse(constraint);
            } catch (IllegalArgumentException e) {
                fail(d.describe() + ": invalid value constraint '" + constraint + "': " + e.getMessage(), d.describe());
            }
        }
    }

    private XsdType lookupBuilt(QName name) {
        if (name == null) {
            return Builtins.anyType();
        }
        SimpleTypeDraft simple = simpleTypes.get(name);
        if (simple != null) {
            return simple.built;
        }
        ComplexTypeDraft complex = complexTypes.get(name);
        if (complex != null) {
            return complex.built;
        }
        return Builtins.lookup(name).orElse(Builtins.anyType());
    }

    // --- failure handling ---

    private void fail(String message, String component) {
        fail(error(message, component));
    }

    private SchemaParseException error(String message, String component) {
        return new SchemaParseException(message, component, source);
    }

    private void fail(SchemaParseException e) {
        SchemaParseException located = e.source() == null && source != null
                ? new SchemaParseException(e.getMessage(), e.getCause(), e.component(), source)
                : e;
        switch (options.mode()) {
            case STRICT -> throw located;
            case LAX -> {
                errors.add(located);
                LOG.warn("Schema build error in {}, continuing with fallback: {}", located.component(), located.getMessage());
            }
            case SKIP -> LOG.debug("Ignoring schema build error in {}: {}", located.component(), located.getMessage());
        }
    }
}
