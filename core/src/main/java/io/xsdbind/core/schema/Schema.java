package io.xsdbind.core.schema;

import io.xsdbind.core.error.SchemaBuildException;
import io.xsdbind.core.model.XsdVersion;
import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.type.AttributeDecl;
import io.xsdbind.core.type.AttributeGroup;
import io.xsdbind.core.type.Builtins;
import io.xsdbind.core.type.XsdNames;
import io.xsdbind.core.type.XsdType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.xml.namespace.QName;

/**
 * A built schema: the name-keyed arena of global components. Cross references between components
 * (element types, element references, substitution groups) are resolved by lookup here.
 *
 * <p>Immutable after {@link SchemaBuilder#build()} and safe to share across threads. Derived
 * lookups are memoized in caches populated under a lock.
 */
public final class Schema {

    private final String targetNamespace;
    private final XsdVersion version;
    private final String source;
    private final Map<QName, XsdType> types;
    private final Map<QName, ElementDecl> elements;
    private final Map<QName, ModelGroup> groups;
    private final Map<QName, AttributeGroup> attributeGroups;
    private final Map<QName, AttributeDecl> attributes;
    private final Map<QName, List<ElementDecl>> substitutionMembers;
    private final List<SchemaBuildException> buildErrors;
    private final MemoCache<QName, List<ElementDecl>> substitutes;

    Schema(
            String targetNamespace,
            XsdVersion version,
            String source,
            Map<QName, XsdType> types,
            Map<QName, ElementDecl> elements,
            Map<QName, ModelGroup> groups,
            Map<QName, AttributeGroup> attributeGroups,
            Map<QName, AttributeDecl> attributes,
            List<SchemaBuildException> buildErrors) {
        this.targetNamespace = targetNamespace == null ? "" : targetNamespace;
        this.version = version;
        this.source = source;
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        this.attributeGroups = Collections.unmodifiableMap(new LinkedHashMap<>(attributeGroups));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.buildErrors = List.copyOf(buildErrors);
        Map<QName, List<ElementDecl>> members = new LinkedHashMap<>();
        for (ElementDecl e : this.elements.values()) {
            if (e.substitutionGroup() != null) {
                members.computeIfAbsent(e.substitutionGroup(), k -> new ArrayList<>()).add(e);
            }
        }
        members.replaceAll((k, v) -> List.copyOf(v));
        this.substitutionMembers = Collections.unmodifiableMap(members);
        this.substitutes = new MemoCache<>(this::collectSubstitutes);
    }

    public String targetNamespace() {
        return targetNamespace;
    }

    public XsdVersion version() {
        return version;
    }

    /** Document the schema was read from, or {@code null} for a programmatic build. */
    public String source() {
        return source;
    }

    /** Errors collected by a lax build; empty for strict and skip builds. */
    public List<SchemaBuildException> buildErrors() {
        return buildErrors;
    }

    /** User-declared global types, builtins excluded. */
    public Map<QName, XsdType> types() {
        return types;
    }

    public Map<QName, ElementDecl> elements() {
        return elements;
    }

    public Map<QName, ModelGroup> groups() {
        return groups;
    }

    public Map<QName, AttributeGroup> attributeGroups() {
        return attributeGroups;
    }

    public Map<QName, AttributeDecl> attributes() {
        return attributes;
    }

    /** Looks a type up among the user types, then among the builtins. */
    public Optional<XsdType> type(QName name) {
        XsdType t = types.get(name);
        return t != null ? Optional.of(t) : Builtins.lookup(name);
    }

    /**
     * @throws IllegalArgumentException if no such type exists
     */
    public XsdType requireType(QName name) {
        return type(name).orElseThrow(() -> new IllegalArgumentException("unknown type '" + XsdNames.display(name) + "'"));
    }

    public Optional<ElementDecl> element(QName name) {
        return Optional.ofNullable(elements.get(name));
    }

    /**
     * @throws IllegalArgumentException if no such global element exists
     */
    public ElementDecl requireElement(QName name) {
        ElementDecl e = elements.get(name);
        if (e == null) {
            throw new IllegalArgumentException("unknown element '" + XsdNames.display(name) + "'");
        }
        return e;
    }

    /**
     * Returns the effective declaration of a particle: the referenced global element (with the
     * particle's occurrence bounds) for a reference, the particle itself otherwise.
     */
    public ElementDecl resolve(ElementDecl particle) {
        if (!particle.isRef()) {
            return particle;
        }
        ElementDecl global = elements.get(particle.name());
        return global == null ? particle : global.withOccurs(particle.occurs());
    }

    /** The type of an element: its inline type, its named type, or {@code anyType}. */
    public XsdType typeOf(ElementDecl particle) {
        ElementDecl decl = resolve(particle);
        if (decl.inlineType() != null) {
            return decl.inlineType();
        }
        if (decl.typeName() != null) {
            return type(decl.typeName()).orElse(Builtins.anyType());
        }
        return Builtins.anyType();
    }

    /**
     * Global elements that may substitute for {@code head}, transitively, in declaration order.
     * Abstract members are included; the head itself is not.
     */
    public List<ElementDecl> substitutes(QName head) {
        return substitutes.get(head);
    }

    private List<ElementDecl> collectSubstitutes(QName head) {
        Set<ElementDecl> out = new LinkedHashSet<>();
        Deque<QName> pending = new ArrayDeque<>();
        pending.add(head);
        Set<QName> seen = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            QName current = pending.poll();
            if (!seen.add(current)) {
                continue;
            }
            for (ElementDecl member : substitutionMembers.getOrDefault(current, List.of())) {
                out.add(member);
                pending.add(member.name());
            }
        }
        return List.copyOf(out);
    }

    @Override
    public String toString() {
        return "Schema[targetNamespace=" + targetNamespace + ", types=" + types.size() + ", elements="
                + elements.size() + ", groups=" + groups.size() + "]";
    }
}
