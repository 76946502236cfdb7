package io.xsdbind.core.type;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.xml.namespace.QName;

/** Attribute declarations of a complex type, plus at most one attribute wildcard. Immutable. */
public final class AttributeGroup {

    public static final AttributeGroup EMPTY = new AttributeGroup(null, Map.of(), null);

    private final QName name;
    private final Map<QName, AttributeDecl> attributes;
    private final AnyAttribute wildcard;

    public AttributeGroup(QName name, Map<QName, AttributeDecl> attributes, AnyAttribute wildcard) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.wildcard = wildcard;
    }

    public static AttributeGroup of(Collection<AttributeDecl> decls, AnyAttribute wildcard) {
        Map<QName, AttributeDecl> map = new LinkedHashMap<>();
        for (AttributeDecl d : decls) {
            if (map.put(d.name(), d) != null) {
                throw new IllegalArgumentException("duplicate attribute '" + d.name().getLocalPart() + "'");
            }
        }
        return new AttributeGroup(null, map, wildcard);
    }

    /** Group name, or {@code null} for the attribute group of a type. */
    public QName name() {
        return name;
    }

    public Map<QName, AttributeDecl> attributes() {
        return attributes;
    }

    public Optional<AttributeDecl> get(QName attrName) {
        return Optional.ofNullable(attributes.get(attrName));
    }

    public Optional<AnyAttribute> wildcard() {
        return Optional.ofNullable(wildcard);
    }

    public boolean isEmpty() {
        return attributes.isEmpty() && wildcard == null;
    }

    public List<AttributeDecl> required() {
        List<AttributeDecl> out = new ArrayList<>();
        for (AttributeDecl d : attributes.values()) {
            if (d.isRequired()) {
                out.add(d);
            }
        }
        return out;
    }

    /**
     * Union used by extension: declarations of {@code other} are added after this group's own.
     * When both carry a wildcard the one of {@code other} wins.
     */
    public AttributeGroup union(AttributeGroup other) {
        Map<QName, AttributeDecl> merged = new LinkedHashMap<>(attributes);
        merged.putAll(other.attributes);
        return new AttributeGroup(name, merged, other.wildcard != null ? other.wildcard : wildcard);
    }

    /**
     * Restriction: declarations of {@code derived} override this group's, inherited ones are
     * kept, the derived wildcard replaces the inherited one.
     */
    public AttributeGroup restrict(AttributeGroup derived) {
        Map<QName, AttributeDecl> merged = new LinkedHashMap<>(attributes);
        merged.putAll(derived.attributes);
        return new AttributeGroup(name, merged, derived.wildcard);
    }

    /** Returns a copy with another name. */
    public AttributeGroup named(QName newName) {
        return new AttributeGroup(newName, attributes, wildcard);
    }
}
