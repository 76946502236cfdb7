package io.xsdbind.core.particle;

import io.xsdbind.core.type.XsdNames;
import io.xsdbind.core.type.XsdType;
import java.util.Objects;
import javax.xml.namespace.QName;

/**
 * An element declaration, either global or local to a content model. A reference particle
 * ({@link #isRef()}) carries only the referenced name and its own occurrence bounds; everything
 * else is looked up in the schema. The declared type is held inline for anonymous types and by
 * name otherwise, so cyclic content models stay representable with immutable objects.
 */
public final class ElementDecl implements Particle {

    private final QName name;
    private final Occurs occurs;
    private final QName typeName;
    private final XsdType inlineType;
    private final boolean ref;
    private final boolean nillable;
    private final String defaultValue;
    private final String fixedValue;
    private final QName substitutionGroup;
    private final boolean isAbstract;
    private final boolean global;

    private ElementDecl(Builder b) {
        this.name = Objects.requireNonNull(b.name, "element name must not be null");
        this.occurs = b.occurs;
        this.typeName = b.typeName;
        this.inlineType = b.inlineType;
        this.ref = b.ref;
        this.nillable = b.nillable;
        this.defaultValue = b.defaultValue;
        this.fixedValue = b.fixedValue;
        this.substitutionGroup = b.substitutionGroup;
        this.isAbstract = b.isAbstract;
        this.global = b.global;
        if (defaultValue != null && fixedValue != null) {
            throw new IllegalArgumentException(describe() + ": 'default' and 'fixed' are mutually exclusive");
        }
        if (typeName != null && inlineType != null) {
            throw new IllegalArgumentException(describe() + ": a type name and an inline type are mutually exclusive");
        }
    }

    public static Builder builder(QName name) {
        return new Builder(name);
    }

    /** A reference particle to the global element {@code target}. */
    public static ElementDecl reference(QName target, Occurs occurs) {
        Builder b = new Builder(target).occurs(occurs);
        b.ref = true;
        return b.build();
    }

    public QName name() {
        return name;
    }

    @Override
    public Occurs occurs() {
        return occurs;
    }

    /** Name of the declared type, or {@code null} for an inline type or no type. */
    public QName typeName() {
        return typeName;
    }

    /** Anonymous type declared inline, or {@code null}. */
    public XsdType inlineType() {
        return inlineType;
    }

    public boolean isRef() {
        return ref;
    }

    public boolean isNillable() {
        return nillable;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public String fixedValue() {
        return fixedValue;
    }

    /** Default or fixed value, whichever is set. */
    public String valueConstraint() {
        return fixedValue != null ? fixedValue : defaultValue;
    }

    public QName substitutionGroup() {
        return substitutionGroup;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public boolean isGlobal() {
        return global;
    }

    @Override
    public boolean isEmptiable() {
        return occurs.isOptional();
    }

    /** Returns a copy with other occurrence bounds, as used for global declarations placed in a group. */
    public ElementDecl withOccurs(Occurs newOccurs) {
        if (newOccurs.equals(occurs)) {
            return this;
        }
        return toBuilder().occurs(newOccurs).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(name)
                .occurs(occurs)
                .typeName(typeName)
                .inlineType(inlineType)
                .nillable(nillable)
                .defaultValue(defaultValue)
                .fixedValue(fixedValue)
                .substitutionGroup(substitutionGroup)
                .isAbstract(isAbstract)
                .global(global);
        b.ref = ref;
        return b;
    }

    public String describe() {
        return "element '" + XsdNames.display(name) + "'";
    }

    @Override
    public String toString() {
        return (ref ? "ref " : "") + describe() + occurs;
    }

    /** Builder for {@link ElementDecl}. */
    public static final class Builder {

        private final QName name;
        private Occurs occurs = Occurs.ONCE;
        private QName typeName;
        private XsdType inlineType;
        private boolean ref;
        private boolean nillable;
        private String defaultValue;
        private String fixedValue;
        private QName substitutionGroup;
        private boolean isAbstract;
        private boolean global;

        private Builder(QName name) {
            this.name = name;
        }

        public Builder occurs(Occurs occurs) {
            this.occurs = Objects.requireNonNull(occurs, "occurs must not be null");
            return this;
        }

        public Builder typeName(QName typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder inlineType(XsdType inlineType) {
            this.inlineType = inlineType;
            return this;
        }

        public Builder nillable(boolean nillable) {
            this.nillable = nillable;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder fixedValue(String fixedValue) {
            this.fixedValue = fixedValue;
            return this;
        }

        public Builder substitutionGroup(QName substitutionGroup) {
            this.substitutionGroup = substitutionGroup;
            return this;
        }

        public Builder isAbstract(boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        public Builder global(boolean global) {
            this.global = global;
            return this;
        }

        public ElementDecl build() {
            return new ElementDecl(this);
        }
    }
}
