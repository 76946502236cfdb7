package io.xsdbind.core.type;

import io.xsdbind.core.particle.ModelGroup;
import java.util.Objects;
import javax.xml.namespace.QName;

/**
 * A complex type. Content is empty, simple (a {@link SimpleType} for the text) or a
 * {@link ModelGroup}; attributes are held in an {@link AttributeGroup}. For an extension the
 * content and attributes already include those inherited from the base.
 *
 * <p>Immutable and thread-safe.
 */
public final class ComplexType implements XsdType {

    private final QName name;
    private final SimpleType simpleContent;
    private final ModelGroup group;
    private final AttributeGroup attributes;
    private final boolean mixed;
    private final Derivation derivation;
    private final QName baseName;
    private final boolean isAbstract;

    private ComplexType(Builder b) {
        this.name = b.name;
        this.simpleContent = b.simpleContent;
        this.group = b.group;
        this.attributes = b.attributes == null ? AttributeGroup.EMPTY : b.attributes;
        this.mixed = b.mixed;
        this.derivation = Objects.requireNonNull(b.derivation, "derivation must not be null");
        this.baseName = b.baseName;
        this.isAbstract = b.isAbstract;
        if (simpleContent != null && group != null) {
            throw new IllegalArgumentException(describe() + ": simple content cannot have element particles");
        }
        if (simpleContent != null && mixed) {
            throw new IllegalArgumentException(describe() + ": simple content cannot be mixed");
        }
    }

    public static Builder builder(QName name) {
        return new Builder(name);
    }

    @Override
    public QName name() {
        return name;
    }

    @Override
    public boolean isSimple() {
        return false;
    }

    /** Text type for simple content, or {@code null}. */
    public SimpleType simpleContent() {
        return simpleContent;
    }

    /** Content model for complex content, or {@code null}. */
    public ModelGroup group() {
        return group;
    }

    public AttributeGroup attributes() {
        return attributes;
    }

    public boolean isMixed() {
        return mixed;
    }

    public Derivation derivation() {
        return derivation;
    }

    /** Name of the base type, or {@code null} when not derived. */
    public QName baseName() {
        return baseName;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public ContentKind contentKind() {
        if (simpleContent != null) {
            return ContentKind.SIMPLE;
        }
        if (mixed) {
            return ContentKind.MIXED;
        }
        if (group == null || group.isEmpty()) {
            return ContentKind.EMPTY;
        }
        return ContentKind.ELEMENT_ONLY;
    }

    public boolean hasSimpleContent() {
        return simpleContent != null;
    }

    /** Returns {@code true} if the content model has element particles or wildcards. */
    public boolean hasElementContent() {
        return group != null && !group.isEmpty();
    }

    /** Returns {@code true} if an element of this type may be empty. */
    public boolean isEmptiable() {
        return group == null || group.isEmptiable();
    }

    @Override
    public String describe() {
        return name != null ? "complexType '" + XsdNames.display(name) + "'" : "anonymous complexType";
    }

    @Override
    public String toString() {
        return describe();
    }

    /** Builder for {@link ComplexType}. */
    public static final class Builder {

        private final QName name;
        private SimpleType simpleContent;
        private ModelGroup group;
        private AttributeGroup attributes;
        private boolean mixed;
        private Derivation derivation = Derivation.NONE;
        private QName baseName;
        private boolean isAbstract;

        private Builder(QName name) {
            this.name = name;
        }

        public Builder simpleContent(SimpleType simpleContent) {
            this.simpleContent = simpleContent;
            return this;
        }

        public Builder group(ModelGroup group) {
            this.group = group;
            return this;
        }

        public Builder attributes(AttributeGroup attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder mixed(boolean mixed) {
            this.mixed = mixed;
            return this;
        }

        public Builder derivation(Derivation derivation, QName baseName) {
            this.derivation = derivation;
            this.baseName = baseName;
            return this;
        }

        public Builder isAbstract(boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        public ComplexType build() {
            return new ComplexType(this);
        }
    }
}
