package io.xsdbind.core.schema;

import io.xsdbind.core.particle.ElementDecl;
import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.type.XsdNames;
import javax.xml.namespace.QName;

/** An element declaration, global or local, or a reference to a global element. */
public final class ElementDraft extends Draft<ElementDecl> implements ParticleDraft {

    QName ref;
    Occurs occurs = Occurs.ONCE;
    QName typeName;
    SimpleTypeDraft inlineSimpleType;
    ComplexTypeDraft inlineComplexType;
    boolean nillable;
    String defaultValue;
    String fixedValue;
    QName substitutionGroup;
    boolean isAbstract;
    boolean global;

    private ElementDraft(QName name) {
        super(name);
    }

    public static ElementDraft global(QName name) {
        ElementDraft d = new ElementDraft(name);
        d.global = true;
        return d;
    }

    public static ElementDraft local(QName name) {
        return new ElementDraft(name);
    }

    public static ElementDraft reference(QName ref) {
        ElementDraft d = new ElementDraft(ref);
        d.ref = ref;
        return d;
    }

    public ElementDraft occurs(Occurs occurs) {
        this.occurs = occurs;
        return this;
    }

    public ElementDraft typeName(QName typeName) {
        this.typeName = typeName;
        return this;
    }

    public ElementDraft inlineType(SimpleTypeDraft type) {
        this.inlineSimpleType = type;
        return this;
    }

    public ElementDraft inlineType(ComplexTypeDraft type) {
        this.inlineComplexType = type;
        return this;
    }

    public ElementDraft nillable(boolean nillable) {
        this.nillable = nillable;
        return this;
    }

    public ElementDraft defaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public ElementDraft fixedValue(String fixedValue) {
        this.fixedValue = fixedValue;
        return this;
    }

    public ElementDraft substitutionGroup(QName head) {
        this.substitutionGroup = head;
        return this;
    }

    public ElementDraft isAbstract(boolean isAbstract) {
        this.isAbstract = isAbstract;
        return this;
    }

    @Override
    public Occurs occurs() {
        return occurs;
    }

    @Override
    String describe() {
        return "element '" + XsdNames.display(name) + "'";
    }
}
