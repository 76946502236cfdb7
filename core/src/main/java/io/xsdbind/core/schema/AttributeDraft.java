package io.xsdbind.core.schema;

import io.xsdbind.core.type.AttributeDecl;
import io.xsdbind.core.type.AttributeUse;
import io.xsdbind.core.type.XsdNames;
import javax.xml.namespace.QName;

/** Declaration of an attribute, global or local, or a reference to a global attribute. */
public final class AttributeDraft extends Draft<AttributeDecl> {

    QName ref;
    QName typeName;
    SimpleTypeDraft inlineType;
    AttributeUse use = AttributeUse.OPTIONAL;
    String defaultValue;
    String fixedValue;

    private AttributeDraft(QName name) {
        super(name);
    }

    public static AttributeDraft named(QName name) {
        return new AttributeDraft(name);
    }

    public static AttributeDraft reference(QName ref) {
        AttributeDraft d = new AttributeDraft(ref);
        d.ref = ref;
        return d;
    }

    public AttributeDraft typeName(QName typeName) {
        this.typeName = typeName;
        return this;
    }

    public AttributeDraft inlineType(SimpleTypeDraft inlineType) {
        this.inlineType = inlineType;
        return this;
    }

    public AttributeDraft use(AttributeUse use) {
        this.use = use;
        return this;
    }

    public AttributeDraft defaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public AttributeDraft fixedValue(String fixedValue) {
        this.fixedValue = fixedValue;
        return this;
    }

    @Override
    String describe() {
        return "attribute '" + XsdNames.display(name) + "'";
    }
}
