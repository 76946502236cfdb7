package io.xsdbind.core.schema;

import io.xsdbind.core.type.AnyAttribute;
import io.xsdbind.core.type.AttributeGroup;
import io.xsdbind.core.type.XsdNames;
import java.util.ArrayList;
import java.util.List;
import javax.xml.namespace.QName;

/**
 * Attribute declarations, attribute group references and an optional wildcard. Used both for named
 * attribute groups and for the attribute part of a complex type.
 */
public final class AttributeGroupDraft extends Draft<AttributeGroup> {

    final List<AttributeDraft> attributes = new ArrayList<>();
    final List<QName> groupRefs = new ArrayList<>();
    AnyAttribute anyAttribute;

    public AttributeGroupDraft(QName name) {
        super(name);
    }

    public AttributeGroupDraft attribute(AttributeDraft attribute) {
        attributes.add(attribute);
        return this;
    }

    public AttributeGroupDraft groupRef(QName ref) {
        groupRefs.add(ref);
        return this;
    }

    public AttributeGroupDraft anyAttribute(AnyAttribute wildcard) {
        this.anyAttribute = wildcard;
        return this;
    }

    boolean isEmpty() {
        return attributes.isEmpty() && groupRefs.isEmpty() && anyAttribute == null;
    }

    @Override
    String describe() {
        return "attributeGroup '" + XsdNames.display(name) + "'";
    }
}
