package io.xsdbind.core.schema;

import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.type.ComplexType;
import io.xsdbind.core.type.Derivation;
import io.xsdbind.core.type.XsdNames;
import java.util.ArrayList;
import java.util.List;
import javax.xml.namespace.QName;

/**
 * Declaration of a complex type: plain, or derived from a base by extension or restriction with
 * simple or complex content.
 */
public final class ComplexTypeDraft extends Draft<ComplexType> {

    /** Where the content comes from. */
    public enum ContentMode {
        /** Content model (or nothing) declared directly on the type. */
        DIRECT,
        SIMPLE_CONTENT,
        COMPLEX_CONTENT
    }

    ContentMode contentMode = ContentMode.DIRECT;
    Derivation derivation = Derivation.NONE;
    QName baseName;
    ModelGroupDraft group;
    final AttributeGroupDraft attributes;
    final List<FacetDecl> facets = new ArrayList<>();
    boolean mixed;
    boolean isAbstract;

    public ComplexTypeDraft(QName name) {
        super(name);
        this.attributes = new AttributeGroupDraft(null);
    }

    public ComplexTypeDraft simpleContent(Derivation derivation, QName baseName) {
        this.contentMode = ContentMode.SIMPLE_CONTENT;
        this.derivation = derivation;
        this.baseName = baseName;
        return this;
    }

    public ComplexTypeDraft complexContent(Derivation derivation, QName baseName) {
        this.contentMode = ContentMode.COMPLEX_CONTENT;
        this.derivation = derivation;
        this.baseName = baseName;
        return this;
    }

    public ComplexTypeDraft group(ModelGroupDraft group) {
        this.group = group;
        return this;
    }

    /** The attribute part of this type, to add attributes, group references or a wildcard. */
    public AttributeGroupDraft attributes() {
        return attributes;
    }

    /** Facets of a simple content restriction. */
    public ComplexTypeDraft facet(FacetDecl facet) {
        facets.add(facet);
        return this;
    }

    public ComplexTypeDraft mixed(boolean mixed) {
        this.mixed = mixed;
        return this;
    }

    public ComplexTypeDraft isAbstract(boolean isAbstract) {
        this.isAbstract = isAbstract;
        return this;
    }

    @Override
    String describe() {
        return name != null ? "complexType '" + XsdNames.display(name) + "'" : "anonymous complexType";
    }
}
