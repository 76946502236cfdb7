package io.xsdbind.core.schema;

import io.xsdbind.core.facet.FacetDecl;
import io.xsdbind.core.type.SimpleType;
import io.xsdbind.core.type.XsdNames;
import java.util.ArrayList;
import java.util.List;
import javax.xml.namespace.QName;

/** Declaration of a simple type by restriction, list or union. */
public final class SimpleTypeDraft extends Draft<SimpleType> {

    /** Derivation method of a simple type declaration. */
    public enum Method {
        RESTRICTION,
        LIST,
        UNION
    }

    final Method method;
    QName baseName;
    SimpleTypeDraft inlineBase;
    final List<FacetDecl> facets = new ArrayList<>();
    QName itemName;
    SimpleTypeDraft inlineItem;
    final List<QName> memberNames = new ArrayList<>();
    final List<SimpleTypeDraft> inlineMembers = new ArrayList<>();

    private SimpleTypeDraft(QName name, Method method) {
        super(name);
        this.method = method;
    }

    public static SimpleTypeDraft restriction(QName name, QName baseName) {
        SimpleTypeDraft d = new SimpleTypeDraft(name, Method.RESTRICTION);
        d.baseName = baseName;
        return d;
    }

    public static SimpleTypeDraft restriction(QName name, SimpleTypeDraft inlineBase) {
        SimpleTypeDraft d = new SimpleTypeDraft(name, Method.RESTRICTION);
        d.inlineBase = inlineBase;
        return d;
    }

    public static SimpleTypeDraft list(QName name, QName itemName) {
        SimpleTypeDraft d = new SimpleTypeDraft(name, Method.LIST);
        d.itemName = itemName;
        return d;
    }

    public static SimpleTypeDraft list(QName name, SimpleTypeDraft inlineItem) {
        SimpleTypeDraft d = new SimpleTypeDraft(name, Method.LIST);
        d.inlineItem = inlineItem;
        return d;
    }

    public static SimpleTypeDraft union(QName name, List<QName> memberNames, List<SimpleTypeDraft> inlineMembers) {
        SimpleTypeDraft d = new SimpleTypeDraft(name, Method.UNION);
        d.memberNames.addAll(memberNames);
        d.inlineMembers.addAll(inlineMembers);
        return d;
    }

    public SimpleTypeDraft facet(FacetDecl facet) {
        facets.add(facet);
        return this;
    }

    public SimpleTypeDraft facets(List<FacetDecl> all) {
        facets.addAll(all);
        return this;
    }

    public Method method() {
        return method;
    }

    @Override
    String describe() {
        return name != null ? "simpleType '" + XsdNames.display(name) + "'" : "anonymous simpleType";
    }
}
