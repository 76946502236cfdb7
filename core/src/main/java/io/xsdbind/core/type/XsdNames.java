package io.xsdbind.core.type;

import javax.xml.namespace.QName;

/** Well-known namespaces and names. */
public final class XsdNames {

    public static final String XSD_NAMESPACE = "http://www.w3.org/2001/XMLSchema";
    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    public static final QName XSI_NIL = new QName(XSI_NAMESPACE, "nil");
    public static final QName ANY_TYPE = xsd("anyType");
    public static final QName ANY_SIMPLE_TYPE = xsd("anySimpleType");

    private XsdNames() {}

    public static QName xsd(String localName) {
        return new QName(XSD_NAMESPACE, localName);
    }

    /** Short display form: {@code xs:} prefix for schema builtins, the local part otherwise. */
    public static String display(QName name) {
        if (name == null) {
            return "<anonymous>";
        }
        if (XSD_NAMESPACE.equals(name.getNamespaceURI())) {
            return "xs:" + name.getLocalPart();
        }
        if (!name.getPrefix().isEmpty()) {
            return name.getPrefix() + ":" + name.getLocalPart();
        }
        return name.getLocalPart();
    }
}
