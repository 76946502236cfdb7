package io.xsdbind.core.type;

import javax.xml.namespace.QName;

/** A simple or complex type. */
public sealed interface XsdType permits SimpleType, ComplexType {

    /** Qualified name, or {@code null} for an anonymous type. */
    QName name();

    /** Short description for error messages, e.g. {@code simpleType 'xs:int'}. */
    String describe();

    boolean isSimple();

    default boolean isComplex() {
        return !isSimple();
    }
}
