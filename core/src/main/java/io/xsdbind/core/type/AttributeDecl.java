package io.xsdbind.core.type;

import java.util.Objects;
import javax.xml.namespace.QName;

/**
 * An attribute declaration with its resolved simple type.
 *
 * @param name         qualified name
 * @param type         the attribute's type
 * @param use          optional, required or prohibited
 * @param defaultValue default value, or {@code null}
 * @param fixedValue   fixed value, or {@code null}
 */
public record AttributeDecl(QName name, SimpleType type, AttributeUse use, String defaultValue, String fixedValue) {

    public AttributeDecl {
        Objects.requireNonNull(name, "attribute name must not be null");
        Objects.requireNonNull(type, "type of attribute '" + name.getLocalPart() + "' must not be null");
        use = use == null ? AttributeUse.OPTIONAL : use;
        if (defaultValue != null && fixedValue != null) {
            throw new IllegalArgumentException(
                    "attribute '" + name.getLocalPart() + "': 'default' and 'fixed' are mutually exclusive");
        }
        if (defaultValue != null && use != AttributeUse.OPTIONAL) {
            throw new IllegalArgumentException(
                    "attribute '" + name.getLocalPart() + "': 'default' requires use 'optional'");
        }
    }

    public static AttributeDecl optional(QName name, SimpleType type) {
        return new AttributeDecl(name, type, AttributeUse.OPTIONAL, null, null);
    }

    public boolean isRequired() {
        return use == AttributeUse.REQUIRED;
    }

    public boolean isProhibited() {
        return use == AttributeUse.PROHIBITED;
    }

    public String valueConstraint() {
        return fixedValue != null ? fixedValue : defaultValue;
    }

    public AttributeDecl withUse(AttributeUse newUse) {
        return new AttributeDecl(name, type, newUse, newUse == AttributeUse.OPTIONAL ? defaultValue : null, fixedValue);
    }

    public String describe() {
        return "attribute '" + XsdNames.display(name) + "'";
    }
}
