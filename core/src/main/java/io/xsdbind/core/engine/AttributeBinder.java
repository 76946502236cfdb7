package io.xsdbind.core.engine;

import io.xsdbind.core.facet.ValueOrder;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.particle.ProcessContents;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.type.AnyAttribute;
import io.xsdbind.core.type.AttributeDecl;
import io.xsdbind.core.type.AttributeGroup;
import io.xsdbind.core.type.Builtins;
import io.xsdbind.core.type.SimpleType;
import io.xsdbind.core.type.XsdNames;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.xml.namespace.QName;

/** Checks and converts the attributes of one element against its attribute group. */
final class AttributeBinder {

    private final Schema schema;
    private final boolean checks;
    private final boolean fillDefaults;

    AttributeBinder(Schema schema, boolean checks, boolean fillDefaults) {
        this.schema = schema;
        this.checks = checks;
        this.fillDefaults = fillDefaults;
    }

    /**
     * Decodes attribute text into native values. {@code xsi:} attributes are left out.
     *
     * @param errors receives every error found, located at the attribute's path
     * @return decoded values in document order, followed by filled-in defaults
     */
    Map<QName, Object> decode(
            AttributeGroup group, Map<QName, String> raw, String path, String component, List<ValidationError> errors) {
        Map<QName, Object> out = new LinkedHashMap<>();
        for (Map.Entry<QName, String> e : raw.entrySet()) {
            QName name = e.getKey();
            if (XsdNames.XSI_NAMESPACE.equals(name.getNamespaceURI())) {
                continue;
            }
            String attrPath = InstancePaths.attribute(path, name);
            AttributeDecl decl = group.attributes().get(name);
            if (decl != null && decl.isProhibited()) {
                if (checks) {
                    errors.add(ValidationError.validation(
                            "attribute '" + XsdNames.display(name) + "' is prohibited", component, attrPath, e.getValue()));
                }
                continue;
            }
            if (decl == null) {
                decl = wildcardDecl(group, name);
                if (decl == null) {
                    if (!admittedBySkipWildcard(group, name)) {
                        if (checks) {
                            errors.add(ValidationError.validation(
                                    "attribute '" + XsdNames.display(name) + "' not allowed for element",
                                    component,
                                    attrPath,
                                    e.getValue()));
                        }
                    }
                    out.put(name, e.getValue());
                    continue;
                }
            }
            out.put(name, decodeValue(decl, e.getValue(), attrPath, errors));
        }
        List<AttributeDecl> missing = new ArrayList<>();
        for (AttributeDecl decl : group.attributes().values()) {
            if (raw.containsKey(decl.name()) || decl.isProhibited()) {
                continue;
            }
            if (decl.isRequired()) {
                missing.add(decl);
            } else if (fillDefaults && decl.valueConstraint() != null) {
                out.put(decl.name(), decodeValue(decl, decl.valueConstraint(), InstancePaths.attribute(path, decl.name()), errors));
            }
        }
        if (checks && !missing.isEmpty()) {
            String names = missing.stream()
                    .map(d -> "'" + XsdNames.display(d.name()) + "'")
                    .collect(Collectors.joining(", "));
            errors.add(ValidationError.validation(
                    (missing.size() == 1 ? "missing required attribute " : "missing required attributes ") + names,
                    component,
                    path,
                    raw));
        }
        return out;
    }

    /**
     * Encodes native attribute values to text. Names not found as given are matched by local
     * part; {@code xsi:} attributes are copied as they are.
     */
    Map<QName, String> encode(
            AttributeGroup group, Map<QName, Object> values, String path, String component, List<ValidationError> errors) {
        Map<QName, String> out = new LinkedHashMap<>();
        for (Map.Entry<QName, Object> e : values.entrySet()) {
            QName name = e.getKey();
            if (XsdNames.XSI_NAMESPACE.equals(name.getNamespaceURI())) {
                out.put(name, String.valueOf(e.getValue()));
                continue;
            }
            AttributeDecl decl = group.attributes().get(name);
            if (decl == null) {
                decl = byLocalPart(group, name);
            }
            if (decl != null) {
                name = decl.name();
            }
            String attrPath = InstancePaths.attribute(path, name);
            if (decl != null && decl.isProhibited()) {
                if (checks) {
                    errors.add(ValidationError.validation(
                            "attribute '" + XsdNames.display(name) + "' is prohibited", component, attrPath, e.getValue()));
                }
                continue;
            }
            if (decl == null) {
                decl = wildcardDecl(group, name);
            }
            if (decl == null) {
                if (checks && !admittedBySkipWildcard(group, name)) {
                    errors.add(ValidationError.encode(
                            "unexpected attribute '" + XsdNames.display(name) + "'", component, attrPath, e.getValue()));
                }
                out.put(name, String.valueOf(e.getValue()));
                continue;
            }
            out.put(name, encodeValue(decl.type(), e.getValue(), attrPath, decl.describe(), errors));
        }
        if (checks) {
            List<String> missing = new ArrayList<>();
            for (AttributeDecl decl : group.required()) {
                if (!out.containsKey(decl.name())) {
                    missing.add("'" + XsdNames.display(decl.name()) + "'");
                }
            }
            if (!missing.isEmpty()) {
                errors.add(ValidationError.validation(
                        (missing.size() == 1 ? "missing required attribute " : "missing required attributes ")
                                + String.join(", ", missing),
                        component,
                        path,
                        values));
            }
        }
        return out;
    }

    private Object decodeValue(AttributeDecl decl, String text, String attrPath, List<ValidationError> errors) {
        List<Result<Object>> steps = decl.type().decode(text, checks);
        Object value = null;
        for (Result<Object> step : steps) {
            if (step instanceof Result.Error<Object> err) {
                errors.add(err.error().at(attrPath).withComponent(decl.describe()));
            } else {
                value = ((Result.Value<Object>) step).value();
            }
        }
        if (checks && decl.fixedValue() != null && !sameAsConstraint(decl.type(), decl.fixedValue(), value)) {
            errors.add(ValidationError.validation(
                    "value doesn't match the fixed value '" + decl.fixedValue() + "'", decl.describe(), attrPath, text));
        }
        return value;
    }

    String encodeValue(SimpleType type, Object value, String path, String component, List<ValidationError> errors) {
        String text = "";
        for (Result<String> step : type.encode(value, checks)) {
            if (step instanceof Result.Error<String> err) {
                errors.add(err.error().at(path).withComponent(component));
            } else {
                text = ((Result.Value<String>) step).value();
            }
        }
        return text;
    }

    /** Compares a decoded value with the value of a default/fixed literal. */
    static boolean sameAsConstraint(SimpleType type, String literal, Object value) {
        Object expected;
        try {
            expected = type.parse(literal);
        } catch (IllegalArgumentException e) {
            return literal.equals(String.valueOf(value));
        }
        return ValueOrder.sameValue(expected, value);
    }

    /** A declaration for an attribute admitted by the wildcard with lax or strict processing. */
    private AttributeDecl wildcardDecl(AttributeGroup group, QName name) {
        AnyAttribute any = group.wildcard().orElse(null);
        if (any == null || !any.allows(name.getNamespaceURI()) || any.processContents() == ProcessContents.SKIP) {
            return null;
        }
        AttributeDecl global = schema.attributes().get(name);
        if (global == null && any.processContents() == ProcessContents.LAX) {
            return AttributeDecl.optional(name, Builtins.anySimpleType());
        }
        return global;
    }

    private static boolean admittedBySkipWildcard(AttributeGroup group, QName name) {
        return group.wildcard()
                .map(any -> any.allows(name.getNamespaceURI()) && any.processContents() == ProcessContents.SKIP)
                .orElse(false);
    }

    private static AttributeDecl byLocalPart(AttributeGroup group, QName name) {
        if (!name.getNamespaceURI().isEmpty()) {
            return null;
        }
        for (AttributeDecl decl : group.attributes().values()) {
            if (decl.name().getLocalPart().equals(name.getLocalPart())) {
                return decl;
            }
        }
        return null;
    }
}
