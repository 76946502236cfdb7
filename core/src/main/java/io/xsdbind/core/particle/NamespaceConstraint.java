package io.xsdbind.core.particle;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The namespace part of a wildcard.
 *
 * @param mode            constraint mode
 * @param namespaces      admitted namespaces for {@link Mode#ENUMERATED}; {@code ""} stands for
 *                        no namespace
 * @param targetNamespace the schema's target namespace, excluded by {@link Mode#OTHER}
 */
public record NamespaceConstraint(Mode mode, Set<String> namespaces, String targetNamespace) {

    /** Constraint modes. */
    public enum Mode {
        /** {@code ##any}. */
        ANY,
        /** {@code ##other}: any namespace except the target namespace and no-namespace. */
        OTHER,
        /** An explicit list, possibly with {@code ##targetNamespace} and {@code ##local}. */
        ENUMERATED
    }

    public NamespaceConstraint {
        namespaces = namespaces == null ? Set.of() : Set.copyOf(namespaces);
        targetNamespace = targetNamespace == null ? "" : targetNamespace;
    }

    public static NamespaceConstraint any() {
        return new NamespaceConstraint(Mode.ANY, Set.of(), "");
    }

    /**
     * Parses a {@code namespace} attribute value.
     *
     * @param value           "##any", "##other" or a whitespace-separated list of URIs,
     *                        "##targetNamespace" and "##local"; {@code null} means "##any"
     * @param targetNamespace the schema's target namespace
     */
    public static NamespaceConstraint parse(String value, String targetNamespace) {
        String tns = targetNamespace == null ? "" : targetNamespace;
        if (value == null || value.isBlank() || "##any".equals(value.trim())) {
            return new NamespaceConstraint(Mode.ANY, Set.of(), tns);
        }
        if ("##other".equals(value.trim())) {
            return new NamespaceConstraint(Mode.OTHER, Set.of(), tns);
        }
        Set<String> admitted = new LinkedHashSet<>();
        for (String token : value.trim().split("\\s+")) {
            switch (token) {
                case "##targetNamespace" -> admitted.add(tns);
                case "##local" -> admitted.add("");
                case "##any", "##other" -> throw new IllegalArgumentException(
                        "'" + token + "' cannot be combined with other namespace values");
                default -> admitted.add(token);
            }
        }
        return new NamespaceConstraint(Mode.ENUMERATED, admitted, tns);
    }

    /** Returns {@code true} if a name in the given namespace is admitted. */
    public boolean allows(String namespace) {
        String ns = namespace == null ? "" : namespace;
        return switch (mode) {
            case ANY -> true;
            case OTHER -> !ns.isEmpty() && !ns.equals(targetNamespace);
            case ENUMERATED -> namespaces.contains(ns);
        };
    }

    @Override
    public String toString() {
        return switch (mode) {
            case ANY -> "##any";
            case OTHER -> "##other";
            case ENUMERATED -> String.join(" ", namespaces);
        };
    }
}
