package io.xsdbind.core.type;

import io.xsdbind.core.particle.NamespaceConstraint;
import io.xsdbind.core.particle.ProcessContents;
import java.util.Objects;

/** An attribute wildcard. */
public record AnyAttribute(NamespaceConstraint namespaces, ProcessContents processContents) {

    public AnyAttribute {
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        Objects.requireNonNull(processContents, "processContents must not be null");
    }

    public boolean allows(String namespace) {
        return namespaces.allows(namespace);
    }
}
