package io.xsdbind.core.particle;

import java.util.Objects;

/**
 * An {@code any} particle.
 *
 * @param namespaces      namespace constraint
 * @param processContents validation of matched children
 * @param occurs          occurrence bounds
 */
public record Wildcard(NamespaceConstraint namespaces, ProcessContents processContents, Occurs occurs)
        implements Particle {

    public Wildcard {
        Objects.requireNonNull(namespaces, "namespaces must not be null");
        Objects.requireNonNull(processContents, "processContents must not be null");
        Objects.requireNonNull(occurs, "occurs must not be null");
    }

    @Override
    public boolean isEmptiable() {
        return occurs.isOptional();
    }

    public String describe() {
        return "any(" + namespaces + ")";
    }
}
