package io.xsdbind.core.schema;

import io.xsdbind.core.particle.Occurs;
import io.xsdbind.core.particle.Wildcard;

/** An {@code any} particle; wildcards have no references to resolve. */
public record WildcardDraft(Wildcard wildcard) implements ParticleDraft {

    @Override
    public Occurs occurs() {
        return wildcard.occurs();
    }
}
