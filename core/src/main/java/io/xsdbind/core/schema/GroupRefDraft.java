package io.xsdbind.core.schema;

import io.xsdbind.core.particle.Occurs;
import javax.xml.namespace.QName;

/** A reference to a named model group, inlined when the schema is built. */
public record GroupRefDraft(QName ref, Occurs occurs) implements ParticleDraft {}
