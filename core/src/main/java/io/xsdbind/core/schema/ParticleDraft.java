package io.xsdbind.core.schema;

import io.xsdbind.core.particle.Occurs;

/** A particle of a content model before resolution. */
public sealed interface ParticleDraft permits ElementDraft, WildcardDraft, ModelGroupDraft, GroupRefDraft {

    Occurs occurs();
}
