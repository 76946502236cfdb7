package io.xsdbind.core.schema;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity token of one check pass over the drafts of a {@link SchemaBuilder}. A draft records the
 * token of the pass that checked it; comparing tokens by identity tells whether the draft was
 * checked in the current pass.
 */
public final class BuildGeneration {

    private static final AtomicLong COUNTER = new AtomicLong();

    private final long ordinal;

    BuildGeneration() {
        this.ordinal = COUNTER.incrementAndGet();
    }

    @Override
    public String toString() {
        return "BuildGeneration#" + ordinal;
    }
}
