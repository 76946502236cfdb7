package io.xsdbind.core.particle;

/**
 * One child slot of a content model. Closed over element declarations, wildcards and nested model
 * groups.
 */
public sealed interface Particle permits ElementDecl, Wildcard, ModelGroup {

    Occurs occurs();

    /** Returns {@code true} if the particle can match zero children. */
    boolean isEmptiable();

    default boolean isOptional() {
        return occurs().isOptional();
    }

    default boolean isSingle() {
        return occurs().isSingle();
    }
}
