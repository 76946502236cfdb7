package io.xsdbind.core.type;

/** How a complex type was derived from its base. */
public enum Derivation {
    NONE,
    RESTRICTION,
    EXTENSION
}
