package io.xsdbind.core.type;

/** Content kind of a complex type. */
public enum ContentKind {
    EMPTY,
    SIMPLE,
    ELEMENT_ONLY,
    MIXED
}
