package io.xsdbind.core.spi;

/** A compiled {@code pattern} facet value. */
@FunctionalInterface
public interface PatternMatcher {

    /**
     * Returns {@code true} if the whole text is matched by the pattern. Schema patterns are
     * implicitly anchored, so compilers must anchor before matching.
     */
    boolean search(String text);
}
