package io.xsdbind.core.spi;

/**
 * Compiles a schema regular expression into a {@link PatternMatcher}. Implementations are
 * stateless and thread-safe.
 */
@FunctionalInterface
public interface PatternCompiler {

    /**
     * @param pattern the schema pattern literal
     * @return a matcher
     * @throws IllegalArgumentException if the pattern is not a valid expression
     */
    PatternMatcher compile(String pattern);
}
