package io.xsdbind.core.model;

/**
 * Instance decode options.
 *
 * @param maxDepth     maximum element nesting depth (default: 9999); deeper elements are a
 *                     validation error and are not decoded
 * @param fillDefaults fill absent attributes and empty elements with their default/fixed value
 */
public record DecodeOptions(int maxDepth, boolean fillDefaults) {

    public static final DecodeOptions DEFAULT = new DecodeOptions(9999, true);

    public DecodeOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
