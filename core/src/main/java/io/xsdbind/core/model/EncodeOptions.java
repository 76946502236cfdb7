package io.xsdbind.core.model;

/**
 * Instance encode options.
 *
 * @param unordered keep children in the value's iteration order and do not run the content
 *                  model matcher on the produced children
 * @param maxDepth  maximum element nesting depth (default: 9999)
 */
public record EncodeOptions(boolean unordered, int maxDepth) {

    public static final EncodeOptions DEFAULT = new EncodeOptions(false, 9999);

    public EncodeOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
