package io.xsdbind.core.model;

import java.util.Objects;

/**
 * Schema build options.
 *
 * @param mode          build-time failure tolerance: strict throws the first build error, lax
 *                      collects errors and falls back to {@code anyType}/{@code anySimpleType},
 *                      skip omits structural checks
 * @param version       schema language version, selects version-specific rules
 * @param maxModelDepth maximum nesting of model groups (default: 15)
 */
public record BuildOptions(ValidationMode mode, XsdVersion version, int maxModelDepth) {

    /** Default options: strict, XSD 1.0, model depth 15. */
    public static final BuildOptions DEFAULT = new BuildOptions(ValidationMode.STRICT, XsdVersion.V1_0, 15);

    public BuildOptions {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(version, "version must not be null");
        if (maxModelDepth <= 0) {
            throw new IllegalArgumentException("maxModelDepth must be positive, got: " + maxModelDepth);
        }
    }

    public BuildOptions withMode(ValidationMode newMode) {
        return new BuildOptions(newMode, version, maxModelDepth);
    }

    public BuildOptions withVersion(XsdVersion newVersion) {
        return new BuildOptions(mode, newVersion, maxModelDepth);
    }
}
