package io.xsdbind.core.engine;

import io.xsdbind.core.model.DecodeOptions;
import io.xsdbind.core.model.EncodeOptions;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spi.Converter;

/**
 * Per-call settings shared by every frame of one decode or encode run.
 *
 * @param checks {@code false} in skip mode: facet, attribute and content checks are off
 */
record BindingContext(
        Schema schema,
        Converter converter,
        ContentModelMatcher matcher,
        DecodeOptions decodeOptions,
        EncodeOptions encodeOptions,
        boolean checks) {}
