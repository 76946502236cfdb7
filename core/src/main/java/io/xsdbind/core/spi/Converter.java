package io.xsdbind.core.spi;

import io.xsdbind.core.particle.ElementDecl;

/**
 * Output-shaping hook of the decode/encode pipeline. The pipeline hands every element to the
 * converter after its attributes, text and children have been processed; the converter decides the
 * shape of the native value.
 *
 * <p>Implementations must be thread-safe: one converter instance serves concurrent calls.
 */
public interface Converter {

    /**
     * Builds the native value of a decoded element.
     *
     * @param data  decoded tag, text, ordered content and attributes
     * @param decl  the element's declaration, {@code null} for an undeclared element
     * @param level nesting level, 0 for the root
     * @return the native value, may be {@code null}
     */
    Object elementDecode(ElementData data, ElementDecl decl, int level);

    /**
     * Splits a native value back into element data. Child names in the returned content are
     * resolved against the element's content model by the pipeline; unknown names produce encode
     * errors there.
     *
     * @param value the native value
     * @param decl  the element's declaration
     * @param level nesting level, 0 for the root
     * @return element data for the encoder
     * @throws IllegalArgumentException if the value has a shape this converter cannot handle
     */
    ElementData elementEncode(Object value, ElementDecl decl, int level);
}
