package io.xsdbind.core.model;

/**
 * Kind tag of an instance-time {@link ValidationError}.
 *
 * <ul>
 *   <li>{@link #VALIDATION}: a facet, attribute or content model check failed.
 *   <li>{@link #DECODE}: well-formed text could not be converted to a native value.
 *   <li>{@link #ENCODE}: a native value does not fit its declaring type.
 * </ul>
 */
public enum ErrorKind {
    VALIDATION,
    DECODE,
    ENCODE
}
