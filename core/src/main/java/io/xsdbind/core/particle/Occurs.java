package io.xsdbind.core.particle;

/**
 * Occurrence bounds of a particle.
 *
 * @param min minimum occurrences, non-negative
 * @param max maximum occurrences, {@code null} for unbounded
 */
public record Occurs(int min, Integer max) {

    public static final Occurs ONCE = new Occurs(1, 1);
    public static final Occurs OPTIONAL = new Occurs(0, 1);
    public static final Occurs ANY_NUMBER = new Occurs(0, null);

    public Occurs {
        if (min < 0) {
            throw new IllegalArgumentException("minOccurs must be non-negative, got: " + min);
        }
        if (max != null && max < min) {
            throw new IllegalArgumentException("maxOccurs (" + max + ") must not be lesser than minOccurs (" + min + ")");
        }
    }

    /**
     * Parses an occurrence pair as written in a schema document.
     *
     * @param min the minOccurs literal, {@code null} for the default 1
     * @param max the maxOccurs literal, {@code null} for the default 1, "unbounded" for no limit
     */
    public static Occurs parse(String min, String max) {
        int lo;
        try {
            lo = min == null ? 1 : Integer.parseInt(min.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("minOccurs must be a non-negative integer, got: '" + min + "'", e);
        }
        if (max == null) {
            return new Occurs(lo, 1);
        }
        if ("unbounded".equals(max.trim())) {
            return new Occurs(lo, null);
        }
        try {
            return new Occurs(lo, Integer.parseInt(max.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("maxOccurs must be an integer or 'unbounded', got: '" + max + "'", e);
        }
    }

    public boolean isOptional() {
        return min == 0;
    }

    public boolean isSingle() {
        return max != null && max == 1;
    }

    public boolean isUnbounded() {
        return max == null;
    }

    /** Returns {@code true} if {@code count} occurrences reach the minimum. */
    public boolean isSatisfiedBy(int count) {
        return count >= min;
    }

    /** Returns {@code true} if no further occurrence is allowed after {@code count}. */
    public boolean isExhaustedBy(int count) {
        return max != null && count >= max;
    }

    @Override
    public String toString() {
        return "[" + min + ".." + (max == null ? "unbounded" : max) + "]";
    }
}
