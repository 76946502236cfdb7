package io.xsdbind.core.facet;

import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.temporal.Temporal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** {@code explicitTimezone}, admitted on date/time primitives under XSD 1.1 only. */
public record ExplicitTimezoneFacet(Presence value) implements Facet {

    private static final Pattern TZ_SUFFIX = Pattern.compile(".*(Z|[+-]\\d{2}:\\d{2})$");

    /** Facet values. */
    public enum Presence {
        REQUIRED,
        PROHIBITED,
        OPTIONAL;

        public static Presence fromName(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "explicitTimezone must be one of required, prohibited, optional, got: '" + name + "'", e);
            }
        }
    }

    @Override
    public FacetKind kind() {
        return FacetKind.EXPLICIT_TIMEZONE;
    }

    @Override
    public Optional<String> violation(Object v) {
        boolean hasTz = hasTimezone(v);
        if (value == Presence.REQUIRED && !hasTz) {
            return Optional.of("time zone required for value " + v);
        }
        if (value == Presence.PROHIBITED && hasTz) {
            return Optional.of("time zone prohibited for value " + v);
        }
        return Optional.empty();
    }

    static boolean hasTimezone(Object v) {
        if (v instanceof OffsetDateTime || v instanceof OffsetTime) {
            return true;
        }
        if (v instanceof Temporal) {
            return false;
        }
        return TZ_SUFFIX.matcher(String.valueOf(v)).matches();
    }
}
