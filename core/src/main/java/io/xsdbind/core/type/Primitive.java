package io.xsdbind.core.type;

import io.xsdbind.core.facet.FacetKind;
import io.xsdbind.core.facet.LengthMeasure;
import io.xsdbind.core.model.XsdVersion;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Primitive value spaces. Each primitive knows its lexical-to-native conversion, its canonical
 * lexical form, the facets it admits and how the length facets measure its values.
 *
 * <p>{@link #INTEGER} is not an XSD primitive: it shares the facets of {@link #DECIMAL} and gives
 * integer-derived types their {@link BigInteger} native values.
 */
public enum Primitive {
    ANY_SIMPLE(Family.STRING),
    STRING(Family.STRING),
    BOOLEAN(Family.BOOLEAN),
    DECIMAL(Family.DECIMAL),
    INTEGER(Family.DECIMAL),
    FLOAT(Family.ORDERED),
    DOUBLE(Family.ORDERED),
    DURATION(Family.UNORDERED),
    DATE_TIME(Family.TEMPORAL),
    TIME(Family.TEMPORAL),
    DATE(Family.TEMPORAL),
    G_YEAR_MONTH(Family.PARTIAL_TEMPORAL),
    G_YEAR(Family.PARTIAL_TEMPORAL),
    G_MONTH_DAY(Family.PARTIAL_TEMPORAL),
    G_DAY(Family.PARTIAL_TEMPORAL),
    G_MONTH(Family.PARTIAL_TEMPORAL),
    HEX_BINARY(Family.STRING),
    BASE64_BINARY(Family.STRING),
    ANY_URI(Family.STRING),
    QNAME(Family.STRING),
    NOTATION(Family.STRING);

    private enum Family {
        STRING,
        BOOLEAN,
        DECIMAL,
        ORDERED,
        TEMPORAL,
        // kept as checked text, so no range facets
        UNORDERED,
        PARTIAL_TEMPORAL
    }

    private static final String TZ = "(Z|[+-]\\d{2}:\\d{2})?";
    private static final Pattern DECIMAL_LEX = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern INTEGER_LEX = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_LEX =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([Ee][+-]?\\d+)?|[+-]?INF|NaN");
    private static final Pattern DURATION_LEX = Pattern.compile(
            "-?P(?=\\d|T\\d)(\\d+Y)?(\\d+M)?(\\d+D)?(T(?=\\d)(\\d+H)?(\\d+M)?(\\d+(\\.\\d+)?S)?)?");
    private static final Pattern DATE_TIME_LEX =
            Pattern.compile("(-?\\d{4,}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?)" + TZ);
    private static final Pattern DATE_LEX = Pattern.compile("(-?\\d{4,}-\\d{2}-\\d{2})" + TZ);
    private static final Pattern TIME_LEX = Pattern.compile("(\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?)" + TZ);
    private static final Pattern G_YEAR_MONTH_LEX = Pattern.compile("-?\\d{4,}-(0[1-9]|1[0-2])" + TZ);
    private static final Pattern G_YEAR_LEX = Pattern.compile("-?\\d{4,}" + TZ);
    private static final Pattern G_MONTH_DAY_LEX = Pattern.compile("--(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])" + TZ);
    private static final Pattern G_DAY_LEX = Pattern.compile("---(0[1-9]|[12]\\d|3[01])" + TZ);
    private static final Pattern G_MONTH_LEX = Pattern.compile("--(0[1-9]|1[0-2])" + TZ);
    private static final Pattern HEX_LEX = Pattern.compile("([0-9a-fA-F]{2})*");
    private static final Pattern QNAME_LEX =
            Pattern.compile("([_\\p{L}][\\-._\\p{L}\\p{N}\\u00B7]*:)?[_\\p{L}][\\-._\\p{L}\\p{N}\\u00B7]*");

    private static final DateTimeFormatter LOCAL_TIME = new DateTimeFormatterBuilder()
            .appendPattern("HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter();
    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .append(LOCAL_TIME)
            .toFormatter();
    private static final DateTimeFormatter OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
            .append(LOCAL_DATE_TIME)
            .appendOffset("+HH:MM", "Z")
            .toFormatter();
    private static final DateTimeFormatter OFFSET_TIME = new DateTimeFormatterBuilder()
            .append(LOCAL_TIME)
            .appendOffset("+HH:MM", "Z")
            .toFormatter();
    private static final DateTimeFormatter OFFSET_DATE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendOffset("+HH:MM", "Z")
            .toFormatter();

    private final Family family;

    Primitive(Family family) {
        this.family = family;
    }

    /** Facets admitted on types derived from this primitive. */
    public Set<FacetKind> admittedFacets(XsdVersion version) {
        Set<FacetKind> kinds = EnumSet.of(FacetKind.PATTERN, FacetKind.WHITE_SPACE);
        switch (family) {
            case STRING -> kinds.addAll(EnumSet.of(
                    FacetKind.LENGTH, FacetKind.MIN_LENGTH, FacetKind.MAX_LENGTH, FacetKind.ENUMERATION));
            case BOOLEAN -> {
                // pattern and whiteSpace only
            }
            case DECIMAL -> {
                kinds.addAll(ranges());
                kinds.addAll(EnumSet.of(FacetKind.TOTAL_DIGITS, FacetKind.FRACTION_DIGITS, FacetKind.ENUMERATION));
            }
            case ORDERED -> {
                kinds.addAll(ranges());
                kinds.add(FacetKind.ENUMERATION);
            }
            case TEMPORAL -> {
                kinds.addAll(ranges());
                kinds.add(FacetKind.ENUMERATION);
                if (version == XsdVersion.V1_1) {
                    kinds.add(FacetKind.EXPLICIT_TIMEZONE);
                }
            }
            case UNORDERED -> kinds.add(FacetKind.ENUMERATION);
            case PARTIAL_TEMPORAL -> {
                kinds.add(FacetKind.ENUMERATION);
                if (version == XsdVersion.V1_1) {
                    kinds.add(FacetKind.EXPLICIT_TIMEZONE);
                }
            }
        }
        return kinds;
    }

    private static Set<FacetKind> ranges() {
        return EnumSet.of(
                FacetKind.MIN_INCLUSIVE, FacetKind.MIN_EXCLUSIVE, FacetKind.MAX_INCLUSIVE, FacetKind.MAX_EXCLUSIVE);
    }

    public LengthMeasure lengthMeasure() {
        return switch (this) {
            case HEX_BINARY -> LengthMeasure.HEX_OCTETS;
            case BASE64_BINARY -> LengthMeasure.BASE64_OCTETS;
            default -> LengthMeasure.CODE_POINTS;
        };
    }

    public boolean isIntegral() {
        return this == INTEGER;
    }

    /**
     * Converts normalized text to the native value.
     *
     * @throws IllegalArgumentException if the text is not in the lexical space
     */
    public Object parse(String text) {
        switch (this) {
            case ANY_SIMPLE, STRING, ANY_URI -> {
                return text;
            }
            case BOOLEAN -> {
                return switch (text) {
                    case "true", "1" -> Boolean.TRUE;
                    case "false", "0" -> Boolean.FALSE;
                    default -> throw invalid(text);
                };
            }
            case DECIMAL -> {
                require(DECIMAL_LEX, text);
                return new BigDecimal(text.endsWith(".") ? text + "0" : text);
            }
            case INTEGER -> {
                require(INTEGER_LEX, text);
                return new BigInteger(text);
            }
            case FLOAT -> {
                require(FLOAT_LEX, text);
                return Float.parseFloat(javaFloating(text));
            }
            case DOUBLE -> {
                require(FLOAT_LEX, text);
                return Double.parseDouble(javaFloating(text));
            }
            case DATE_TIME -> {
                Matcher m = require(DATE_TIME_LEX, text);
                try {
                    LocalDateTime local = LocalDateTime.parse(m.group(1));
                    return m.group(3) == null ? local : local.atOffset(ZoneOffset.of(m.group(3)));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("invalid dateTime '" + text + "': " + e.getMessage(), e);
                }
            }
            case DATE -> {
                Matcher m = require(DATE_LEX, text);
                try {
                    LocalDate local = LocalDate.parse(m.group(1));
                    return m.group(2) == null ? local : local.atStartOfDay().atOffset(ZoneOffset.of(m.group(2)));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("invalid date '" + text + "': " + e.getMessage(), e);
                }
            }
            case TIME -> {
                Matcher m = require(TIME_LEX, text);
                try {
                    LocalTime local = LocalTime.parse(m.group(1));
                    return m.group(3) == null ? local : local.atOffset(ZoneOffset.of(m.group(3)));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("invalid time '" + text + "': " + e.getMessage(), e);
                }
            }
            case DURATION -> {
                require(DURATION_LEX, text);
                return text;
            }
            case G_YEAR_MONTH -> {
                require(G_YEAR_MONTH_LEX, text);
                return text;
            }
            case G_YEAR -> {
                require(G_YEAR_LEX, text);
                return text;
            }
            case G_MONTH_DAY -> {
                require(G_MONTH_DAY_LEX, text);
                return text;
            }
            case G_DAY -> {
                require(G_DAY_LEX, text);
                return text;
            }
            case G_MONTH -> {
                require(G_MONTH_LEX, text);
                return text;
            }
            case HEX_BINARY -> {
                require(HEX_LEX, text);
                return text;
            }
            case BASE64_BINARY -> {
                try {
                    Base64.getDecoder().decode(text.replaceAll("\\s+", ""));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("invalid base64Binary '" + text + "'", e);
                }
                return text;
            }
            case QNAME, NOTATION -> {
                require(QNAME_LEX, text);
                return text;
            }
            default -> throw new IllegalStateException("unhandled primitive " + this);
        }
    }

    /**
     * Converts a native Java value into this primitive's native representation.
     *
     * @throws IllegalArgumentException if the value's class does not fit the value space
     */
    public Object coerce(Object value) {
        switch (this) {
            case BOOLEAN -> {
                if (value instanceof Boolean) {
                    return value;
                }
            }
            case DECIMAL -> {
                if (value instanceof BigDecimal) {
                    return value;
                }
                if (value instanceof BigInteger bi) {
                    return new BigDecimal(bi);
                }
                if (isFixedPoint(value)) {
                    return BigDecimal.valueOf(((Number) value).longValue());
                }
                if (value instanceof Double || value instanceof Float) {
                    double d = ((Number) value).doubleValue();
                    if (!Double.isNaN(d) && !Double.isInfinite(d)) {
                        return BigDecimal.valueOf(d);
                    }
                }
            }
            case INTEGER -> {
                if (value instanceof BigInteger) {
                    return value;
                }
                if (isFixedPoint(value)) {
                    return BigInteger.valueOf(((Number) value).longValue());
                }
                if (value instanceof BigDecimal bd) {
                    try {
                        return bd.toBigIntegerExact();
                    } catch (ArithmeticException e) {
                        throw new IllegalArgumentException("value " + value + " is not an integer", e);
                    }
                }
            }
            case FLOAT -> {
                if (value instanceof Number n) {
                    return n.floatValue();
                }
            }
            case DOUBLE -> {
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
            }
            case DATE_TIME -> {
                if (value instanceof LocalDateTime || value instanceof OffsetDateTime) {
                    return value;
                }
            }
            case DATE -> {
                if (value instanceof LocalDate || value instanceof OffsetDateTime) {
                    return value;
                }
            }
            case TIME -> {
                if (value instanceof LocalTime || value instanceof OffsetTime) {
                    return value;
                }
            }
            case ANY_SIMPLE -> {
                return value instanceof String ? value : format(value);
            }
            case STRING -> {
                if (value instanceof String) {
                    return value;
                }
                if (value instanceof Number || value instanceof Boolean) {
                    return format(value);
                }
            }
            default -> {
                if (value instanceof String) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException(
                "value of class " + value.getClass().getSimpleName() + " is not compatible with " + this.xsdLabel());
    }

    /** Canonical lexical form of a native value. */
    public String format(Object value) {
        if (value instanceof Float f) {
            return f.isNaN() ? "NaN" : f.isInfinite() ? (f > 0 ? "INF" : "-INF") : f.toString();
        }
        if (value instanceof Double d) {
            return d.isNaN() ? "NaN" : d.isInfinite() ? (d > 0 ? "INF" : "-INF") : d.toString();
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof LocalDateTime ldt) {
            return LOCAL_DATE_TIME.format(ldt);
        }
        if (value instanceof OffsetDateTime odt) {
            return this == DATE ? OFFSET_DATE.format(odt) : OFFSET_DATE_TIME.format(odt);
        }
        if (value instanceof LocalTime lt) {
            return LOCAL_TIME.format(lt);
        }
        if (value instanceof OffsetTime ot) {
            return OFFSET_TIME.format(ot);
        }
        return String.valueOf(value);
    }

    /** Schema-style label, e.g. {@code dateTime}. */
    public String xsdLabel() {
        return switch (this) {
            case ANY_SIMPLE -> "anySimpleType";
            case DATE_TIME -> "dateTime";
            case G_YEAR_MONTH -> "gYearMonth";
            case G_YEAR -> "gYear";
            case G_MONTH_DAY -> "gMonthDay";
            case G_DAY -> "gDay";
            case G_MONTH -> "gMonth";
            case HEX_BINARY -> "hexBinary";
            case BASE64_BINARY -> "base64Binary";
            case ANY_URI -> "anyURI";
            case QNAME -> "QName";
            default -> name().toLowerCase(Locale.ROOT);
        };
    }

    private static boolean isFixedPoint(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }

    private static String javaFloating(String text) {
        return switch (text) {
            case "INF", "+INF" -> "Infinity";
            case "-INF" -> "-Infinity";
            default -> text;
        };
    }

    private Matcher require(Pattern lexical, String text) {
        Matcher m = lexical.matcher(text);
        if (!m.matches()) {
            throw invalid(text);
        }
        return m;
    }

    private IllegalArgumentException invalid(String text) {
        return new IllegalArgumentException("invalid literal for " + xsdLabel() + ": '" + text + "'");
    }
}
