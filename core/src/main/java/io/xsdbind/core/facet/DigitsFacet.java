package io.xsdbind.core.facet;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@code totalDigits} or {@code fractionDigits}. Digit counts ignore leading zeros of the integer
 * part and trailing zeros of the fraction part.
 */
public record DigitsFacet(FacetKind kind, int value) implements Facet {

    public DigitsFacet {
        if (kind != FacetKind.TOTAL_DIGITS && kind != FacetKind.FRACTION_DIGITS) {
            throw new IllegalArgumentException("not a digits facet: " + kind);
        }
        if (kind == FacetKind.TOTAL_DIGITS && value <= 0) {
            throw new IllegalArgumentException("totalDigits must be positive, got: " + value);
        }
        if (value < 0) {
            throw new IllegalArgumentException(kind + " must be non-negative, got: " + value);
        }
    }

    @Override
    public Optional<String> violation(Object v) {
        if (!(v instanceof Number n)) {
            return Optional.of("value " + v + " is not a decimal number");
        }
        int[] digits = countDigits(ValueOrder.toBigDecimal(n));
        if (kind == FacetKind.TOTAL_DIGITS) {
            int total = digits[0] + digits[1];
            return total > value
                    ? Optional.of("the number of digits is greater than " + value)
                    : Optional.empty();
        }
        return digits[1] > value
                ? Optional.of("the number of fractional digits is greater than " + value)
                : Optional.empty();
    }

    /** Returns {@code [integerDigits, fractionDigits]} of a decimal value. */
    static int[] countDigits(BigDecimal number) {
        if (number.signum() == 0) {
            return new int[] {0, 0};
        }
        String plain = number.abs().stripTrailingZeros().toPlainString();
        int dot = plain.indexOf('.');
        String intPart = dot < 0 ? plain : plain.substring(0, dot);
        String fracPart = dot < 0 ? "" : plain.substring(dot + 1);
        int start = 0;
        while (start < intPart.length() && intPart.charAt(start) == '0') {
            start++;
        }
        return new int[] {intPart.length() - start, fracPart.length()};
    }
}
