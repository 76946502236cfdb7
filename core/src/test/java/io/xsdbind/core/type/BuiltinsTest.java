package io.xsdbind.core.type;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xsdbind.core.model.ErrorKind;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Builtin simple types")
class BuiltinsTest {

    static Object value(List<? extends Result<?>> steps) {
        Result<?> last = steps.get(steps.size() - 1);
        assertThat(last.isValue()).as("streams end with a value").isTrue();
        return ((Result.Value<?>) last).value();
    }

    static List<ValidationError> errors(List<? extends Result<?>> steps) {
        return steps.stream()
                .filter(s -> s instanceof Result.Error<?>)
                .map(s -> ((Result.Error<?>) s).error())
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        void integerTypesDecodeToBigInteger() {
            assertThat(value(Builtins.simple("int").decode(" 42 ", true))).isEqualTo(BigInteger.valueOf(42));
            assertThat(value(Builtins.simple("unsignedLong").decode("18446744073709551615", true)))
                    .isEqualTo(new BigInteger("18446744073709551615"));
        }

        @Test
        void decimalKeepsScale() {
            assertThat(value(Builtins.simple("decimal").decode("1.50", true))).isEqualTo(new BigDecimal("1.50"));
        }

        @Test
        void booleanAcceptsDigits() {
            assertThat(value(Builtins.simple("boolean").decode("1", true))).isEqualTo(Boolean.TRUE);
            assertThat(value(Builtins.simple("boolean").decode("false", true))).isEqualTo(Boolean.FALSE);
        }

        @Test
        void floatingPointSpecialValues() {
            assertThat(value(Builtins.simple("float").decode("INF", true))).isEqualTo(Float.POSITIVE_INFINITY);
            assertThat(value(Builtins.simple("double").decode("-INF", true))).isEqualTo(Double.NEGATIVE_INFINITY);
            assertThat((Double) value(Builtins.simple("double").decode("NaN", true))).isNaN();
        }

        @Test
        void datesWithAndWithoutTimezone() {
            assertThat(value(Builtins.simple("date").decode("2024-01-31", true))).isEqualTo(LocalDate.of(2024, 1, 31));
            assertThat(value(Builtins.simple("date").decode("2024-01-31Z", true)))
                    .isEqualTo(OffsetDateTime.of(2024, 1, 31, 0, 0, 0, 0, ZoneOffset.UTC));
            assertThat(value(Builtins.simple("dateTime").decode("2024-01-31T10:15:30", true)))
                    .isEqualTo(LocalDateTime.of(2024, 1, 31, 10, 15, 30));
        }

        @Test
        void tokenCollapsesWhitespace() {
            assertThat(value(Builtins.simple("token").decode("  a \n  b  ", true))).isEqualTo("a b");
        }

        @Test
        void durationIsKeptAsText() {
            assertThat(value(Builtins.simple("duration").decode("P1Y2M", true))).isEqualTo("P1Y2M");
        }

        @Test
        void builtinListTypesSplitOnWhitespace() {
            assertThat(value(Builtins.simple("NMTOKENS").decode(" a  b c ", true))).isEqualTo(List.of("a", "b", "c"));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void conversionFailureFallsBackToNormalizedText() {
            List<Result<Object>> steps = Builtins.simple("int").decode(" abc ", true);

            assertThat(errors(steps)).singleElement().extracting(ValidationError::kind).isEqualTo(ErrorKind.DECODE);
            assertThat(value(steps)).isEqualTo("abc");
        }

        @Test
        void rangeOfDerivedIntegerTypesIsChecked() {
            List<Result<Object>> steps = Builtins.simple("byte").decode("200", true);

            assertThat(errors(steps)).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION);
                assertThat(e.reason()).isEqualTo("value has to be lesser or equal than 127");
            });
            assertThat(value(steps)).isEqualTo(BigInteger.valueOf(200));
        }

        @Test
        void checksCanBeSuppressed() {
            assertThat(errors(Builtins.simple("byte").decode("200", false))).isEmpty();
        }

        @Test
        void unknownBuiltinIsRejected() {
            assertThatThrownBy(() -> Builtins.simple("integr"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("xs:integr");
        }
    }

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        void nativeValuesAreFormattedCanonically() {
            assertThat(value(Builtins.simple("boolean").encode(Boolean.TRUE, true))).isEqualTo("true");
            assertThat(value(Builtins.simple("int").encode(7, true))).isEqualTo("7");
            assertThat(value(Builtins.simple("date").encode(LocalDate.of(2024, 2, 29), true))).isEqualTo("2024-02-29");
        }

        @Test
        void stringsAreHandledAsLexicalForms() {
            assertThat(value(Builtins.simple("boolean").encode("1", true))).isEqualTo("true");
            assertThat(value(Builtins.simple("integer").encode(" 0012 ", true))).isEqualTo("12");
        }

        @Test
        void incompatibleNativeValueIsAnEncodeError() {
            List<Result<String>> steps = Builtins.simple("date").encode(Boolean.TRUE, true);

            assertThat(errors(steps)).singleElement().extracting(ValidationError::kind).isEqualTo(ErrorKind.ENCODE);
        }
    }

    @Test
    void anyTypeIsMixedWithLaxWildcards() {
        ComplexType anyType = Builtins.anyType();

        assertThat(anyType.isMixed()).isTrue();
        assertThat(anyType.group().wildcards()).isNotEmpty();
        assertThat(anyType.attributes().wildcard()).isPresent();
    }
}
