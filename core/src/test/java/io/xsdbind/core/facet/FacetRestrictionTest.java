package io.xsdbind.core.facet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xsdbind.core.error.SchemaParseException;
import io.xsdbind.core.model.ErrorKind;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spec.SchemaParser;
import io.xsdbind.core.type.SimpleType;
import java.util.List;
import javax.xml.namespace.QName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Build-time facet checks: contradictions, narrowing and version-specific facets. */
class FacetRestrictionTest {

    private static Schema parse(String simpleTypes) {
        return new SchemaParser().parse("simpleTypes:\n" + simpleTypes.indent(2), "facets.yaml");
    }

    @Nested
    @DisplayName("contradictory facets")
    class Contradictions {

        @Test
        void minLengthAboveMaxLength() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:string
                        facets: {minLength: 5, maxLength: 3}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("'minLength' has a greater value than 'maxLength'");
        }

        @Test
        void inclusiveAndExclusiveLowerBoundsTogether() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:int
                        facets: {minInclusive: 1, minExclusive: 0}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("'minInclusive' and 'minExclusive' cannot be specified together");
        }

        @Test
        void fractionDigitsAboveTotalDigits() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:decimal
                        facets: {totalDigits: 2, fractionDigits: 3}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("'fractionDigits' has a greater value than 'totalDigits'");
        }

        @Test
        void rangeFacetsOnDurationAreNotApplicable() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:duration
                        facets: {maxInclusive: P1Y}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("is not applicable to this type");
        }
    }

    @Nested
    @DisplayName("narrowing")
    class Narrowing {

        @Test
        @DisplayName("minLength above the base maxLength is a parse error")
        void minLengthAboveBaseMaxLength() {
            assertThatThrownBy(() -> parse("""
                    short:
                      restriction:
                        base: xs:string
                        facets: {maxLength: 5}
                    derived:
                      restriction:
                        base: short
                        facets: {minLength: 6}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("'minLength' has a greater value than parent 'maxLength'");
        }

        @Test
        void widerRangeThanTheBase() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:byte
                        facets: {maxInclusive: 1000}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("outside the range of parent");
        }

        @Test
        void relaxedWhitespace() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:token
                        facets: {whiteSpace: preserve}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("whiteSpace");
        }

        @Test
        void enumerationLiteralMustBeValidForTheBase() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:int
                        facets: {enumeration: [1, two]}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("two");
        }

        @Test
        void facetNotAdmittedByThePrimitive() {
            assertThatThrownBy(() -> parse("""
                    t:
                      restriction:
                        base: xs:boolean
                        facets: {maxLength: 1}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("facet 'maxLength' is not applicable to this type");
        }
    }

    @Nested
    @DisplayName("explicitTimezone")
    class ExplicitTimezone {

        private static final String DOCUMENT = """
                version: "%s"
                simpleTypes:
                  stamp:
                    restriction:
                      base: xs:dateTime
                      facets: {explicitTimezone: required}
                """;

        @Test
        void rejectedUnderVersion10() {
            assertThatThrownBy(() -> new SchemaParser().parse(DOCUMENT.formatted("1.0"), "tz.yaml"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("explicitTimezone");
        }

        @Test
        void checkedUnderVersion11() {
            Schema schema = new SchemaParser().parse(DOCUMENT.formatted("1.1"), "tz.yaml");
            SimpleType stamp = (SimpleType) schema.requireType(new QName("stamp"));

            List<Result<Object>> steps = stamp.decode("2024-01-01T00:00:00", true);

            List<ValidationError> errors = steps.stream()
                    .filter(s -> !s.isValue())
                    .map(s -> ((Result.Error<Object>) s).error())
                    .toList();
            assertThat(errors).singleElement().satisfies(e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION);
                assertThat(e.reason()).startsWith("time zone required");
            });
            assertThat(stamp.decode("2024-01-01T00:00:00Z", true)).allMatch(Result::isValue);
        }
    }
}
