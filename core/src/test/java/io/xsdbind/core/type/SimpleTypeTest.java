package io.xsdbind.core.type;

import static io.xsdbind.core.type.BuiltinsTest.errors;
import static io.xsdbind.core.type.BuiltinsTest.value;
import static org.assertj.core.api.Assertions.assertThat;

import io.xsdbind.core.model.ErrorKind;
import io.xsdbind.core.model.Result;
import io.xsdbind.core.model.ValidationError;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spec.SchemaParser;
import java.math.BigInteger;
import java.util.List;
import javax.xml.namespace.QName;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Derived simple types: restriction facets, list and union varieties. */
class SimpleTypeTest {

    private static final String NS = "urn:types";

    private static Schema schema;

    @BeforeAll
    static void parseSchema() {
        schema = new SchemaParser().parse("""
                targetNamespace: "urn:types"
                simpleTypes:
                  intOrString:
                    union:
                      memberTypes: [xs:integer, xs:string]
                  sizes:
                    list:
                      itemType: xs:int
                  shortSizes:
                    restriction:
                      base: sizes
                      facets:
                        maxLength: 2
                  code:
                    restriction:
                      base: xs:string
                      facets:
                        pattern: "[A-Z]{3}"
                        length: 3
                  color:
                    restriction:
                      base: xs:token
                      facets:
                        enumeration: [red, green]
                  percent:
                    restriction:
                      base: xs:decimal
                      facets:
                        minInclusive: 0
                        maxInclusive: 100
                        totalDigits: 5
                        fractionDigits: 2
                """, "types.yaml");
    }

    private static SimpleType type(String localName) {
        return (SimpleType) schema.requireType(new QName(NS, localName));
    }

    @Nested
    @DisplayName("union")
    class Union {

        @Test
        @DisplayName("first decodable member wins: '89' decodes as integer")
        void firstMemberWins() {
            List<Result<Object>> steps = type("intOrString").decode("89", true);

            assertThat(errors(steps)).isEmpty();
            assertThat(value(steps)).isEqualTo(BigInteger.valueOf(89));
        }

        @Test
        void fallsThroughToLaterMembers() {
            assertThat(value(type("intOrString").decode("eighty-nine", true))).isEqualTo("eighty-nine");
        }

        @Test
        void varietyAndMembers() {
            UnionType union = (UnionType) type("intOrString");

            assertThat(union.variety()).isEqualTo(SimpleType.Variety.UNION);
            assertThat(union.members()).extracting(SimpleType::name)
                    .containsExactly(XsdNames.xsd("integer"), XsdNames.xsd("string"));
        }
    }

    @Nested
    @DisplayName("list")
    class Lists {

        @Test
        void itemsAreDecodedWithTheItemType() {
            assertThat(value(type("sizes").decode(" 1 2\n 3 ", true)))
                    .isEqualTo(List.of(BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3)));
        }

        @Test
        void badItemIsADecodeError() {
            List<Result<Object>> steps = type("sizes").decode("1 x", true);

            assertThat(errors(steps)).singleElement().extracting(ValidationError::kind).isEqualTo(ErrorKind.DECODE);
        }

        @Test
        void lengthFacetsCountItems() {
            List<Result<Object>> steps = type("shortSizes").decode("1 2 3", true);

            assertThat(errors(steps)).extracting(ValidationError::reason)
                    .containsExactly("length cannot be greater than 2, got 3");
        }

        @Test
        void encodeJoinsWithSingleSpaces() {
            assertThat(value(type("sizes").encode(List.of(1, 2, 3), true))).isEqualTo("1 2 3");
        }
    }

    @Nested
    @DisplayName("restriction")
    class Restriction {

        @Test
        void lexicalFacetsAreCheckedBeforeValueFacets() {
            List<Result<Object>> steps = type("code").decode("ABCD", true);

            assertThat(errors(steps)).extracting(ValidationError::reason)
                    .containsExactly("value doesn't match the pattern '[A-Z]{3}'", "length has to be 3, got 4");
        }

        @Test
        void validValuePassesEveryFacet() {
            assertThat(errors(type("code").decode("XSD", true))).isEmpty();
        }

        @Test
        void enumerationComparesNormalizedValues() {
            assertThat(errors(type("color").decode("  red ", true))).isEmpty();
            assertThat(errors(type("color").decode("blue", true))).extracting(ValidationError::reason)
                    .containsExactly("value must be one of [red, green]");
        }

        @Test
        void rangeAndDigits() {
            assertThat(errors(type("percent").decode("99.99", true))).isEmpty();
            assertThat(errors(type("percent").decode("100.5", true))).extracting(ValidationError::reason)
                    .containsExactly("value has to be lesser or equal than 100");
            assertThat(errors(type("percent").decode("1.125", true))).extracting(ValidationError::reason)
                    .containsExactly("the number of fractional digits is greater than 2");
        }

        @Test
        void restrictionKnowsItsAncestors() {
            assertThat(type("color").isDerivedFrom(Builtins.simple("string"))).isTrue();
            assertThat(type("color").isDerivedFrom(Builtins.simple("int"))).isFalse();
        }
    }
}
