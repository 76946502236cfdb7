package io.xsdbind.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.xsdbind.core.particle.ModelGroup;
import io.xsdbind.core.particle.Particle;
import io.xsdbind.core.schema.Schema;
import io.xsdbind.core.spec.SchemaParser;
import io.xsdbind.core.type.ComplexType;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.xml.namespace.QName;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ContentModelMatcher")
class ContentModelMatcherTest {

    private static Schema schema;
    private static ContentModelMatcher matcher;

    @BeforeAll
    static void parseSchema() {
        schema = new SchemaParser().parse("""
                complexTypes:
                  pair:
                    sequence:
                      particles:
                        - {element: A, type: xs:string, minOccurs: 2, maxOccurs: 2}
                  bag:
                    all:
                      particles:
                        - {element: A, type: xs:string}
                        - {element: B, type: xs:string, minOccurs: 0}
                        - {element: C, type: xs:string, minOccurs: 0}
                  pick:
                    choice:
                      particles:
                        - sequence:
                            particles:
                              - {element: A, type: xs:string}
                        - sequence:
                            particles:
                              - {element: A, type: xs:string}
                              - {element: B, type: xs:string}
                  cycle:
                    sequence:
                      maxOccurs: unbounded
                      particles:
                        - {element: X, type: xs:string}
                        - {element: Y, type: xs:string}
                  drawing:
                    sequence:
                      particles:
                        - {ref: shape, maxOccurs: unbounded}
                  open:
                    sequence:
                      particles:
                        - {element: head, type: xs:string}
                        - any: {namespace: "urn:ext", processContents: skip, maxOccurs: unbounded}
                  strictOpen:
                    sequence:
                      particles:
                        - any: {processContents: strict, maxOccurs: unbounded}
                elements:
                  shape: {type: xs:string, abstract: true}
                  circle: {type: xs:string, substitutionGroup: shape}
                """, "matcher.yaml");
        matcher = new ContentModelMatcher(schema);
    }

    private static ModelGroup group(String typeName) {
        return ((ComplexType) schema.requireType(new QName(typeName))).group();
    }

    private static List<QName> names(String... localNames) {
        return Arrays.stream(localNames).map(QName::new).collect(Collectors.toList());
    }

    private static List<String> reasons(MatchResult result) {
        return result.mismatches().stream().map(MatchResult.Mismatch::reason).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("sequence with A{2,2}")
    class BoundedSequence {

        @Test
        void exactCountIsAccepted() {
            MatchResult result = matcher.match(group("pair"), names("A", "A"));

            assertThat(result.isValid()).isTrue();
            assertThat(result.pairings()).extracting(MatchResult.Pairing::childIndex).containsExactly(0, 1);
            assertThat(result.pairings()).allMatch(MatchResult.Pairing::repeatable);
        }

        @Test
        void missingOccurrenceIsOneTagExpected() {
            assertThat(reasons(matcher.match(group("pair"), names("A")))).containsExactly("tag expected: 'A'");
        }

        @Test
        void extraOccurrenceIsOneUnexpectedTag() {
            MatchResult result = matcher.match(group("pair"), names("A", "A", "A"));

            assertThat(reasons(result)).containsExactly("unexpected tag 'A'");
            assertThat(result.mismatches()).extracting(MatchResult.Mismatch::childIndex).containsExactly(2);
            assertThat(result.unplaced().stream().toArray()).containsExactly(2);
        }

        @Test
        void emptyContentReportsTheExpectedTag() {
            assertThat(reasons(matcher.match(group("pair"), List.of()))).containsExactly("tag expected: 'A'");
        }
    }

    @Nested
    @DisplayName("all with required A, optional B and C")
    class AllGroup {

        @Test
        void anyOrderIsAccepted() {
            MatchResult result = matcher.match(group("bag"), names("C", "A"));

            assertThat(result.isValid()).isTrue();
            assertThat(result.pairings()).extracting(p -> p.decl().name().getLocalPart()).containsExactly("C", "A");
        }

        @Test
        void missingRequiredMember() {
            assertThat(reasons(matcher.match(group("bag"), names("B", "C")))).containsExactly("tag expected: 'A'");
        }

        @Test
        void memberAtMostOnce() {
            assertThat(reasons(matcher.match(group("bag"), names("A", "A")))).containsExactly("unexpected tag 'A'");
        }
    }

    @Nested
    @DisplayName("choice")
    class Choice {

        @Test
        @DisplayName("the first alternative accepting the child is always taken")
        void firstAlternativeWins() {
            MatchResult result = matcher.match(group("pick"), names("A"));
            Particle firstAlternativeA = ((ModelGroup) group("pick").particles().get(0)).particles().get(0);

            assertThat(result.isValid()).isTrue();
            assertThat(result.pairings()).singleElement()
                    .satisfies(p -> assertThat(p.particle()).isSameAs(firstAlternativeA));
        }

        @Test
        @DisplayName("no backtracking into a later alternative")
        void noBacktracking() {
            assertThat(reasons(matcher.match(group("pick"), names("A", "B")))).containsExactly("unexpected tag 'B'");
        }

        @Test
        void noAlternativeMatches() {
            assertThat(reasons(matcher.match(group("pick"), names("Z"))))
                    .containsExactly("unexpected tag 'Z', tag expected: 'A'");
        }
    }

    @Nested
    @DisplayName("repeated sequence")
    class RepeatedSequence {

        @Test
        void wholeCyclesAreAccepted() {
            assertThat(matcher.match(group("cycle"), names("X", "Y", "X", "Y")).isValid()).isTrue();
        }

        @Test
        void partialCycleReportsTheMissingMember() {
            assertThat(reasons(matcher.match(group("cycle"), names("X", "Y", "X")))).containsExactly("tag expected: 'Y'");
        }

        @Test
        void outOfOrderChild() {
            assertThat(reasons(matcher.match(group("cycle"), names("Y"))))
                    .containsExactly("unexpected tag 'Y', tag expected: 'X'");
        }
    }

    @Nested
    @DisplayName("substitution groups")
    class SubstitutionGroups {

        @Test
        void memberStandsInForTheHead() {
            MatchResult result = matcher.match(group("drawing"), names("circle", "circle"));

            assertThat(result.isValid()).isTrue();
            assertThat(result.pairings()).extracting(p -> p.decl().name()).containsOnly(new QName("circle"));
        }

        @Test
        void abstractHeadNeverMatchesByItsOwnName() {
            assertThat(reasons(matcher.match(group("drawing"), names("shape"))))
                    .containsExactly("unexpected tag 'shape', tag expected: 'circle'");
        }
    }

    @Nested
    @DisplayName("wildcards")
    class Wildcards {

        @Test
        void skipWildcardMatchesOnNamespaceAlone() {
            MatchResult result = matcher.match(
                    group("open"), List.of(new QName("head"), new QName("urn:ext", "x"), new QName("urn:ext", "y")));

            assertThat(result.isValid()).isTrue();
            assertThat(result.pairings()).hasSize(3);
            assertThat(result.pairings().get(1).decl()).isNull();
        }

        @Test
        void namespaceConstraintMustHold() {
            MatchResult result = matcher.match(group("open"), List.of(new QName("head"), new QName("urn:other", "x")));

            assertThat(result.isValid()).isFalse();
            assertThat(reasons(result)).singleElement().asString().startsWith("unexpected tag");
        }

        @Test
        void strictWildcardRequiresAGlobalDeclaration() {
            Particle wildcard = group("strictOpen").particles().get(0);

            assertThat(matcher.accepts(wildcard, new QName("circle"))).isNotNull()
                    .extracting(ContentModelMatcher.Candidate::decl)
                    .isNotNull();
            assertThat(matcher.accepts(wildcard, new QName("undeclared"))).isNull();
        }
    }
}
