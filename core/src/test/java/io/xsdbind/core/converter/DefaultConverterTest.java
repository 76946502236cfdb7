package io.xsdbind.core.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xsdbind.core.spi.ContentItem;
import io.xsdbind.core.spi.ElementData;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.namespace.QName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultConverterTest {

    private static final String PO = "urn:po";

    private static ElementData element(String tag, Object text, List<ContentItem> content, Map<QName, Object> attributes) {
        return new ElementData(new QName(tag), text, content, attributes);
    }

    private static ContentItem.Child child(String name, Object value, boolean repeatable) {
        return new ContentItem.Child(new QName(name), value, null, repeatable);
    }

    @Nested
    @DisplayName("elementDecode")
    class Decode {

        private final DefaultConverter converter = new DefaultConverter();

        @Test
        void textOnlyElementIsItsValue() {
            assertThat(converter.elementDecode(element("qty", BigInteger.TWO, List.of(), Map.of()), null, 1))
                    .isEqualTo(BigInteger.TWO);
        }

        @Test
        void attributesAndTextMakeAMap() {
            Object value = converter.elementDecode(
                    element("price", "9.99", List.of(), Map.of(new QName("currency"), "EUR")), null, 0);

            assertThat(value).isEqualTo(Map.of("@currency", "EUR", "$", "9.99"));
        }

        @Test
        void repeatableChildrenAreLists() {
            Object value = converter.elementDecode(element("order", null, List.of(
                    child("customer", "Ann", false),
                    child("item", "a", true),
                    child("item", "b", true)), Map.of()), null, 0);

            assertThat(value).isEqualTo(Map.of("customer", "Ann", "item", List.of("a", "b")));
        }

        @Test
        @DisplayName("a name seen twice under a single particle keeps both values")
        void duplicateSingleChild() {
            Object value = converter.elementDecode(element("order", null, List.of(
                    child("note", "x", false),
                    child("note", "y", false)), Map.of()), null, 0);

            assertThat(value).isEqualTo(Map.of("note", List.of("x", "y")));
        }

        @Test
        void forceListWrapsSingleChildren() {
            DefaultConverter forced = new DefaultConverter(ConverterOptions.builder().forceList(true).build());

            Object value = forced.elementDecode(
                    element("order", null, List.of(child("customer", "Ann", false)), Map.of()), null, 0);

            assertThat(value).isEqualTo(Map.of("customer", List.of("Ann")));
        }

        @Test
        void characterDataNeedsAPrefix() {
            List<ContentItem> content = List.of(
                    new ContentItem.CharData(0, "Hi "), child("b", "there", false), new ContentItem.CharData(1, "!"));

            assertThat(converter.elementDecode(element("p", null, content, Map.of()), null, 0))
                    .isEqualTo(Map.of("b", "there"));
            assertThat(new DefaultConverter(ConverterOptions.builder().cdataPrefix("#").build())
                    .elementDecode(element("p", null, content, Map.of()), null, 0))
                    .isEqualTo(Map.of("#0", "Hi ", "b", "there", "#1", "!"));
        }

        @Test
        void attributesCanBeDropped() {
            DefaultConverter noAttributes = new DefaultConverter(ConverterOptions.builder().attrPrefix(null).build());

            assertThat(noAttributes.elementDecode(element("price", "9.99", List.of(), Map.of(new QName("c"), "EUR")), null, 0))
                    .isEqualTo("9.99");
        }

        @Test
        void preservedRootIsWrapped() {
            DefaultConverter preserving = new DefaultConverter(ConverterOptions.builder().preserveRoot(true).build());

            assertThat(preserving.elementDecode(element("note", "hi", List.of(), Map.of()), null, 0))
                    .isEqualTo(Map.of("note", "hi"));
            assertThat(preserving.elementDecode(element("note", "hi", List.of(), Map.of()), null, 1)).isEqualTo("hi");
        }
    }

    @Nested
    @DisplayName("elementEncode")
    class Encode {

        private final DefaultConverter converter = new DefaultConverter(ConverterOptions.builder()
                .cdataPrefix("#")
                .namespaces(Map.of("po", PO))
                .build());

        @Test
        void scalarBecomesText() {
            ElementData data = converter.elementEncode(42, null, 1);

            assertThat(data.text()).isEqualTo(42);
            assertThat(data.content()).isEmpty();
            assertThat(data.attributes()).isEmpty();
        }

        @Test
        void mapKeysAreSplitByPrefix() {
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("@id", 7);
            value.put("$", "text");
            value.put("#1", " tail");
            value.put("po:item", List.of("a", "b"));

            ElementData data = converter.elementEncode(value, null, 0);

            assertThat(data.text()).isEqualTo("text");
            assertThat(data.attributes()).containsExactly(Map.entry(new QName("id"), 7));
            assertThat(data.content()).containsExactly(
                    new ContentItem.CharData(1, " tail"),
                    new ContentItem.Child(new QName(PO, "item"), List.of("a", "b"), null, true));
        }

        @Test
        void preservedRootMustBeASingleEntryMap() {
            DefaultConverter preserving = new DefaultConverter(ConverterOptions.builder().preserveRoot(true).build());

            assertThat(preserving.elementEncode(Map.of("note", "hi"), null, 0).text()).isEqualTo("hi");
            assertThatThrownBy(() -> preserving.elementEncode("hi", null, 0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("a preserved root must be a map with a single entry");
        }

        @Test
        void malformedCharacterDataKey() {
            assertThatThrownBy(() -> converter.elementEncode(Map.of("#x", "?"), null, 0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("malformed character data key '#x'");
        }
    }

    @Nested
    @DisplayName("names")
    class Names {

        private final DefaultConverter converter = new DefaultConverter(ConverterOptions.builder()
                .namespaces(Map.of("", PO, "ext", "urn:ext"))
                .build());

        @Test
        void render() {
            assertThat(converter.render(new QName(PO, "order"))).isEqualTo("order");
            assertThat(converter.render(new QName("urn:ext", "flag"))).isEqualTo("ext:flag");
            assertThat(converter.render(new QName("urn:other", "x"))).isEqualTo("{urn:other}x");
            assertThat(converter.render(new QName("plain"))).isEqualTo("plain");
        }

        @Test
        void unprefixedElementNamesTakeTheDefaultNamespace() {
            assertThat(converter.parse("order", true)).isEqualTo(new QName(PO, "order"));
            assertThat(converter.parse("id", false)).isEqualTo(new QName("id"));
            assertThat(converter.parse("ext:flag", false)).isEqualTo(new QName("urn:ext", "flag"));
            assertThat(converter.parse("{urn:other}x", true)).isEqualTo(new QName("urn:other", "x"));
        }

        @Test
        void unknownPrefix() {
            assertThatThrownBy(() -> converter.parse("zz:x", true))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("unknown namespace prefix 'zz' in 'zz:x'");
        }
    }

    @Test
    void cdataAndAttributePrefixesMustDiffer() {
        assertThatThrownBy(() -> ConverterOptions.builder().attrPrefix("#").cdataPrefix("#").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
