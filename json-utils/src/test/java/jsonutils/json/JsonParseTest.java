package jsonutils.json;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonParseTest extends JsonUtilsLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonParseTest.class.getName());

    @Test
    void parsesNestedDocument() {
        LOG.info(() -> "TEST: parsesNestedDocument");
        final JsonNode root = Json.parse("{\"a\": 1, \"b\": [1,2,3], \"c\": {\"d\": null}}");

        assertThat(root.kind()).isEqualTo(JsonKind.OBJECT);
        assertThat(root.members()).containsOnlyKeys("a", "b", "c");
        assertThat(root.get("a").number().value()).isEqualTo(1);
        assertThat(root.get("b").elements())
                .extracting(n -> n.number().value())
                .containsExactly(1, 2, 3);
        assertThat(root.get("c").get("d").kind()).isEqualTo(JsonKind.NULL);
    }

    @Test
    void parsesComplexDocumentWithLines() {
        LOG.info(() -> "TEST: parsesComplexDocumentWithLines");
        final String json = """
                {
                    "name": "John Doe",
                    "age": 30,
                    "isStudent": false,
                    "courses": [
                        {"title": "History", "credits": 3},
                        {"title": "Math", "credits": 4}
                    ],
                    "address": {
                        "street": "123 Main St",
                        "city": "Anytown"
                    }
                }
                """;
        final JsonNode root = Json.parse(json);

        assertThat(root.sourceLine()).isEqualTo(1);
        assertThat(root.get("name").string()).isEqualTo("John Doe");
        assertThat(root.get("name").sourceLine()).isEqualTo(2);
        assertThat(root.get("age").number().intValue()).isEqualTo(30);
        assertThat(root.get("age").sourceLine()).isEqualTo(3);
        assertThat(root.get("isStudent").bool()).isFalse();
        assertThat(root.get("isStudent").sourceLine()).isEqualTo(4);

        final JsonNode courses = root.get("courses");
        assertThat(courses.sourceLine()).isEqualTo(5);
        assertThat(courses.elements()).hasSize(2);
        assertThat(courses.element(0).get("title").string()).isEqualTo("History");
        assertThat(courses.element(1).sourceLine()).isEqualTo(7);
        assertThat(courses.element(1).get("credits").number().intValue()).isEqualTo(4);

        final JsonNode address = root.get("address");
        assertThat(address.sourceLine()).isEqualTo(9);
        assertThat(address.get("street").string()).isEqualTo("123 Main St");
        assertThat(address.get("city").sourceLine()).isEqualTo(11);
    }

    @Test
    void preservesMemberOrder() {
        LOG.info(() -> "TEST: preservesMemberOrder");
        final JsonNode root = Json.parse("{\"z\":1,\"a\":2,\"m\":3}");
        assertThat(root.members().keySet()).containsExactly("z", "a", "m");
    }

    @Test
    void firstDuplicateKeyWins() {
        LOG.info(() -> "TEST: firstDuplicateKeyWins");
        final JsonObject obj = (JsonObject) Json.parse("{\"a\":1,\"a\":2}");

        assertThat(obj.members()).hasSize(1);
        assertThat(obj.get("a").number().intValue()).isEqualTo(1);
        assertThat(obj.duplicateLines("a")).containsExactly(1);
        assertThat(obj.duplicates()).containsOnlyKeys("a");
    }

    @Test
    void duplicateLinesRecordEveryLaterOccurrence() {
        LOG.info(() -> "TEST: duplicateLinesRecordEveryLaterOccurrence");
        final JsonObject obj = (JsonObject) Json.parse("""
                {
                  "a": "first",
                  "b": true,
                  "a": {"nested": [1, 2]},
                  "a": null
                }""");

        assertThat(obj.get("a").string()).isEqualTo("first");
        assertThat(obj.get("a").sourceLine()).isEqualTo(2);
        assertThat(obj.duplicateLines("a")).containsExactly(4, 5);
        assertThat(obj.duplicateLines("b")).isEmpty();
        assertThat(obj.duplicateLines("missing")).isEmpty();
        assertThat(obj.members().keySet()).containsExactly("a", "b");
    }

    @Test
    void duplicateValueIsStillValidated() {
        LOG.info(() -> "TEST: duplicateValueIsStillValidated");
        assertThatThrownBy(() -> Json.parse("{\"a\":1,\n\"a\":[1,}"))
                .isInstanceOfSatisfying(InvalidJsonException.class, e -> assertThat(e.line()).isEqualTo(2));
    }

    @Test
    void duplicatesAreTrackedPerObject() {
        LOG.info(() -> "TEST: duplicatesAreTrackedPerObject");
        final JsonNode root = Json.parse("{\"a\":{\"x\":1},\"b\":{\"x\":2}}");
        assertThat(((JsonObject) root.get("a")).duplicates()).isEmpty();
        assertThat(((JsonObject) root.get("b")).duplicates()).isEmpty();
        assertThat(root.get("b").get("x").number().intValue()).isEqualTo(2);
    }

    @Test
    void emptyContainers() {
        LOG.info(() -> "TEST: emptyContainers");
        assertThat(Json.parse("{}").members()).isEmpty();
        assertThat(Json.parse("[]").elements()).isEmpty();
        assertThat(Json.parse("{ }").members()).isEmpty();
        assertThat(Json.parse("[\n]").elements()).isEmpty();
        assertThat(Json.parse("{\"a\":{},\"b\":[]}").get("b").elements()).isEmpty();
        assertThat(Json.parse("[[],{}]").elements()).hasSize(2);
    }

    @Test
    void scalarRoots() {
        LOG.info(() -> "TEST: scalarRoots");
        assertThat(Json.parse("42").number().value()).isEqualTo(42);
        assertThat(Json.parse("\"hi\"").string()).isEqualTo("hi");
        assertThat(Json.parse("true").bool()).isTrue();
        assertThat(Json.parse("false").bool()).isFalse();
        assertThat(Json.parse("null").isNull()).isTrue();
        assertThat(Json.parse("  7  ").number().intValue()).isEqualTo(7);
    }

    @Test
    void decodesEscapes() {
        LOG.info(() -> "TEST: decodesEscapes");
        assertThat(Json.parse("\"\\u0041\"").string()).isEqualTo("A");
        assertThat(Json.parse("\"\\n\"").string()).isEqualTo("\n");
        assertThat(Json.parse("\"\\\"\\\\\\/\\b\\f\\r\\t\"").string()).isEqualTo("\"\\/\b\f\r\t");
        assertThat(Json.parse("\"\\u00e9\\u00C9\"").string()).isEqualTo("éÉ");
        assertThat(Json.parse("\"\\ud83d\\ude00\"").string()).isEqualTo("\uD83D\uDE00");
    }

    @Test
    void stringsKeepSpacesButDropLineBreaksAndTabs() {
        LOG.info(() -> "TEST: stringsKeepSpacesButDropLineBreaksAndTabs");
        assertThat(Json.parse("\"  a b  \"").string()).isEqualTo("  a b  ");
        assertThat(Json.parse("\"a\tb\r\nc\"").string()).isEqualTo("abc");
        assertThat(Json.parse("{\"first name\": \"Ada\"}").members()).containsOnlyKeys("first name");
    }

    @Test
    void spacesOutsideStringsAreIgnoredInsideLiterals() {
        LOG.info(() -> "TEST: spacesOutsideStringsAreIgnoredInsideLiterals");
        assertThat(Json.parse("[1 2]").element(0).number().intValue()).isEqualTo(12);
        assertThat(Json.parse("[tr ue]").element(0).bool()).isTrue();
    }

    @Test
    void integralAndDecimalNumbers() {
        LOG.info(() -> "TEST: integralAndDecimalNumbers");
        final JsonNode arr = Json.parse("[0, -7, 2147483647, 2147483648, 1.5, 1e3, -0.25E-2, .5, 007]");

        assertThat(arr.element(0).number().value()).isEqualTo(0);
        assertThat(arr.element(1).number().value()).isEqualTo(-7);
        assertThat(arr.element(2).number().value()).isEqualTo(Integer.MAX_VALUE);
        assertThat(arr.element(3).number().value()).isEqualTo(new BigDecimal("2147483648"));
        assertThat(arr.element(4).number().value()).isEqualTo(new BigDecimal("1.5"));
        assertThat(arr.element(5).number().value()).isEqualTo(new BigDecimal("1e3"));
        assertThat(arr.element(6).number().value()).isEqualTo(new BigDecimal("-0.25E-2"));
        assertThat(arr.element(7).number().value()).isEqualTo(new BigDecimal("0.5"));
        assertThat(arr.element(8).number().value()).isEqualTo(7);

        assertThat(arr.element(0).number().isIntegral()).isTrue();
        assertThat(arr.element(4).number().isIntegral()).isFalse();
        assertThat(arr.element(3).number().decimalValue()).isEqualByComparingTo("2147483648");
        assertThat(arr.element(1).number().decimalValue()).isEqualByComparingTo("-7");
    }

    @Test
    void intValueOfDecimalThrows() {
        LOG.info(() -> "TEST: intValueOfDecimalThrows");
        final JsonNumber n = Json.parse("2.5").number();
        assertThatThrownBy(n::intValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void wrongKindAccessorsThrow() {
        LOG.info(() -> "TEST: wrongKindAccessorsThrow");
        final JsonNode root = Json.parse("{\"a\":[1]}");
        assertThatThrownBy(root::string)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("STRING expected")
                .hasMessageContaining("OBJECT");
        assertThatThrownBy(() -> root.get("missing")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> root.get("a").element(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> root.get("a").bool()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void treeIsUnmodifiable() {
        LOG.info(() -> "TEST: treeIsUnmodifiable");
        final JsonObject obj = (JsonObject) Json.parse("{\"a\":[1],\"a\":2}");
        assertThatThrownBy(() -> obj.members().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> obj.get("a").elements().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> obj.duplicateLines("a").add(9)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equalityIgnoresSourceLines() {
        LOG.info(() -> "TEST: equalityIgnoresSourceLines");
        final JsonNode compact = Json.parse("{\"a\":[1,\"x\",true,null]}");
        final JsonNode spread = Json.parse("{\n\"a\":\n[\n1,\n\"x\",\ntrue,\nnull\n]\n}");
        assertThat(spread).isEqualTo(compact);
        assertThat(spread.hashCode()).isEqualTo(compact.hashCode());
        assertThat(Json.parse("1")).isNotEqualTo(Json.parse("1.0"));
    }

    @Test
    void toUntypedConvertsWholeTree() {
        LOG.info(() -> "TEST: toUntypedConvertsWholeTree");
        final Object untyped = Json.toUntyped(Json.parse("{\"a\":1,\"b\":[\"x\",2.5,false,null]}"));
        assertThat(untyped).isEqualTo(Map.of(
                "a", 1,
                "b", java.util.Arrays.asList("x", new BigDecimal("2.5"), false, null)));
        assertThat(Json.toUntyped(Json.parse("null"))).isNull();
        assertThat(Json.toUntyped(Json.parse("[]"))).isEqualTo(List.of());
    }
}
