package jsonutils.json;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jsonutils.internal.json.JsonParser;

/// This class provides static methods for producing a {@link JsonNode} tree
/// from JSON text and for converting a tree to plain Java objects.
///
/// Every `parse` method reads the whole document and either returns its root
/// node or throws {@link InvalidJsonException} carrying the line of the first
/// grammar violation. Objects with duplicate keys do not fail the parse; see
/// {@link JsonObject#duplicateLines(String)}.
///
/// ## Example Usage
/// ```java
/// JsonNode doc = Json.parse("{\"name\":\"John\",\"age\":30}");
/// Map<String, Object> data = (Map<String, Object>) Json.toUntyped(doc);
/// ```
public final class Json {

    private Json() {
        throw new AssertionError("Json cannot be instantiated");
    }

    /// Parses the given JSON text with {@link JsonParserOptions#defaults()}.
    ///
    /// @param in the JSON text. Non-null.
    /// @return the root node, of any kind
    /// @throws InvalidJsonException if the text does not conform to the grammar
    /// @throws NullPointerException if `in` is `null`
    public static JsonNode parse(String in) {
        return parse(in, JsonParserOptions.defaults());
    }

    /// Parses the given JSON text.
    ///
    /// @param in the JSON text. Non-null.
    /// @param options the parse options. Non-null.
    /// @return the root node, of any kind
    /// @throws InvalidJsonException if the text does not conform to the grammar
    public static JsonNode parse(String in, JsonParserOptions options) {
        Objects.requireNonNull(in);
        return new JsonParser(in, options).parse();
    }

    /// Parses JSON text read from `in`. The reader is consumed but not closed.
    ///
    /// @throws InvalidJsonException if the text does not conform to the grammar
    /// @throws UncheckedIOException if reading fails
    public static JsonNode parse(Reader in) {
        return parse(in, JsonParserOptions.defaults());
    }

    /// Parses JSON text read from `in` with the given options.
    public static JsonNode parse(Reader in, JsonParserOptions options) {
        Objects.requireNonNull(in);
        return new JsonParser(in, options).parse();
    }

    /// Parses JSON text decoded from a byte stream. A leading byte-order mark
    /// selects the charset; otherwise the bytes are read as UTF-8. The stream is
    /// consumed but not closed.
    ///
    /// @throws InvalidJsonException if the text does not conform to the grammar
    /// @throws UncheckedIOException if reading fails
    public static JsonNode parse(InputStream in) {
        return parse(in, JsonParserOptions.defaults());
    }

    /// Parses JSON text decoded from a byte stream with the given options.
    public static JsonNode parse(InputStream in, JsonParserOptions options) {
        Objects.requireNonNull(in);
        return new JsonParser(in, options).parse();
    }

    /// Parses the JSON file at `file`, detecting its charset as
    /// {@link #parse(InputStream)} does.
    ///
    /// @throws IOException if the file cannot be opened or read
    /// @throws InvalidJsonException if the text does not conform to the grammar
    public static JsonNode parse(Path file) throws IOException {
        return parse(file, JsonParserOptions.defaults());
    }

    /// Parses the JSON file at `file` with the given options.
    public static JsonNode parse(Path file, JsonParserOptions options) throws IOException {
        Objects.requireNonNull(file);
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, options);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /// {@return an `Object` created from the given `src` `JsonNode`}
    /// The mapping follows the table below. Source lines and duplicate-key
    /// lines are not carried over.
    ///
    /// | JsonNode | Untyped Object |
    /// |----------|----------------|
    /// | `JsonObject` | `Map<String, Object>` (insertion ordered) |
    /// | `JsonArray` | `List<Object>` |
    /// | `JsonString` | `String` |
    /// | `JsonNumber` | `Integer` or `BigDecimal` |
    /// | `JsonBoolean` | `Boolean` |
    /// | `JsonNull` | `null` |
    ///
    /// @param src the node to convert. Non-null.
    public static Object toUntyped(JsonNode src) {
        Objects.requireNonNull(src);
        switch (src.kind()) {
            case OBJECT: {
                final Map<String, Object> map = new LinkedHashMap<>();
                src.members().forEach((key, value) -> map.put(key, toUntyped(value)));
                return map;
            }
            case ARRAY: {
                final List<Object> list = new ArrayList<>(src.elements().size());
                for (JsonNode element : src.elements()) {
                    list.add(toUntyped(element));
                }
                return list;
            }
            case STRING:
                return src.string();
            case NUMBER:
                return src.number().value();
            case BOOLEAN:
                return src.bool();
            case NULL:
            default:
                return null;
        }
    }
}
