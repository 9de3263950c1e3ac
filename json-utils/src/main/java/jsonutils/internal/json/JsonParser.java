package jsonutils.internal.json;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import jsonutils.json.InvalidJsonException;
import jsonutils.json.JsonArray;
import jsonutils.json.JsonNode;
import jsonutils.json.JsonObject;
import jsonutils.json.JsonParserOptions;

/// Single-pass recursive-descent parser producing a {@link JsonNode} tree.
///
/// The current character selects the production: `{` an object, `[` an array,
/// `"` a string, `t`/`f`/`n` a boolean or null, and anything else a number.
/// Object, array and string productions leave the cursor on their own closing
/// character; the caller advances past it before looking for a delimiter.
///
/// A parser reads its input once and can be used for a single {@link #parse()}.
/// Instances are not thread safe.
public final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private final Cursor cursor;
    private final ScalarReader scalars;
    private final ColonValidator colon;
    private final int maxDepth;
    private int depth;
    private boolean used;

    public JsonParser(String in) {
        this(in, JsonParserOptions.defaults());
    }

    public JsonParser(String in, JsonParserOptions options) {
        this(new StringReader(Objects.requireNonNull(in)), options);
    }

    public JsonParser(InputStream in) {
        this(in, JsonParserOptions.defaults());
    }

    public JsonParser(InputStream in, JsonParserOptions options) {
        this(InputDecoder.decode(Objects.requireNonNull(in)), options);
    }

    public JsonParser(Reader in) {
        this(in, JsonParserOptions.defaults());
    }

    /// Creates a parser over `in` and primes it with the first character.
    public JsonParser(Reader in, JsonParserOptions options) {
        Objects.requireNonNull(in);
        this.maxDepth = Objects.requireNonNull(options).maxDepth();
        this.cursor = new Cursor(in instanceof BufferedReader || in instanceof StringReader
                ? in : new BufferedReader(in));
        this.scalars = new ScalarReader(cursor);
        this.colon = new ColonValidator(cursor);
    }

    /// Parses the whole input.
    ///
    /// @return the root node, of any kind
    /// @throws InvalidJsonException at the first grammar violation, or if
    ///         anything other than whitespace follows the root value
    /// @throws IllegalStateException if this parser has already been used
    public JsonNode parse() {
        if (used) {
            throw new IllegalStateException("JsonParser instances are single use");
        }
        used = true;
        LOG.fine(() -> "Parsing JSON document, maxDepth=" + maxDepth);

        final JsonNode root = readValue();
        if (root.kind().endsOnOwnDelimiter()) {
            cursor.advance();
        }
        if (!cursor.exhausted()) {
            throw cursor.unexpected("end of input after the root value");
        }

        LOG.fine(() -> "Parsed " + root.kind() + " root spanning lines 1-" + cursor.line());
        return root;
    }

    JsonNode readValue() {
        if (cursor.exhausted()) {
            throw cursor.unexpected("a value");
        }
        return switch (cursor.current()) {
            case '{' -> readObject();
            case '[' -> readArray();
            case '"' -> scalars.readString();
            case 't', 'f', 'n' -> scalars.readBooleanOrNull();
            default -> scalars.readNumber();
        };
    }

    private JsonObject readObject() {
        final int startLine = cursor.line();
        enterContainer(startLine);
        LOG.finer(() -> "Object at line " + startLine);

        final var members = new LinkedHashMap<String, JsonNode>();
        final var duplicates = new LinkedHashMap<String, List<Integer>>();
        cursor.advance();
        if (!cursor.is('}')) {
            while (true) {
                if (!cursor.is('"')) {
                    throw cursor.unexpected("'\"' to start an object key");
                }
                final int keyLine = cursor.line();
                final String key = scalars.readStringBody();
                colon.expectColonAndValueStart(true);
                final JsonNode value = readValue();

                if (members.containsKey(key)) {
                    duplicates.computeIfAbsent(key, k -> new ArrayList<>()).add(keyLine);
                    LOG.finer(() -> "Duplicate key \"" + key + "\" at line " + keyLine
                            + ", keeping the value from line " + members.get(key).sourceLine());
                } else {
                    members.put(key, value);
                }

                if (value.kind().endsOnOwnDelimiter()) {
                    cursor.advance();
                }
                if (cursor.is(',')) {
                    cursor.advance();
                    continue;
                }
                if (cursor.is('}')) {
                    break;
                }
                throw cursor.unexpected("',' or '}' after object member");
            }
        }

        depth--;
        return new JsonObjectImpl(members, duplicates, startLine);
    }

    private JsonArray readArray() {
        final int startLine = cursor.line();
        enterContainer(startLine);
        LOG.finer(() -> "Array at line " + startLine);

        final var elements = new ArrayList<JsonNode>();
        cursor.advance();
        if (!cursor.is(']')) {
            while (true) {
                final JsonNode element = readValue();
                elements.add(element);
                if (element.kind().endsOnOwnDelimiter()) {
                    cursor.advance();
                }
                if (!cursor.is(',')) {
                    break;
                }
                cursor.advance();
            }
            if (!cursor.is(']')) {
                throw cursor.unexpected("',' or ']' after array element");
            }
        }

        depth--;
        return new JsonArrayImpl(elements, startLine);
    }

    private void enterContainer(int line) {
        if (++depth > maxDepth) {
            throw new InvalidJsonException(line, "nesting depth exceeds " + maxDepth);
        }
    }
}
