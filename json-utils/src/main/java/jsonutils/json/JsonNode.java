package jsonutils.json;

import jsonutils.internal.json.Utils;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The interface that represents one parsed JSON value together with the
/// 1-based source line on which its production began.
///
/// A `JsonNode` is produced by {@link Json#parse(String)} and its overloads.
/// Instances are immutable once the parse that created them has returned.
///
/// Two nodes are equal when they hold the same logical value; the source line
/// takes no part in {@link Object#equals(Object)} or {@link Object#hashCode()}.
///
/// ## Example Usage
/// ```java
/// JsonNode root = Json.parse("{\"name\":\"Ada\",\"tags\":[1,2]}");
/// String name = root.get("name").string();
/// int first = root.get("tags").element(0).number().intValue();
/// ```
public sealed interface JsonNode
        permits JsonObject, JsonArray, JsonString, JsonNumber, JsonBoolean, JsonNull {

    /// {@return the kind of this node} The kind never changes after construction.
    JsonKind kind();

    /// {@return the 1-based line on which this value began in the source text}
    int sourceLine();

    /// {@return the decoded value of a `JsonString`}
    default String string() {
        throw Utils.composeTypeError(this, JsonKind.STRING);
    }

    /// {@return this node as a `JsonNumber`}
    default JsonNumber number() {
        throw Utils.composeTypeError(this, JsonKind.NUMBER);
    }

    /// {@return the value of a `JsonBoolean`}
    default boolean bool() {
        throw Utils.composeTypeError(this, JsonKind.BOOLEAN);
    }

    /// {@return the {@link JsonArray#elements() elements} of a `JsonArray`}
    default List<JsonNode> elements() {
        throw Utils.composeTypeError(this, JsonKind.ARRAY);
    }

    /// {@return the {@link JsonObject#members() members} of a `JsonObject`}
    default Map<String, JsonNode> members() {
        throw Utils.composeTypeError(this, JsonKind.OBJECT);
    }

    /// {@return the member of a `JsonObject` with the given name}
    ///
    /// @param name the member name
    /// @throws NullPointerException if `name` is `null`
    /// @throws IllegalStateException if this is not a `JsonObject` or it has
    ///         no such member
    default JsonNode get(String name) {
        Objects.requireNonNull(name);
        final JsonNode member = members().get(name);
        if (member == null) {
            throw new IllegalStateException(
                    "JsonObject member \"%s\" does not exist.".formatted(name));
        }
        return member;
    }

    /// {@return the element of a `JsonArray` at the given index}
    ///
    /// @param index the zero-based index
    /// @throws IllegalStateException if this is not a `JsonArray` or the index
    ///         is out of bounds
    default JsonNode element(int index) {
        final List<JsonNode> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new IllegalStateException(
                    "JsonArray index %d out of bounds for length %d.".formatted(index, elements.size()));
        }
        return elements.get(index);
    }

    /// {@return `true` if this node is a `JsonNull`}
    default boolean isNull() {
        return kind() == JsonKind.NULL;
    }
}
