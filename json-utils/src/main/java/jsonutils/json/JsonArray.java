package jsonutils.json;

import java.util.List;

/// The interface that represents a JSON array.
public non-sealed interface JsonArray extends JsonNode {

    /// {@return an unmodifiable list of the elements of this array, in source order}
    @Override
    List<JsonNode> elements();

    @Override
    default JsonKind kind() {
        return JsonKind.ARRAY;
    }
}
