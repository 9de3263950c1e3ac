package jsonutils.json;

/// The interface that represents the JSON literal `null`.
public non-sealed interface JsonNull extends JsonNode {

    @Override
    default JsonKind kind() {
        return JsonKind.NULL;
    }
}
