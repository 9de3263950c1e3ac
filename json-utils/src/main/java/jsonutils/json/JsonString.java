package jsonutils.json;

/// The interface that represents a JSON string. Escape sequences have already
/// been resolved.
public non-sealed interface JsonString extends JsonNode {

    @Override
    String string();

    @Override
    default JsonKind kind() {
        return JsonKind.STRING;
    }
}
