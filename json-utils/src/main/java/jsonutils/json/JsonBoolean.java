package jsonutils.json;

/// The interface that represents the JSON literals `true` and `false`.
public non-sealed interface JsonBoolean extends JsonNode {

    @Override
    boolean bool();

    @Override
    default JsonKind kind() {
        return JsonKind.BOOLEAN;
    }
}
