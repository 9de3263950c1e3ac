package jsonutils.internal.json;

import jsonutils.json.JsonKind;
import jsonutils.json.JsonNode;

/// Shared helpers for the node implementations and the public API.
public final class Utils {

    private Utils() {
        throw new AssertionError("Utils cannot be instantiated");
    }

    /// {@return the error raised when an accessor for `expected` is called on a node of another kind}
    public static IllegalStateException composeTypeError(JsonNode node, JsonKind expected) {
        return new IllegalStateException("%s expected, but the node at line %d is %s."
                .formatted(expected, node.sourceLine(), node.kind()));
    }
}
