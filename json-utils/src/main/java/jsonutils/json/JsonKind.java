package jsonutils.json;

/// The six kinds of value a {@link JsonNode} can hold.
public enum JsonKind {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    /// {@return `true` for the kinds whose production leaves the cursor on its
    /// own closing character (`}`, `]` or `"`)}
    public boolean endsOnOwnDelimiter() {
        return this == OBJECT || this == ARRAY || this == STRING;
    }
}
