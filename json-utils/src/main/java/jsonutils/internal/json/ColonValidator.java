package jsonutils.internal.json;

/// Checks the `:` that follows an object key and the character that starts
/// the value after it.
///
/// Two legal-starter sets exist. Inside an object any value may follow the
/// colon, except that a number must begin with a digit. Outside an object only
/// a string or a container may follow. The object builder is the only caller
/// and always passes `insideObject = true`.
final class ColonValidator {

    static final String VALUE_STARTERS = "\"{[0123456789tfn";
    static final String CONTAINER_STARTERS = "\"{[";

    private final Cursor cursor;

    ColonValidator(Cursor cursor) {
        this.cursor = cursor;
    }

    /// Expects the cursor to sit on the closing quote of a key. Advances to the
    /// colon and then onto the first character of the value.
    void expectColonAndValueStart(boolean insideObject) {
        cursor.advance();
        if (!cursor.is(':')) {
            throw cursor.unexpected("':' after object key");
        }
        cursor.advance();
        final String legal = insideObject ? VALUE_STARTERS : CONTAINER_STARTERS;
        if (cursor.exhausted() || legal.indexOf(cursor.current()) < 0) {
            throw cursor.unexpected(insideObject
                    ? "a string, object, array, digit, true, false or null after ':'"
                    : "a string, object or array after ':'");
        }
    }
}
