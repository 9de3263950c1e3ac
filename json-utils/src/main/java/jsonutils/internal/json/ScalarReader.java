package jsonutils.internal.json;

import java.math.BigDecimal;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import jsonutils.json.InvalidJsonException;
import jsonutils.json.JsonNode;
import jsonutils.json.JsonNumber;
import jsonutils.json.JsonString;

/// Reads string, number, boolean and null literals at the cursor.
///
/// A string read leaves the cursor on its closing quote. Number, boolean and
/// null reads consume through to the following `,`, `}` or `]` (or the end of
/// input) and leave the cursor there.
final class ScalarReader {

    private static final Logger LOG = Logger.getLogger(ScalarReader.class.getName());

    private static final Pattern NUMBER = Pattern.compile("-?[0-9]*(\\.[0-9]+)?([eE][-+]?[0-9]+)?");

    private final Cursor cursor;

    ScalarReader(Cursor cursor) {
        this.cursor = cursor;
    }

    JsonString readString() {
        final int startLine = cursor.line();
        final String value = readStringBody();
        LOG.finest(() -> "String at line " + startLine + ": " + value);
        return new JsonStringImpl(value, startLine);
    }

    /// Reads from the opening quote at the cursor through the closing quote,
    /// with space-skipping off for the body.
    String readStringBody() {
        final int startLine = cursor.line();
        final var sb = new StringBuilder();
        cursor.skipSpaces(false);
        try {
            while (true) {
                cursor.advance();
                if (cursor.exhausted()) {
                    throw new InvalidJsonException(cursor.line(),
                            "unterminated string starting at line " + startLine);
                }
                final char c = cursor.current();
                if (c == '"') {
                    return sb.toString();
                }
                sb.append(c == '\\' ? readEscape() : c);
            }
        } finally {
            cursor.skipSpaces(true);
        }
    }

    JsonNumber readNumber() {
        final int startLine = cursor.line();
        final String text = readLiteral();
        if (text.isEmpty()) {
            throw cursor.unexpected("a value");
        }
        if (!NUMBER.matcher(text).matches()) {
            throw new InvalidJsonException(startLine, "malformed number '" + text + "'");
        }
        final Number value = toNumber(text, startLine);
        LOG.finest(() -> "Number at line " + startLine + ": " + value);
        return new JsonNumberImpl(value, startLine);
    }

    JsonNode readBooleanOrNull() {
        final int startLine = cursor.line();
        final String text = readLiteral();
        LOG.finest(() -> "Literal at line " + startLine + ": " + text);
        return switch (text) {
            case "true" -> new JsonBooleanImpl(true, startLine);
            case "false" -> new JsonBooleanImpl(false, startLine);
            case "null" -> new JsonNullImpl(startLine);
            default -> throw new InvalidJsonException(cursor.line(),
                    "expected true, false or null but found '" + text + "'");
        };
    }

    private char readEscape() {
        cursor.advance();
        if (cursor.exhausted()) {
            throw new InvalidJsonException(cursor.line(), "unterminated escape sequence");
        }
        final char c = cursor.current();
        return switch (c) {
            case '"', '\\', '/' -> c;
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'u' -> readUnicodeEscape();
            default -> throw new InvalidJsonException(cursor.line(), "illegal escape sequence '\\" + c + "'");
        };
    }

    private char readUnicodeEscape() {
        int codeUnit = 0;
        for (int i = 0; i < 4; i++) {
            cursor.advance();
            if (cursor.exhausted()) {
                throw new InvalidJsonException(cursor.line(), "incomplete \\u escape");
            }
            final int digit = hexValue(cursor.current());
            if (digit < 0) {
                throw new InvalidJsonException(cursor.line(),
                        "illegal hex digit '" + cursor.current() + "' in \\u escape");
            }
            codeUnit = (codeUnit << 4) | digit;
        }
        return (char) codeUnit;
    }

    private String readLiteral() {
        final var sb = new StringBuilder();
        while (!cursor.exhausted() && !isDelimiter(cursor.current())) {
            sb.append(cursor.current());
            cursor.advance();
        }
        return sb.toString().trim();
    }

    private static Number toNumber(String text, int line) {
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                LOG.finest(() -> "Literal " + text + " is outside int range");
            }
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new InvalidJsonException(line, "malformed number '" + text + "'");
        }
    }

    private static boolean isDelimiter(char c) {
        return c == ',' || c == '}' || c == ']';
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
