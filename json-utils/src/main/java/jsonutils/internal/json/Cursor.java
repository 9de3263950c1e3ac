package jsonutils.internal.json;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

import jsonutils.json.InvalidJsonException;

/// Forward-only character cursor over the input with a running line counter.
///
/// Each {@link #advance()} reads exactly one character from the underlying
/// reader and then keeps reading past carriage returns, line feeds and tabs,
/// and past spaces while space-skipping is on. Nothing is ever pushed back.
/// Once the reader is drained the cursor is {@link #exhausted()} and stays so.
final class Cursor {

    /// Placeholder held in {@link #current()} after end of input.
    static final char EOF = '\uFFFF';

    private final Reader reader;
    private char current = EOF;
    private boolean exhausted;
    private int line = 1;
    private boolean skipSpaces = true;

    /// Creates the cursor and primes it with the first meaningful character.
    Cursor(Reader reader) {
        this.reader = reader;
        advance();
    }

    char current() {
        return current;
    }

    boolean exhausted() {
        return exhausted;
    }

    /// {@return the 1-based line of the current character}
    int line() {
        return line;
    }

    /// {@return `true` if input remains and the current character is `c`}
    boolean is(char c) {
        return !exhausted && current == c;
    }

    /// Turns skipping of spaces on or off; string literal bodies run with it off.
    void skipSpaces(boolean skip) {
        this.skipSpaces = skip;
    }

    void advance() {
        readChar();
        while (!exhausted && isIgnorable(current)) {
            readChar();
        }
    }

    /// {@return a violation at the current line saying what was expected and what was found}
    InvalidJsonException unexpected(String expected) {
        final String found = exhausted ? "end of input" : "'" + current + "'";
        return new InvalidJsonException(line, "expected " + expected + " but found " + found);
    }

    private boolean isIgnorable(char c) {
        return c == '\r' || c == '\n' || c == '\t' || (skipSpaces && c == ' ');
    }

    private void readChar() {
        if (exhausted) {
            return;
        }
        final int next;
        try {
            next = reader.read();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON input at line " + line, e);
        }
        if (next < 0) {
            exhausted = true;
            current = EOF;
            return;
        }
        current = (char) next;
        if (current == '\n') {
            line++;
        }
    }
}
