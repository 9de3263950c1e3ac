package jsonutils.json;

/// Signals that the input does not conform to the accepted JSON grammar.
///
/// Every grammar violation the parser detects is reported through this one
/// exception type, distinguished only by the 1-based {@link #line()} on which
/// it was detected. Parsing stops at the first violation; no partial tree is
/// returned.
public final class InvalidJsonException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int line;
    private final String reason;

    /// Creates a new exception for a violation detected on `line`.
    /// @param line the 1-based line number
    /// @param reason a short description of the violation
    public InvalidJsonException(int line, String reason) {
        super("Invalid JSON at line " + line + ": " + reason);
        this.line = line;
        this.reason = reason;
    }

    /// {@return the 1-based line on which the violation was detected}
    public int line() {
        return line;
    }

    /// {@return the description of the violation, without the line prefix}
    public String reason() {
        return reason;
    }
}
