package delimiter.tree;

/// Exception thrown when a delimiter token list cannot be built into a tree.
/// This is a runtime exception as the input is fully available and a failure is final for that call.
public final class DelimiterParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// The kind of structural failure.
    public enum Kind {
        /// A close delimiter with no open delimiter left to match it.
        UNMATCHED_CLOSE,
        /// A close delimiter whose label differs from the innermost open label.
        MISMATCHED_LABEL,
        /// Input ended before every open delimiter was closed.
        INCOMPLETE_PARSE
    }

    private final Kind kind;
    private final int position;
    private final String expected;
    private final String found;

    private DelimiterParseException(Kind kind, String message, int position, String expected, String found) {
        super(formatMessage(message, position));
        this.kind = kind;
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    static DelimiterParseException unmatchedClose(int position) {
        return new DelimiterParseException(Kind.UNMATCHED_CLOSE,
                "Close delimiter has no matching open delimiter", position, null, null);
    }

    static DelimiterParseException mismatchedLabel(int position, String expected, String found) {
        return new DelimiterParseException(Kind.MISMATCHED_LABEL,
                "Expected close label '" + expected + "' but found '" + found + "'", position, expected, found);
    }

    static DelimiterParseException incompleteParse(int position, String reason) {
        return new DelimiterParseException(Kind.INCOMPLETE_PARSE, reason, position, null, null);
    }

    /// Returns the kind of failure.
    public Kind kind() {
        return kind;
    }

    /// Returns the token index the failure was detected at.
    /// For [Kind#INCOMPLETE_PARSE] this is the index of the innermost unclosed open delimiter.
    public int position() {
        return position;
    }

    /// Returns the label of the open delimiter being closed, or null unless [Kind#MISMATCHED_LABEL].
    public String expected() {
        return expected;
    }

    /// Returns the label the close delimiter carried, or null unless [Kind#MISMATCHED_LABEL].
    public String found() {
        return found;
    }

    private static String formatMessage(String message, int position) {
        if (position < 0) {
            return message;
        }
        return message + " at token " + position;
    }
}
