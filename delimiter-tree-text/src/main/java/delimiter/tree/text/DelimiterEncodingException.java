package delimiter.tree.text;

/// Exception thrown when text cannot be scanned into delimiter tokens.
public final class DelimiterEncodingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final String text;

    /// Creates a new encoding exception with position information.
    public DelimiterEncodingException(String message, String text, int position) {
        super(formatMessage(message, text, position));
        this.position = position;
        this.text = text;
    }

    /// Returns the character offset of the offending character.
    public int position() {
        return position;
    }

    /// Returns the text that was being scanned.
    public String text() {
        return text;
    }

    private static String formatMessage(String message, String text, int position) {
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at position ").append(position);
        if (position < text.length()) {
            sb.append(" (near '").append(text.charAt(position)).append("')");
        }
        return sb.toString();
    }
}
