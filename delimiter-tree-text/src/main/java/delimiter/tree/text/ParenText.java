package delimiter.tree.text;

import delimiter.tree.ParenAst;
import delimiter.tree.Parens;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts between `(`/`)` strings and [ParenAst.Token] lists.
///
/// The alphabet is exactly `(` and `)`. Whitespace is not skipped.
public final class ParenText {

    private static final Logger LOG = Logger.getLogger(ParenText.class.getName());

    private ParenText() {}

    /// Scans `text` into tokens, one per character.
    ///
    /// @throws DelimiterEncodingException at the first character that is not `(` or `)`
    public static List<ParenAst.Token> scan(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.finer(() -> "Scanning " + text.length() + " characters");
        final var tokens = new ArrayList<ParenAst.Token>(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            tokens.add(switch (c) {
                case '(' -> ParenAst.Token.OPEN;
                case ')' -> ParenAst.Token.CLOSE;
                default -> throw new DelimiterEncodingException("Unexpected character", text, i);
            });
        }
        return List.copyOf(tokens);
    }

    /// Renders tokens as text, the inverse of [#scan].
    public static String render(List<ParenAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final var sb = new StringBuilder(tokens.size());
        for (final var token : tokens) {
            sb.append(token == ParenAst.Token.OPEN ? '(' : ')');
        }
        return sb.toString();
    }

    /// Renders a tree as text.
    public static String render(ParenAst.Tree tree) {
        return render(Parens.flatten(tree));
    }

    /// Scans and builds in one step.
    ///
    /// @throws DelimiterEncodingException if the text contains a non-delimiter character
    /// @throws delimiter.tree.DelimiterParseException if the delimiters are not balanced
    public static ParenAst.Tree parse(String text) {
        return Parens.parse(scan(text));
    }

    /// Returns true when `text` consists only of balanced `(` and `)`.
    /// Text with any other character is not balanced.
    public static boolean isBalanced(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return Parens.isBalanced(scan(text));
        } catch (DelimiterEncodingException e) {
            LOG.fine(() -> "Not balanced: " + e.getMessage());
            return false;
        }
    }
}
