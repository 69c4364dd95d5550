package delimiter.tree.text;

import delimiter.tree.TagAst;
import delimiter.tree.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts between labeled delimiter text and [TagAst.Token] lists.
///
/// A label is the longest run of characters other than `(` and `)` and belongs to the
/// delimiter immediately before it: `(h1` opens `h1`, `)h1` closes `h1`, and `()` is an
/// open and a close with empty labels.
///
/// The label is written after both delimiters, so `Nested("h1", Empty)` renders as
/// `(h1)h1` and `Nested("a", Nested("b", Empty))` as `(a(b)b)a`.
public final class TagText {

    private static final Logger LOG = Logger.getLogger(TagText.class.getName());

    private TagText() {}

    /// Scans `text` into labeled tokens.
    ///
    /// @throws DelimiterEncodingException if the text does not start with `(` or `)`
    public static List<TagAst.Token> scan(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.finer(() -> "Scanning " + text.length() + " characters");
        final var tokens = new ArrayList<TagAst.Token>();
        int pos = 0;
        while (pos < text.length()) {
            final char delimiter = text.charAt(pos);
            if (!isDelimiter(delimiter)) {
                throw new DelimiterEncodingException("Expected '(' or ')'", text, pos);
            }
            final int start = ++pos;
            while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
                pos++;
            }
            final var label = text.substring(start, pos);
            tokens.add(delimiter == '(' ? new TagAst.Open(label) : new TagAst.Close(label));
        }
        return List.copyOf(tokens);
    }

    /// Renders tokens as text, the inverse of [#scan].
    ///
    /// @throws IllegalArgumentException if a label contains `(` or `)`, which [#scan] could not read back
    public static String render(List<TagAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final var sb = new StringBuilder();
        for (final var token : tokens) {
            final var label = token.label();
            if (label.indexOf('(') >= 0 || label.indexOf(')') >= 0) {
                throw new IllegalArgumentException("label must not contain '(' or ')': " + label);
            }
            sb.append(token instanceof TagAst.Open ? '(' : ')').append(label);
        }
        return sb.toString();
    }

    /// Renders a tree as text.
    public static String render(TagAst.Tree tree) {
        return render(Tags.flatten(tree));
    }

    /// Scans and builds in one step.
    ///
    /// @throws DelimiterEncodingException if the text does not start with a delimiter
    /// @throws delimiter.tree.DelimiterParseException if the delimiters are not balanced
    public static TagAst.Tree parse(String text) {
        return Tags.parse(scan(text));
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')';
    }
}
