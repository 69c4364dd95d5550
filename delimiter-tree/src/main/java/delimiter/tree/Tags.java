package delimiter.tree;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for labeled delimiters.
///
/// A close delimiter matches only the innermost open delimiter with an equal label:
/// ```java
/// List<TagAst.Token> tokens = List.of(
///     new TagAst.Open("root"),
///     new TagAst.Open("a"), new TagAst.Close("a"),
///     new TagAst.Open("b"), new TagAst.Close("b"),
///     new TagAst.Close("root"));
/// TagAst.Tree tree = Tags.parse(tokens);
/// // Nested("root", Concat(Nested("a", Empty), Nested("b", Empty)))
/// ```
///
/// Labels are compared with [String#equals]; there is no case folding or normalization.
public final class Tags {

    private static final Logger LOG = Logger.getLogger(Tags.class.getName());

    private Tags() {
        // Static utility class
    }

    /// Returns true when every close matches the label of the innermost open and no open is left over.
    ///
    /// @param tokens the tokens in document order
    /// @return whether the tokens are balanced; the empty list is balanced
    /// @throws NullPointerException if tokens or any token is null
    public static boolean isBalanced(List<TagAst.Token> tokens) {
        final var balanced = BalanceValidator.tagsBalanced(tokens);
        LOG.fine(() -> "isBalanced over " + tokens.size() + " tokens: " + balanced);
        return balanced;
    }

    /// Builds the tree for a balanced token list.
    ///
    /// @param tokens the tokens in document order
    /// @return the tree; [TagAst#EMPTY] for the empty list
    /// @throws DelimiterParseException if the tokens are not balanced
    /// @throws NullPointerException if tokens or any token is null
    public static TagAst.Tree parse(List<TagAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        LOG.fine(() -> "Parsing " + tokens.size() + " labeled tokens");
        try {
            return TreeBuilder.buildTags(tokens);
        } catch (DelimiterParseException e) {
            LOG.fine(() -> "Parse failed: " + e.getMessage());
            throw e;
        }
    }

    /// Builds the tree, returning parse failures as a value.
    public static ParseResult<TagAst.Tree> tryParse(List<TagAst.Token> tokens) {
        return ParseResult.of(() -> parse(tokens));
    }

    /// Returns the tokens that [#parse] would turn back into `tree`.
    public static List<TagAst.Token> flatten(TagAst.Tree tree) {
        return TreeFlattener.flatten(tree);
    }

    /// Returns an indented outline of `tree` using two spaces per level.
    public static String toDisplayString(TagAst.Tree tree) {
        return toDisplayString(tree, 2);
    }

    /// Returns an indented outline of `tree`.
    ///
    /// @throws IllegalArgumentException if indent is negative
    public static String toDisplayString(TagAst.Tree tree, int indent) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        return TreePrinter.toDisplayString(tree, indent);
    }
}
