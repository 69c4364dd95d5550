package delimiter.tree;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for plain, unlabeled parentheses.
///
/// Usage:
/// ```java
/// List<ParenAst.Token> tokens = List.of(OPEN, OPEN, CLOSE, OPEN, CLOSE, CLOSE);
/// if (Parens.isBalanced(tokens)) {
///     ParenAst.Tree tree = Parens.parse(tokens);
///     // Nested(Concat(Nested(Empty), Nested(Empty)))
///     assert Parens.flatten(tree).equals(tokens);
/// }
/// ```
///
/// [#isBalanced] and [#tryParse] agree on every input: a token list is balanced exactly when
/// it builds. Prefer [#isBalanced] when only the answer is needed.
public final class Parens {

    private static final Logger LOG = Logger.getLogger(Parens.class.getName());

    private Parens() {
        // Static utility class
    }

    /// Returns true when every close matches an earlier open and no open is left over.
    ///
    /// @param tokens the tokens in document order
    /// @return whether the tokens are balanced; the empty list is balanced
    /// @throws NullPointerException if tokens or any token is null
    public static boolean isBalanced(List<ParenAst.Token> tokens) {
        final var balanced = BalanceValidator.parensBalanced(tokens);
        LOG.fine(() -> "isBalanced over " + tokens.size() + " tokens: " + balanced);
        return balanced;
    }

    /// Builds the tree for a balanced token list.
    ///
    /// @param tokens the tokens in document order
    /// @return the tree; [ParenAst#EMPTY] for the empty list
    /// @throws DelimiterParseException if the tokens are not balanced
    /// @throws NullPointerException if tokens or any token is null
    public static ParenAst.Tree parse(List<ParenAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        LOG.fine(() -> "Parsing " + tokens.size() + " unlabeled tokens");
        try {
            return TreeBuilder.buildParens(tokens);
        } catch (DelimiterParseException e) {
            LOG.fine(() -> "Parse failed: " + e.getMessage());
            throw e;
        }
    }

    /// Builds the tree, returning parse failures as a value.
    ///
    /// @param tokens the tokens in document order
    /// @return a [ParseResult.Success] holding the tree or a [ParseResult.Failure] holding the error
    public static ParseResult<ParenAst.Tree> tryParse(List<ParenAst.Token> tokens) {
        return ParseResult.of(() -> parse(tokens));
    }

    /// Returns the tokens that [#parse] would turn back into `tree`.
    ///
    /// @param tree the tree to linearize
    /// @return an unmodifiable token list in document order
    public static List<ParenAst.Token> flatten(ParenAst.Tree tree) {
        return TreeFlattener.flatten(tree);
    }

    /// Returns an indented outline of `tree` using two spaces per level.
    public static String toDisplayString(ParenAst.Tree tree) {
        return toDisplayString(tree, 2);
    }

    /// Returns an indented outline of `tree`.
    ///
    /// @param tree the tree to print
    /// @param indent spaces per nesting level, zero or more
    /// @throws IllegalArgumentException if indent is negative
    public static String toDisplayString(ParenAst.Tree tree, int indent) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        return TreePrinter.toDisplayString(tree, indent);
    }
}
