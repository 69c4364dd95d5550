package delimiter.tree;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds trees from token lists in a single forward pass over a [WorkingStack].
///
/// No recursion is keyed to nesting depth: an input nested a million levels deep costs heap,
/// not call stack.
final class TreeBuilder {

    private static final Logger LOG = Logger.getLogger(TreeBuilder.class.getName());

    private TreeBuilder() {}

    /// Builds an unlabeled tree.
    ///
    /// @throws DelimiterParseException on an unmatched close or an unclosed open
    static ParenAst.Tree buildParens(List<ParenAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final var stack = new WorkingStack<ParenAst.Tree>();
        for (int i = 0; i < tokens.size(); i++) {
            final var token = Objects.requireNonNull(tokens.get(i), "token must not be null");
            if (token == ParenAst.Token.OPEN) {
                stack.pushOpen(null, i);
                continue;
            }
            final var closed = stack.popToOpen(i);
            final var content = WorkingStack.foldRight(closed.content(), ParenAst.EMPTY, ParenAst.Concat::new);
            stack.pushCompleted(new ParenAst.Nested(content));
            logStep(i, stack);
        }
        return WorkingStack.foldRight(stack.finish(), ParenAst.EMPTY, ParenAst.Concat::new);
    }

    /// Builds a labeled tree.
    ///
    /// @throws DelimiterParseException on an unmatched close, a label mismatch or an unclosed open
    static TagAst.Tree buildTags(List<TagAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final var stack = new WorkingStack<TagAst.Tree>();
        for (int i = 0; i < tokens.size(); i++) {
            final var token = Objects.requireNonNull(tokens.get(i), "token must not be null");
            if (token instanceof TagAst.Open open) {
                stack.pushOpen(open.label(), i);
                continue;
            }
            final var closed = stack.popToOpen(i);
            final var expected = closed.marker().label();
            if (!expected.equals(token.label())) {
                throw DelimiterParseException.mismatchedLabel(i, expected, token.label());
            }
            final var content = WorkingStack.foldRight(closed.content(), TagAst.EMPTY, TagAst.Concat::new);
            stack.pushCompleted(new TagAst.Nested(expected, content));
            logStep(i, stack);
        }
        return WorkingStack.foldRight(stack.finish(), TagAst.EMPTY, TagAst.Concat::new);
    }

    private static void logStep(int position, WorkingStack<?> stack) {
        LOG.finer(() -> "Closed at token " + position + ", stack size " + stack.size());
    }
}
