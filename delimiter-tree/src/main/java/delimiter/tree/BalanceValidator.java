package delimiter.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Single-pass balance checks. Both variants stop at the first violation and never throw
/// for a non-null list of non-null tokens.
final class BalanceValidator {

    private static final Logger LOG = Logger.getLogger(BalanceValidator.class.getName());

    private BalanceValidator() {}

    /// Depth-counting check for unlabeled delimiters.
    static boolean parensBalanced(List<ParenAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            final var token = Objects.requireNonNull(tokens.get(i), "token must not be null");
            depth += token == ParenAst.Token.OPEN ? 1 : -1;
            if (depth < 0) {
                final int at = i;
                LOG.finer(() -> "Unbalanced: depth below zero at token " + at);
                return false;
            }
        }
        final int finalDepth = depth;
        LOG.finer(() -> "Final depth " + finalDepth + " after " + tokens.size() + " tokens");
        return depth == 0;
    }

    /// Label-stack check for labeled delimiters.
    static boolean tagsBalanced(List<TagAst.Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final var pending = new ArrayList<String>();
        for (int i = 0; i < tokens.size(); i++) {
            final var token = Objects.requireNonNull(tokens.get(i), "token must not be null");
            if (token instanceof TagAst.Open open) {
                pending.add(open.label());
                continue;
            }
            if (pending.isEmpty()) {
                final int at = i;
                LOG.finer(() -> "Unbalanced: close with nothing open at token " + at);
                return false;
            }
            final var top = pending.remove(pending.size() - 1);
            if (!top.equals(token.label())) {
                final int at = i;
                LOG.finer(() -> "Unbalanced: expected '" + top + "' but found '" + token.label() + "' at token " + at);
                return false;
            }
        }
        return pending.isEmpty();
    }
}
