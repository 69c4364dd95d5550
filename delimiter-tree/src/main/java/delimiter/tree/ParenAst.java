package delimiter.tree;

import java.util.Objects;

/// Token and tree model for plain, unlabeled parentheses.
///
/// A document is a list of [Token] values in reading order. A balanced document
/// parses into a [Tree]:
/// - [Empty]: no enclosed content
/// - [Nested]: one matched `(` `)` pair around its child
/// - [Concat]: two siblings side by side, left before right
///
/// Sibling runs longer than two are right-associated chains of [Concat], so
/// `()()()` is `Concat(Nested(Empty), Concat(Nested(Empty), Nested(Empty)))`.
public interface ParenAst {

    /// An unlabeled delimiter.
    enum Token {
        OPEN,
        CLOSE
    }

    /// A node in a parsed parenthesis tree.
    sealed interface Tree permits Empty, Nested, Concat {}

    /// No enclosed content. Use [#EMPTY].
    record Empty() implements Tree {}

    /// Shared empty tree.
    Empty EMPTY = new Empty();

    /// One matched open/close pair wrapping `child`.
    record Nested(Tree child) implements Tree {
        public Nested {
            Objects.requireNonNull(child, "child must not be null");
        }
    }

    /// Two subtrees at the same nesting level in document order.
    record Concat(Tree left, Tree right) implements Tree {
        public Concat {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }
}
