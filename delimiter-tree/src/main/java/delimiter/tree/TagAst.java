package delimiter.tree;

import java.util.Objects;

/// Token and tree model for labeled delimiters, the shape of markup open and close tags.
///
/// Labels are compared with [String#equals] only. The empty label is a valid label.
///
/// ## Node Types
/// - [Empty]: no enclosed content
/// - [Nested]: one matched `Open(label)` / `Close(label)` pair around its child
/// - [Concat]: two siblings side by side, left before right
public interface TagAst {

    /// A labeled delimiter.
    sealed interface Token permits Open, Close {

        /// The label this delimiter carries.
        String label();
    }

    /// Opens a region named `label`.
    record Open(String label) implements Token {
        public Open {
            Objects.requireNonNull(label, "label must not be null");
        }
    }

    /// Closes the innermost open region, which must carry the same `label`.
    record Close(String label) implements Token {
        public Close {
            Objects.requireNonNull(label, "label must not be null");
        }
    }

    /// A node in a parsed tag tree.
    sealed interface Tree permits Empty, Nested, Concat {}

    /// No enclosed content. Use [#EMPTY].
    record Empty() implements Tree {}

    /// Shared empty tree.
    Empty EMPTY = new Empty();

    /// A matched open/close pair labeled `label` wrapping `child`.
    ///
    /// @param label the label shared by the open and the close delimiter
    /// @param child the enclosed content
    record Nested(String label, Tree child) implements Tree {
        public Nested {
            Objects.requireNonNull(label, "label must not be null");
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
