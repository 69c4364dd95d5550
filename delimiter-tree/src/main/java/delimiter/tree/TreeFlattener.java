package delimiter.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Linearizes trees back into tokens, the inverse of [TreeBuilder].
///
/// Walks the tree with an explicit work stack holding either subtrees still to visit or
/// close tokens still to emit, so trees of any depth flatten without recursion.
final class TreeFlattener {

    private TreeFlattener() {}

    static List<ParenAst.Token> flatten(ParenAst.Tree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        final var out = new ArrayList<ParenAst.Token>();
        final var work = new ArrayDeque<Object>();
        work.push(tree);
        while (!work.isEmpty()) {
            final var next = work.pop();
            if (next instanceof ParenAst.Token token) {
                out.add(token);
            } else if (next instanceof ParenAst.Nested nested) {
                out.add(ParenAst.Token.OPEN);
                work.push(ParenAst.Token.CLOSE);
                work.push(nested.child());
            } else if (next instanceof ParenAst.Concat concat) {
                work.push(concat.right());
                work.push(concat.left());
            }
            // Empty contributes nothing
        }
        return Collections.unmodifiableList(out);
    }

    static List<TagAst.Token> flatten(TagAst.Tree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        final var out = new ArrayList<TagAst.Token>();
        final var work = new ArrayDeque<Object>();
        work.push(tree);
        while (!work.isEmpty()) {
            final var next = work.pop();
            if (next instanceof TagAst.Token token) {
                out.add(token);
            } else if (next instanceof TagAst.Nested nested) {
                out.add(new TagAst.Open(nested.label()));
                work.push(new TagAst.Close(nested.label()));
                work.push(nested.child());
            } else if (next instanceof TagAst.Concat concat) {
                work.push(concat.right());
                work.push(concat.left());
            }
        }
        return Collections.unmodifiableList(out);
    }
}
