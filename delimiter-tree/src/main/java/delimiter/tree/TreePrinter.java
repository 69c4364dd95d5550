package delimiter.tree;

import java.util.ArrayDeque;

/// Indented one-node-per-line outlines of trees, for logging and debugging.
///
/// Example for `(()())`:
/// ```
/// Nested
///   Concat
///     Nested
///       Empty
///     Nested
///       Empty
/// ```
final class TreePrinter {

    private TreePrinter() {}

    private record Line(Object node, int depth) {}

    static String toDisplayString(ParenAst.Tree tree, int indent) {
        final var sb = new StringBuilder();
        final var work = new ArrayDeque<Line>();
        work.push(new Line(tree, 0));
        while (!work.isEmpty()) {
            final var line = work.pop();
            startLine(sb, line.depth() * indent);
            if (line.node() instanceof ParenAst.Nested nested) {
                sb.append("Nested");
                work.push(new Line(nested.child(), line.depth() + 1));
            } else if (line.node() instanceof ParenAst.Concat concat) {
                sb.append("Concat");
                work.push(new Line(concat.right(), line.depth() + 1));
                work.push(new Line(concat.left(), line.depth() + 1));
            } else {
                sb.append("Empty");
            }
        }
        return sb.toString();
    }

    static String toDisplayString(TagAst.Tree tree, int indent) {
        final var sb = new StringBuilder();
        final var work = new ArrayDeque<Line>();
        work.push(new Line(tree, 0));
        while (!work.isEmpty()) {
            final var line = work.pop();
            startLine(sb, line.depth() * indent);
            if (line.node() instanceof TagAst.Nested nested) {
                sb.append("Nested[").append(nested.label()).append(']');
                work.push(new Line(nested.child(), line.depth() + 1));
            } else if (line.node() instanceof TagAst.Concat concat) {
                sb.append("Concat");
                work.push(new Line(concat.right(), line.depth() + 1));
                work.push(new Line(concat.left(), line.depth() + 1));
            } else {
                sb.append("Empty");
            }
        }
        return sb.toString();
    }

    private static void startLine(StringBuilder sb, int spaces) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(" ".repeat(spaces));
    }
}
