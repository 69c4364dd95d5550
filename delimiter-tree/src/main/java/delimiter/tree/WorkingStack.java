package delimiter.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BinaryOperator;

/// Array-backed LIFO used by [TreeBuilder] for the lifetime of one build call.
///
/// Holds [PendingOpen] markers for delimiters not yet closed and [Completed] runs of
/// finished sibling trees. Adjacent [Completed] items are merged as soon as they appear,
/// so a close delimiter always finds at most one run above its marker.
///
/// @param <T> the tree type being built
final class WorkingStack<T> {

    /// A stack item.
    sealed interface Item<T> permits PendingOpen, Completed {}

    /// An open delimiter waiting for its close. `label` is null for unlabeled delimiters.
    record PendingOpen<T>(String label, int position) implements Item<T> {}

    /// Finished sibling trees in document order. Never empty; the list is owned by the stack and grows on merge.
    record Completed<T>(List<T> siblings) implements Item<T> {}

    /// The marker consumed by a close together with the content it enclosed.
    record Closed<T>(PendingOpen<T> marker, List<T> content) {}

    private final ArrayList<Item<T>> items = new ArrayList<>();

    void pushOpen(String label, int position) {
        items.add(new PendingOpen<>(label, position));
    }

    /// Pushes a finished tree then merges adjacent completed runs.
    void pushCompleted(T tree) {
        final var siblings = new ArrayList<T>();
        siblings.add(tree);
        items.add(new Completed<>(siblings));
        normalize();
    }

    /// Pops the completed runs above the nearest [PendingOpen] and then the marker itself.
    ///
    /// @param position token index of the close delimiter, for error reporting
    /// @throws DelimiterParseException if no marker is left
    Closed<T> popToOpen(int position) {
        final var buffer = new ArrayList<Completed<T>>();
        while (!items.isEmpty() && top() instanceof Completed<T> completed) {
            pop();
            buffer.add(completed);
        }
        if (items.isEmpty()) {
            throw DelimiterParseException.unmatchedClose(position);
        }
        final var marker = (PendingOpen<T>) pop();
        // popped nearest first
        Collections.reverse(buffer);
        final var content = new ArrayList<T>();
        for (final var run : buffer) {
            content.addAll(run.siblings());
        }
        return new Closed<>(marker, content);
    }

    /// Returns the single remaining sibling run, or an empty list when nothing was pushed.
    ///
    /// @throws DelimiterParseException if an open delimiter is still pending
    List<T> finish() {
        for (int i = items.size() - 1; i >= 0; i--) {
            if (items.get(i) instanceof PendingOpen<T> open) {
                final var what = open.label() == null
                        ? "Open delimiter is never closed"
                        : "Open delimiter '" + open.label() + "' is never closed";
                throw DelimiterParseException.incompleteParse(open.position(), what);
            }
        }
        if (items.isEmpty()) {
            return List.of();
        }
        if (items.size() > 1) {
            throw new AssertionError("unreachable: " + items.size() + " unmerged completed runs");
        }
        return ((Completed<T>) items.get(0)).siblings();
    }

    int size() {
        return items.size();
    }

    /// Right-folds `trees` into a chain of `concat` nodes, first tree outermost-left.
    /// An empty list folds to `empty`.
    static <T> T foldRight(List<T> trees, T empty, BinaryOperator<T> concat) {
        if (trees.isEmpty()) {
            return empty;
        }
        var acc = trees.get(trees.size() - 1);
        for (int i = trees.size() - 2; i >= 0; i--) {
            acc = concat.apply(trees.get(i), acc);
        }
        return acc;
    }

    private void normalize() {
        while (items.size() >= 2
                && items.get(items.size() - 1) instanceof Completed<T> upper
                && items.get(items.size() - 2) instanceof Completed<T> lower) {
            pop();
            lower.siblings().addAll(upper.siblings());
        }
    }

    private Item<T> top() {
        return items.get(items.size() - 1);
    }

    private Item<T> pop() {
        return items.remove(items.size() - 1);
    }
}
