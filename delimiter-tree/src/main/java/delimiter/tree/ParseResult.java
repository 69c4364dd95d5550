package delimiter.tree;

import java.util.Objects;
import java.util.function.Supplier;

/// Outcome of building a tree without throwing.
///
/// @param <T> the tree type, [ParenAst.Tree] or [TagAst.Tree]
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    /// Returns true when a tree was built.
    boolean isSuccess();

    /// Returns the built tree, or throws the parse failure.
    ///
    /// @throws DelimiterParseException if this is a [Failure]
    T orElseThrow();

    /// A built tree.
    record Success<T>(T tree) implements ParseResult<T> {
        public Success {
            Objects.requireNonNull(tree, "tree must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T orElseThrow() {
            return tree;
        }
    }

    /// A structural failure.
    record Failure<T>(DelimiterParseException error) implements ParseResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T orElseThrow() {
            throw error;
        }
    }

    /// Runs `build`, capturing a [DelimiterParseException] as a [Failure].
    static <T> ParseResult<T> of(Supplier<T> build) {
        try {
            return new Success<>(build.get());
        } catch (DelimiterParseException e) {
            return new Failure<>(e);
        }
    }
}
