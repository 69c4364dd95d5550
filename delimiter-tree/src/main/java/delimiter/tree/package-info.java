/// Validation and tree building for sequences of paired delimiters.
///
/// Two variants share one design:
/// - {@link delimiter.tree.Parens} over {@link delimiter.tree.ParenAst}: plain `(` and `)`
/// - {@link delimiter.tree.Tags} over {@link delimiter.tree.TagAst}: delimiters carrying a text label
///
/// Each variant offers a balance check, a tree builder and a flattener. A token list is
/// balanced exactly when it builds, and flattening a built tree returns the original tokens.
///
/// The builder works over an explicit heap-allocated stack, so nesting depth is bounded by
/// memory rather than by the thread's call stack. All state is local to a call; every
/// entry point is safe to call concurrently on independent inputs.
package delimiter.tree;
