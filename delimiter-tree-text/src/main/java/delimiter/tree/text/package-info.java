/// Text forms of delimiter token lists.
///
/// {@link delimiter.tree.text.ParenText} reads and writes strings over `(` and `)`.
/// {@link delimiter.tree.text.TagText} reads and writes labeled delimiter strings, where the
/// label follows both the open and the close delimiter: `(label...)label`.
package delimiter.tree.text;
