package delimiter.tree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static delimiter.tree.ParenAst.EMPTY;
import static delimiter.tree.ParenAst.Token.CLOSE;
import static delimiter.tree.ParenAst.Token.OPEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for building and flattening unlabeled trees.
class ParensTest extends DelimiterTreeTestBase {

    // ========== Building ==========

    @Test
    void testEmptyInputBuildsEmpty() {
        assertThat(Parens.parse(List.of())).isEqualTo(EMPTY);
    }

    @Test
    void testSinglePair() {
        assertThat(Parens.parse(parens("()"))).isEqualTo(nested(EMPTY));
    }

    @Test
    void testTwoSiblingsInsideOnePair() {
        assertThat(Parens.parse(parens("(()())")))
                .isEqualTo(nested(new ParenAst.Concat(nested(EMPTY), nested(EMPTY))));
    }

    @Test
    void testTopLevelSiblings() {
        assertThat(Parens.parse(parens("()(())")))
                .isEqualTo(new ParenAst.Concat(nested(EMPTY), nested(nested(EMPTY))));
    }

    @Test
    void testSiblingRunIsRightAssociated() {
        final var a = nested(EMPTY);
        final var b = nested(nested(EMPTY));
        final var c = nested(EMPTY);
        assertThat(Parens.parse(parens("(()(())()())")))
                .isEqualTo(nested(new ParenAst.Concat(a, new ParenAst.Concat(b, new ParenAst.Concat(c, nested(EMPTY))))));
    }

    @Test
    void testParseIsDeterministic() {
        final var tokens = parens("((())())(()())");
        assertThat(Parens.parse(tokens)).isEqualTo(Parens.parse(tokens));
    }

    // ========== Errors ==========

    @Test
    void testLoneCloseIsUnmatched() {
        assertThatThrownBy(() -> Parens.parse(List.of(CLOSE)))
                .isInstanceOf(DelimiterParseException.class)
                .satisfies(e -> {
                    final var ex = (DelimiterParseException) e;
                    assertThat(ex.kind()).isEqualTo(DelimiterParseException.Kind.UNMATCHED_CLOSE);
                    assertThat(ex.position()).isEqualTo(0);
                });
    }

    @Test
    void testUnmatchedClosePositionIsTheOffendingToken() {
        assertThatThrownBy(() -> Parens.parse(parens("()())(")))
                .isInstanceOf(DelimiterParseException.class)
                .satisfies(e -> {
                    final var ex = (DelimiterParseException) e;
                    assertThat(ex.kind()).isEqualTo(DelimiterParseException.Kind.UNMATCHED_CLOSE);
                    assertThat(ex.position()).isEqualTo(4);
                    assertThat(ex.getMessage()).contains("at token 4");
                });
    }

    @Test
    void testLeftoverOpenIsIncomplete() {
        assertThatThrownBy(() -> Parens.parse(parens("(()")))
                .isInstanceOf(DelimiterParseException.class)
                .satisfies(e -> {
                    final var ex = (DelimiterParseException) e;
                    assertThat(ex.kind()).isEqualTo(DelimiterParseException.Kind.INCOMPLETE_PARSE);
                    assertThat(ex.position()).isEqualTo(0);
                    assertThat(ex.expected()).isNull();
                });
    }

    @Test
    void testIncompleteReportsInnermostUnclosedOpen() {
        assertThatThrownBy(() -> Parens.parse(parens("(()(")))
                .isInstanceOf(DelimiterParseException.class)
                .satisfies(e -> assertThat(((DelimiterParseException) e).position()).isEqualTo(3));
    }

    @Test
    void testTryParseReturnsValues() {
        final var ok = Parens.tryParse(parens("()"));
        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.orElseThrow()).isEqualTo(nested(EMPTY));

        final var bad = Parens.tryParse(parens(")("));
        assertThat(bad.isSuccess()).isFalse();
        assertThat(bad).isInstanceOf(ParseResult.Failure.class);
        assertThat(((ParseResult.Failure<ParenAst.Tree>) bad).error().kind())
                .isEqualTo(DelimiterParseException.Kind.UNMATCHED_CLOSE);
        assertThatThrownBy(bad::orElseThrow).isInstanceOf(DelimiterParseException.class);
    }

    @Test
    void testTryParseAgreesWithIsBalanced() {
        for (final var text : List.of("", "()", "(()())", ")(())", "(()", ")", "(", "()()()", "())(()")) {
            final var tokens = parens(text);
            assertThat(Parens.tryParse(tokens).isSuccess())
                    .as("agreement on '%s'", text)
                    .isEqualTo(Parens.isBalanced(tokens));
        }
    }

    // ========== Flattening ==========

    @Test
    void testFlattenEmpty() {
        assertThat(Parens.flatten(EMPTY)).isEmpty();
    }

    @Test
    void testFlattenRestoresTokens() {
        final var tokens = parens("(()(()))()");
        assertThat(Parens.flatten(Parens.parse(tokens))).isEqualTo(tokens);
    }

    @Test
    void testFlattenLeftAssociatedConcat() {
        final var tree = new ParenAst.Concat(new ParenAst.Concat(nested(EMPTY), nested(EMPTY)), nested(EMPTY));
        assertThat(Parens.flatten(tree)).isEqualTo(parens("()()()"));
    }

    @Test
    void testFlattenResultIsUnmodifiable() {
        assertThatThrownBy(() -> Parens.flatten(nested(EMPTY)).add(OPEN))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ========== Depth ==========

    @Test
    void testDeepNestingDoesNotUseTheCallStack() {
        final int depth = 200_000;
        final var tokens = new ArrayList<ParenAst.Token>(depth * 2);
        tokens.addAll(Collections.nCopies(depth, OPEN));
        tokens.addAll(Collections.nCopies(depth, CLOSE));

        assertThat(Parens.isBalanced(tokens)).isTrue();
        final var tree = Parens.parse(tokens);
        assertThat(tree).isInstanceOf(ParenAst.Nested.class);
        assertThat(Parens.flatten(tree)).isEqualTo(tokens);
    }

    @Test
    void testLongSiblingRun() {
        final int count = 100_000;
        final var tokens = new ArrayList<ParenAst.Token>(count * 2);
        for (int i = 0; i < count; i++) {
            tokens.add(OPEN);
            tokens.add(CLOSE);
        }
        final var tree = Parens.parse(tokens);
        assertThat(tree).isInstanceOf(ParenAst.Concat.class);
        assertThat(((ParenAst.Concat) tree).left()).isEqualTo(nested(EMPTY));
        assertThat(Parens.flatten(tree)).isEqualTo(tokens);
    }
}
