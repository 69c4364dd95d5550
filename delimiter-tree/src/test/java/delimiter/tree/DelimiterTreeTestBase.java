package delimiter.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static delimiter.tree.ParenAst.Token.CLOSE;
import static delimiter.tree.ParenAst.Token.OPEN;

/// Base class for all delimiter tree tests.
/// - Emits an INFO banner per test.
/// - Provides shorthand for building token lists.
public class DelimiterTreeTestBase extends DelimiterTreeLoggingConfig {

    static final Logger LOG = Logger.getLogger("delimiter.tree");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    /// Reads a string of `(` and `)` as tokens. Test shorthand only.
    static List<ParenAst.Token> parens(String text) {
        final var tokens = new ArrayList<ParenAst.Token>();
        for (final char c : text.toCharArray()) {
            tokens.add(c == '(' ? OPEN : CLOSE);
        }
        return tokens;
    }

    static TagAst.Open open(String label) {
        return new TagAst.Open(label);
    }

    static TagAst.Close close(String label) {
        return new TagAst.Close(label);
    }

    static ParenAst.Nested nested(ParenAst.Tree child) {
        return new ParenAst.Nested(child);
    }

    static TagAst.Nested nested(String label, TagAst.Tree child) {
        return new TagAst.Nested(label, child);
    }
}
