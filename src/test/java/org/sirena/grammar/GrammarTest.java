package org.sirena.grammar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

class GrammarTest {

    /** {@code demo} header followed by one identifier per line. */
    private static class NamesGrammar extends Grammar {
        private final Rule root = document(
                seq(keyword("demo"), LINE_END),
                choice(METADATA, seq(IDENTIFIER.as("name"), LINE_END)));

        @Override
        protected Rule root() {
            return root;
        }
    }

    private final Grammar grammar = new NamesGrammar();

    @Test
    void shouldCaptureStatementsInOrder() {
        CstNode.Captures tree = grammar.parse("demo\n  alpha\n\n%% skipped\n  beta;\n");

        assertEquals(2, tree.records("statements").size());
        assertEquals("alpha", tree.records("statements").get(0).text("name"));
        assertEquals("beta", tree.records("statements").get(1).text("name"));
    }

    @Test
    void shouldParseAccessibilityMetadata() {
        CstNode.Captures tree = grammar.parse("demo\naccTitle: Names\naccDescr {\n  several\n  lines\n}\n");

        assertEquals("Names", tree.records("statements").get(0).text("acc_title"));
        assertTrue(tree.records("statements").get(1).text("acc_descr").contains("several"));
    }

    @Test
    void shouldReportFurthestFailurePosition() {
        GrammarException e = assertThrows(GrammarException.class, () -> grammar.parse("demo\nabc\n1x\n"));

        assertEquals(3, e.getLine());
        assertEquals(1, e.getColumn());
        assertEquals(9, e.getOffset());
        assertEquals("1x", e.getSourceLine());
        assertTrue(e.getExpected().contains("identifier"));
        assertTrue(e.getMessage().startsWith("Parse error at line 3, column 1: expected one of"));
        assertEquals(DiagramParseException.Kind.GRAMMAR, e.kind());
    }

    @Test
    void shouldRejectMissingHeader() {
        GrammarException e = assertThrows(GrammarException.class, () -> grammar.parse("alpha\n"));

        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
    }
}
