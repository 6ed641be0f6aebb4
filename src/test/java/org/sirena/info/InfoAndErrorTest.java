package org.sirena.info;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.GrammarException;
import org.sirena.info.models.ErrorDiagram;
import org.sirena.info.models.InfoDiagram;

import static org.junit.jupiter.api.Assertions.*;

class InfoAndErrorTest {

    private final DiagramParser<InfoDiagram> info = new DiagramParser<>("info", new InfoGrammar(), InfoTransform::new);
    private final DiagramParser<ErrorDiagram> error =
            new DiagramParser<>("error", new ErrorGrammar(), ErrorTransform::new);

    @Test
    void shouldReadShowInfoFlag() {
        assertTrue(info.parse("info showInfo\n").showInfo());
        assertFalse(info.parse("info").showInfo());
    }

    @Test
    void shouldKeepErrorMessage() {
        assertEquals("Syntax error in graph", error.parse("error Syntax error in graph\n").message());
        assertNull(error.parse("Error").message());
    }

    @Test
    void shouldRejectTrailingStatementsAfterError() {
        assertThrows(GrammarException.class, () -> error.parse("error\nmore text\n"));
    }
}
