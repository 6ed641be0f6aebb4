package org.sirena.diagram;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndentationTreeTest {

    @Test
    void shouldBuildSameShapeForTwoAndFourSpaceIndents() {
        IndentationTree.Layout twoSpaces = IndentationTree.build(List.of(0, 2, 4, 2, 0));
        IndentationTree.Layout fourSpaces = IndentationTree.build(List.of(0, 4, 8, 4, 0));

        assertEquals(List.of(0, 1, 2, 1, 0), twoSpaces.levels());
        assertEquals(List.of(-1, 0, 1, 0, -1), twoSpaces.parents());
        assertEquals(twoSpaces, fourSpaces);
    }

    @Test
    void shouldMeasureLevelsFromLeastIndentedLine() {
        IndentationTree.Layout layout = IndentationTree.build(List.of(6, 8, 8, 6));

        assertEquals(List.of(0, 1, 1, 0), layout.levels());
        assertEquals(List.of(1, 2), layout.children(0));
        assertTrue(layout.children(3).isEmpty());
    }

    @Test
    void shouldAttachToNearestShallowerOpenLine() {
        // the third line is less indented than the second but deeper than the first
        IndentationTree.Layout layout = IndentationTree.build(List.of(0, 8, 4));

        assertEquals(0, layout.parent(1));
        assertEquals(0, layout.parent(2));
        assertEquals(1, layout.level(2));
    }

    @Test
    void shouldComputeCandidateLevels() {
        assertEquals(0, IndentationTree.candidateLevel(2, 2));
        assertEquals(2, IndentationTree.candidateLevel(4, 0));
        assertEquals(1, IndentationTree.candidateLevel(5, 0));
        assertEquals(0, IndentationTree.candidateLevel(3, 0));
    }

    @Test
    void shouldMeasureIndentOfLine() {
        assertEquals(3, IndentationTree.indentOf(" \t text"));
        assertEquals(0, IndentationTree.indentOf("text"));
    }

    @Test
    void shouldHandleNoLines() {
        assertEquals(0, IndentationTree.build(List.of()).size());
    }
}
