package org.sirena.diagram;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DiagramTypeDetectorTest {

    @Test
    void shouldDetectFromFirstMeaningfulLine() {
        assertEquals(Optional.of("flowchart"), DiagramTypeDetector.detect("\n%% comment\n  graph TD\nA-->B"));
        assertEquals(Optional.of("state"), DiagramTypeDetector.detect("stateDiagram-v2\n"));
        assertEquals(Optional.of("c4"), DiagramTypeDetector.detect("C4Deployment\n"));
        assertEquals(Optional.of("treemap"), DiagramTypeDetector.detect("treemap-beta\n"));
        assertEquals(Optional.of("sequence"), DiagramTypeDetector.detect("sequenceDiagram"));
    }

    @Test
    void shouldNotLookPastFirstLine() {
        assertTrue(DiagramTypeDetector.detect("hello\nflowchart TD\n").isEmpty());
    }

    @Test
    void shouldRequireKnownHeader() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DiagramTypeDetector.require("venn\n"));
        assertTrue(e.getMessage().startsWith("Unsupported diagram type"));
    }
}
