package org.sirena.mindmap;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.mindmap.models.Mindmap;
import org.sirena.mindmap.models.MindmapNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MindmapTest {

    private final DiagramParser<Mindmap> parser =
            new DiagramParser<>("mindmap", new MindmapGrammar(), MindmapTransform::new);

    @Test
    void shouldBuildTreeFromIndentation() {
        Mindmap mindmap = parser.parse("""
                mindmap
                  root((Central))
                    A
                    B[Square]
                    ::icon(fa fa-book)
                      C)Cloud(
                    :::urgent large
                """);

        assertEquals(4, mindmap.nodes().size());
        MindmapNode root = mindmap.root();
        assertEquals("Central", root.getText());
        assertEquals("circle", root.getShape());
        assertEquals(List.of("A", "Square"), mindmap.childrenOf("node-0").stream().map(MindmapNode::getText).toList());
        assertEquals("default", mindmap.findNode("node-1").getShape());
        assertEquals("fa fa-book", mindmap.findNode("node-2").getIcon());

        MindmapNode cloud = mindmap.findNode("node-3");
        assertEquals("cloud", cloud.getShape());
        assertEquals(2, cloud.getParentIndex());
        assertEquals(List.of("urgent", "large"), cloud.getClasses());
        assertEquals(2, mindmap.depth());
        assertTrue(mindmap.isValid());
    }

    @Test
    void shouldGiveSameShapeForTwoAndFourSpaceIndents() {
        Mindmap narrow = parser.parse("mindmap\nroot\n  a\n    b\n  c\n");
        Mindmap wide = parser.parse("mindmap\nroot\n    a\n        b\n    c\n");

        assertEquals(shape(narrow), shape(wide));
        assertEquals(List.of(-1, 0, 1, 0), shape(wide));
    }

    @Test
    void shouldReportSecondRootAsInvalid() {
        Mindmap mindmap = parser.parse("mindmap\nfirst\nsecond\n");

        assertFalse(mindmap.isValid());
    }

    private static List<Integer> shape(Mindmap mindmap) {
        return mindmap.nodes().stream().map(MindmapNode::getParentIndex).toList();
    }

    @Test
    void shouldKeepNodeClassesReadOnly() {
        Mindmap mindmap = parser.parse("mindmap\n  root\n    child\n    :::urgent large\n");
        MindmapNode child = mindmap.nodes().get(1);

        assertEquals(List.of("urgent", "large"), child.getClasses());
        assertThrows(UnsupportedOperationException.class, () -> child.getClasses().add("other"));
        assertThrows(UnsupportedOperationException.class, () -> mindmap.nodes().clear());
    }
}
