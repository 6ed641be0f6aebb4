package org.sirena.packet;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.packet.models.PacketDiagram;
import org.sirena.packet.models.PacketField;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PacketTest {

    private final DiagramParser<PacketDiagram> parser = parser(32);

    @Test
    void shouldResolveAbsoluteAndRelativeFields() {
        PacketDiagram packet = parser.parse("""
                packet-beta
                title TCP
                0-15: "Source Port"
                16-31: "Destination Port"
                32-63: "Sequence Number"
                +8: "Flags"
                72: "URG"
                """);

        assertEquals("TCP", packet.title());
        assertEquals(new PacketField(64, 71, "Flags"), packet.findField("Flags"));
        assertEquals(new PacketField(72, 72, "URG"), packet.findField("URG"));
        assertEquals(73, packet.totalBits());
        assertEquals(3, packet.rowCount());
        assertEquals(2, packet.rows().get(0).size());
        assertTrue(packet.isValid());
    }

    @Test
    void shouldSplitFieldsAtRowBoundaries() {
        PacketDiagram packet = parser(16).parse("packet\n0-7: \"A\"\n8-23: \"B\"\n");

        assertEquals(List.of(
                List.of(new PacketField(0, 7, "A"), new PacketField(8, 15, "B")),
                List.of(new PacketField(16, 23, "B"))), packet.rows());
        assertEquals(16, packet.findField("B").bits());
    }

    @Test
    void shouldKeepGapsButReportThemAsInvalid() {
        PacketDiagram packet = parser.parse("packet-beta\n0-3: \"a\"\n8-9: \"b\"\n");

        assertEquals(2, packet.fields().size());
        assertFalse(packet.isValid());
    }

    @Test
    void shouldRejectZeroWidthAndReversedFields() {
        assertThrows(CanonicalizationException.class, () -> parser.parse("packet-beta\n+0: \"none\"\n"));
        assertThrows(CanonicalizationException.class, () -> parser.parse("packet-beta\n5-2: \"back\"\n"));
    }

    @Test
    void shouldRejectNonPositiveRowWidth() {
        assertThrows(IllegalArgumentException.class, () -> new PacketTransform(0));
    }

    private static DiagramParser<PacketDiagram> parser(int bitsPerRow) {
        return new DiagramParser<>("packet", new PacketGrammar(), () -> new PacketTransform(bitsPerRow));
    }
}
