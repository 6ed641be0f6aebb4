package org.sirena.packet;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.packet.models.PacketDiagram;
import org.sirena.packet.models.PacketField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class PacketTransform implements Transform<PacketDiagram> {

    private static final Logger logger = LoggerFactory.getLogger(PacketTransform.class);

    private final int bitsPerRow;

    public PacketTransform(int bitsPerRow) {
        if (bitsPerRow <= 0) {
            throw new IllegalArgumentException("Bits per row must be positive: " + bitsPerRow);
        }
        this.bitsPerRow = bitsPerRow;
    }

    @Override
    public PacketDiagram apply(Captures tree) {
        List<PacketField> fields = new ArrayList<>();
        String title = null;
        String accTitle = null;
        String accDescription = null;
        int next = 0;
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("label")) {
                PacketField field = field(stmt, next);
                if (field.start() != next) {
                    logger.debug("Packet field '{}' starts at {}, expected {}", field.label(), field.start(), next);
                }
                fields.add(field);
                next = field.end() + 1;
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        return new PacketDiagram(title, fields, bitsPerRow, accTitle, accDescription);
    }

    private static PacketField field(Captures stmt, int next) {
        String label = stmt.text("label");
        if (stmt.has("bits")) {
            int bits = Integer.parseInt(stmt.text("bits"));
            if (bits == 0) {
                throw new CanonicalizationException("Packet field '" + label + "' has zero width");
            }
            return new PacketField(next, next + bits - 1, label);
        }
        int start = Integer.parseInt(stmt.text("start"));
        int end = stmt.has("end") ? Integer.parseInt(stmt.text("end")) : start;
        if (end < start) {
            throw new CanonicalizationException(String.format(
                    "Packet field '%s' ends at %d before it starts at %d", label, end, start));
        }
        return new PacketField(start, end, label);
    }
}
