package org.sirena.packet.models;

import org.sirena.diagram.Diagram;

import java.util.ArrayList;
import java.util.List;

public record PacketDiagram(
        String title,
        List<PacketField> fields,
        int bitsPerRow,
        String accTitle,
        String accDescription
) implements Diagram {

    public PacketDiagram {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    @Override
    public String diagramType() {
        return "packet";
    }

    /** Valid when the fields cover the bits from 0 upwards without gaps or overlaps. */
    @Override
    public boolean isValid() {
        int next = 0;
        for (PacketField field : fields) {
            if (field.start() != next || field.end() < field.start()) {
                return false;
            }
            next = field.end() + 1;
        }
        return !fields.isEmpty();
    }

    public int totalBits() {
        return fields.isEmpty() ? 0 : fields.get(fields.size() - 1).end() + 1;
    }

    public PacketField findField(String label) {
        return fields.stream().filter(f -> f.label().equals(label)).findFirst().orElse(null);
    }

    /**
     * Fields laid out in rows of {@link #bitsPerRow()} bits. A field crossing a row
     * boundary is split into one piece per row, each keeping the field's label.
     */
    public List<List<PacketField>> rows() {
        List<List<PacketField>> rows = new ArrayList<>();
        for (PacketField field : fields) {
            int start = field.start();
            while (start <= field.end()) {
                int row = start / bitsPerRow;
                int end = Math.min(field.end(), (row + 1) * bitsPerRow - 1);
                while (rows.size() <= row) {
                    rows.add(new ArrayList<>());
                }
                rows.get(row).add(new PacketField(start, end, field.label()));
                start = end + 1;
            }
        }
        return rows;
    }

    public int rowCount() {
        return (totalBits() + bitsPerRow - 1) / bitsPerRow;
    }
}
