package org.sirena.pie.models;

import org.sirena.diagram.Diagram;

import java.util.List;

public record PieChart(
        String title,
        boolean showData,
        List<PieSlice> slices,
        String accTitle,
        String accDescription
) implements Diagram {

    public PieChart {
        slices = slices == null ? List.of() : List.copyOf(slices);
    }

    @Override
    public String diagramType() {
        return "pie";
    }

    @Override
    public boolean isValid() {
        return !slices.isEmpty();
    }

    public double totalValue() {
        return slices.stream().mapToDouble(PieSlice::value).sum();
    }

    /** Share of the slice in the total, in percent; 0 when the label is unknown or the total is 0. */
    public double percentage(String label) {
        double total = totalValue();
        if (total == 0) {
            return 0;
        }
        return slices.stream()
                .filter(s -> s.label().equals(label))
                .mapToDouble(s -> s.value() * 100.0 / total)
                .findFirst()
                .orElse(0);
    }

    public PieSlice findSlice(String label) {
        return slices.stream().filter(s -> s.label().equals(label)).findFirst().orElse(null);
    }
}
