package org.sirena.pie.models;

public record PieSlice(String label, double value) {
}
