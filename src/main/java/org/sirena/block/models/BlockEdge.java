package org.sirena.block.models;

public record BlockEdge(String fromId, String toId, String label, String arrowType) {
}
