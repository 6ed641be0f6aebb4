package org.sirena.sankey.models;

public record SankeyFlow(String sourceId, String targetId, double value) {
}
