package org.sirena.sankey.models;

public record SankeyNode(String id, String label) {
}
