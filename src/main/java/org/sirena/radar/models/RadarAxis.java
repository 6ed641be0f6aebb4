package org.sirena.radar.models;

public record RadarAxis(String id, String label) {
}
