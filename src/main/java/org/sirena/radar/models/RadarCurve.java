package org.sirena.radar.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param values value per axis id, in axis order for positional curves
 */
public record RadarCurve(String id, String label, Map<String, Double> values) {

    public RadarCurve {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
