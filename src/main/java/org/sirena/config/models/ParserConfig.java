package org.sirena.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser settings, loaded from {@code sirena.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParserConfig {
    /**
     * Diagram type keys the registry refuses to parse.
     * Example: ["c4", "architecture"]
     */
    public List<String> disabledDiagramTypes = new ArrayList<>();

    /**
     * Direction given to flowcharts whose header names none.
     * Example: "TB"
     */
    public String defaultFlowchartDirection = "TB";

    /**
     * Date format recorded on Gantt charts that do not declare one.
     */
    public String ganttDateFormat = "YYYY-MM-DD";

    /**
     * Row width used by packet diagram row helpers.
     */
    public int packetBitsPerRow = 32;

    /**
     * Whether journey task scores outside 1..5 fail the parse.
     */
    public boolean strictJourneyScores = true;

    public static ParserConfig defaults() {
        return new ParserConfig();
    }
}
