package org.sirena.diagram;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps the first meaningful line of a document to a registry key. Blank lines,
 * {@code %%} comments and {@code %%{...}%%} directives before the header are skipped.
 */
public final class DiagramTypeDetector {

    private static final Map<String, Pattern> TYPE_PATTERNS = new LinkedHashMap<>();

    static {
        TYPE_PATTERNS.put("flowchart", Pattern.compile("^(graph|flowchart)\\b"));
        TYPE_PATTERNS.put("sequence", Pattern.compile("^sequenceDiagram\\b"));
        TYPE_PATTERNS.put("class", Pattern.compile("^classDiagram(-v2)?\\b"));
        TYPE_PATTERNS.put("state", Pattern.compile("^stateDiagram(-v2)?\\b"));
        TYPE_PATTERNS.put("er", Pattern.compile("^erDiagram\\b"));
        TYPE_PATTERNS.put("journey", Pattern.compile("^journey\\b"));
        TYPE_PATTERNS.put("gantt", Pattern.compile("^gantt\\b"));
        TYPE_PATTERNS.put("pie", Pattern.compile("^[Pp]ie\\b"));
        TYPE_PATTERNS.put("timeline", Pattern.compile("^timeline\\b"));
        TYPE_PATTERNS.put("quadrant", Pattern.compile("^quadrantChart\\b"));
        TYPE_PATTERNS.put("gitgraph", Pattern.compile("^gitGraph\\b"));
        TYPE_PATTERNS.put("mindmap", Pattern.compile("^mindmap\\b"));
        TYPE_PATTERNS.put("kanban", Pattern.compile("^kanban\\b"));
        TYPE_PATTERNS.put("radar", Pattern.compile("^radar-beta\\b"));
        TYPE_PATTERNS.put("block", Pattern.compile("^block(-beta)?\\b"));
        TYPE_PATTERNS.put("requirement", Pattern.compile("^requirementDiagram\\b"));
        TYPE_PATTERNS.put("xychart", Pattern.compile("^xychart-beta\\b"));
        TYPE_PATTERNS.put("architecture", Pattern.compile("^architecture-beta\\b"));
        TYPE_PATTERNS.put("sankey", Pattern.compile("^sankey-beta\\b"));
        TYPE_PATTERNS.put("packet", Pattern.compile("^packet(-beta)?\\b"));
        TYPE_PATTERNS.put("treemap", Pattern.compile("^treemap(-beta)?\\b"));
        TYPE_PATTERNS.put("c4", Pattern.compile("^C4(Context|Container|Component|Dynamic|Deployment)\\b"));
        TYPE_PATTERNS.put("info", Pattern.compile("^info\\b"));
        TYPE_PATTERNS.put("error", Pattern.compile("^[Ee]rror\\b"));
    }

    private DiagramTypeDetector() {
    }

    public static Optional<String> detect(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("%%")) {
                continue;
            }
            for (Map.Entry<String, Pattern> e : TYPE_PATTERNS.entrySet()) {
                if (e.getValue().matcher(line).find()) {
                    return Optional.of(e.getKey());
                }
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    /** Same as {@link #detect(String)} but fails on unknown input. */
    public static String require(String text) {
        return detect(text).orElseThrow(() -> new IllegalArgumentException(
                "Unsupported diagram type: cannot detect a known header in the input"));
    }
}
