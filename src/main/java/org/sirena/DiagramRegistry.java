package org.sirena;

import org.sirena.architecture.ArchitectureGrammar;
import org.sirena.architecture.ArchitectureTransform;
import org.sirena.block.BlockGrammar;
import org.sirena.block.BlockTransform;
import org.sirena.c4.C4Grammar;
import org.sirena.c4.C4Transform;
import org.sirena.classdiagram.ClassDiagramGrammar;
import org.sirena.classdiagram.ClassDiagramTransform;
import org.sirena.config.models.ParserConfig;
import org.sirena.diagram.Diagram;
import org.sirena.diagram.DiagramParser;
import org.sirena.diagram.DiagramTypeDetector;
import org.sirena.er.ErDiagramGrammar;
import org.sirena.er.ErDiagramTransform;
import org.sirena.flowchart.FlowchartGrammar;
import org.sirena.flowchart.FlowchartTransform;
import org.sirena.gantt.GanttGrammar;
import org.sirena.gantt.GanttTransform;
import org.sirena.gitgraph.GitGraphGrammar;
import org.sirena.gitgraph.GitGraphTransform;
import org.sirena.info.ErrorGrammar;
import org.sirena.info.ErrorTransform;
import org.sirena.info.InfoGrammar;
import org.sirena.info.InfoTransform;
import org.sirena.journey.JourneyGrammar;
import org.sirena.journey.JourneyTransform;
import org.sirena.kanban.KanbanGrammar;
import org.sirena.kanban.KanbanTransform;
import org.sirena.mindmap.MindmapGrammar;
import org.sirena.mindmap.MindmapTransform;
import org.sirena.packet.PacketGrammar;
import org.sirena.packet.PacketTransform;
import org.sirena.pie.PieGrammar;
import org.sirena.pie.PieTransform;
import org.sirena.quadrant.QuadrantGrammar;
import org.sirena.quadrant.QuadrantTransform;
import org.sirena.radar.RadarGrammar;
import org.sirena.radar.RadarTransform;
import org.sirena.requirement.RequirementGrammar;
import org.sirena.requirement.RequirementTransform;
import org.sirena.sankey.SankeyGrammar;
import org.sirena.sankey.SankeyTransform;
import org.sirena.sequence.SequenceGrammar;
import org.sirena.sequence.SequenceTransform;
import org.sirena.state.StateDiagramGrammar;
import org.sirena.state.StateDiagramTransform;
import org.sirena.timeline.TimelineGrammar;
import org.sirena.timeline.TimelineTransform;
import org.sirena.treemap.TreemapGrammar;
import org.sirena.treemap.TreemapTransform;
import org.sirena.xychart.XyChartGrammar;
import org.sirena.xychart.XyChartTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Type key to parser table. Detection of the key from the document header is done by
 * {@link DiagramTypeDetector}; this class only dispatches.
 */
public class DiagramRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DiagramRegistry.class);

    private final Map<String, DiagramParser<?>> parsers = new LinkedHashMap<>();

    /**
     * Registry with every built-in notation except those the configuration disables.
     */
    public static DiagramRegistry defaults(ParserConfig config) {
        DiagramRegistry registry = new DiagramRegistry();
        String direction = config.defaultFlowchartDirection;
        String dateFormat = config.ganttDateFormat;
        boolean strictScores = config.strictJourneyScores;
        int bitsPerRow = config.packetBitsPerRow;

        registry.registerUnlessDisabled(config,
                new DiagramParser<>("flowchart", new FlowchartGrammar(), () -> new FlowchartTransform(direction)));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("sequence", new SequenceGrammar(), SequenceTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("class", new ClassDiagramGrammar(), ClassDiagramTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("state", new StateDiagramGrammar(), StateDiagramTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("er", new ErDiagramGrammar(), ErDiagramTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("journey", new JourneyGrammar(), () -> new JourneyTransform(strictScores)));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("gantt", new GanttGrammar(), () -> new GanttTransform(dateFormat)));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("pie", new PieGrammar(), PieTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("timeline", new TimelineGrammar(), TimelineTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("quadrant", new QuadrantGrammar(), QuadrantTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("gitgraph", new GitGraphGrammar(), GitGraphTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("mindmap", new MindmapGrammar(), MindmapTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("kanban", new KanbanGrammar(), KanbanTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("radar", new RadarGrammar(), RadarTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("block", new BlockGrammar(), BlockTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("requirement", new RequirementGrammar(), RequirementTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("xychart", new XyChartGrammar(), XyChartTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("architecture", new ArchitectureGrammar(), ArchitectureTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("sankey", new SankeyGrammar(), SankeyTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("packet", new PacketGrammar(), () -> new PacketTransform(bitsPerRow)));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("treemap", new TreemapGrammar(), TreemapTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("c4", new C4Grammar(), C4Transform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("info", new InfoGrammar(), InfoTransform::new));
        registry.registerUnlessDisabled(config,
                new DiagramParser<>("error", new ErrorGrammar(), ErrorTransform::new));

        logger.debug("Registered {} diagram types", registry.parsers.size());
        return registry;
    }

    private void registerUnlessDisabled(ParserConfig config, DiagramParser<?> parser) {
        if (config.disabledDiagramTypes.contains(parser.getType())) {
            logger.warn("Diagram type '{}' is disabled by configuration", parser.getType());
            return;
        }
        register(parser);
    }

    /** Adds or replaces the parser for its type key. */
    public void register(DiagramParser<?> parser) {
        parsers.put(parser.getType(), parser);
    }

    public Optional<DiagramParser<?>> get(String type) {
        return Optional.ofNullable(parsers.get(type));
    }

    public Set<String> types() {
        return new LinkedHashSet<>(parsers.keySet());
    }

    public boolean isRegistered(String type) {
        return parsers.containsKey(type);
    }

    public void clear() {
        parsers.clear();
    }

    /**
     * Detects the notation of {@code text} and parses it.
     *
     * @throws IllegalArgumentException if the header is unknown or its type is not registered
     * @throws org.sirena.grammar.DiagramParseException if the document is malformed
     */
    public Diagram parse(String text) {
        String type = DiagramTypeDetector.require(text);
        DiagramParser<?> parser = parsers.get(type);
        if (parser == null) {
            logger.warn("Diagram type '{}' was detected but is not registered", type);
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }
        logger.debug("Detected diagram type {}", type);
        return parser.parse(text);
    }
}
