package org.sirena.c4;

import org.sirena.c4.models.C4Boundary;
import org.sirena.c4.models.C4Diagram;
import org.sirena.c4.models.C4Element;
import org.sirena.c4.models.C4Relationship;
import org.sirena.diagram.ContextStack;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class C4Transform implements Transform<C4Diagram> {

    private static final Logger logger = LoggerFactory.getLogger(C4Transform.class);

    private final Map<String, C4Element> elements = new LinkedHashMap<>();
    private final Map<String, C4Boundary> boundaries = new LinkedHashMap<>();
    private final List<C4Relationship> relationships = new ArrayList<>();
    private final Map<String, String> layoutConfig = new LinkedHashMap<>();
    private final ContextStack<String> scope = new ContextStack<>();
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public C4Diagram apply(Captures tree) {
        tree.records("statements").forEach(this::statement);
        logger.debug("C4 diagram: {} elements, {} boundaries, {} relationships",
                elements.size(), boundaries.size(), relationships.size());
        return C4Diagram.builder()
                .c4Type(tree.text("c4_type"))
                .title(title)
                .elements(new ArrayList<>(elements.values()))
                .boundaries(new ArrayList<>(boundaries.values()))
                .relationships(relationships)
                .layoutConfig(layoutConfig)
                .accTitle(accTitle)
                .accDescription(accDescription)
                .build();
    }

    private void statement(Captures stmt) {
        if (stmt.has("element")) {
            element(stmt.text("element"), Arguments.of(stmt.text("element"), stmt));
        } else if (stmt.has("boundary")) {
            boundary(stmt);
        } else if (stmt.has("relation")) {
            relation(stmt.text("relation"), Arguments.of(stmt.text("relation"), stmt));
        } else if (stmt.has("layout_config")) {
            Arguments.of("UpdateLayoutConfig", stmt).named.forEach(layoutConfig::put);
        } else if (stmt.has("element_style")) {
            Arguments args = Arguments.of(stmt.text("element_style"), stmt);
            String elementId = args.required(0, "element id");
            C4Element element = elements.get(elementId);
            if (element == null) {
                logger.debug("Style update for undeclared element {}", args.positional(0));
            } else {
                elements.put(elementId, element.toBuilder().styles(restyled(element.styles(), args.named)).build());
            }
        } else if (stmt.has("rel_style")) {
            Arguments args = Arguments.of("UpdateRelStyle", stmt);
            String from = args.required(0, "from");
            String to = args.required(1, "to");
            relationships.replaceAll(r -> r.fromId().equals(from) && r.toId().equals(to)
                    ? r.toBuilder().styles(restyled(r.styles(), args.named)).build()
                    : r);
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        } else if (stmt.has("title")) {
            title = stmt.text("title");
        }
    }

    private void element(String macro, Arguments args) {
        String id = args.required(0, "alias");
        boolean technical = macro.startsWith("Container") || macro.startsWith("Component");
        C4Element element = C4Element.builder()
                .id(id)
                .type(macro)
                .label(args.positionalOr(1, id))
                .technology(technical ? args.namedOr("techn", args.positional(2)) : args.named("techn"))
                .description(args.namedOr("descr", args.positional(technical ? 3 : 2)))
                .sprite(args.named("sprite"))
                .link(args.named("link"))
                .tags(args.named("tags"))
                .boundaryId(scope.current().orElse(null))
                .build();
        elements.put(id, element);
    }

    private void boundary(Captures stmt) {
        String macro = stmt.text("boundary");
        Arguments args = Arguments.of(macro, stmt);
        String id = args.required(0, "alias");
        String type = switch (macro) {
            case "Enterprise_Boundary" -> "enterprise";
            case "System_Boundary" -> "system";
            case "Container_Boundary" -> "container";
            default -> args.namedOr("type", args.positional(2));
        };
        boundaries.put(id, new C4Boundary(id, macro,
                args.positionalOr(1, id),
                type,
                args.namedOr("descr", macro.equals("Boundary") ? null : args.positional(3)),
                scope.current().orElse(null),
                args.named("tags"),
                args.named("link")));
        scope.within(id, () -> stmt.records("body").forEach(this::statement));
    }

    private void relation(String macro, Arguments args) {
        relationships.add(C4Relationship.builder()
                .fromId(args.required(0, "from"))
                .toId(args.required(1, "to"))
                .type(macro)
                .label(args.positional(2))
                .technology(args.namedOr("techn", args.positional(3)))
                .description(args.namedOr("descr", args.positional(4)))
                .index(relationships.size() + 1)
                .sprite(args.named("sprite"))
                .link(args.named("link"))
                .tags(args.named("tags"))
                .build());
    }

    private static Map<String, String> restyled(Map<String, String> current, Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(current);
        merged.putAll(overrides);
        return merged;
    }

    /** Positional and {@code $key=value} arguments of one macro call. */
    private static final class Arguments {
        private final List<String> positional = new ArrayList<>();
        private final Map<String, String> named = new LinkedHashMap<>();
        private final String macro;

        private Arguments(String macro) {
            this.macro = macro;
        }

        static Arguments of(String macro, Captures stmt) {
            Arguments args = new Arguments(macro);
            for (Captures arg : stmt.records("args")) {
                if (arg.has("key")) {
                    args.named.put(arg.text("key"), arg.text("value"));
                } else {
                    args.positional.add(arg.text("value"));
                }
            }
            return args;
        }

        /** Positional argument, null when absent or blank. */
        String positional(int index) {
            if (index >= positional.size() || positional.get(index).isBlank()) {
                return null;
            }
            return positional.get(index);
        }

        String positionalOr(int index, String fallback) {
            String value = positional(index);
            return value == null ? fallback : value;
        }

        String required(int index, String what) {
            String value = positional(index);
            if (value == null) {
                throw new CanonicalizationException(String.format("%s is missing its %s", macro, what));
            }
            return value;
        }

        String named(String key) {
            return named.get(key);
        }

        String namedOr(String key, String fallback) {
            return named.getOrDefault(key, fallback);
        }
    }
}
