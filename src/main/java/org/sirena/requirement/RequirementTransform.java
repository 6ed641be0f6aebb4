package org.sirena.requirement;

import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.requirement.models.Requirement;
import org.sirena.requirement.models.RequirementDiagram;
import org.sirena.requirement.models.RequirementElement;
import org.sirena.requirement.models.RequirementRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RequirementTransform implements Transform<RequirementDiagram> {

    private static final Logger logger = LoggerFactory.getLogger(RequirementTransform.class);

    private static final Map<String, String> REQUIREMENT_TYPES = Map.of(
            "requirement", "requirement",
            "functionalRequirement", "functional",
            "interfaceRequirement", "interface",
            "performanceRequirement", "performance",
            "physicalRequirement", "physical",
            "designConstraint", "designConstraint");

    private static final Set<String> RISKS = Set.of("low", "medium", "high");
    private static final Set<String> VERIFY_METHODS = Set.of("analysis", "inspection", "test", "demonstration");

    private final EntityRegistry<Requirement> requirements = new EntityRegistry<>(Requirement::new);
    private final EntityRegistry<RequirementElement> elements = new EntityRegistry<>(RequirementElement::new);
    private final List<RequirementRelation> relations = new ArrayList<>();
    private final Map<String, String> classDefs = new LinkedHashMap<>();
    private String direction = "TB";
    private String accTitle;
    private String accDescription;

    @Override
    public RequirementDiagram apply(Captures tree) {
        tree.records("statements").forEach(this::statement);
        return new RequirementDiagram(direction, requirements.values(), elements.values(), relations,
                classDefs, accTitle, accDescription);
    }

    private void statement(Captures stmt) {
        if (stmt.has("requirement")) {
            requirement(stmt);
        } else if (stmt.has("element")) {
            element(stmt);
        } else if (stmt.has("relation")) {
            relations.add(new RequirementRelation(
                    stmt.text("source"), stmt.text("target"), stmt.text("relation")));
        } else if (stmt.has("direction")) {
            direction = stmt.text("direction");
        } else if (stmt.has("style")) {
            for (String name : split(stmt.text("style"))) {
                style(name, stmt.text("css"));
            }
        } else if (stmt.has("class_def")) {
            for (String name : split(stmt.text("class_def"))) {
                classDefs.put(name, stmt.text("css"));
            }
        } else if (stmt.has("class_targets")) {
            for (String name : split(stmt.text("class_targets"))) {
                addClass(name, stmt.text("class_name"));
            }
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        }
    }

    private void requirement(Captures stmt) {
        Requirement requirement = requirements.findOrCreate(stmt.text("requirement"));
        requirement.setType(REQUIREMENT_TYPES.get(stmt.text("requirement_type")));
        classRefs(stmt).forEach(requirement::addClass);
        for (Captures property : stmt.records("properties")) {
            String value = unquote(property.text("value"));
            switch (property.text("key").toLowerCase()) {
                case "id" -> requirement.setId(value);
                case "text" -> requirement.setText(value);
                case "risk" -> requirement.setRisk(checked(value, RISKS, "risk"));
                case "verifymethod" -> requirement.setVerifyMethod(checked(value, VERIFY_METHODS, "verify method"));
                default -> logger.debug("Ignoring requirement property {}", property.text("key"));
            }
        }
    }

    private void element(Captures stmt) {
        RequirementElement element = elements.findOrCreate(stmt.text("element"));
        classRefs(stmt).forEach(element::addClass);
        for (Captures property : stmt.records("properties")) {
            String value = unquote(property.text("value"));
            switch (property.text("key").toLowerCase()) {
                case "type" -> element.setType(value);
                case "docref" -> element.setDocRef(value);
                default -> logger.debug("Ignoring element property {}", property.text("key"));
            }
        }
    }

    private void style(String name, String css) {
        requirements.find(name).ifPresent(r -> r.setStyle(css));
        elements.find(name).ifPresent(e -> e.setStyle(css));
    }

    private void addClass(String name, String cls) {
        requirements.find(name).ifPresent(r -> r.addClass(cls));
        elements.find(name).ifPresent(e -> e.addClass(cls));
    }

    private static List<String> classRefs(Captures stmt) {
        return stmt.has("class_ref") ? split(stmt.text("class_ref")) : List.of();
    }

    private static String checked(String value, Set<String> allowed, String what) {
        String normalized = value.toLowerCase();
        if (!allowed.contains(normalized)) {
            throw new CanonicalizationException(String.format("Unknown %s: %s", what, value));
        }
        return normalized;
    }

    private static List<String> split(String text) {
        List<String> parts = new ArrayList<>();
        for (String part : text.split(",")) {
            if (!part.isBlank()) parts.add(part.trim());
        }
        return parts;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
