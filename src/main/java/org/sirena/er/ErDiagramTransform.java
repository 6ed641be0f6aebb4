package org.sirena.er;

import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.er.models.ErAttribute;
import org.sirena.er.models.ErDiagram;
import org.sirena.er.models.ErEntity;
import org.sirena.er.models.ErRelationship;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode.Captures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ErDiagramTransform implements Transform<ErDiagram> {

    private static final Map<String, String> CARDINALITIES = Map.ofEntries(
            Map.entry("||", "one"),
            Map.entry("o|", "zero_or_one"),
            Map.entry("|o", "zero_or_one"),
            Map.entry("o{", "zero_or_more"),
            Map.entry("{o", "zero_or_more"),
            Map.entry("}o", "zero_or_more"),
            Map.entry("|{", "one_or_more"),
            Map.entry("{|", "one_or_more"),
            Map.entry("}|", "one_or_more"),
            Map.entry("}{", "one_or_more"),
            Map.entry("{}", "one_or_more"));

    private final EntityRegistry<ErEntity> entities = new EntityRegistry<>(ErEntity::new);
    private final List<ErRelationship> relationships = new ArrayList<>();
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public ErDiagram apply(Captures tree) {
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("from")) {
                relationship(stmt);
            } else if (stmt.has("entity")) {
                entity(stmt);
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        return new ErDiagram(entities.values(), relationships, title, accTitle, accDescription);
    }

    private void entity(Captures stmt) {
        ErEntity entity = entities.findOrCreate(stmt.text("entity"));
        entity.setLabel(EntityRegistry.merge(entity.getLabel(), stmt.optText("alias")));
        for (Captures attribute : stmt.records("attributes")) {
            List<String> keys = attribute.has("keys")
                    ? Arrays.stream(attribute.text("keys").split(",")).map(String::trim).toList()
                    : List.of();
            entity.putAttribute(new ErAttribute(attribute.text("name"), attribute.text("type"), keys,
                    attribute.has("comment") ? attribute.text("comment") : null));
        }
    }

    private void relationship(Captures stmt) {
        String from = entities.findOrCreate(stmt.text("from")).getId();
        String to = entities.findOrCreate(stmt.text("to")).getId();
        relationships.add(ErRelationship.builder()
                .fromId(from)
                .toId(to)
                .cardinalityFrom(cardinality(stmt.text("card_from")))
                .cardinalityTo(cardinality(stmt.text("card_to")))
                .relationshipType(stmt.text("operator").equals("==") ? "identifying" : "non-identifying")
                .label(stmt.optText("label"))
                .build());
    }

    private static String cardinality(String symbol) {
        String meaning = CARDINALITIES.get(symbol);
        if (meaning == null) {
            throw new CanonicalizationException("Unknown cardinality symbol: " + symbol);
        }
        return meaning;
    }
}
