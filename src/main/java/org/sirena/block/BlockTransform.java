package org.sirena.block;

import org.sirena.block.models.Block;
import org.sirena.block.models.BlockDiagram;
import org.sirena.block.models.BlockEdge;
import org.sirena.diagram.ContextStack;
import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BlockTransform implements Transform<BlockDiagram> {

    private static final Logger logger = LoggerFactory.getLogger(BlockTransform.class);

    private final EntityRegistry<Block> blocks = new EntityRegistry<>(Block::new);
    private final List<BlockEdge> edges = new ArrayList<>();
    private final Map<String, String> classDefs = new LinkedHashMap<>();
    private final ContextStack<Block> scope = new ContextStack<>();
    private int spaceCounter;
    private int compoundCounter;
    private Integer columns;
    private String accTitle;
    private String accDescription;

    @Override
    public BlockDiagram apply(Captures tree) {
        tree.records("statements").forEach(this::statement);
        logger.debug("Block diagram: {} blocks, {} edges", blocks.size(), edges.size());
        return new BlockDiagram(columns, blocks.values(), edges, classDefs, accTitle, accDescription);
    }

    private void statement(Captures stmt) {
        if (stmt.has("compound")) {
            compound(stmt);
        } else if (stmt.has("items")) {
            stmt.records("items").forEach(this::item);
        } else if (stmt.has("from")) {
            String from = ref(stmt.record("from"));
            String to = ref(stmt.record("to"));
            edges.add(new BlockEdge(from, to, stmt.has("edge_label") ? stmt.text("edge_label") : null,
                    stmt.text("arrow_type")));
        } else if (stmt.has("columns")) {
            String value = stmt.text("columns");
            Integer count = value.equals("auto") ? null : Integer.valueOf(value);
            scope.current().ifPresentOrElse(b -> b.setColumns(count), () -> columns = count);
        } else if (stmt.has("style")) {
            blocks.findOrCreate(stmt.text("style")).setStyle(stmt.text("css"));
        } else if (stmt.has("class_def")) {
            classDefs.put(stmt.text("class_def"), stmt.text("css"));
        } else if (stmt.has("class_targets")) {
            for (String id : stmt.text("class_targets").split(",")) {
                blocks.findOrCreate(id.trim()).addClass(stmt.text("class_name"));
            }
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        }
    }

    private void compound(Captures stmt) {
        String id = stmt.has("compound_id") ? stmt.text("compound_id") : "compound-" + compoundCounter++;
        Block block = place(id);
        block.setType("composite");
        if (stmt.has("width")) {
            block.setWidth(Integer.parseInt(stmt.text("width")));
        }
        scope.within(block, () -> stmt.records("body").forEach(this::statement));
    }

    private void item(Captures item) {
        String kind = item.text("kind");
        Block block;
        if (kind.equals("space")) {
            block = place("space-" + spaceCounter++);
            block.setType("space");
            block.setLabel("");
        } else {
            block = place(item.text("id"));
            if (kind.equals("block_arrow")) {
                block.setType("block_arrow");
                block.setLabel(stripQuotes(item.text("label")));
                block.setArrowDirection(item.text("arrow_direction"));
            } else {
                applyShape(block, item);
            }
        }
        if (item.has("width")) {
            block.setWidth(Integer.parseInt(item.text("width")));
        }
    }

    private String ref(Captures ref) {
        Block block = place(ref.text("id"));
        applyShape(block, ref);
        return block.getId();
    }

    private static void applyShape(Block block, Captures captures) {
        if (captures.has("shape")) {
            block.setType(captures.text("shape"));
            block.setLabel(EntityRegistry.merge(block.getLabel(), stripQuotes(captures.optText("label"))));
        }
    }

    /** Finds or creates the block; a new block joins the innermost open compound. */
    private Block place(String id) {
        boolean known = blocks.contains(id);
        Block block = blocks.findOrCreate(id);
        if (!known) {
            scope.current().ifPresent(parent -> {
                block.setParentId(parent.getId());
                parent.addChild(id);
            });
        }
        return block;
    }

    private static String stripQuotes(String text) {
        String s = text.trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
