package org.sirena.mindmap;

import org.sirena.diagram.IndentationTree;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.mindmap.models.Mindmap;
import org.sirena.mindmap.models.MindmapNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class MindmapTransform implements Transform<Mindmap> {

    @Override
    public Mindmap apply(Captures tree) {
        List<MindmapNode> nodes = new ArrayList<>();
        List<Integer> indents = new ArrayList<>();
        for (Captures line : tree.records("statements")) {
            MindmapNode previous = nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
            if (line.has("icon")) {
                if (previous != null) previous.setIcon(line.text("icon"));
            } else if (line.has("classes")) {
                if (previous != null) {
                    Arrays.stream(line.text("classes").split("\\s+")).forEach(previous::addClass);
                }
            } else {
                nodes.add(new MindmapNode("node-" + nodes.size(), line.text("text"), line.text("shape")));
                indents.add(line.rawText("indent").length());
            }
        }
        IndentationTree.Layout layout = IndentationTree.build(indents);
        for (int i = 0; i < nodes.size(); i++) {
            nodes.get(i).setLevel(layout.level(i));
            nodes.get(i).setParentIndex(layout.parent(i));
        }
        return new Mindmap(nodes);
    }
}
