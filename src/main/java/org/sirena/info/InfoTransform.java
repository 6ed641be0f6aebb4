package org.sirena.info;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.info.models.InfoDiagram;

public class InfoTransform implements Transform<InfoDiagram> {

    @Override
    public InfoDiagram apply(Captures tree) {
        return new InfoDiagram(tree.has("show_info"));
    }
}
