package org.sirena.info;

import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.info.models.ErrorDiagram;

public class ErrorTransform implements Transform<ErrorDiagram> {

    @Override
    public ErrorDiagram apply(Captures tree) {
        return new ErrorDiagram(tree.has("message") ? tree.text("message") : null);
    }
}
