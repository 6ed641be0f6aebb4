package org.sirena.diagram;

import org.sirena.grammar.CstNode;

/**
 * Turns one concrete syntax tree into a model. Instances carry traversal state and are
 * used for a single document only.
 */
@FunctionalInterface
public interface Transform<T extends Diagram> {

    T apply(CstNode.Captures tree);
}
