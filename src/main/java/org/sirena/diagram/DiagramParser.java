package org.sirena.diagram;

import org.sirena.grammar.CanonicalizationException;
import org.sirena.grammar.CstNode;
import org.sirena.grammar.DiagramParseException;
import org.sirena.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * A notation's grammar paired with a factory for its transform. The grammar is shared;
 * every call to {@link #parse(String)} gets a fresh transform.
 */
public class DiagramParser<T extends Diagram> {

    private static final Logger logger = LoggerFactory.getLogger(DiagramParser.class);

    private final String type;
    private final Grammar grammar;
    private final Supplier<? extends Transform<T>> transforms;

    public DiagramParser(String type, Grammar grammar, Supplier<? extends Transform<T>> transforms) {
        this.type = type;
        this.grammar = grammar;
        this.transforms = transforms;
    }

    public String getType()     { return type; }
    public Grammar getGrammar() { return grammar; }

    /**
     * Parses one document of this notation.
     *
     * @throws org.sirena.grammar.GrammarException if the text does not match the grammar
     * @throws CanonicalizationException if the tree cannot be turned into a model
     */
    public T parse(String text) {
        CstNode.Captures tree = grammar.parse(text);
        T model;
        try {
            model = transforms.get().apply(tree);
        } catch (DiagramParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CanonicalizationException(
                    String.format("Failed to build %s model: %s", type, e.getMessage()), e);
        }
        logger.debug("Parsed {} diagram (valid: {})", type, model.isValid());
        return model;
    }
}
