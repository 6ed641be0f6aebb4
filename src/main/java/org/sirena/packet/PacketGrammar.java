package org.sirena.packet;

import org.sirena.grammar.Grammar;
import org.sirena.grammar.Rule;

import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

/**
 * Grammar for {@code packet-beta} documents. A field is {@code start-end: "label"},
 * a single bit {@code n: "label"}, or a width relative to the previous field
 * {@code +n: "label"}.
 */
public class PacketGrammar extends Grammar {

    private final Rule header = seq(choice(str("packet-beta"), keyword("packet")), LINE_END);

    private final Rule range = choice(
            seq(PLUS, INTEGER.as("bits")),
            seq(INTEGER.as("start"), seq(OPT_SPACES, MINUS, OPT_SPACES, INTEGER.as("end")).maybe()));

    private final Rule field = seq(
            range, OPT_SPACES, COLON, OPT_SPACES, STRING.as("label"), LINE_END);

    private final Rule root = document(header, choice(METADATA, field));

    @Override
    protected Rule root() {
        return root;
    }
}
