package org.sirena.grammar;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.sirena.grammar.Lexical.*;
import static org.sirena.grammar.Rules.*;

class RulesTest {

    @Test
    void shouldFoldLiteralSequenceIntoLeaf() {
        CstNode node = seq(str("a"), str("b")).parse(new ParseState("ab"));

        CstNode.Leaf leaf = assertInstanceOf(CstNode.Leaf.class, node);
        assertEquals("ab", leaf.text());
    }

    @Test
    void shouldRestorePositionWhenSequenceFails() {
        ParseState state = new ParseState("ab");

        assertNull(seq(str("a"), str("c")).parse(state));
        assertEquals(0, state.pos());
    }

    @Test
    void shouldPreferLongestSpellingInOneOf() {
        ParseState state = new ParseState("->>x");

        CstNode node = oneOf("-", "->", "->>").parse(state);

        assertEquals("->>", ((CstNode.Leaf) node).text());
        assertEquals(3, state.pos());
    }

    @Test
    void shouldMergeCapturesOfSequence() {
        CstNode node = seq(IDENTIFIER.as("name"), SPACES, INTEGER.as("count")).parse(new ParseState("apples 12"));

        CstNode.Captures captures = assertInstanceOf(CstNode.Captures.class, node);
        assertEquals("apples", captures.text("name"));
        assertEquals("12", captures.text("count"));
    }

    @Test
    void shouldCollectRepeatedRecordsIntoSequence() {
        Rule list = seq(INTEGER.as("n"), COMMA.maybe()).repeat(1).as("numbers");

        CstNode.Captures captures = (CstNode.Captures) list.parse(new ParseState("1,2,3"));

        assertEquals(List.of("1", "2", "3"), captures.texts("numbers", "n"));
    }

    @Test
    void shouldReturnEmptyListForAbsentRepeat() {
        Rule list = seq(str("["), seq(INTEGER.as("n"), COMMA.maybe()).repeat(0).as("numbers"), str("]"));

        CstNode.Captures captures = (CstNode.Captures) list.parse(new ParseState("[]"));

        assertTrue(captures.records("numbers").isEmpty());
    }

    @Test
    void shouldNotMatchKeywordPrefixOfLongerWord() {
        assertNull(keyword("end").parse(new ParseState("ending")));
        assertNotNull(keyword("end").parse(new ParseState("end ")));
    }

    @Test
    void shouldStopAnyUntilBeforeDelimiter() {
        ParseState state = new ParseState("label]rest");

        CstNode node = anyUntil(RBRACKET).parse(state);

        assertEquals("label", ((CstNode.Leaf) node).text());
        assertEquals(5, state.pos());
    }

    @Test
    void shouldTagAlternativeWithConstant() {
        Rule arrow = choice(
                seq(str("-->"), constant("kind", "dotted")),
                seq(str("->"), constant("kind", "solid")));

        CstNode.Captures captures = (CstNode.Captures) arrow.parse(new ParseState("->"));

        assertEquals("solid", captures.text("kind"));
    }

    @Test
    void shouldUnescapeQuotedString() {
        CstNode node = QUOTED.parse(new ParseState("\"say \\\"hi\\\"\" tail"));

        assertEquals("say \"hi\"", ((CstNode.Leaf) node).text());
    }

    @Test
    void shouldFailOnUnterminatedQuotedString() {
        ParseState state = new ParseState("\"open");

        assertNull(QUOTED.parse(state));
        assertEquals(0, state.pos());
    }

    @Test
    void shouldAcceptLineEndWithSemicolonAndComment() {
        ParseState state = new ParseState(";  %% trailing note\nnext");

        assertNotNull(LINE_END.parse(state));
        assertEquals("next", state.input().substring(state.pos()));
    }

    @Test
    void shouldAcceptSignedDecimalNumbers() {
        assertEquals("-3.25", ((CstNode.Leaf) NUMBER.parse(new ParseState("-3.25"))).text());
    }

    @Test
    void shouldResolveForwardReference() {
        RuleRef item = ref("item");
        Rule list = seq(str("("), item.repeat(0), str(")"));
        item.define(choice(list, str("x")));

        ParseState state = new ParseState("(x(x)x)");

        assertNotNull(list.parse(state));
        assertTrue(state.atEnd());
    }

    @Test
    void shouldRaiseMissingCaptureAsCanonicalizationError() {
        CstNode.Captures captures = (CstNode.Captures) IDENTIFIER.as("name").parse(new ParseState("abc"));

        CanonicalizationException e = assertThrows(CanonicalizationException.class, () -> captures.text("other"));
        assertEquals(DiagramParseException.Kind.CANONICALIZATION, e.kind());
        assertEquals("", captures.optText("other"));
    }
}
