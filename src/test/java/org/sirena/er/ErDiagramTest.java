package org.sirena.er;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.er.models.ErAttribute;
import org.sirena.er.models.ErDiagram;
import org.sirena.er.models.ErEntity;
import org.sirena.er.models.ErRelationship;
import org.sirena.grammar.CanonicalizationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErDiagramTest {

    private final DiagramParser<ErDiagram> parser =
            new DiagramParser<>("er", new ErDiagramGrammar(), ErDiagramTransform::new);

    @Test
    void shouldParseRelationshipCardinalities() {
        ErDiagram diagram = parser.parse("""
                erDiagram
                CUSTOMER ||--o{ ORDER : places
                """);

        assertEquals(List.of("CUSTOMER", "ORDER"), diagram.entities().stream().map(ErEntity::getId).toList());
        assertEquals(1, diagram.relationships().size());
        ErRelationship places = diagram.relationships().get(0);
        assertEquals("one", places.cardinalityFrom());
        assertEquals("zero_or_more", places.cardinalityTo());
        assertFalse(places.isIdentifying());
        assertEquals("places", places.label());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldMarkUnlabelledDashedRelationshipAsNonIdentifying() {
        ErDiagram diagram = parser.parse("erDiagram\nCUSTOMER ||--o{ ORDER");

        assertEquals(2, diagram.entities().size());
        ErRelationship relationship = diagram.relationships().get(0);
        assertEquals("non-identifying", relationship.relationshipType());
        assertEquals("one", relationship.cardinalityFrom());
        assertEquals("zero_or_more", relationship.cardinalityTo());
        assertEquals("", relationship.label());
    }

    @Test
    void shouldParseAttributesWithKeysAndComments() {
        ErDiagram diagram = parser.parse("""
                erDiagram
                CUSTOMER {
                  string name PK "full name"
                  int age
                }
                ORDER ||==|{ LINE_ITEM : contains
                """);

        ErEntity customer = diagram.findEntity("CUSTOMER");
        assertEquals(List.of(
                new ErAttribute("name", "string", List.of("PK"), "full name"),
                new ErAttribute("age", "int", List.of(), null)), customer.getAttributes());
        assertEquals(1, customer.primaryKeys().size());

        assertEquals(1, diagram.identifyingRelationships().size());
        assertEquals("one_or_more", diagram.relationshipsTo("LINE_ITEM").get(0).cardinalityTo());
        assertTrue(diagram.nonIdentifyingRelationships().isEmpty());
    }

    @Test
    void shouldRejectUnknownCardinalityPair() {
        CanonicalizationException e = assertThrows(CanonicalizationException.class,
                () -> parser.parse("erDiagram\nA |}--|| B\n"));
        assertTrue(e.getMessage().contains("|}"));
    }

    @Test
    void shouldTreatEmptyDiagramAsInvalid() {
        assertFalse(parser.parse("erDiagram\n").isValid());
    }

    @Test
    void shouldNotExposeMutableCollections() {
        ErDiagram diagram = parser.parse("erDiagram\nCUSTOMER {\n  string name\n}\nCUSTOMER ||--o{ ORDER : places\n");
        ErEntity customer = diagram.findEntity("CUSTOMER");

        assertThrows(UnsupportedOperationException.class,
                () -> customer.getAttributes().add(new ErAttribute("age", "int", List.of(), null)));
        assertThrows(UnsupportedOperationException.class, () -> diagram.relationships().clear());
        assertThrows(UnsupportedOperationException.class, () -> diagram.entities().remove(0));
        assertEquals(1, customer.getAttributes().size());
        assertTrue(diagram.isValid());
    }
}
