package org.sirena.classdiagram;

import org.junit.jupiter.api.Test;
import org.sirena.classdiagram.models.ClassAttribute;
import org.sirena.classdiagram.models.ClassDiagram;
import org.sirena.classdiagram.models.ClassEntity;
import org.sirena.classdiagram.models.ClassMethod;
import org.sirena.classdiagram.models.ClassNote;
import org.sirena.classdiagram.models.ClassRelationship;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.GrammarException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassDiagramTest {

    private final DiagramParser<ClassDiagram> parser =
            new DiagramParser<>("class", new ClassDiagramGrammar(), ClassDiagramTransform::new);

    @Test
    void shouldParseMembersAndNormaliseInheritance() {
        ClassDiagram diagram = parser.parse("""
                classDiagram
                Animal <|-- Duck
                class Duck {
                  +String beakColor
                  +swim() void
                  -quack()$ int
                }
                Animal : +int age
                """);

        assertEquals(List.of("Animal", "Duck"), diagram.classes().stream().map(ClassEntity::getId).toList());
        assertEquals(List.of("Animal"), diagram.parents("Duck"));
        assertEquals(List.of("Duck"), diagram.children("Animal"));

        ClassEntity duck = diagram.findClass("Duck");
        assertEquals(List.of(new ClassAttribute("beakColor", "String", "public", false)), duck.getAttributes());
        assertEquals(List.of(
                ClassMethod.builder().name("swim").returnType("void").visibility("public").build(),
                ClassMethod.builder().name("quack").returnType("int").visibility("private").isStatic(true).build()),
                duck.getMethods());
        assertEquals(List.of(new ClassAttribute("age", "int", "public", false)),
                diagram.findClass("Animal").getAttributes());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldQualifyNamespaceMembersAndKeepCardinalities() {
        ClassDiagram diagram = parser.parse("""
                classDiagram
                namespace Shapes {
                  class Square~Shape~
                  class Circle
                }
                Customer "1" --> "*" Ticket : buys
                note for Customer "VIP"
                """);

        assertEquals(1, diagram.namespaces().size());
        assertEquals(List.of("Shapes.Square", "Shapes.Circle"), diagram.namespaces().get(0).classIds());
        assertEquals("Shape", diagram.findClass("Shapes.Square").getGeneric());
        assertEquals("Shapes", diagram.findClass("Shapes.Circle").getNamespace());

        ClassRelationship buys = diagram.relationshipsFrom("Customer").get(0);
        assertEquals("Ticket", buys.targetId());
        assertEquals("association", buys.type());
        assertEquals("1", buys.sourceCardinality());
        assertEquals("*", buys.targetCardinality());
        assertEquals("buys", buys.label());
        assertEquals(List.of(new ClassNote("Customer", "VIP")), diagram.notes());
    }

    @Test
    void shouldReportDanglingRelationshipAsInvalid() {
        ClassRelationship dangling = ClassRelationship.builder()
                .sourceId("A").targetId("Missing").type("association").operator("-->").build();
        ClassDiagram diagram = new ClassDiagram("TB", List.of(new ClassEntity("A")), List.of(dangling),
                null, null, null, null, null, null, null);

        assertFalse(diagram.isValid());
    }

    @Test
    void shouldRejectIncompleteRelationship() {
        assertThrows(GrammarException.class, () -> parser.parse("classDiagram\nA <|-- \n"));
    }
}
