package org.sirena.c4;

import org.junit.jupiter.api.Test;
import org.sirena.c4.models.C4Boundary;
import org.sirena.c4.models.C4Diagram;
import org.sirena.c4.models.C4Element;
import org.sirena.c4.models.C4Relationship;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.CanonicalizationException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class C4DiagramTest {

    private final DiagramParser<C4Diagram> parser = new DiagramParser<>("c4", new C4Grammar(), C4Transform::new);

    @Test
    void shouldParseElementsBoundariesAndRelationships() {
        C4Diagram diagram = parser.parse("""
                C4Container
                title Shop
                Person(customer, "Customer", "A buyer")
                System_Boundary(shop, "Shop") {
                  Container(api, "API", "Java", "Handles requests")
                  ContainerDb_Ext(db, "Database", $techn="Postgres")
                }
                Rel(customer, api, "Uses", "HTTPS")
                BiRel(api, db, "Reads")
                UpdateElementStyle(customer, $fontColor="red")
                UpdateRelStyle(customer, api, $textColor="blue")
                UpdateLayoutConfig($c4ShapeInRow="3")
                """);

        assertEquals("C4Container", diagram.c4Type());
        assertEquals("Shop", diagram.title());

        C4Element customer = diagram.findElement("customer");
        assertEquals("person", customer.kind());
        assertEquals("A buyer", customer.description());
        assertNull(customer.boundaryId());
        assertEquals(Map.of("fontColor", "red"), customer.styles());

        C4Element api = diagram.findElement("api");
        assertEquals("Java", api.technology());
        assertEquals("Handles requests", api.description());

        C4Element db = diagram.findElement("db");
        assertTrue(db.isExternal());
        assertEquals("Postgres", db.technology());

        C4Boundary shop = diagram.findBoundary("shop");
        assertEquals("system", shop.type());
        assertFalse(shop.isDeploymentNode());
        assertEquals(List.of("api", "db"), diagram.elementsInBoundary("shop").stream().map(C4Element::id).toList());

        C4Relationship uses = diagram.relationshipsFrom("customer").get(0);
        assertEquals(1, uses.index());
        assertEquals("Uses", uses.label());
        assertEquals("HTTPS", uses.technology());
        assertEquals(Map.of("textColor", "blue"), uses.styles());
        assertTrue(diagram.relationshipsTo("db").get(0).isBidirectional());
        assertEquals(2, diagram.relationshipsTo("db").get(0).index());

        assertEquals(Map.of("c4ShapeInRow", "3"), diagram.layoutConfig());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldTreatDeploymentNodesAsNestedBoundaries() {
        C4Diagram diagram = parser.parse("""
                C4Deployment
                Deployment_Node(dc, "Data Center", "Rack") {
                  Node(vm, "VM", "Ubuntu") {
                    Container(app, "App", "Go")
                  }
                }
                Rel_U(app, vm, "Runs on")
                """);

        C4Boundary vm = diagram.findBoundary("vm");
        assertTrue(vm.isDeploymentNode());
        assertEquals("dc", vm.parentId());
        assertEquals("Ubuntu", vm.type());
        assertEquals("vm", diagram.findElement("app").boundaryId());
        assertEquals("up", diagram.relationshipsFrom("app").get(0).direction());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldRejectRelationshipWithoutTarget() {
        CanonicalizationException e = assertThrows(CanonicalizationException.class,
                () -> parser.parse("C4Context\nRel(a)\n"));
        assertEquals("Rel is missing its to", e.getMessage());
    }
}
