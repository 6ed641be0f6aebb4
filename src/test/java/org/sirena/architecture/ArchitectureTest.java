package org.sirena.architecture;

import org.junit.jupiter.api.Test;
import org.sirena.architecture.models.ArchitectureDiagram;
import org.sirena.architecture.models.ArchitectureEdge;
import org.sirena.architecture.models.ArchitectureGroup;
import org.sirena.architecture.models.ArchitectureService;
import org.sirena.diagram.DiagramParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchitectureTest {

    private final DiagramParser<ArchitectureDiagram> parser =
            new DiagramParser<>("architecture", new ArchitectureGrammar(), ArchitectureTransform::new);

    @Test
    void shouldParseGroupsServicesAndEdges() {
        ArchitectureDiagram diagram = parser.parse("""
                architecture-beta
                group api(cloud)[API]
                service db(database)[Database] in api
                service server(server)[Server] in api
                junction j1 in api
                db:L -- R:server
                server:T <--> B:j1 : sync
                """);

        assertEquals(new ArchitectureGroup("api", "cloud", "API", null), diagram.findGroup("api"));
        assertEquals(new ArchitectureService("db", "database", "Database", "api", false), diagram.findService("db"));
        assertTrue(diagram.findService("j1").junction());
        assertEquals(3, diagram.servicesIn("api").size());

        assertEquals(ArchitectureEdge.builder()
                .fromId("db").fromSide("L").toId("server").toSide("R").build(), diagram.edgesFrom("db").get(0));
        ArchitectureEdge sync = diagram.edgesTo("j1").get(0);
        assertTrue(sync.fromArrow());
        assertTrue(sync.toArrow());
        assertEquals("sync", sync.label());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldMergeRedeclaredService() {
        ArchitectureDiagram diagram = parser.parse("""
                architecture-beta
                service web(internet)
                service web[Web Front]
                """);

        assertEquals(List.of(new ArchitectureService("web", "internet", "Web Front", null, false)),
                diagram.services());
    }

    @Test
    void shouldReportEdgeToUnknownServiceAsInvalid() {
        ArchitectureDiagram diagram = parser.parse("architecture-beta\nservice a\na --> ghost\n");

        assertTrue(diagram.edgesFrom("a").get(0).toArrow());
        assertFalse(diagram.isValid());
    }
}
