package org.sirena.requirement;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.grammar.CanonicalizationException;
import org.sirena.requirement.models.Requirement;
import org.sirena.requirement.models.RequirementDiagram;
import org.sirena.requirement.models.RequirementElement;
import org.sirena.requirement.models.RequirementRelation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequirementDiagramTest {

    private final DiagramParser<RequirementDiagram> parser =
            new DiagramParser<>("requirement", new RequirementGrammar(), RequirementTransform::new);

    @Test
    void shouldParseRequirementsElementsAndRelations() {
        RequirementDiagram diagram = parser.parse("""
                requirementDiagram
                direction LR
                functionalRequirement login_req {
                  id: 1.1
                  text: "Users can log in"
                  risk: High
                  verifymethod: Test
                }
                element login_test {
                  type: simulation
                  docref: reqs/login.md
                }
                login_test - verifies -> login_req
                login_req <- traces - login_test
                classDef critical fill:#f00
                class login_req critical
                """);

        assertEquals("LR", diagram.direction());
        Requirement req = diagram.findRequirement("login_req");
        assertEquals("functional", req.getType());
        assertEquals("1.1", req.getId());
        assertEquals("Users can log in", req.getText());
        assertEquals("high", req.getRisk());
        assertEquals("test", req.getVerifyMethod());
        assertEquals(List.of("critical"), req.getClasses());

        RequirementElement test = diagram.findElement("login_test");
        assertEquals("simulation", test.getType());
        assertEquals("reqs/login.md", test.getDocRef());

        assertEquals(List.of(
                new RequirementRelation("login_test", "login_req", "verifies"),
                new RequirementRelation("login_test", "login_req", "traces")), diagram.relationsFrom("login_test"));
        assertEquals(2, diagram.relationsTo("login_req").size());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldRejectUnknownRisk() {
        CanonicalizationException e = assertThrows(CanonicalizationException.class, () -> parser.parse("""
                requirementDiagram
                requirement r {
                  risk: extreme
                }
                """));
        assertEquals("Unknown risk: extreme", e.getMessage());
    }

    @Test
    void shouldReportRelationToUndeclaredNodeAsInvalid() {
        RequirementDiagram diagram = parser.parse("requirementDiagram\na - contains -> b\n");

        assertEquals("TB", diagram.direction());
        assertFalse(diagram.isValid());
    }
}
