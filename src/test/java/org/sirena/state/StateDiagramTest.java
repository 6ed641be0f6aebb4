package org.sirena.state;

import org.junit.jupiter.api.Test;
import org.sirena.diagram.DiagramParser;
import org.sirena.state.models.StateDiagram;
import org.sirena.state.models.StateNode;
import org.sirena.state.models.StateNote;
import org.sirena.state.models.StateTransition;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateDiagramTest {

    private final DiagramParser<StateDiagram> parser =
            new DiagramParser<>("state", new StateDiagramGrammar(), StateDiagramTransform::new);

    @Test
    void shouldGivePseudoStatesPerScope() {
        StateDiagram diagram = parser.parse("""
                stateDiagram-v2
                [*] --> Idle
                Idle --> Running : start [ready]
                state Running {
                  [*] --> Working
                  Working --> [*]
                }
                Running --> [*]
                state check <<choice>>
                """);

        assertEquals("start_1", diagram.startState().getId());
        assertEquals(List.of("start_2", "Working", "end_3"),
                diagram.childrenOf("Running").stream().map(StateNode::getId).toList());
        assertEquals(List.of("end_3", "end_4"), diagram.endStates().stream().map(StateNode::getId).toList());
        assertEquals(List.of("Running"), diagram.compositeStates().stream().map(StateNode::getId).toList());
        assertEquals(List.of("check"), diagram.choiceStates().stream().map(StateNode::getId).toList());
        assertNull(diagram.findState("Idle").getParentId());
        assertTrue(diagram.isValid());
    }

    @Test
    void shouldSplitTriggerAndGuard() {
        StateDiagram diagram = parser.parse("""
                stateDiagram
                Idle --> Running : start [ready]
                Running --> Idle : stop
                """);

        assertEquals(new StateTransition("Idle", "Running", "start [ready]", "start", "ready"),
                diagram.transitionsFrom("Idle").get(0));
        assertEquals(new StateTransition("Running", "Idle", "stop", "stop", null),
                diagram.transitionsFrom("Running").get(0));
    }

    @Test
    void shouldCreateImplicitStatesFromChainedTransitions() {
        StateDiagram diagram = parser.parse("""
                stateDiagram-v2
                A --> B --> C
                note right of A : first
                """);

        assertEquals(List.of("A", "B", "C"), diagram.states().stream().map(StateNode::getId).toList());
        assertEquals(List.of(new StateTransition("A", "B"), new StateTransition("B", "C")), diagram.transitions());
        assertEquals(List.of(new StateNote("A", "right_of", "first")), diagram.notes());
        assertEquals("normal", diagram.findState("B").getType());
    }

    @Test
    void shouldReportDanglingTransitionAsInvalid() {
        StateDiagram diagram = new StateDiagram("TB", List.of(new StateNode("A")),
                List.of(new StateTransition("A", "Ghost")), null, null, null, null, null);

        assertFalse(diagram.isValid());
    }
}
