package org.sirena.state.models;

import org.sirena.diagram.Diagram;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record StateDiagram(
        String direction,
        List<StateNode> states,
        List<StateTransition> transitions,
        List<StateNote> notes,
        Map<String, String> classDefs,
        String title,
        String accTitle,
        String accDescription
) implements Diagram {

    public StateDiagram {
        states = states == null ? List.of() : List.copyOf(states);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        notes = notes == null ? List.of() : List.copyOf(notes);
        classDefs = classDefs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classDefs));
    }

    @Override
    public String diagramType() {
        return "state";
    }

    /** Valid when every transition endpoint is a known state. */
    @Override
    public boolean isValid() {
        Set<String> ids = new HashSet<>();
        states.forEach(s -> ids.add(s.getId()));
        return transitions.stream().allMatch(t -> ids.contains(t.fromId()) && ids.contains(t.toId()));
    }

    public StateNode findState(String id) {
        return states.stream().filter(s -> s.getId().equals(id)).findFirst().orElse(null);
    }

    public List<StateTransition> transitionsFrom(String stateId) {
        return transitions.stream().filter(t -> t.fromId().equals(stateId)).toList();
    }

    public List<StateTransition> transitionsTo(String stateId) {
        return transitions.stream().filter(t -> t.toId().equals(stateId)).toList();
    }

    /** The top-level start state, or null when the diagram has none. */
    public StateNode startState() {
        return states.stream()
                .filter(s -> s.getType().equals("start") && s.getParentId() == null)
                .findFirst()
                .orElse(null);
    }

    public List<StateNode> endStates() {
        return ofType("end");
    }

    public List<StateNode> choiceStates() {
        return ofType("choice");
    }

    public List<StateNode> compositeStates() {
        return states.stream().filter(StateNode::isComposite).toList();
    }

    public List<StateNode> childrenOf(String stateId) {
        return states.stream().filter(s -> stateId.equals(s.getParentId())).toList();
    }

    private List<StateNode> ofType(String type) {
        return states.stream().filter(s -> s.getType().equals(type)).toList();
    }
}
