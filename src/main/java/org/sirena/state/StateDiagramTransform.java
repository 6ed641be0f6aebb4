package org.sirena.state;

import org.sirena.diagram.ContextStack;
import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;
import org.sirena.state.models.StateDiagram;
import org.sirena.state.models.StateNode;
import org.sirena.state.models.StateNote;
import org.sirena.state.models.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link StateDiagram}. Each scope (the document and every composite state)
 * gets its own start and end pseudo-state the first time {@code [*]} is used in it.
 */
public class StateDiagramTransform implements Transform<StateDiagram> {

    private static final Logger logger = LoggerFactory.getLogger(StateDiagramTransform.class);

    private static final String START_END = "[*]";
    private static final Pattern TRIGGER_GUARD = Pattern.compile("^(.*?)\\s*\\[(.+?)]\\s*$");

    private final EntityRegistry<StateNode> states = new EntityRegistry<>(StateNode::new);
    private final List<StateTransition> transitions = new ArrayList<>();
    private final List<StateNote> notes = new ArrayList<>();
    private final Map<String, String> classDefs = new LinkedHashMap<>();
    private final ContextStack<Scope> scopes = new ContextStack<>();
    private int pseudoCounter;
    private String direction = "TB";
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public StateDiagram apply(Captures tree) {
        scopes.within(new Scope(null), () -> tree.records("statements").forEach(this::statement));
        return new StateDiagram(direction, states.values(), transitions, notes, classDefs,
                title, accTitle, accDescription);
    }

    private void statement(Captures stmt) {
        if (stmt.has("direction")) {
            direction = stmt.text("direction");
        } else if (stmt.has("state")) {
            declare(stmt);
        } else if (stmt.has("separator")) {
            scope().region++;
        } else if (stmt.has("from")) {
            transition(stmt);
        } else if (stmt.has("described")) {
            touch(stmt.text("described")).addDescription(stmt.text("description"));
        } else if (stmt.has("note_of")) {
            notes.add(new StateNote(stmt.text("note_of"), stmt.text("position"), stmt.text("note")));
        } else if (stmt.has("class_def")) {
            classDefs.put(stmt.text("class_def"), stmt.text("css"));
        } else if (stmt.has("class_targets")) {
            for (String id : stmt.text("class_targets").split(",")) {
                states.find(id.trim()).ifPresentOrElse(
                        s -> s.addClass(stmt.text("class_name")),
                        () -> logger.debug("class {} applied to unknown state {}", stmt.text("class_name"), id));
            }
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        } else if (stmt.has("title")) {
            title = stmt.text("title");
        }
    }

    private void declare(Captures stmt) {
        StateNode state = touch(stmt.text("state"));
        state.setLabel(EntityRegistry.merge(state.getLabel(), stmt.optText("state_label")));
        if (stmt.has("marker")) {
            state.setType(stmt.text("marker"));
        }
        if (stmt.has("description")) {
            state.addDescription(stmt.text("description"));
        }
        if (stmt.has("composite")) {
            state.setComposite(true);
            scopes.within(new Scope(state.getId()), () -> stmt.records("body").forEach(this::statement));
        }
    }

    private void transition(Captures stmt) {
        String from = endpoint(stmt.text("from"), true);
        String to = endpoint(stmt.text("to"), false);
        String label = stmt.optText("label");
        String trigger = null;
        String guard = null;
        if (!label.isEmpty()) {
            Matcher m = TRIGGER_GUARD.matcher(label);
            if (m.matches()) {
                trigger = m.group(1).isEmpty() ? null : m.group(1);
                guard = m.group(2).trim();
            } else {
                trigger = label;
            }
        }
        transitions.add(new StateTransition(from, to, label, trigger, guard));
        String previous = to;
        for (Captures step : stmt.records("chain")) {
            String next = endpoint(step.text("next"), false);
            transitions.add(new StateTransition(previous, next));
            previous = next;
        }
    }

    /** Resolves {@code [*]} to the scope's start or end state; other ids are created on demand. */
    private String endpoint(String ref, boolean source) {
        if (!ref.equals(START_END)) {
            return touch(ref).getId();
        }
        Scope scope = scope();
        if (source) {
            if (scope.startId == null) {
                scope.startId = pseudoState("start");
            }
            return scope.startId;
        }
        if (scope.endId == null) {
            scope.endId = pseudoState("end");
        }
        return scope.endId;
    }

    private String pseudoState(String type) {
        String id = type + "_" + (++pseudoCounter);
        StateNode node = new StateNode(id, type);
        node.setLabel("");
        place(node);
        states.putIfAbsent(id, node);
        return id;
    }

    private StateNode touch(String id) {
        boolean known = states.contains(id);
        StateNode state = states.findOrCreate(id);
        if (!known) {
            place(state);
        }
        return state;
    }

    private void place(StateNode node) {
        Scope scope = scope();
        node.setParentId(scope.compositeId);
        node.setRegion(scope.region);
    }

    private Scope scope() {
        return scopes.current().orElseThrow(() -> new IllegalStateException("No open state scope"));
    }

    private static class Scope {
        final String compositeId;
        String startId;
        String endId;
        int region;

        Scope(String compositeId) {
            this.compositeId = compositeId;
        }
    }
}
