package org.sirena.state.models;

/**
 * @param label   full label text, empty when none
 * @param trigger label part before a {@code [guard]}, null when unlabeled
 * @param guard   bracketed condition, null when absent
 */
public record StateTransition(String fromId, String toId, String label, String trigger, String guard) {

    public StateTransition(String fromId, String toId) {
        this(fromId, toId, "", null, null);
    }
}
