package org.sirena.state.models;

/**
 * @param position left_of or right_of
 */
public record StateNote(String stateId, String position, String text) {
}
