package org.sirena.classdiagram.models;

/**
 * @param classId the class the note is attached to, or null for a free-standing note
 */
public record ClassNote(String classId, String text) {
}
