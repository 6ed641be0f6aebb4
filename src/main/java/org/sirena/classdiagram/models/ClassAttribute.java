package org.sirena.classdiagram.models;

/**
 * @param visibility public, private, protected or package
 * @param type       declared type, empty when the member names none
 */
public record ClassAttribute(String name, String type, String visibility, boolean isStatic) {
}
