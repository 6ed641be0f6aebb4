package org.sirena.architecture.models;

/**
 * A service or, when {@code junction} is set, a four-way junction without icon or label.
 */
public record ArchitectureService(String id, String icon, String label, String groupId, boolean junction) {
}
