package org.sirena.architecture.models;

public record ArchitectureGroup(String id, String icon, String label, String parentId) {
}
