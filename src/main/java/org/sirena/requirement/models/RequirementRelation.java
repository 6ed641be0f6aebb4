package org.sirena.requirement.models;

/**
 * @param type one of contains, copies, derives, satisfies, verifies, refines, traces
 */
public record RequirementRelation(String sourceId, String targetId, String type) {
}
