package org.sirena.gitgraph.models;

/**
 * @param order           display order; 0 for main, null when the document gives none
 * @param parentBranch    branch checked out when this one was created, null for main
 * @param createdAtCommit last commit made before the branch was created
 * @param implicit        the branch was never declared with {@code branch}, only checked out
 */
public record GitBranch(String name, Integer order, String parentBranch, String createdAtCommit, boolean implicit) {
}
