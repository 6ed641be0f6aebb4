package org.sirena.gitgraph.models;

import lombok.Builder;

import java.util.List;

/**
 * One commit of a git graph.
 *
 * @param type             NORMAL, REVERSE or HIGHLIGHT
 * @param branch           branch that was checked out when the commit was made
 * @param parentIds        previous commit on the same branch, followed by the merged tip for merges
 * @param mergeBranch      branch merged by this commit, null unless {@code merge}
 * @param cherryPickSource commit copied by this commit, null unless {@code cherryPick}
 */
@Builder
public record GitCommit(
        String id,
        String type,
        String tag,
        String branch,
        List<String> parentIds,
        boolean merge,
        String mergeBranch,
        boolean cherryPick,
        String cherryPickSource,
        String cherryPickParent
) {
    public GitCommit {
        type = type == null ? "NORMAL" : type;
        parentIds = parentIds == null ? List.of() : List.copyOf(parentIds);
    }

    /** First parent, or null for a root commit. */
    public String parentId() {
        return parentIds.isEmpty() ? null : parentIds.get(0);
    }
}
