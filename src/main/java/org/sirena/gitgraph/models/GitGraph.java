package org.sirena.gitgraph.models;

import org.sirena.diagram.Diagram;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record GitGraph(
        String direction,
        List<GitCommit> commits,
        List<GitBranch> branches,
        String title,
        String accTitle,
        String accDescription
) implements Diagram {

    public GitGraph {
        commits = commits == null ? List.of() : List.copyOf(commits);
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    @Override
    public String diagramType() {
        return "gitgraph";
    }

    /** Valid when parents, branches, merge sources and cherry-pick sources all resolve. */
    @Override
    public boolean isValid() {
        Set<String> commitIds = new HashSet<>();
        Set<String> branchNames = new HashSet<>();
        commits.forEach(c -> commitIds.add(c.id()));
        branches.forEach(b -> branchNames.add(b.name()));
        return commits.stream().allMatch(c ->
                commitIds.containsAll(c.parentIds())
                        && branchNames.contains(c.branch())
                        && (!c.merge() || branchNames.contains(c.mergeBranch()))
                        && (!c.cherryPick() || commitIds.contains(c.cherryPickSource())));
    }

    public GitCommit findCommit(String id) {
        return commits.stream().filter(c -> c.id().equals(id)).findFirst().orElse(null);
    }

    public GitBranch findBranch(String name) {
        return branches.stream().filter(b -> b.name().equals(name)).findFirst().orElse(null);
    }

    public List<GitCommit> commitsOnBranch(String name) {
        return commits.stream().filter(c -> c.branch().equals(name)).toList();
    }
}
