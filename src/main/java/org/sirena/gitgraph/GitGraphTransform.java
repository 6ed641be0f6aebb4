package org.sirena.gitgraph;

import org.sirena.diagram.Transform;
import org.sirena.gitgraph.models.GitBranch;
import org.sirena.gitgraph.models.GitCommit;
import org.sirena.gitgraph.models.GitGraph;
import org.sirena.grammar.CstNode.Captures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays gitGraph commands against a current-branch pointer. Commits are append-only;
 * a commit's parent is the latest earlier commit made on the same branch, or the branch
 * point for the first commit of a branch.
 */
public class GitGraphTransform implements Transform<GitGraph> {

    private static final Logger logger = LoggerFactory.getLogger(GitGraphTransform.class);

    static final String MAIN = "main";

    private final List<GitCommit> commits = new ArrayList<>();
    private final Map<String, GitBranch> branches = new LinkedHashMap<>();
    private String currentBranch = MAIN;
    private int commitCounter;
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public GitGraph apply(Captures tree) {
        branches.put(MAIN, new GitBranch(MAIN, 0, null, null, false));
        for (Captures stmt : tree.records("statements")) {
            if (stmt.has("command")) {
                command(stmt);
            } else if (stmt.has("acc_title")) {
                accTitle = stmt.text("acc_title");
            } else if (stmt.has("acc_descr")) {
                accDescription = stmt.text("acc_descr");
            } else if (stmt.has("title")) {
                title = stmt.text("title");
            }
        }
        String direction = tree.has("direction") ? tree.text("direction") : "LR";
        return new GitGraph(direction, commits, new ArrayList<>(branches.values()), title, accTitle, accDescription);
    }

    private void command(Captures stmt) {
        Map<String, String> options = options(stmt);
        switch (stmt.text("command")) {
            case "commit" -> commit(options, null, null);
            case "branch" -> branch(stmt.text("branch"), options.get("order"), false);
            case "checkout" -> checkout(stmt.text("branch"));
            case "merge" -> merge(stmt.text("branch"), options);
            case "cherry_pick" -> cherryPick(options);
            default -> throw new IllegalStateException("Unknown git command " + stmt.text("command"));
        }
    }

    private GitCommit commit(Map<String, String> options, String mergeBranch, String cherryPickSource) {
        commitCounter++;
        List<String> parents = new ArrayList<>();
        String head = head(currentBranch);
        if (head != null) {
            parents.add(head);
        }
        if (mergeBranch != null) {
            String mergedTip = head(mergeBranch);
            if (mergedTip != null && !parents.contains(mergedTip)) {
                parents.add(mergedTip);
            }
        }
        GitCommit commit = GitCommit.builder()
                .id(options.getOrDefault("id", "commit-" + commitCounter))
                .type(options.get("type"))
                .tag(options.get("tag"))
                .branch(currentBranch)
                .parentIds(parents)
                .merge(mergeBranch != null)
                .mergeBranch(mergeBranch)
                .cherryPick(cherryPickSource != null)
                .cherryPickSource(cherryPickSource)
                .cherryPickParent(cherryPickSource != null ? options.get("parent") : null)
                .build();
        commits.add(commit);
        return commit;
    }

    /** Declaring an existing branch again is a no-op; the current branch does not change. */
    private void branch(String name, String order, boolean implicit) {
        if (branches.containsKey(name)) {
            return;
        }
        String createdAt = commits.isEmpty() ? null : commits.get(commits.size() - 1).id();
        branches.put(name, new GitBranch(name, order == null ? null : Integer.valueOf(order),
                currentBranch, createdAt, implicit));
    }

    private void checkout(String name) {
        if (!branches.containsKey(name)) {
            logger.debug("Checkout of undeclared branch {}, registering it implicitly", name);
            branch(name, null, true);
        }
        currentBranch = name;
    }

    private void merge(String name, Map<String, String> options) {
        if (!branches.containsKey(name)) {
            logger.warn("Merge of unknown branch {} into {}", name, currentBranch);
        }
        commit(options, name, null);
    }

    private void cherryPick(Map<String, String> options) {
        Map<String, String> own = new HashMap<>(options);
        String source = own.remove("id");
        if (source == null) {
            logger.warn("cherry-pick without a source commit id on branch {}", currentBranch);
            source = "";
        }
        commit(own, null, source);
    }

    /** Latest commit on the branch, or the commit it was created at while it has none. */
    private String head(String branch) {
        for (int i = commits.size() - 1; i >= 0; i--) {
            if (commits.get(i).branch().equals(branch)) {
                return commits.get(i).id();
            }
        }
        GitBranch known = branches.get(branch);
        return known == null ? null : known.createdAtCommit();
    }

    private static Map<String, String> options(Captures stmt) {
        Map<String, String> options = new HashMap<>();
        for (Captures option : stmt.records("options")) {
            option.captures().keySet().forEach(key -> options.put(key, option.text(key)));
        }
        return options;
    }
}
