package com.conductor.core.model;

/**
 * How a workspace should be checked out.
 */
public sealed interface WorkspaceMode permits WorkspaceMode.NewBranch, WorkspaceMode.ExistingBranch, WorkspaceMode.None {

    /**
     * Create branch {@code <prefix>-<shortId>} from the project's default branch.
     */
    record NewBranch(String prefix, String shortId) implements WorkspaceMode {
        public String branchName() {
            return prefix + "-" + shortId;
        }
    }

    /**
     * Check out a branch that must already exist.
     */
    record ExistingBranch(String name) implements WorkspaceMode {}

    /**
     * No workspace at all.
     */
    record None() implements WorkspaceMode {}

    WorkspaceMode NONE = new None();
}
