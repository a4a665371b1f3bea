package com.conductor.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A disposable linked worktree owned by exactly one job.
 *
 * @param path          worktree directory, unique per acquisition
 * @param project       owning project name
 * @param branch        branch checked out in the worktree
 * @param baseBranch    ref the branch was created from, used to detect new commits
 * @param createdAt     acquisition time
 * @param createdBranch true when the branch was created for this workspace
 */
public record Workspace(
    Path path,
    String project,
    String branch,
    String baseBranch,
    Instant createdAt,
    boolean createdBranch
) {}
