package com.conductor.workspace;

import com.conductor.core.error.BranchNotFoundException;
import com.conductor.core.error.CloneException;
import com.conductor.core.error.WorkspaceAcquisitionException;
import com.conductor.core.metrics.ConductorMetrics;
import com.conductor.core.model.Project;
import com.conductor.core.model.Workspace;
import com.conductor.core.model.WorkspaceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out isolated git worktrees of a project's canonical clone, one per job.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>First use of a project: the canonical clone is created under a per-project lock</li>
 *   <li>Per job: {@link #acquire} fetches origin and adds a worktree in a fresh directory</li>
 *   <li>Job done: {@link #release} removes the worktree and optionally the branch it created</li>
 * </ol>
 *
 * <p>The per-project lock only serialises mutations of the canonical clone's git
 * metadata (clone, fetch, worktree add/remove). Agents run in their own
 * worktrees without holding it, so jobs on one project proceed in parallel.
 */
public class WorktreeManager {

    private static final Logger log = LoggerFactory.getLogger(WorktreeManager.class);

    private final GitWorkspaceManager git;
    private final Path worktreeBase;
    private final ConductorMetrics metrics;

    private final ConcurrentHashMap<String, ReentrantLock> projectLocks = new ConcurrentHashMap<>();

    /** Active worktree path to the canonical clone it belongs to. */
    private final ConcurrentHashMap<Path, Path> activeWorktrees = new ConcurrentHashMap<>();

    public WorktreeManager(GitWorkspaceManager git, Path worktreeBase) {
        this(git, worktreeBase, null);
    }

    public WorktreeManager(GitWorkspaceManager git, Path worktreeBase, ConductorMetrics metrics) {
        this.git = git;
        this.worktreeBase = worktreeBase;
        this.metrics = metrics;
    }

    /**
     * Acquires a workspace for one job.
     *
     * @return the workspace, or empty for {@link WorkspaceMode.None}
     * @throws CloneException                 if the canonical clone cannot be created
     * @throws BranchNotFoundException        if an existing branch was requested and is gone
     * @throws WorkspaceAcquisitionException  if git refuses to add the worktree
     */
    public Optional<Workspace> acquire(Project project, WorkspaceMode mode) {
        if (mode instanceof WorkspaceMode.None) {
            return Optional.empty();
        }

        Path repo = project.workDir();
        ensureClone(project);

        Path worktreePath = worktreeBase.resolve(project.name()).resolve(UUID.randomUUID().toString());
        ReentrantLock lock = lockFor(project.name());
        lock.lock();
        try {
            git.fetch(repo);
            String base = resolveBase(project);
            createParent(worktreePath);

            Workspace workspace;
            if (mode instanceof WorkspaceMode.NewBranch newBranch) {
                String branch = newBranch.branchName();
                var result = git.addWorktree(repo, worktreePath, branch, base);
                workspace = toWorkspace(result, worktreePath, project, branch, base, true);
            } else if (mode instanceof WorkspaceMode.ExistingBranch existing) {
                String branch = existing.name();
                GitWorkspaceManager.WorktreeResult result;
                if (git.refExists(repo, "refs/heads/" + branch)) {
                    result = git.addWorktreeForBranch(repo, worktreePath, branch);
                } else if (git.refExists(repo, "refs/remotes/origin/" + branch)) {
                    result = git.addWorktreeFromRemote(repo, worktreePath, branch);
                } else {
                    recordOperation("acquire", false);
                    throw new BranchNotFoundException(project.name(), branch);
                }
                workspace = toWorkspace(result, worktreePath, project, branch, base, false);
            } else {
                throw new IllegalArgumentException("Unsupported workspace mode: " + mode);
            }

            activeWorktrees.put(workspace.path(), repo);
            recordOperation("acquire", true);
            updateActiveGauge();
            log.info("Acquired worktree for {} at {} (branch: {})", project.name(), workspace.path(), workspace.branch());
            return Optional.of(workspace);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a workspace and keeps its branch.
     */
    public void release(Workspace workspace) {
        release(workspace, false);
    }

    /**
     * Removes the worktree. Idempotent and never throws; failures are logged.
     *
     * @param deleteBranch also delete the branch, if it was created for this workspace
     */
    public void release(Workspace workspace, boolean deleteBranch) {
        if (workspace == null) {
            return;
        }
        Path repo = activeWorktrees.remove(workspace.path());
        if (repo == null) {
            log.debug("Worktree {} already released", workspace.path());
            return;
        }

        ReentrantLock lock = lockFor(workspace.project());
        lock.lock();
        try {
            boolean removed = git.removeWorktree(repo, workspace.path());
            if (deleteBranch && workspace.createdBranch()) {
                git.deleteBranch(repo, workspace.branch());
            }
            recordOperation("release", removed);
            log.info("Released worktree {}{}", workspace.path(),
                    deleteBranch && workspace.createdBranch() ? " and deleted branch " + workspace.branch() : "");
        } catch (RuntimeException e) {
            recordOperation("release", false);
            log.warn("Failed to release worktree {}: {}", workspace.path(), e.getMessage(), e);
        } finally {
            lock.unlock();
            updateActiveGauge();
        }
    }

    /**
     * Whether the workspace's branch has commits its base does not.
     */
    public boolean hasNewCommits(Workspace workspace) {
        return git.countCommitsSince(workspace.path(), workspace.baseBranch()) > 0;
    }

    /**
     * Commits one file of the workspace and pushes it to {@code targetBranch}.
     *
     * @return true if pushed; failures are logged
     */
    public boolean commitAndPush(Workspace workspace, String file, String message, String targetBranch) {
        try {
            return git.commitAndPush(workspace.path(), file, message, targetBranch);
        } catch (RuntimeException e) {
            log.warn("Commit and push of {} failed in {}: {}", file, workspace.path(), e.getMessage(), e);
            return false;
        }
    }

    public int activeCount() {
        return activeWorktrees.size();
    }

    private void ensureClone(Project project) {
        if (git.isRepository(project.workDir())) {
            return;
        }
        ReentrantLock lock = lockFor(project.name());
        lock.lock();
        try {
            // A racing first request may have cloned while we waited.
            if (git.isRepository(project.workDir())) {
                return;
            }
            if (project.repoUrl() == null || project.repoUrl().isBlank()) {
                throw new CloneException("Project " + project.name() + " has no repository URL and "
                        + project.workDir() + " is not a git repository");
            }
            try {
                git.cloneRepository(project.repoUrl(), project.workDir());
                recordOperation("clone", true);
            } catch (CloneException e) {
                recordOperation("clone", false);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private String resolveBase(Project project) {
        String remote = "origin/" + project.defaultBranch();
        if (git.refExists(project.workDir(), remote)) {
            return remote;
        }
        log.debug("{} does not resolve in {}, using local {}", remote, project.name(), project.defaultBranch());
        return project.defaultBranch();
    }

    private Workspace toWorkspace(GitWorkspaceManager.WorktreeResult result, Path worktreePath, Project project,
                                  String branch, String base, boolean createdBranch) {
        if (!result.success()) {
            recordOperation("acquire", false);
            GitWorkspaceManager.deleteDirectory(worktreePath);
            throw new WorkspaceAcquisitionException(
                    "Could not create worktree for %s on branch %s: %s".formatted(project.name(), branch, result.error()));
        }
        return new Workspace(result.worktreePath(), project.name(), branch, base, Instant.now(), createdBranch);
    }

    private ReentrantLock lockFor(String project) {
        return projectLocks.computeIfAbsent(project, k -> new ReentrantLock());
    }

    private void createParent(Path worktreePath) {
        try {
            Files.createDirectories(worktreePath.getParent());
        } catch (IOException e) {
            throw new WorkspaceAcquisitionException("Cannot create " + worktreePath.getParent(), e);
        }
    }

    private void recordOperation(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordWorktreeOperation(operation, success);
        }
    }

    private void updateActiveGauge() {
        if (metrics != null) {
            metrics.setActiveWorktrees(activeWorktrees.size());
        }
    }
}
