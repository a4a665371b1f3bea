package com.conductor.core.model;

import java.util.Locale;

/**
 * The development commands a job can run. Each constant carries the policy the
 * engine needs, so callers switch over the kind instead of comparing strings.
 */
public enum CommandKind {
    ASK(WorkspacePolicy.NONE, null, "ask", false, true),
    FEAT(WorkspacePolicy.NEW_BRANCH, "feat", "feat", true, true),
    FIX(WorkspacePolicy.NEW_BRANCH, "fix", "fix", true, true),
    PLAN(WorkspacePolicy.NEW_BRANCH, "plan", "plan", true, true),
    FEEDBACK(WorkspacePolicy.SESSION_BRANCH, null, "feedback", false, true),
    INIT(WorkspacePolicy.DEFAULT_BRANCH, "init", "init", false, false);

    /**
     * How a job of this kind gets its working directory.
     */
    public enum WorkspacePolicy {
        /** No worktree; the agent runs in the neutral directory. */
        NONE,
        /** Fresh branch {@code <prefix>-<jobId>} from the default branch. */
        NEW_BRANCH,
        /** Branch recorded by an earlier feat/fix/plan job. */
        SESSION_BRANCH,
        /** Changes land on the default branch; the worktree uses a throwaway {@code init-<jobId>} branch. */
        DEFAULT_BRANCH
    }

    private final WorkspacePolicy workspacePolicy;
    private final String branchPrefix;
    private final String ruleKey;
    private final boolean recordsSession;
    private final boolean agentWritesOutput;

    CommandKind(WorkspacePolicy workspacePolicy, String branchPrefix, String ruleKey,
                boolean recordsSession, boolean agentWritesOutput) {
        this.workspacePolicy = workspacePolicy;
        this.branchPrefix = branchPrefix;
        this.ruleKey = ruleKey;
        this.recordsSession = recordsSession;
        this.agentWritesOutput = agentWritesOutput;
    }

    public WorkspacePolicy workspacePolicy() { return workspacePolicy; }

    /** Prefix of the branch created for the job, null when the job creates none. */
    public String branchPrefix() { return branchPrefix; }

    public String ruleKey() { return ruleKey; }

    /** Whether a successful run with commits leaves a session link for {@code feedback}. */
    public boolean recordsSession() { return recordsSession; }

    /** False when the engine writes the summary file itself instead of the agent. */
    public boolean agentWritesOutput() { return agentWritesOutput; }

    /** Lower-case name as typed in chat, e.g. {@code feat}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a chat command name, with or without a leading slash.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static CommandKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Command is required");
        }
        String normalized = value.trim();
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        try {
            return valueOf(normalized.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown command: " + value);
        }
    }
}
