package com.conductor.core.model;

import java.time.Instant;

/**
 * Association between a finished feat/fix/plan job and the branch it left behind,
 * so a later {@code feedback} can continue on it.
 *
 * @param agentSessionId conversation id reported by the agent, resumed by feedback; nullable
 */
public record SessionLink(
    String project,
    String jobId,
    CommandKind command,
    String branchName,
    String agentSessionId,
    Instant createdAt
) {

    public SessionLink(String project, String jobId, CommandKind command, String branchName, Instant createdAt) {
        this(project, jobId, command, branchName, null, createdAt);
    }

    public boolean hasAgentSession() {
        return agentSessionId != null && !agentSessionId.isBlank();
    }

    public SessionLink withAgentSession(String sessionId) {
        return new SessionLink(project, jobId, command, branchName, sessionId, createdAt);
    }
}
