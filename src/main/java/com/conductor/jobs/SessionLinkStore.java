package com.conductor.jobs;

import com.conductor.core.model.SessionLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which branch each successful feat/fix/plan job left behind.
 */
public class SessionLinkStore {

    private static final Logger log = LoggerFactory.getLogger(SessionLinkStore.class);

    private final ConcurrentHashMap<String, Map<String, SessionLink>> linksByProject = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SessionLink> latestByProject = new ConcurrentHashMap<>();

    public void record(SessionLink link) {
        linksByProject.computeIfAbsent(link.project(), k -> new ConcurrentHashMap<>()).put(link.jobId(), link);
        latestByProject.merge(link.project(), link,
                (current, candidate) -> candidate.createdAt().isBefore(current.createdAt()) ? current : candidate);
        log.info("Session {} of {} linked to branch {}", link.jobId(), link.project(), link.branchName());
    }

    /**
     * Finds the link to resume: the one recorded by {@code jobId} when given,
     * otherwise the project's most recent link.
     */
    public Optional<SessionLink> resolve(String project, String jobId) {
        if (jobId != null && !jobId.isBlank()) {
            return find(project, jobId);
        }
        return Optional.ofNullable(latestByProject.get(project));
    }

    public Optional<SessionLink> find(String project, String jobId) {
        Map<String, SessionLink> links = linksByProject.get(project);
        return Optional.ofNullable(links == null ? null : links.get(jobId));
    }

    /**
     * Replaces the agent conversation id of a recorded link, e.g. after a feedback
     * run continued it. Does nothing if the link was forgotten meanwhile.
     */
    public void updateAgentSession(String project, String jobId, String agentSessionId) {
        Map<String, SessionLink> links = linksByProject.get(project);
        if (links == null) {
            return;
        }
        SessionLink updated = links.computeIfPresent(jobId, (id, link) -> link.withAgentSession(agentSessionId));
        if (updated == null) {
            return;
        }
        latestByProject.computeIfPresent(project,
                (name, latest) -> latest.jobId().equals(jobId) ? updated : latest);
        log.info("Session {} of {} now continues agent session {}", jobId, project, agentSessionId);
    }

    /**
     * Forgets a link, e.g. after its branch turned out to be deleted.
     */
    public void remove(SessionLink link) {
        Map<String, SessionLink> links = linksByProject.get(link.project());
        if (links != null) {
            links.remove(link.jobId());
        }
        latestByProject.computeIfPresent(link.project(), (project, latest) -> {
            if (!latest.jobId().equals(link.jobId())) {
                return latest;
            }
            return links == null ? null : links.values().stream()
                    .max(Comparator.comparing(SessionLink::createdAt))
                    .orElse(null);
        });
    }

    public List<SessionLink> list(String project) {
        Map<String, SessionLink> links = linksByProject.get(project);
        if (links == null) {
            return List.of();
        }
        return links.values().stream()
                .sorted(Comparator.comparing(SessionLink::createdAt))
                .toList();
    }
}
