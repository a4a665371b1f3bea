package com.conductor.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during job execution or process supervision.
 *
 * @param eventType event type, e.g. "job.submitted", "job.finished", "process.exited"
 * @param jobId     the job this event belongs to (null for process events)
 * @param project   project the event relates to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ConductorEvent(
    String eventType,
    String jobId,
    String project,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String JOB_SUBMITTED = "job.submitted";
    public static final String JOB_STARTED = "job.started";
    public static final String JOB_FINISHED = "job.finished";
    public static final String PROCESS_STARTED = "process.started";
    public static final String PROCESS_EXITED = "process.exited";

    public static ConductorEvent of(String eventType, String jobId, String project, Map<String, Object> payload) {
        return new ConductorEvent(eventType, jobId, project, payload, Instant.now());
    }
}
