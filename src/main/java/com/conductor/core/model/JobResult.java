package com.conductor.core.model;

/**
 * Final result of a job as delivered to callers.
 *
 * @param summaryText content of the summary file, null when the job produced none
 * @param error       user-facing error message, null on success
 */
public record JobResult(
    String id,
    String project,
    CommandKind command,
    String requesterId,
    JobState state,
    String summaryText,
    String error
) {

    public boolean isSuccess() {
        return state == JobState.COMPLETED;
    }
}
