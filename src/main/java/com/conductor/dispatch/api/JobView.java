package com.conductor.dispatch.api;

import com.conductor.core.model.Job;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * JSON view of a job.
 */
public record JobView(
    @JsonProperty("job_id") String jobId,
    String project,
    String command,
    String argument,
    String status,
    String detail,
    @JsonProperty("submitted_at") Instant submittedAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("elapsed_ms") long elapsedMs,
    String branch
) {

    public static JobView of(Job job) {
        var workspace = job.workspace();
        return new JobView(job.id(), job.project(), job.command().label(), job.argument(), job.state().name(),
                job.detail(), job.submittedAt(), job.startedAt(), job.completedAt(), job.elapsed().toMillis(),
                workspace == null ? null : workspace.branch());
    }
}
