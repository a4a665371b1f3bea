package com.conductor.dispatch.api;

import com.conductor.core.model.JobResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public record JobResultResponse(
    @JsonProperty("job_id") String jobId,
    String project,
    String command,
    @JsonProperty("requester_id") String requesterId,
    String status,
    String summary,
    String error
) {

    public static JobResultResponse of(JobResult result) {
        return new JobResultResponse(result.id(), result.project(), result.command().label(), result.requesterId(),
                result.state().name(), result.summaryText(), result.error());
    }
}
