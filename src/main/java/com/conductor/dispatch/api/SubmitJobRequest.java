package com.conductor.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/jobs.
 *
 * @param project     project name
 * @param command     command name (ask, feat, fix, plan, feedback, init), with or without a leading slash
 * @param argument    task text; may be omitted for init
 * @param requesterId opaque caller id; nullable
 * @param sessionRef  job id of the feat/fix/plan session to resume; nullable, feedback only
 */
public record SubmitJobRequest(
    String project,
    String command,
    String argument,
    @JsonProperty("requester_id") String requesterId,
    @JsonProperty("session_ref") String sessionRef
) {}
