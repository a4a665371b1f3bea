package com.conductor.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A supervised long-running project process such as a dev server.
 */
public record AuxiliaryProcess(
    String project,
    long pid,
    String command,
    Instant startedAt
) {

    public Duration uptime() {
        return Duration.between(startedAt, Instant.now());
    }
}
