package com.conductor.core.model;

/**
 * Lifecycle state of a job. Transitions only move forward.
 */
public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean canTransitionTo(JobState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED || next == FAILED;
            case RUNNING -> next.isTerminal();
            case COMPLETED, FAILED, CANCELLED, TIMED_OUT -> false;
        };
    }
}
