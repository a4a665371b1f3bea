package com.conductor.core.model;

/**
 * Returned by submission, before the job has run.
 */
public record JobHandle(String id) {}
