package com.conductor.status;

import com.conductor.core.model.CommandKind;
import com.conductor.core.model.JobState;

import java.time.Duration;

public record ActiveJobView(String id, CommandKind command, String argument, JobState state, Duration elapsed) {}
