package com.conductor.status;

import java.util.List;

public record ProjectStatus(String project, List<ActiveJobView> activeJobs, ProcessView process) {}
