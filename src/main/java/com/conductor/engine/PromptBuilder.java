package com.conductor.engine;

import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.Project;

import java.nio.file.Path;
import java.util.Map;

/**
 * Builds the agent prompt and the rule text for a job.
 */
public class PromptBuilder {

    static final String COMMON_RULES_KEY = "common";
    static final String INIT_PROMPT = "/init";

    private final Map<String, String> rules;

    public PromptBuilder(Map<String, String> rules) {
        this.rules = rules == null ? Map.of() : Map.copyOf(rules);
    }

    public String prompt(Job job, Project project, Path workingDir, Path outputFile) {
        if (job.command() == CommandKind.INIT) {
            return INIT_PROMPT;
        }
        String label = switch (job.command()) {
            case ASK -> "Query";
            case FEEDBACK -> "Feedback";
            case FEAT, FIX, PLAN, INIT -> "Task";
        };
        var prompt = new StringBuilder()
                .append("Project: ").append(project.name()).append('\n')
                .append("Repository: ").append(project.repoUrl() == null ? "" : project.repoUrl()).append('\n')
                .append("Working Directory: ").append(workingDir).append('\n');
        if (job.workspace() != null) {
            prompt.append("Branch: ").append(job.workspace().branch()).append('\n');
        }
        prompt.append('\n')
                .append(label).append(": ").append(job.argument()).append("\n\n")
                .append("Write the output in ").append(outputFile);
        return prompt.toString();
    }

    /**
     * Common rules followed by the command's own rules, separated by a blank line.
     */
    public String rules(CommandKind command) {
        String common = rules.getOrDefault(COMMON_RULES_KEY, "");
        String specific = rules.getOrDefault(command.ruleKey(), "");
        if (common.isBlank()) return specific.strip();
        if (specific.isBlank()) return common.strip();
        return common.strip() + "\n\n" + specific.strip();
    }
}
