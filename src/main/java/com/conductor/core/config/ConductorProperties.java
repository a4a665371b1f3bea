package com.conductor.core.config;

import com.conductor.core.model.Project;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "conductor")
public class ConductorProperties {

    private Workspace workspace = new Workspace();
    private Agent agent = new Agent();
    private Jobs jobs = new Jobs();
    private Supervisor supervisor = new Supervisor();
    private Display display = new Display();

    /** Rule text appended to the agent's system prompt, keyed by "common" or a command name. */
    private Map<String, String> rules = new HashMap<>();

    private List<ProjectEntry> projects = new ArrayList<>();

    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Jobs getJobs() { return jobs; }
    public void setJobs(Jobs jobs) { this.jobs = jobs; }
    public Supervisor getSupervisor() { return supervisor; }
    public void setSupervisor(Supervisor supervisor) { this.supervisor = supervisor; }
    public Display getDisplay() { return display; }
    public void setDisplay(Display display) { this.display = display; }
    public Map<String, String> getRules() { return rules; }
    public void setRules(Map<String, String> rules) { this.rules = rules; }
    public List<ProjectEntry> getProjects() { return projects; }
    public void setProjects(List<ProjectEntry> projects) { this.projects = projects; }

    public static class Workspace {
        private String scratchRoot = "/tmp/conductor";
        private String worktreeBase = "/tmp/ccc-worktrees";
        private String neutralDir = "/tmp";
        private String defaultBranch = "main";
        private int cloneTimeoutMinutes = 30;
        private int gitTimeoutSeconds = 120;

        public String getScratchRoot() { return scratchRoot; }
        public void setScratchRoot(String scratchRoot) { this.scratchRoot = scratchRoot; }
        public String getWorktreeBase() { return worktreeBase; }
        public void setWorktreeBase(String worktreeBase) { this.worktreeBase = worktreeBase; }
        public String getNeutralDir() { return neutralDir; }
        public void setNeutralDir(String neutralDir) { this.neutralDir = neutralDir; }
        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
        public int getCloneTimeoutMinutes() { return cloneTimeoutMinutes; }
        public void setCloneTimeoutMinutes(int cloneTimeoutMinutes) { this.cloneTimeoutMinutes = cloneTimeoutMinutes; }
        public int getGitTimeoutSeconds() { return gitTimeoutSeconds; }
        public void setGitTimeoutSeconds(int gitTimeoutSeconds) { this.gitTimeoutSeconds = gitTimeoutSeconds; }
    }

    public static class Agent {
        private String executable = "claude";
        private String model = "opus";
        private String permissionMode = "bypassPermissions";
        private int timeoutMinutes = 30;
        private int killGraceSeconds = 5;
        private int outputTailLines = 40;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getPermissionMode() { return permissionMode; }
        public void setPermissionMode(String permissionMode) { this.permissionMode = permissionMode; }
        public int getTimeoutMinutes() { return timeoutMinutes; }
        public void setTimeoutMinutes(int timeoutMinutes) { this.timeoutMinutes = timeoutMinutes; }
        public int getKillGraceSeconds() { return killGraceSeconds; }
        public void setKillGraceSeconds(int killGraceSeconds) { this.killGraceSeconds = killGraceSeconds; }
        public int getOutputTailLines() { return outputTailLines; }
        public void setOutputTailLines(int outputTailLines) { this.outputTailLines = outputTailLines; }
    }

    public static class Jobs {
        private int maxParallel = 8;
        private int retentionPerProject = 20;
        private int retentionMinutes = 60;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getRetentionPerProject() { return retentionPerProject; }
        public void setRetentionPerProject(int retentionPerProject) { this.retentionPerProject = retentionPerProject; }
        public int getRetentionMinutes() { return retentionMinutes; }
        public void setRetentionMinutes(int retentionMinutes) { this.retentionMinutes = retentionMinutes; }
    }

    public static class Supervisor {
        private String shell = "sh";
        private int logCapacity = 500;
        private int stopGraceSeconds = 5;
        private long reaperIntervalMs = 1000;
        private int downTimeoutSeconds = 60;
        private boolean startOnBoot = true;

        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        public int getLogCapacity() { return logCapacity; }
        public void setLogCapacity(int logCapacity) { this.logCapacity = logCapacity; }
        public int getStopGraceSeconds() { return stopGraceSeconds; }
        public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
        public long getReaperIntervalMs() { return reaperIntervalMs; }
        public void setReaperIntervalMs(long reaperIntervalMs) { this.reaperIntervalMs = reaperIntervalMs; }
        public int getDownTimeoutSeconds() { return downTimeoutSeconds; }
        public void setDownTimeoutSeconds(int downTimeoutSeconds) { this.downTimeoutSeconds = downTimeoutSeconds; }
        public boolean isStartOnBoot() { return startOnBoot; }
        public void setStartOnBoot(boolean startOnBoot) { this.startOnBoot = startOnBoot; }
    }

    public static class Display {
        private int maxSummaryChars = 4000;
        private int promptPreviewChars = 50;

        public int getMaxSummaryChars() { return maxSummaryChars; }
        public void setMaxSummaryChars(int maxSummaryChars) { this.maxSummaryChars = maxSummaryChars; }
        public int getPromptPreviewChars() { return promptPreviewChars; }
        public void setPromptPreviewChars(int promptPreviewChars) { this.promptPreviewChars = promptPreviewChars; }
    }

    /**
     * One entry of {@code conductor.projects}.
     */
    public static class ProjectEntry {
        private String name;
        private String repoUrl;
        private String workDir;
        private String defaultBranch;
        private String upCommand;
        private String downCommand;
        private String endpointUrl;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getRepoUrl() { return repoUrl; }
        public void setRepoUrl(String repoUrl) { this.repoUrl = repoUrl; }
        public String getWorkDir() { return workDir; }
        public void setWorkDir(String workDir) { this.workDir = workDir; }
        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
        public String getUpCommand() { return upCommand; }
        public void setUpCommand(String upCommand) { this.upCommand = upCommand; }
        public String getDownCommand() { return downCommand; }
        public void setDownCommand(String downCommand) { this.downCommand = downCommand; }
        public String getEndpointUrl() { return endpointUrl; }
        public void setEndpointUrl(String endpointUrl) { this.endpointUrl = endpointUrl; }

        public Project toProject(String fallbackBranch) {
            if (workDir == null || workDir.isBlank()) {
                throw new IllegalArgumentException("Project " + name + " has no work-dir");
            }
            String branch = defaultBranch != null && !defaultBranch.isBlank() ? defaultBranch : fallbackBranch;
            return new Project(name, repoUrl, Path.of(workDir), branch, upCommand, downCommand, endpointUrl);
        }
    }
}
