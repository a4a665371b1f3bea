package com.conductor.core.model;

import java.nio.file.Path;

/**
 * A git-backed project the bot can work on. Bound once from configuration and never mutated.
 *
 * @param name          unique project name used in chat commands
 * @param repoUrl       remote URL the canonical clone is created from
 * @param workDir       location of the canonical clone
 * @param defaultBranch branch new work branches start from
 * @param upCommand     shell command starting the auxiliary process; nullable
 * @param downCommand   shell command run after the auxiliary process is stopped; nullable
 * @param endpointUrl   where the running project can be reached; nullable, display only
 */
public record Project(
    String name,
    String repoUrl,
    Path workDir,
    String defaultBranch,
    String upCommand,
    String downCommand,
    String endpointUrl
) {

    public Project(String name, String repoUrl, Path workDir) {
        this(name, repoUrl, workDir, "main", null, null, null);
    }

    public boolean hasUpCommand() {
        return upCommand != null && !upCommand.isBlank();
    }

    public boolean hasDownCommand() {
        return downCommand != null && !downCommand.isBlank();
    }
}
