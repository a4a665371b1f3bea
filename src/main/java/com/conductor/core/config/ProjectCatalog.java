package com.conductor.core.config;

import com.conductor.core.error.UnknownProjectException;
import com.conductor.core.model.Project;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of configured projects by name, in configuration order.
 */
public class ProjectCatalog {

    private final Map<String, Project> projects;

    public ProjectCatalog(List<Project> projects) {
        var byName = new LinkedHashMap<String, Project>();
        for (Project project : projects) {
            if (project.name() == null || project.name().isBlank()) {
                throw new IllegalArgumentException("Project name is required");
            }
            if (byName.putIfAbsent(project.name(), project) != null) {
                throw new IllegalArgumentException("Duplicate project name: " + project.name());
            }
        }
        this.projects = Collections.unmodifiableMap(byName);
    }

    public static ProjectCatalog fromProperties(ConductorProperties properties) {
        String fallbackBranch = properties.getWorkspace().getDefaultBranch();
        return new ProjectCatalog(properties.getProjects().stream()
                .map(entry -> entry.toProject(fallbackBranch))
                .toList());
    }

    public Optional<Project> find(String name) {
        return Optional.ofNullable(name == null ? null : projects.get(name));
    }

    /**
     * @throws UnknownProjectException if no project has that name
     */
    public Project require(String name) {
        return find(name).orElseThrow(() -> new UnknownProjectException(
                "Unknown project: " + name + ". Available projects: " + String.join(", ", projects.keySet())));
    }

    public Collection<Project> all() {
        return projects.values();
    }

    public List<String> names() {
        return List.copyOf(projects.keySet());
    }
}
