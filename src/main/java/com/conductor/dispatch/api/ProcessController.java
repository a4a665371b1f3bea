package com.conductor.dispatch.api;

import com.conductor.core.OrchestratorContext;
import com.conductor.core.model.AuxiliaryProcess;
import com.conductor.core.model.Project;
import com.conductor.supervisor.ProcessSupervisor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the auxiliary process of each project (up, stop, log).
 */
@RestController
@RequestMapping("/api/v1/projects/{name}")
public class ProcessController {

    private final OrchestratorContext context;

    public ProcessController(OrchestratorContext context) {
        this.context = context;
    }

    @PostMapping("/up")
    public ResponseEntity<Map<String, Object>> up(@PathVariable String name) {
        Project project = context.projects().require(name);
        AuxiliaryProcess process = context.supervisor().start(project);
        var body = new LinkedHashMap<String, Object>();
        body.put("project", name);
        body.put("pid", process.pid());
        if (project.endpointUrl() != null) {
            body.put("endpoint_url", project.endpointUrl());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop(@PathVariable String name) {
        Project project = context.projects().require(name);
        if (!context.supervisor().stop(project)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "error", "No running process found for project " + name,
                    "code", "NOT_RUNNING"));
        }
        return ResponseEntity.ok(Map.of("project", name, "status", "STOPPED"));
    }

    /**
     * GET /api/v1/projects/{name}/log?lines=50: Tail of the process output, 1 to 200 lines.
     */
    @GetMapping("/log")
    public Map<String, Object> log(@PathVariable String name,
                                   @RequestParam(defaultValue = "" + ProcessSupervisor.DEFAULT_TAIL_LINES) int lines) {
        context.projects().require(name);
        List<String> tail = context.supervisor().tailLog(name, lines);
        return Map.of(
                "project", name,
                "running", context.supervisor().get(name).isPresent(),
                "lines", tail);
    }
}
