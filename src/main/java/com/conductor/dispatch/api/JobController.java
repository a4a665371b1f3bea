package com.conductor.dispatch.api;

import com.conductor.core.OrchestratorContext;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.JobHandle;
import com.conductor.core.model.JobRequest;
import com.conductor.core.model.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for job submission, inspection and cancellation.
 */
@RestController
@RequestMapping("/api/v1")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final OrchestratorContext context;

    public JobController(OrchestratorContext context) {
        this.context = context;
    }

    /**
     * POST /api/v1/jobs: Submit a job. Runs asynchronously.
     */
    @PostMapping("/jobs")
    public ResponseEntity<Map<String, String>> submit(@RequestBody SubmitJobRequest request) {
        CommandKind command = CommandKind.parse(request.command());
        JobHandle handle = context.jobs().submit(new JobRequest(request.project(), command,
                request.argument(), request.requesterId(), request.sessionRef()));
        log.info("Accepted job {} for {} /{}", handle.id(), request.project(), command.label());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "job_id", handle.id(),
                "status", "PENDING"));
    }

    /**
     * GET /api/v1/jobs: All jobs still held by the registry.
     */
    @GetMapping("/jobs")
    public List<JobView> list() {
        return context.registry().listAll().stream().map(JobView::of).toList();
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<JobView> get(@PathVariable String id) {
        return context.registry().get(id)
                .map(job -> ResponseEntity.ok(JobView.of(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/jobs/{id}/result: The job's result. The first read after
     * completion consumes the summary file.
     */
    @GetMapping("/jobs/{id}/result")
    public ResponseEntity<JobResultResponse> result(@PathVariable String id) {
        return context.jobs().collectResult(id)
                .map(this::toResponse)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (context.registry().get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!context.jobs().cancel(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "error", "Job " + id + " has already finished",
                    "code", "ALREADY_FINISHED"));
        }
        return ResponseEntity.accepted().body(Map.of("job_id", id, "status", "CANCELLING"));
    }

    /**
     * POST /api/v1/projects/{name}/cancel: Cancel every unfinished job of a project.
     */
    @PostMapping("/projects/{name}/cancel")
    public Map<String, Object> cancelProject(@PathVariable String name) {
        List<String> cancelled = context.jobs().cancelProject(name);
        return Map.of("project", name, "cancelled", cancelled);
    }

    @PostMapping("/jobs/cancel-all")
    public Map<String, Object> cancelAll() {
        return Map.of("cancelled", context.jobs().cancelAll());
    }

    private ResponseEntity<JobResultResponse> toResponse(JobResult result) {
        HttpStatus status = result.state().isTerminal() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(JobResultResponse.of(result));
    }
}
