package com.conductor.dispatch.api;

import com.conductor.core.OrchestratorContext;
import com.conductor.status.StatusReport;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/status")
public class StatusController {

    private final OrchestratorContext context;

    public StatusController(OrchestratorContext context) {
        this.context = context;
    }

    @GetMapping
    public StatusReport status() {
        return context.status().snapshot();
    }

    @GetMapping(value = "/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public String text() {
        return context.status().renderSnapshot();
    }
}
