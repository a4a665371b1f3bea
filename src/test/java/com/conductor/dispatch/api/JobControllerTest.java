package com.conductor.dispatch.api;

import com.conductor.core.config.ProjectCatalog;
import com.conductor.core.error.NoActiveSessionException;
import com.conductor.core.error.UnknownProjectException;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.Job;
import com.conductor.core.model.JobHandle;
import com.conductor.core.model.JobRequest;
import com.conductor.core.model.JobResult;
import com.conductor.core.model.JobState;
import com.conductor.jobs.JobRegistry;
import com.conductor.jobs.JobService;
import com.conductor.status.StatusReporter;
import com.conductor.supervisor.ProcessSupervisor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(JobController.class)
@Import(ControllerTestConfig.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private JobService jobService;

    @MockitoBean
    private JobRegistry registry;

    @MockitoBean
    private ProjectCatalog catalog;

    @MockitoBean
    private ProcessSupervisor supervisor;

    @MockitoBean
    private StatusReporter statusReporter;

    // ── POST /api/v1/jobs ────────────────────────────────────────

    @Test
    @DisplayName("POST /jobs returns 202 Accepted with job_id")
    void submitJob() throws Exception {
        when(jobService.submit(any(JobRequest.class))).thenReturn(new JobHandle("abcd1234"));

        String body = objectMapper.writeValueAsString(
                new SubmitJobRequest("alpha", "/feat", "add login", "u1", null));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").value("abcd1234"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        var captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(jobService).submit(captor.capture());
        assertEquals(CommandKind.FEAT, captor.getValue().command());
        assertEquals("u1", captor.getValue().requesterId());
    }

    @Test
    @DisplayName("POST /jobs accepts snake_case session_ref")
    void submitFeedbackWithSessionRef() throws Exception {
        when(jobService.submit(any(JobRequest.class))).thenReturn(new JobHandle("feed0001"));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\":\"alpha\",\"command\":\"feedback\",\"argument\":\"tweak\","
                                + "\"session_ref\":\"abcd1234\"}"))
                .andExpect(status().isAccepted());

        var captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(jobService).submit(captor.capture());
        assertEquals("abcd1234", captor.getValue().sessionRef());
    }

    @Test
    @DisplayName("POST /jobs with unknown command returns 400")
    void submitUnknownCommand() throws Exception {
        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\":\"alpha\",\"command\":\"deploy\",\"argument\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error", containsString("deploy")));
    }

    @Test
    @DisplayName("POST /jobs for unknown project returns 404")
    void submitUnknownProject() throws Exception {
        when(jobService.submit(any(JobRequest.class)))
                .thenThrow(new UnknownProjectException("Unknown project: gamma. Available projects: alpha"));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\":\"gamma\",\"command\":\"ask\",\"argument\":\"q\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_PROJECT"));
    }

    @Test
    @DisplayName("POST /jobs feedback without session returns 409")
    void submitFeedbackWithoutSession() throws Exception {
        when(jobService.submit(any(JobRequest.class))).thenThrow(new NoActiveSessionException("alpha", null));

        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"project\":\"alpha\",\"command\":\"feedback\",\"argument\":\"x\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_SESSION"));
    }

    @Test
    @DisplayName("POST /jobs with malformed JSON returns 400")
    void submitMalformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/jobs ─────────────────────────────────────────

    @Test
    @DisplayName("GET /jobs lists registered jobs")
    void listJobs() throws Exception {
        Job job = new Job("abcd1234", new JobRequest("alpha", CommandKind.ASK, "where is auth?"));
        when(registry.listAll()).thenReturn(List.of(job));

        mockMvc.perform(get("/api/v1/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].job_id").value("abcd1234"))
                .andExpect(jsonPath("$[0].command").value("ask"))
                .andExpect(jsonPath("$[0].status").value("PENDING"));
    }

    @Test
    @DisplayName("GET /jobs/{id} returns 404 for unknown job")
    void getUnknownJob() throws Exception {
        when(registry.get("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/jobs/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /jobs/{id}/result returns 200 with summary when finished")
    void getFinishedResult() throws Exception {
        when(jobService.collectResult("abcd1234")).thenReturn(Optional.of(new JobResult("abcd1234", "alpha",
                CommandKind.ASK, "u1", JobState.COMPLETED, "Auth lives in auth.py", null)));

        mockMvc.perform(get("/api/v1/jobs/abcd1234/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.summary").value("Auth lives in auth.py"))
                .andExpect(jsonPath("$.requester_id").value("u1"));
    }

    @Test
    @DisplayName("GET /jobs/{id}/result returns 202 while running")
    void getRunningResult() throws Exception {
        when(jobService.collectResult("abcd1234")).thenReturn(Optional.of(new JobResult("abcd1234", "alpha",
                CommandKind.FEAT, null, JobState.RUNNING, null, null)));

        mockMvc.perform(get("/api/v1/jobs/abcd1234/result"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    // ── cancellation ─────────────────────────────────────────────

    @Test
    @DisplayName("DELETE /jobs/{id} cancels an active job")
    void cancelJob() throws Exception {
        when(registry.get("abcd1234")).thenReturn(Optional.of(
                new Job("abcd1234", new JobRequest("alpha", CommandKind.FEAT, "x"))));
        when(jobService.cancel("abcd1234")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/jobs/abcd1234"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("CANCELLING"));
    }

    @Test
    @DisplayName("DELETE /jobs/{id} on a finished job returns 409")
    void cancelFinishedJob() throws Exception {
        when(registry.get("abcd1234")).thenReturn(Optional.of(
                new Job("abcd1234", new JobRequest("alpha", CommandKind.FEAT, "x"))));
        when(jobService.cancel("abcd1234")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/jobs/abcd1234"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_FINISHED"));
    }

    @Test
    @DisplayName("POST /projects/{name}/cancel returns cancelled ids")
    void cancelProject() throws Exception {
        when(jobService.cancelProject("alpha")).thenReturn(List.of("a1", "a2"));

        mockMvc.perform(post("/api/v1/projects/alpha/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.project").value("alpha"))
                .andExpect(jsonPath("$.cancelled", contains("a1", "a2")));
    }

    @Test
    @DisplayName("POST /jobs/cancel-all returns cancelled ids")
    void cancelAll() throws Exception {
        when(jobService.cancelAll()).thenReturn(List.of("a1"));

        mockMvc.perform(post("/api/v1/jobs/cancel-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled", hasSize(1)));
    }
}
