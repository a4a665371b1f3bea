package com.conductor.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the {@code claude} CLI in non-interactive print mode with JSON output, so
 * the result line carries the {@code session_id} a later feedback resumes.
 */
public class ClaudeCliCommandFactory implements AgentCommandFactory {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliCommandFactory.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SESSION_ID_FIELD = "session_id";

    private final String executable;
    private final String model;
    private final String permissionMode;

    public ClaudeCliCommandFactory(String executable, String model, String permissionMode) {
        this.executable = executable;
        this.model = model;
        this.permissionMode = permissionMode;
    }

    @Override
    public AgentInvocation create(String jobId, String prompt, String rules, Path workingDir, Path outputFile,
                                  String resumeSessionId) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.add("-p");
        command.add(prompt);
        command.add("--output-format");
        command.add("json");
        if (resumeSessionId != null && !resumeSessionId.isBlank()) {
            command.add("--resume");
            command.add(resumeSessionId);
        }
        if (rules != null && !rules.isBlank()) {
            command.add("--append-system-prompt");
            command.add(rules);
        }
        if (permissionMode != null && !permissionMode.isBlank()) {
            command.add("--permission-mode");
            command.add(permissionMode);
        }
        if (model != null && !model.isBlank()) {
            command.add("--model");
            command.add(model);
        }
        return new AgentInvocation(command, workingDir, Map.of(
                OUTPUT_FILE_ENV, outputFile.toString(),
                JOB_ID_ENV, jobId));
    }

    @Override
    public Optional<String> sessionIdFrom(String outputLine) {
        return sessionIdOf(outputLine);
    }

    /**
     * Reads {@code session_id} from a JSON result line such as
     * {@code {"type":"result","session_id":"..."}}. Anything else yields empty.
     */
    public static Optional<String> sessionIdOf(String line) {
        if (line == null || !line.contains(SESSION_ID_FIELD)) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode id = MAPPER.readTree(trimmed).get(SESSION_ID_FIELD);
            if (id == null || !id.isTextual() || id.asText().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(id.asText());
        } catch (JsonProcessingException e) {
            log.debug("Agent output line is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
