package com.conductor.dispatch.cli;

import com.conductor.core.OrchestratorContext;
import com.conductor.core.config.ConductorProperties;
import com.conductor.core.error.ConductorException;
import com.conductor.core.model.CommandKind;
import com.conductor.core.model.JobHandle;
import com.conductor.core.model.JobRequest;
import com.conductor.core.model.JobResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: conductor run &lt;project&gt; &lt;command&gt; &lt;argument...&gt;
 * <p>
 * Submits one job, waits for it to finish and prints its summary.
 * Exit code 0 on completion, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one job and print its result")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project name")
    private String project;

    @Parameters(index = "1", description = "Command: ask, feat, fix, plan, feedback, init")
    private String command;

    @Parameters(index = "2..*", arity = "0..*", description = "Task text")
    private List<String> argument = List.of();

    @Option(names = {"--timeout-minutes", "-t"}, description = "Agent timeout in minutes (default from configuration)")
    private Integer timeoutMinutes;

    @Option(names = {"--session"}, description = "Job id of the session to resume (feedback only)")
    private String sessionRef;

    private final OrchestratorContext context;
    private final ConductorProperties properties;

    public RunCommand(OrchestratorContext context, ConductorProperties properties) {
        this.context = context;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        CommandKind kind;
        try {
            kind = CommandKind.parse(command);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        if (timeoutMinutes != null) {
            properties.getAgent().setTimeoutMinutes(timeoutMinutes);
        }

        var done = new CompletableFuture<JobResult>();
        JobHandle handle;
        try {
            handle = context.jobs().submit(
                    new JobRequest(project, kind, String.join(" ", argument), "cli", sessionRef), done::complete);
        } catch (ConductorException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Job " + handle.id() + " submitted: " + project + " /" + kind.label());

        JobResult result;
        try {
            // Generous bound past the agent timeout covers clone and cleanup.
            long waitMinutes = properties.getAgent().getTimeoutMinutes()
                    + properties.getWorkspace().getCloneTimeoutMinutes() + 5L;
            result = done.get(waitMinutes, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.jobs().cancel(handle.id());
            ConsoleOutput.error("Interrupted, job " + handle.id() + " cancelled");
            return 1;
        } catch (ExecutionException | TimeoutException e) {
            context.jobs().cancel(handle.id());
            ConsoleOutput.error("Gave up waiting for job " + handle.id());
            return 1;
        }

        ConsoleOutput.job(result.id(), result.state());
        if (result.summaryText() != null) {
            System.out.println();
            System.out.println(result.summaryText());
        }
        if (result.error() != null) {
            ConsoleOutput.error(result.error());
        }
        return result.isSuccess() ? 0 : 1;
    }
}
