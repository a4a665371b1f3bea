package com.conductor.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.List;
import java.util.Set;

/**
 * Hands the process arguments to picocli once the Spring context is up and keeps
 * the command's exit code for {@link org.springframework.boot.SpringApplication#exit}.
 * In serve mode nothing is executed: the embedded web server owns the JVM.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);
    private static final String SERVE = "serve";
    private static final Set<String> INFO_FLAGS = Set.of("-h", "--help", "-V", "--version");

    private final ConductorCommand conductorCommand;
    private final IFactory factory;
    private volatile int exitCode;

    public CliRunner(ConductorCommand conductorCommand, IFactory factory) {
        this.conductorCommand = conductorCommand;
        this.factory = factory;
    }

    /**
     * True when the arguments start the HTTP server: {@code serve} is the subcommand
     * and no help or version output was asked for.
     */
    public static boolean isServeMode(String... args) {
        if (args.length == 0 || !SERVE.equals(args[0])) {
            return false;
        }
        return List.of(args).subList(1, args.length).stream().noneMatch(INFO_FLAGS::contains);
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            log.debug("Serve mode, leaving the JVM to the web server");
            return;
        }
        exitCode = new CommandLine(conductorCommand, factory).execute(args);
        log.debug("Command {} finished with exit code {}", String.join(" ", args), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
