package com.calcifer.dispatch.cli;

import com.calcifer.core.registry.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the appropriate command and hands its exit code to Spring.
 * <p>
 * Exceptions escaping a command never print a stack trace: a {@link ConfigException} exits 2,
 * anything else is logged and exits 1.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILED = 1;

    private final CalciferCommand calciferCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CalciferCommand calciferCommand, IFactory factory) {
        this.calciferCommand = calciferCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(calciferCommand, factory)
                .setExecutionExceptionHandler(CliRunner::handleExecutionException);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static int handleExecutionException(Exception e, CommandLine commandLine, ParseResult parseResult) {
        if (e instanceof ConfigException) {
            ConsoleOutput.error(e.getMessage());
            return GoalCommand.EXIT_CONFIG_ERROR;
        }
        log.error("Command '{}' failed", commandLine.getCommandName(), e);
        ConsoleOutput.error("Unexpected error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        return EXIT_FAILED;
    }
}
