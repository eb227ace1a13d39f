package com.calcifer.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Calcifer.
 * Routes to subcommands: verify, init, arc-connect, destroy, plan.
 */
@Command(
        name = "calcifer",
        mixinStandardHelpOptions = true,
        version = "Calcifer 0.1.0",
        description = "Provisions a Kubernetes cluster and connects it to Azure Arc",
        subcommands = {
                VerifyCommand.class,
                InitCommand.class,
                ArcConnectCommand.class,
                DestroyCommand.class,
                PlanCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CalciferCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
