package com.opsassistant.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: query, tools.
 */
@Command(
        name = "ops-assistant",
        mixinStandardHelpOptions = true,
        version = "ops-assistant 0.1.0",
        description = "Plans, executes and verifies data-gathering requests",
        subcommands = {
                QueryCommand.class,
                ToolsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OpsAssistantCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
