package com.opsassistant.dispatch.cli;

import com.opsassistant.tools.ToolKind;
import com.opsassistant.tools.ToolRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ops-assistant tools
 * <p>
 * Lists the registered tools with their required parameters.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "List the available tools")
@Component
public class ToolsCommand implements Runnable {

    private final ToolRegistry toolRegistry;

    public ToolsCommand(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (ToolKind kind : toolRegistry.registeredKinds()) {
            ConsoleOutput.tool(kind.wireName(), kind.purpose());
            System.out.println("      required: " + String.join(", ", kind.requiredParameters()));
        }
    }
}
