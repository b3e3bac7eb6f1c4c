package io.taskloom;

import io.taskloom.cli.TaskloomCommand;
import io.taskloom.config.ConfigurationException;
import picocli.CommandLine;

public final class Main {
    static final int CONFIGURATION_ERROR = 2;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new TaskloomCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ConfigurationException config) {
                commandLine.getErr().println("Configuration error: " + config.getMessage());
                return CONFIGURATION_ERROR;
            }
            throw ex;
        });
        return cmd;
    }
}
