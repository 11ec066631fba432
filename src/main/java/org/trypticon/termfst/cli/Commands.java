package org.trypticon.termfst.cli;

import java.io.PrintStream;

/**
 * Utilities for finding and listing commands.
 */
public class Commands {
    private static final Command[] commands = {
            new HelpCommand(),
            new ContainsCommand(),
            new PrefixCommand(),
            new FuzzyCommand(),
            new QueryCommand(),
            new StatsCommand(),
    };

    /**
     * Finds a command by name.
     *
     * @param name the command name.
     * @return the command. Returns {@code null} if no command with that name was found.
     */
    static Command findCommand(String name) {
        for (Command command : commands) {
            if (command.getName().equals(name)) {
                return command;
            }
        }
        return null;
    }

    static void unknownCommand(PrintStream err, String command) {
        err.println("Unknown command: " + command);
        availableCommands(err);
    }

    static void availableCommands(PrintStream err) {
        err.println("Available commands:");
        for (Command command : commands) {
            err.println(String.format("  %-10s%s", command.getName(), command.getDescription()));
        }
    }

    /**
     * Prints the top-level usage with the list of commands.
     *
     * @param err the error stream.
     */
    static void overview(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " <command> <args...>");
        availableCommands(err);
        err.println("Use " + Constants.APP_NAME + " help <command> for help on a specific command.");
    }
}
