package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Base class for CLI commands.
 */
abstract class Command {
    private final String name;
    private final String description;
    private final String usage;

    /**
     * Constructs the command.
     *
     * @param name a short name for the command.
     * @param description a description of the command.
     * @param usage usage summary of arguments to the command.
     */
    protected Command(String name, String description, String usage) {
        this.name = name;
        this.description = description;
        this.usage = usage;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Prints usage info for this command.
     *
     * @param err the error stream.
     */
    void usage(PrintStream err) {
        err.println("usage: " + Constants.APP_NAME + " " + name + " " + usage);
    }

    /**
     * Prints the full help for this command: its description, usage and any details.
     *
     * @param err the error stream.
     */
    void help(PrintStream err) {
        err.println(Constants.APP_NAME + " " + name + " - " + description);
        usage(err);
        details(err);
    }

    /**
     * Prints details beyond the usage line. Nothing by default.
     *
     * @param err the error stream.
     */
    void details(PrintStream err) {
    }

    /**
     * Runs the command.
     *
     * @param args the arguments to the command.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code.
     */
    abstract int run(List<String> args, PrintStream out, PrintStream err);

    /**
     * Prints each exception in the cause chain on its own line.
     *
     * @param err the error stream.
     * @param e the exception.
     */
    static void printErrorSummary(PrintStream err, Exception e) {
        Throwable temp = e;
        while (temp != null) {
            err.println(temp);
            temp = temp.getCause();
        }
    }

    /**
     * Parses a non-negative integer argument, reporting a bad one to the error stream.
     *
     * @param err the error stream.
     * @param value the argument text.
     * @return the number, or -1 if the argument was not a non-negative number.
     */
    static int parseCount(PrintStream err, String value) {
        int number;
        try {
            number = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            err.println("Not a number: " + value);
            return -1;
        }
        if (number < 0) {
            err.println("Must not be negative: " + value);
            return -1;
        }
        return number;
    }
}
