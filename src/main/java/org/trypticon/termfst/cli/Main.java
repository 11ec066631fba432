package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point for the {@code termfst} command line.
 */
public class Main {
    public static void main(String[] args) {
        System.exit(new Main().run(Arrays.asList(args), System.out, System.err));
    }

    /**
     * Dispatches to the command named by the first argument.
     * {@code -h} and {@code --help} are accepted as aliases for {@code help}.
     *
     * @param args the command-line arguments.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code.
     */
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            Commands.overview(err);
            return 1;
        }
        String name = args.get(0);
        if (name.equals("-h") || name.equals("--help")) {
            name = "help";
        }
        Command command = Commands.findCommand(name);
        if (command == null) {
            Commands.unknownCommand(err, name);
            return 1;
        }
        return command.run(args.subList(1, args.size()), out, err);
    }
}
