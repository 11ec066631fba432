package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints the command overview, or the full help for one command.
 */
class HelpCommand extends Command {
    HelpCommand() {
        super("help", "Prints help for a command", "[command]");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        switch (args.size()) {
            case 0:
                Commands.overview(err);
                return 0;
            case 1:
                Command command = Commands.findCommand(args.get(0));
                if (command == null) {
                    Commands.unknownCommand(err, args.get(0));
                    return 1;
                }
                command.help(err);
                return 0;
            default:
                usage(err);
                return 1;
        }
    }
}
