package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;

import org.trypticon.termfst.TermDictionary;

/**
 * Command to list the terms starting with a prefix.
 */
class PrefixCommand extends CorpusCommand {
    PrefixCommand() {
        super("prefix", "Lists the terms starting with a prefix", "<corpus> <prefix> [limit]", 1, 2);
    }

    @Override
    void details(PrintStream err) {
        super.details(err);
        err.println("A limit of 0 lists every match.");
    }

    @Override
    int run(TermDictionary dictionary, List<String> args, PrintStream out, PrintStream err) {
        int limit = 0;
        if (args.size() > 1) {
            limit = parseCount(err, args.get(1));
            if (limit < 0) {
                return 1;
            }
        }
        for (String term : dictionary.prefix(args.get(0), limit)) {
            out.println(term);
        }
        return 0;
    }
}
