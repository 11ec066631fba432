package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;

import org.trypticon.termfst.TermDictionary;

/**
 * Command to look up one term.
 */
class ContainsCommand extends CorpusCommand {
    ContainsCommand() {
        super("contains", "Tests whether a term is in a corpus", "<corpus> <term>", 1, 1);
    }

    @Override
    int run(TermDictionary dictionary, List<String> args, PrintStream out, PrintStream err) {
        String term = args.get(0);
        Long line = dictionary.get(term);
        if (line == null) {
            out.println("Not found: " + term);
            return 1;
        }
        out.println("Found: " + term + " (line " + line + ")");
        return 0;
    }
}
