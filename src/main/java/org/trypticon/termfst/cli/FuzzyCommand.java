package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;

import org.trypticon.termfst.TermDictionary;

/**
 * Command to list the terms within an edit distance of a pattern.
 */
class FuzzyCommand extends CorpusCommand {
    FuzzyCommand() {
        super("fuzzy", "Lists the terms within an edit distance of a pattern", "<corpus> <pattern> <distance>", 2, 2);
    }

    @Override
    int run(TermDictionary dictionary, List<String> args, PrintStream out, PrintStream err) {
        int distance = parseCount(err, args.get(1));
        if (distance < 0) {
            return 1;
        }
        for (String term : dictionary.fuzzy(args.get(0), distance)) {
            out.println(term);
        }
        return 0;
    }
}
