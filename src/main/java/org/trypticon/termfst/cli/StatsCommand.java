package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import org.trypticon.termfst.PrintStreamInfoStream;
import org.trypticon.termfst.TermDictionary;
import org.trypticon.termfst.fst.BuilderOptions;
import org.trypticon.termfst.fst.MinimizationStats;

/**
 * Command to show how compactly a corpus compiles.
 */
class StatsCommand extends CorpusCommand {
    private static final String VERBOSE = "--verbose";

    StatsCommand() {
        super("stats", "Shows term and state counts for a corpus", "<corpus> [" + VERBOSE + "]", 0, 1);
    }

    @Override
    void details(PrintStream err) {
        super.details(err);
        err.println("  " + VERBOSE + "  log the dictionary build to the error stream");
    }

    @Override
    BuilderOptions builderOptions(List<String> args, PrintStream err) {
        BuilderOptions options = new BuilderOptions();
        if (args.contains(VERBOSE)) {
            options.setInfoStream(new PrintStreamInfoStream(err));
        }
        return options;
    }

    @Override
    int run(TermDictionary dictionary, List<String> args, PrintStream out, PrintStream err) {
        if (!args.isEmpty() && !args.get(0).equals(VERBOSE)) {
            err.println("Unknown option: " + args.get(0));
            usage(err);
            return 1;
        }
        MinimizationStats stats = dictionary.getStats();
        out.println("Terms: " + dictionary.size());
        out.println("Trie states: " + stats.getOriginalStates());
        out.println("Stored states: " + stats.getMinimizedStates());
        out.println(String.format(Locale.ROOT, "Space saving: %.1f%%", stats.getSpaceSavingPercent()));
        return 0;
    }
}
