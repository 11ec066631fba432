package org.trypticon.termfst.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import org.trypticon.termfst.TermDictionary;
import org.trypticon.termfst.fst.BuilderOptions;

/**
 * Base class for commands whose first argument is a corpus file.
 */
abstract class CorpusCommand extends Command {
    private final int minArgs;
    private final int maxArgs;

    /**
     * Constructs the command.
     *
     * @param name a short name for the command.
     * @param description a description of the command.
     * @param usage usage summary of arguments to the command.
     * @param minArgs minimum number of arguments after the corpus.
     * @param maxArgs maximum number of arguments after the corpus.
     */
    protected CorpusCommand(String name, String description, String usage, int minArgs, int maxArgs) {
        super(name, description, usage);
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        if (args.size() < minArgs + 1 || args.size() > maxArgs + 1) {
            usage(err);
            return 1;
        }
        Path corpus = Path.of(args.get(0));
        TermDictionary dictionary;
        try {
            dictionary = TermDictionary.load(corpus, builderOptions(args.subList(1, args.size()), err));
        } catch (IOException e) {
            err.println("Error loading corpus at: " + corpus);
            printErrorSummary(err, e);
            return 1;
        }
        return run(dictionary, args.subList(1, args.size()), out, err);
    }

    @Override
    void details(PrintStream err) {
        err.println("<corpus> is a UTF-8 text file with one term per line. Blank lines are skipped");
        err.println("and each term's value is the line it first appears on.");
    }

    /**
     * Gets the options used to build the corpus dictionary.
     *
     * @param args the arguments after the corpus.
     * @param err the error stream.
     * @return the options.
     */
    BuilderOptions builderOptions(List<String> args, PrintStream err) {
        return new BuilderOptions();
    }

    /**
     * Runs the command against the loaded corpus.
     *
     * @param dictionary the loaded corpus.
     * @param args the remaining arguments.
     * @param out the output stream.
     * @param err the error stream.
     * @return the exit code.
     */
    abstract int run(TermDictionary dictionary, List<String> args, PrintStream out, PrintStream err);
}
