package org.trypticon.termfst.cli;

import java.io.PrintStream;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.trypticon.termfst.TermDictionary;
import org.trypticon.termfst.search.QueryOptions;
import org.trypticon.termfst.search.QueryResult;

/**
 * Command to run a combined prefix, range, regex and fuzzy query.
 */
class QueryCommand extends CorpusCommand {
    QueryCommand() {
        super("query", "Runs a combined query over a corpus",
                "<corpus> [--prefix=P] [--start=S] [--end=E] [--regex=R] [--fuzzy=F] [--distance=D] [--limit=N]",
                0, Integer.MAX_VALUE - 1);
    }

    @Override
    void details(PrintStream err) {
        super.details(err);
        err.println("Options:");
        err.println("  --prefix=P    terms starting with P; takes precedence over --start/--end");
        err.println("  --start=S     terms at or after S");
        err.println("  --end=E       terms before E");
        err.println("  --regex=R     terms containing a match for R");
        err.println("  --fuzzy=F     terms within --distance edits of F");
        err.println("  --distance=D  edit distance for --fuzzy (default 0)");
        err.println("  --limit=N     stop after N terms (default 0, no limit)");
        err.println("Example: " + Constants.APP_NAME + " query words.txt --prefix=app --regex=e$ --limit=10");
    }

    @Override
    int run(TermDictionary dictionary, List<String> args, PrintStream out, PrintStream err) {
        QueryOptions.Builder builder = QueryOptions.builder();
        String start = null;
        String end = null;
        String fuzzy = null;
        int distance = 0;
        for (String arg : args) {
            int equals = arg.indexOf('=');
            if (!arg.startsWith("--") || equals < 0) {
                err.println("Unknown option: " + arg);
                usage(err);
                return 1;
            }
            String name = arg.substring(2, equals);
            String value = arg.substring(equals + 1);
            switch (name) {
                case "prefix":
                    builder.prefix(value);
                    break;
                case "start":
                    start = value;
                    break;
                case "end":
                    end = value;
                    break;
                case "regex":
                    builder.regex(value);
                    break;
                case "fuzzy":
                    fuzzy = value;
                    break;
                case "distance":
                    distance = parseCount(err, value);
                    if (distance < 0) {
                        return 1;
                    }
                    break;
                case "limit":
                    int limit = parseCount(err, value);
                    if (limit < 0) {
                        return 1;
                    }
                    builder.limit(limit);
                    break;
                default:
                    err.println("Unknown option: " + arg);
                    usage(err);
                    return 1;
            }
        }
        builder.range(start, end);
        builder.fuzzy(fuzzy, distance);

        QueryResult result;
        try {
            result = dictionary.search(builder.build());
        } catch (PatternSyntaxException e) {
            err.println("Invalid regex: " + e.getPattern());
            return 1;
        }
        for (String term : result.getKeyStrings()) {
            out.println(term);
        }
        return 0;
    }
}
