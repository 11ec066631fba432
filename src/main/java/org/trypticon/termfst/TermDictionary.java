package org.trypticon.termfst;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.trypticon.termfst.automaton.FuzzySearch;
import org.trypticon.termfst.fst.BuilderOptions;
import org.trypticon.termfst.fst.FST;
import org.trypticon.termfst.fst.FSTBuilder;
import org.trypticon.termfst.fst.KeyIterator;
import org.trypticon.termfst.fst.MinimizationStats;
import org.trypticon.termfst.search.CompositeQuery;
import org.trypticon.termfst.search.QueryOptions;
import org.trypticon.termfst.search.QueryResult;
import org.trypticon.termfst.util.BytesRef;

/**
 * A dictionary of terms compiled into an {@link FST}, mapping each term to the
 * 1-based line on which it first appeared in the corpus.
 */
public class TermDictionary {
    private static final String INFO_COMPONENT = "DICT";

    @Nonnull
    private final FST fst;

    @Nonnull
    private final MinimizationStats stats;

    private TermDictionary(@Nonnull FST fst, @Nonnull MinimizationStats stats) {
        this.fst = fst;
        this.stats = stats;
    }

    /**
     * Loads a newline-delimited corpus file with default options.
     *
     * @param corpus the corpus file, UTF-8.
     * @return the dictionary.
     * @throws IOException if an error occurs reading the file.
     */
    public static TermDictionary load(@Nonnull Path corpus) throws IOException {
        return load(corpus, new BuilderOptions());
    }

    /**
     * Loads a newline-delimited corpus file.
     *
     * @param corpus the corpus file, UTF-8.
     * @param options options for building the transducer.
     * @return the dictionary.
     * @throws IOException if an error occurs reading the file.
     */
    public static TermDictionary load(@Nonnull Path corpus, @Nonnull BuilderOptions options) throws IOException {
        List<String> lines = Files.readAllLines(corpus, StandardCharsets.UTF_8);
        InfoStream infoStream = options.getInfoStream();
        if (infoStream.isEnabled(INFO_COMPONENT)) {
            infoStream.message(INFO_COMPONENT, "read " + lines.size() + " lines from " + corpus);
        }
        return fromLines(lines, options);
    }

    /**
     * Builds a dictionary from corpus lines. Lines are trimmed, blank lines are skipped,
     * and repeated terms keep the line number of their first occurrence.
     *
     * @param lines the corpus lines.
     * @param options options for building the transducer.
     * @return the dictionary.
     */
    public static TermDictionary fromLines(@Nonnull List<String> lines, @Nonnull BuilderOptions options) {
        Map<BytesRef, Long> terms = new TreeMap<>();
        for (int i = 0; i < lines.size(); i++) {
            String term = lines.get(i).trim();
            if (!term.isEmpty()) {
                terms.putIfAbsent(new BytesRef(term), (long) (i + 1));
            }
        }

        FSTBuilder builder = new FSTBuilder(options);
        for (Map.Entry<BytesRef, Long> entry : terms.entrySet()) {
            try {
                builder.add(entry.getKey(), entry.getValue());
            } catch (InvalidKeyException e) {
                // keys come out of a sorted map with blanks removed
                throw new IllegalStateException("Corpus terms were not sorted and unique", e);
            }
        }
        FST fst = builder.build();
        MinimizationStats stats = builder.getStats();

        InfoStream infoStream = options.getInfoStream();
        if (infoStream.isEnabled(INFO_COMPONENT)) {
            infoStream.message(INFO_COMPONENT, "indexed " + fst.size() + " distinct terms, " + stats);
        }
        return new TermDictionary(fst, stats);
    }

    public boolean contains(@Nonnull String term) {
        return fst.contains(new BytesRef(term));
    }

    /**
     * Gets the line on which a term first appeared.
     *
     * @param term the term.
     * @return the 1-based line number, or {@code null} if the term is not present.
     */
    @Nullable
    public Long get(@Nonnull String term) {
        return fst.get(new BytesRef(term));
    }

    /**
     * Lists the terms starting with a prefix.
     *
     * @param prefix the prefix.
     * @param limit the maximum number of terms, 0 meaning unlimited.
     * @return the terms in order.
     */
    public List<String> prefix(@Nonnull String prefix, int limit) {
        List<String> result = new ArrayList<>();
        KeyIterator iterator = fst.prefixIterator(new BytesRef(prefix));
        while ((limit == 0 || result.size() < limit) && iterator.next()) {
            result.add(iterator.key().utf8ToString());
        }
        return result;
    }

    /**
     * Lists the terms within an edit distance of a pattern.
     *
     * @param pattern the pattern.
     * @param maxDistance the maximum edit distance.
     * @return the terms in order.
     */
    public List<String> fuzzy(@Nonnull String pattern, int maxDistance) {
        List<String> result = new ArrayList<>();
        for (BytesRef key : FuzzySearch.search(fst, pattern, maxDistance)) {
            result.add(key.utf8ToString());
        }
        return result;
    }

    @Nonnull
    public QueryResult search(@Nonnull QueryOptions options) {
        return new CompositeQuery(fst).execute(options);
    }

    public int size() {
        return fst.size();
    }

    @Nonnull
    public MinimizationStats getStats() {
        return stats;
    }

    @Nonnull
    public FST getFST() {
        return fst;
    }
}
