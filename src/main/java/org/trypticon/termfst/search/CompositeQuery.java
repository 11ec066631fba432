package org.trypticon.termfst.search;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import javax.annotation.Nonnull;

import org.trypticon.termfst.automaton.FuzzySearch;
import org.trypticon.termfst.automaton.RegexSearch;
import org.trypticon.termfst.fst.FSA;
import org.trypticon.termfst.fst.KeyIterator;
import org.trypticon.termfst.util.BytesRef;

/**
 * Runs a combination of filters over one {@link FSA}.
 *
 * <p>The key space is restricted first: to a prefix, else to a range, else left whole.
 * A fuzzy pattern is then searched only inside that space. Surviving keys are tested
 * against the regex and the result is truncated to the limit. Keys come back in order.
 */
public class CompositeQuery {
    private final FSA fsa;

    public CompositeQuery(@Nonnull FSA fsa) {
        if (fsa == null) {
            throw new NullPointerException("fsa");
        }
        this.fsa = fsa;
    }

    /**
     * Executes the query.
     *
     * @param options the filters to apply.
     * @return the matching keys.
     * @throws java.util.regex.PatternSyntaxException if the regex is malformed.
     */
    @Nonnull
    public QueryResult execute(@Nonnull QueryOptions options) {
        // compile before walking anything so a bad pattern fails fast
        Pattern regex = options.getRegexPattern() == null ? null : Pattern.compile(options.getRegexPattern());

        KeyIterator iterator;
        if (options.hasPrefix()) {
            iterator = fsa.prefixIterator(new BytesRef(options.getPrefix()));
        } else if (options.hasRange()) {
            iterator = fsa.rangeIterator(toBytesRef(options.getStartKey()), toBytesRef(options.getEndKey()));
        } else {
            iterator = null;
        }

        List<BytesRef> keys = new ArrayList<>();
        int limit = options.getLimit();
        if (options.getFuzzyPattern() != null) {
            BytesRef pattern = new BytesRef(options.getFuzzyPattern());
            int maxDistance = options.getFuzzyMaxDistance();
            List<BytesRef> fuzzyMatches = iterator == null
                    ? FuzzySearch.search(fsa, pattern, maxDistance)
                    : FuzzySearch.search(iterator, pattern, maxDistance);
            for (BytesRef key : fuzzyMatches) {
                if (limit != 0 && keys.size() >= limit) {
                    break;
                }
                if (regex == null || RegexSearch.matches(regex, key)) {
                    keys.add(key);
                }
            }
        } else {
            if (iterator == null) {
                iterator = fsa.iterator();
            }
            while ((limit == 0 || keys.size() < limit) && iterator.next()) {
                BytesRef key = iterator.key();
                if (regex == null || RegexSearch.matches(regex, key)) {
                    keys.add(BytesRef.deepCopyOf(key));
                }
            }
        }
        return new QueryResult(keys);
    }

    private static BytesRef toBytesRef(String value) {
        return value == null ? null : new BytesRef(value);
    }
}
