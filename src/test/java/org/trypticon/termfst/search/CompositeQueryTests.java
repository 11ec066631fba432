package org.trypticon.termfst.search;

import java.util.regex.PatternSyntaxException;

import org.junit.Before;
import org.junit.Test;
import org.trypticon.termfst.Fixtures;
import org.trypticon.termfst.fst.FSA;
import org.trypticon.termfst.fst.KeyIterator;
import org.trypticon.termfst.util.BytesRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link CompositeQuery}.
 */
public class CompositeQueryTests {
    private CompositeQuery query;

    @Before
    public void setUp() throws Exception {
        FSA fsa = Fixtures.fsa("apple", "application", "apply", "banana", "band", "bandana", "cat", "catch");
        query = new CompositeQuery(fsa);
    }

    @Test
    public void testAll() {
        QueryResult result = query.execute(QueryOptions.all());
        assertThat(result.getCount(), is(8));
        assertThat(result.getKeyStrings().get(0), is("apple"));
    }

    @Test
    public void testPrefix() {
        QueryResult result = query.execute(QueryOptions.builder().prefix("band").build());
        assertThat(result.getKeyStrings(), contains("band", "bandana"));
        assertThat(result.getCount(), is(2));
    }

    @Test
    public void testPrefixTakesPrecedenceOverRange() {
        QueryResult result = query.execute(QueryOptions.builder().prefix("cat").range("a", "b").build());
        assertThat(result.getKeyStrings(), contains("cat", "catch"));
    }

    @Test
    public void testRange() {
        assertThat(query.execute(QueryOptions.builder().range("apply", "band").build()).getKeyStrings(),
                contains("apply", "banana"));
        assertThat(query.execute(QueryOptions.builder().range("band", "").build()).getKeyStrings(),
                contains("band", "bandana", "cat", "catch"));
        assertThat(query.execute(QueryOptions.builder().range(null, "apply").build()).getKeyStrings(),
                contains("apple", "application"));
    }

    @Test
    public void testRegex() {
        assertThat(query.execute(QueryOptions.builder().regex("an").build()).getKeyStrings(),
                contains("banana", "band", "bandana"));
        assertThat(query.execute(QueryOptions.builder().prefix("app").regex("^appl[ey]$").build()).getKeyStrings(),
                contains("apple", "apply"));
    }

    @Test
    public void testFuzzy() {
        assertThat(query.execute(QueryOptions.builder().fuzzy("bant", 1).build()).getKeyStrings(),
                contains("band"));
        assertThat(query.execute(QueryOptions.builder().fuzzy("cot", 1).build()).getKeyStrings(),
                contains("cat"));
    }

    @Test
    public void testFiltersCombine() {
        QueryOptions options = QueryOptions.builder()
                .prefix("ban")
                .regex("a$")
                .fuzzy("banana", 2)
                .build();
        assertThat(query.execute(options).getKeyStrings(), contains("banana", "bandana"));
    }

    @Test
    public void testLimit() {
        assertThat(query.execute(QueryOptions.builder().limit(3).build()).getKeyStrings(),
                contains("apple", "application", "apply"));
        assertThat(query.execute(QueryOptions.builder().regex("a$").limit(1).build()).getKeyStrings(),
                contains("banana"));
        assertThat(query.execute(QueryOptions.builder().limit(0).build()).getCount(), is(8));
    }

    @Test
    public void testNoMatches() {
        assertThat(query.execute(QueryOptions.builder().prefix("zzz").build()).getKeys(), is(empty()));
    }

    @Test(expected = PatternSyntaxException.class)
    public void testInvalidRegex() {
        query.execute(QueryOptions.builder().regex("[a-").build());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeLimit() {
        QueryOptions.builder().limit(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDistance() {
        QueryOptions.builder().fuzzy("a", -1);
    }

    @Test
    public void testFuzzyStaysInsidePrefix() throws Exception {
        CountingFSA fsa = new CountingFSA(Fixtures.fsa(false,
                "apple", "application", "apply", "banana", "band", "bandana", "cat", "catch"));
        QueryResult result = new CompositeQuery(fsa).execute(
                QueryOptions.builder().prefix("ban").fuzzy("banda", 2).build());
        assertThat(result.getKeyStrings(), contains("banana", "band", "bandana"));
        assertThat(fsa.wholeIterators, is(0));
        assertThat(fsa.keysVisited, is(3));
    }

    @Test
    public void testFuzzyStaysInsideRange() throws Exception {
        CountingFSA fsa = new CountingFSA(Fixtures.fsa(false,
                "apple", "application", "apply", "banana", "band", "bandana", "cat", "catch"));
        QueryResult result = new CompositeQuery(fsa).execute(
                QueryOptions.builder().range("c", null).fuzzy("cap", 1).build());
        assertThat(result.getKeyStrings(), contains("cat"));
        assertThat(fsa.wholeIterators, is(0));
        assertThat(fsa.keysVisited, is(2));
    }

    /**
     * Delegating FSA which records how its key space is walked.
     */
    private static class CountingFSA implements FSA {
        private final FSA delegate;
        int wholeIterators;
        int keysVisited;

        CountingFSA(FSA delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean contains(BytesRef key) {
            return delegate.contains(key);
        }

        @Override
        public KeyIterator iterator() {
            wholeIterators++;
            return counting(delegate.iterator());
        }

        @Override
        public KeyIterator prefixIterator(BytesRef prefix) {
            return counting(delegate.prefixIterator(prefix));
        }

        @Override
        public KeyIterator rangeIterator(BytesRef start, BytesRef end) {
            return counting(delegate.rangeIterator(start, end));
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public int getNumStates() {
            return delegate.getNumStates();
        }

        private KeyIterator counting(KeyIterator iterator) {
            return new KeyIterator() {
                @Override
                public boolean next() {
                    boolean found = iterator.next();
                    if (found) {
                        keysVisited++;
                    }
                    return found;
                }

                @Override
                public BytesRef key() {
                    return iterator.key();
                }

                @Override
                public long value() {
                    return iterator.value();
                }

                @Override
                public void reset() {
                    iterator.reset();
                }

                @Override
                public boolean seek(BytesRef target) {
                    return iterator.seek(target);
                }
            };
        }
    }
}
