package org.trypticon.termfst.automaton;

import java.util.regex.PatternSyntaxException;

import org.junit.Before;
import org.junit.Test;
import org.trypticon.termfst.Fixtures;
import org.trypticon.termfst.fst.FSA;
import org.trypticon.termfst.util.BytesRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link RegexSearch}.
 */
public class RegexSearchTests {
    private FSA fsa;

    @Before
    public void setUp() throws Exception {
        fsa = Fixtures.fsa("apple", "application", "apply", "banana", "pineapple");
    }

    @Test
    public void testUnanchoredMatchesAnywhere() {
        assertThat(Fixtures.strings(RegexSearch.search(fsa, "app.*")),
                contains("apple", "application", "apply", "pineapple"));
    }

    @Test
    public void testAnchored() {
        assertThat(Fixtures.strings(RegexSearch.search(fsa, "^app.*$")), contains("apple", "application", "apply"));
        assertThat(Fixtures.strings(RegexSearch.search(fsa, "^appl[ey]$")), contains("apple", "apply"));
        assertThat(RegexSearch.search(fsa, "^z"), is(empty()));
    }

    @Test
    public void testPrefixSearch() {
        assertThat(Fixtures.strings(RegexSearch.prefixSearch(fsa, new BytesRef("app"), "ion$")), contains("application"));
        assertThat(Fixtures.strings(RegexSearch.prefixSearch(fsa, new BytesRef("p"), "apple")), contains("pineapple"));
    }

    @Test(expected = PatternSyntaxException.class)
    public void testInvalidPattern() {
        RegexSearch.search(fsa, "app(");
    }
}
