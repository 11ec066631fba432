package org.trypticon.termfst.automaton;

import java.util.Random;

import org.junit.Test;
import org.trypticon.termfst.util.BytesRef;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

/**
 * Tests for {@link LevenshteinAutomaton} and {@link LevenshteinDistance}.
 */
public class LevenshteinAutomatonTests {

    @Test
    public void testExactMatch() {
        LevenshteinAutomaton lev = new LevenshteinAutomaton("car", 0);
        assertThat(lev.step(new BytesRef("car")).isMatch(), is(true));
        assertThat(lev.step(new BytesRef("ca")).isMatch(), is(false));
        assertThat(lev.step(new BytesRef("ca")).canMatch(), is(true));
        assertThat(lev.step(new BytesRef("cb")).canMatch(), is(false));
    }

    @Test
    public void testSingleEdits() {
        LevenshteinAutomaton lev = new LevenshteinAutomaton("car", 1);
        assertThat(lev.step(new BytesRef("cat")).isMatch(), is(true));   // substitution
        assertThat(lev.step(new BytesRef("card")).isMatch(), is(true));  // insertion
        assertThat(lev.step(new BytesRef("ca")).isMatch(), is(true));    // deletion at the end
        assertThat(lev.step(new BytesRef("ar")).isMatch(), is(true));    // deletion at the start
        assertThat(lev.step(new BytesRef("cards")).isMatch(), is(false));
        assertThat(lev.step(new BytesRef("dog")).isMatch(), is(false));
    }

    @Test
    public void testInitialStateAllowsLeadingDeletions() {
        LevenshteinAutomaton lev = new LevenshteinAutomaton("ab", 2);
        assertThat(lev.getState(0, 0).isValid(), is(true));
        assertThat(lev.getState(1, 1).isValid(), is(true));
        assertThat(lev.getState(2, 2).isValid(), is(true));
        assertThat(lev.getState(1, 0).isValid(), is(false));
        // dropping both bytes is within distance 2
        assertThat(lev.isMatch(), is(true));
        assertThat(new LevenshteinAutomaton("abc", 2).isMatch(), is(false));
    }

    @Test
    public void testDistance() {
        LevenshteinAutomaton lev = new LevenshteinAutomaton("kitten", 3);
        assertThat(lev.step(new BytesRef("sitting")).getDistance(), is(3));
        assertThat(lev.step(new BytesRef("kitten")).getDistance(), is(0));
        assertThat(new LevenshteinAutomaton("kitten", 2).step(new BytesRef("sitting")).isMatch(), is(false));
    }

    @Test
    public void testStepDoesNotChangeReceiver() {
        LevenshteinAutomaton lev = new LevenshteinAutomaton("abc", 1);
        LevenshteinAutomaton next = lev.step('a');
        assertThat(lev.getValidStates().toString(), is("[(0,0), (1,1)]"));
        assertThat(next.getValidStates().toString(), is("[(0,1), (1,0), (2,1)]"));
    }

    @Test
    public void testAgreesWithDynamicProgramming() {
        Random random = new Random(3);
        for (int i = 0; i < 2000; i++) {
            String pattern = randomWord(random);
            String input = randomWord(random);
            int maxDistance = random.nextInt(3);
            int distance = LevenshteinDistance.compute(pattern, input);
            boolean matched = new LevenshteinAutomaton(pattern, maxDistance).step(new BytesRef(input)).isMatch();
            assertThat(pattern + " vs " + input, matched, is(distance <= maxDistance));
        }
    }

    @Test
    public void testLevenshteinDistance() {
        assertThat(LevenshteinDistance.compute("", ""), is(0));
        assertThat(LevenshteinDistance.compute("", "abc"), is(3));
        assertThat(LevenshteinDistance.compute("car", "card"), is(1));
        assertThat(LevenshteinDistance.compute("car", "care"), is(1));
        assertThat(LevenshteinDistance.compute("car", "cat"), is(1));
        assertThat(LevenshteinDistance.compute("kitten", "sitting"), is(3));
        assertThat(LevenshteinDistance.compute("flaw", "lawn"), is(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDistance() {
        new LevenshteinAutomaton("a", -1);
    }

    private static String randomWord(Random random) {
        StringBuilder builder = new StringBuilder();
        int length = random.nextInt(6);
        for (int i = 0; i < length; i++) {
            builder.append((char) ('a' + random.nextInt(3)));
        }
        return builder.toString();
    }
}
