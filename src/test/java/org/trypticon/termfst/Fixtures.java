package org.trypticon.termfst;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

import org.trypticon.termfst.fst.BuilderOptions;
import org.trypticon.termfst.fst.FSA;
import org.trypticon.termfst.fst.FSABuilder;
import org.trypticon.termfst.fst.FST;
import org.trypticon.termfst.fst.FSTBuilder;
import org.trypticon.termfst.fst.KeyIterator;
import org.trypticon.termfst.util.BytesRef;

/**
 * Helpers for building small automata in tests.
 */
public class Fixtures {
    private Fixtures() {
    }

    public static FSA fsa(boolean useAutomaton, String... sortedKeys) throws InvalidKeyException {
        FSABuilder builder = new FSABuilder(new BuilderOptions().setUseAutomaton(useAutomaton));
        for (String key : sortedKeys) {
            builder.add(new BytesRef(key));
        }
        return builder.build();
    }

    public static FSA fsa(String... sortedKeys) throws InvalidKeyException {
        return fsa(true, sortedKeys);
    }

    public static FSA fsa(boolean useAutomaton, List<BytesRef> sortedKeys) throws InvalidKeyException {
        FSABuilder builder = new FSABuilder(new BuilderOptions().setUseAutomaton(useAutomaton));
        for (BytesRef key : sortedKeys) {
            builder.add(key);
        }
        return builder.build();
    }

    public static FST fst(boolean useAutomaton, String[] sortedKeys, long[] values) throws InvalidKeyException {
        FSTBuilder builder = new FSTBuilder(new BuilderOptions().setUseAutomaton(useAutomaton));
        for (int i = 0; i < sortedKeys.length; i++) {
            builder.add(new BytesRef(sortedKeys[i]), values[i]);
        }
        return builder.build();
    }

    /**
     * Drains an iterator from its current position.
     *
     * @param iterator the iterator.
     * @return the remaining keys as strings.
     */
    public static List<String> drain(KeyIterator iterator) {
        List<String> keys = new ArrayList<>();
        while (iterator.next()) {
            keys.add(iterator.key().utf8ToString());
        }
        return keys;
    }

    public static List<String> strings(List<BytesRef> keys) {
        List<String> strings = new ArrayList<>(keys.size());
        for (BytesRef key : keys) {
            strings.add(key.utf8ToString());
        }
        return strings;
    }

    /**
     * Generates distinct random keys over a small alphabet, so that prefixes and suffixes are often shared.
     *
     * @param random the source of randomness.
     * @param count how many keys to try to generate.
     * @param maxLength the maximum key length.
     * @return the keys in sorted order.
     */
    public static List<BytesRef> randomKeys(Random random, int count, int maxLength) {
        TreeSet<BytesRef> keys = new TreeSet<>();
        for (int i = 0; i < count; i++) {
            keys.add(new BytesRef(randomString(random, 1 + random.nextInt(maxLength))));
        }
        return new ArrayList<>(keys);
    }

    public static String randomString(Random random, int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append((char) ('a' + random.nextInt(4)));
        }
        return builder.toString();
    }
}
