package org.trypticon.termfst.fst;

import java.util.Arrays;

import org.trypticon.termfst.InvalidKeyException;
import org.trypticon.termfst.util.ArrayUtil;
import org.trypticon.termfst.util.BytesRef;

/**
 * Shared lifecycle of {@link FSABuilder} and {@link FSTBuilder}: mutable while adding,
 * frozen by {@link #build()}, reusable only after {@link #reset()}.
 */
abstract class AbstractKeyBuilder<T extends FSA> {

  final BuilderOptions options;

  // graph-backed path
  private final MinimizingBuilder graph;

  // array-backed path
  private final KeyOrderValidator validator;
  private BytesRef[] keys;
  private long[] values;

  private int count;

  private long keyBytes;

  private T result;

  private MinimizationStats stats;

  AbstractKeyBuilder(BuilderOptions options) {
    this.options = options;
    if (options.getUseAutomaton()) {
      graph = new MinimizingBuilder(options.effectiveCacheCapacity(), options.getInfoStream());
      validator = null;
    } else {
      graph = null;
      validator = new KeyOrderValidator();
      keys = new BytesRef[0];
      values = new long[0];
    }
  }

  final void addEntry(BytesRef key, long value) throws InvalidKeyException {
    if (result != null) {
      throw new IllegalStateException("already built; call reset() to start another");
    }
    if (graph != null) {
      graph.add(key, value);
    } else {
      validator.validate(key);
      keys = ArrayUtil.grow(keys, count + 1);
      values = ArrayUtil.grow(values, count + 1);
      keys[count] = BytesRef.deepCopyOf(key);
      values[count] = value;
    }
    count++;
    keyBytes += key.length;
  }

  /** Finishes construction. Calling it again returns the same instance. */
  public T build() {
    if (result != null) {
      return result;
    }
    if (graph != null) {
      Automaton automaton = graph.build();
      stats = graph.getStats();
      result = newAutomatonBacked(automaton, count);
    } else {
      BytesRef[] sortedKeys = Arrays.copyOf(keys, count);
      long[] sortedValues = Arrays.copyOf(values, count);
      stats = new MinimizationStats(count + 1, count + 1);
      result = newArrayBacked(sortedKeys, sortedValues);
    }
    return result;
  }

  abstract T newAutomatonBacked(Automaton automaton, int size);

  abstract T newArrayBacked(BytesRef[] keys, long[] values);

  /** Discards everything added so far. */
  public void reset() {
    if (graph != null) {
      graph.reset();
    } else {
      validator.reset();
      keys = new BytesRef[0];
      values = new long[0];
    }
    count = 0;
    keyBytes = 0;
    result = null;
    stats = null;
  }

  /** Number of keys added so far. */
  public int size() {
    return count;
  }

  /** Rough size in bytes of the keys added so far: key bytes plus 8 per key. */
  public long estimatedSize() {
    return keyBytes + 8L * count;
  }

  /** Sharing statistics of the last build. */
  public MinimizationStats getStats() {
    if (stats == null) {
      throw new IllegalStateException("not built yet");
    }
    return stats;
  }
}
