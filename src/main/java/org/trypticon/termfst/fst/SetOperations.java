package org.trypticon.termfst.fst;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

import org.trypticon.termfst.InvalidKeyException;
import org.trypticon.termfst.util.BytesRef;

/**
 * Set algebra over the key sets of several {@link FSA}s or {@link FST}s.
 * Every operation builds a new, independent result. Where operands disagree
 * on the value of a shared key, the earliest operand wins.
 */
public final class SetOperations {

  private SetOperations() {} // no instance

  /** Keys present in any operand. */
  public static FSA union(FSA... operands) {
    FSABuilder builder = new FSABuilder();
    merge(operands, 1, operands.length, (key, value) -> builder.add(key));
    return builder.build();
  }

  /** Keys present in any operand, valued by the earliest operand holding each. */
  public static FST union(FST... operands) {
    FSTBuilder builder = new FSTBuilder();
    merge(operands, 1, operands.length, builder::add);
    return builder.build();
  }

  /** Keys present in every operand. */
  public static FSA intersection(FSA... operands) {
    FSABuilder builder = new FSABuilder();
    intersect(operands, (key, value) -> builder.add(key));
    return builder.build();
  }

  /** Keys present in every operand, valued by the first operand. */
  public static FST intersection(FST... operands) {
    FSTBuilder builder = new FSTBuilder();
    intersect(operands, builder::add);
    return builder.build();
  }

  /** Keys of the first operand absent from all the others. */
  public static FSA difference(FSA... operands) {
    FSABuilder builder = new FSABuilder();
    subtract(operands, (key, value) -> builder.add(key));
    return builder.build();
  }

  /** Keys of the first operand absent from all the others, with their first-operand values. */
  public static FST difference(FST... operands) {
    FSTBuilder builder = new FSTBuilder();
    subtract(operands, builder::add);
    return builder.build();
  }

  /**
   * Keys present in exactly one of two operands. With more operands the
   * operation is applied pairwise from left to right.
   */
  public static FSA symmetricDifference(FSA... operands) {
    if (operands.length <= 2) {
      FSABuilder builder = new FSABuilder();
      merge(operands, 1, 1, (key, value) -> builder.add(key));
      return builder.build();
    }
    FSA result = symmetricDifference(operands[0], operands[1]);
    for (int i = 2; i < operands.length; i++) {
      result = symmetricDifference(result, operands[i]);
    }
    return result;
  }

  /** As {@link #symmetricDifference(FSA...)}, keeping each surviving key's value. */
  public static FST symmetricDifference(FST... operands) {
    if (operands.length <= 2) {
      FSTBuilder builder = new FSTBuilder();
      merge(operands, 1, 1, builder::add);
      return builder.build();
    }
    FST result = symmetricDifference(operands[0], operands[1]);
    for (int i = 2; i < operands.length; i++) {
      result = symmetricDifference(result, operands[i]);
    }
    return result;
  }

  @FunctionalInterface
  private interface Sink {
    void accept(BytesRef key, long value) throws InvalidKeyException;
  }

  private static void emit(Sink sink, BytesRef key, long value) {
    try {
      sink.accept(key, value);
    } catch (InvalidKeyException e) {
      // operands are strictly ordered, so merged output is too
      throw new IllegalStateException("merged keys out of order", e);
    }
  }

  /**
   * Merges all operands in key order, emitting a key when the number of operands
   * holding it lies within {@code [minCount, maxCount]}.
   */
  private static void merge(FSA[] operands, int minCount, int maxCount, Sink sink) {
    PriorityQueue<SubIterator> queue = new PriorityQueue<>(Math.max(1, operands.length));
    for (int i = 0; i < operands.length; i++) {
      KeyIterator iterator = operands[i].iterator();
      if (iterator.next()) {
        queue.add(new SubIterator(iterator, i));
      }
    }
    SubIterator[] top = new SubIterator[operands.length];
    while (queue.isEmpty() == false) {
      int numTop = 0;
      top[numTop++] = queue.poll();
      while (queue.isEmpty() == false && queue.peek().iterator.key().bytesEquals(top[0].iterator.key())) {
        top[numTop++] = queue.poll();
      }
      if (numTop >= minCount && numTop <= maxCount) {
        // top[0] has the lowest operand index among equal keys
        emit(sink, top[0].iterator.key(), top[0].iterator.value());
      }
      for (int i = 0; i < numTop; i++) {
        if (top[i].iterator.next()) {
          queue.add(top[i]);
        }
      }
    }
  }

  private static void intersect(FSA[] operands, Sink sink) {
    if (operands.length == 0) {
      return;
    }
    List<BytesRef> keys = new ArrayList<>();
    List<Long> values = new ArrayList<>();
    KeyIterator iterator = operands[0].iterator();
    while (iterator.next()) {
      keys.add(BytesRef.deepCopyOf(iterator.key()));
      values.add(iterator.value());
    }
    for (int i = 1; i < operands.length && keys.isEmpty() == false; i++) {
      FSA other = operands[i];
      int upto = 0;
      for (int j = 0; j < keys.size(); j++) {
        if (other.contains(keys.get(j))) {
          keys.set(upto, keys.get(j));
          values.set(upto, values.get(j));
          upto++;
        }
      }
      keys.subList(upto, keys.size()).clear();
      values.subList(upto, values.size()).clear();
    }
    for (int i = 0; i < keys.size(); i++) {
      emit(sink, keys.get(i), values.get(i));
    }
  }

  private static void subtract(FSA[] operands, Sink sink) {
    if (operands.length == 0) {
      return;
    }
    KeyIterator iterator = operands[0].iterator();
    outer:
    while (iterator.next()) {
      BytesRef key = iterator.key();
      for (int i = 1; i < operands.length; i++) {
        if (operands[i].contains(key)) {
          continue outer;
        }
      }
      emit(sink, key, iterator.value());
    }
  }

  private static final class SubIterator implements Comparable<SubIterator> {
    final KeyIterator iterator;
    final int index;

    SubIterator(KeyIterator iterator, int index) {
      this.iterator = iterator;
      this.index = index;
    }

    @Override
    public int compareTo(SubIterator other) {
      int cmp = iterator.key().compareTo(other.iterator.key());
      if (cmp != 0) {
        return cmp;
      }
      return Integer.compare(index, other.index);
    }
  }
}
