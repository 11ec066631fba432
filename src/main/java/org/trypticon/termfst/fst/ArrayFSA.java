package org.trypticon.termfst.fst;

import java.util.Arrays;

import org.trypticon.termfst.util.BytesRef;
import org.trypticon.termfst.util.StringHelper;

/**
 * {@link FSA} backed by a sorted array of keys. Membership is a binary search.
 * Answers every query exactly like the graph-backed {@link AutomatonFSA}.
 */
public class ArrayFSA implements FSA {

  final BytesRef[] keys;

  /** @param keys strictly increasing keys; the array is owned from now on. */
  ArrayFSA(BytesRef[] keys) {
    this.keys = keys;
  }

  @Override
  public boolean contains(BytesRef key) {
    return Arrays.binarySearch(keys, key) >= 0;
  }

  @Override
  public KeyIterator iterator() {
    return newIterator(0, keys.length);
  }

  @Override
  public KeyIterator prefixIterator(BytesRef prefix) {
    int from = ArrayKeyIterator.ceil(keys, 0, keys.length, prefix);
    BytesRef successor = StringHelper.prefixSuccessor(prefix);
    int to = successor == null ? keys.length : ArrayKeyIterator.ceil(keys, from, keys.length, successor);
    return newIterator(from, to);
  }

  @Override
  public KeyIterator rangeIterator(BytesRef start, BytesRef end) {
    int from = start == null ? 0 : ArrayKeyIterator.ceil(keys, 0, keys.length, start);
    int to = end == null ? keys.length : ArrayKeyIterator.ceil(keys, 0, keys.length, end);
    return newIterator(from, to);
  }

  KeyIterator newIterator(int from, int to) {
    return new ArrayKeyIterator(keys, null, from, to);
  }

  @Override
  public int size() {
    return keys.length;
  }

  @Override
  public int getNumStates() {
    return keys.length + 1;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(size=" + size() + ")";
  }
}
