package org.trypticon.termfst.fst;

import java.util.Arrays;

import org.trypticon.termfst.util.BytesRef;

/**
 * {@link FST} backed by parallel sorted key and value arrays.
 */
public class ArrayFST extends ArrayFSA implements FST {

  private final long[] values;

  ArrayFST(BytesRef[] keys, long[] values) {
    super(keys);
    assert keys.length == values.length;
    this.values = values;
  }

  @Override
  public Long get(BytesRef key) {
    int index = Arrays.binarySearch(keys, key);
    return index >= 0 ? values[index] : null;
  }

  @Override
  KeyIterator newIterator(int from, int to) {
    return new ArrayKeyIterator(keys, values, from, to);
  }
}
