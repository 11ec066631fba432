package org.trypticon.termfst.fst;

import org.trypticon.termfst.util.BytesRef;
import org.trypticon.termfst.util.BytesRefBuilder;

/**
 * Cursor over a sorted key array, restricted to the index window {@code [from, to)}.
 * Seeking is a binary search over that window.
 */
final class ArrayKeyIterator implements KeyIterator {

  private final BytesRef[] keys;

  private final long[] values;

  private final int from;

  private final int to;

  private int upto;

  private int current = -1;

  /** The stored keys belong to the FSA; callers only ever see this copy. */
  private final BytesRefBuilder scratch = new BytesRefBuilder();

  ArrayKeyIterator(BytesRef[] keys, long[] values, int from, int to) {
    this.keys = keys;
    this.values = values;
    this.from = from;
    this.to = Math.max(from, to);
    this.upto = from;
  }

  @Override
  public boolean next() {
    if (upto < to) {
      current = upto++;
      scratch.copyBytes(keys[current]);
      return true;
    }
    current = -1;
    return false;
  }

  @Override
  public BytesRef key() {
    return scratch.get();
  }

  @Override
  public long value() {
    return values == null ? 0 : values[current];
  }

  @Override
  public void reset() {
    upto = from;
    current = -1;
  }

  @Override
  public boolean seek(BytesRef target) {
    upto = Math.max(from, ceil(keys, from, to, target));
    current = -1;
    return upto < to;
  }

  /** Index of the first key in {@code [from, to)} which is &gt;= target, or {@code to}. */
  static int ceil(BytesRef[] keys, int from, int to, BytesRef target) {
    int low = from;
    int high = to;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (keys[mid].compareTo(target) < 0) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
