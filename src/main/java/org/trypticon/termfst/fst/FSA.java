package org.trypticon.termfst.fst;

import javax.annotation.Nullable;

import org.trypticon.termfst.util.BytesRef;

/**
 * An immutable, ordered set of byte keys (a finite state acceptor).
 * Safe for concurrent readers; every iterator is a separate cursor.
 */
public interface FSA {

  /** Returns true if the key is in the set. */
  boolean contains(BytesRef key);

  /** Returns a cursor over all keys in increasing order. */
  KeyIterator iterator();

  /**
   * Returns a cursor over the keys starting with {@code prefix}. It stops at the end
   * of the matching block rather than scanning the rest of the set.
   */
  KeyIterator prefixIterator(BytesRef prefix);

  /**
   * Returns a cursor over the keys in {@code [start, end)}.
   *
   * @param start inclusive lower bound, or {@code null} for no lower bound.
   * @param end exclusive upper bound, or {@code null} for no upper bound.
   */
  KeyIterator rangeIterator(@Nullable BytesRef start, @Nullable BytesRef end);

  /** Number of keys, O(1). */
  int size();

  /** Number of states in the underlying representation. */
  int getNumStates();
}
