package org.trypticon.termfst.fst;

import org.trypticon.termfst.util.BytesRef;

/**
 * Restartable cursor over the keys of an {@link FSA}, in strictly increasing order,
 * limited to whatever bounds the cursor was created with.
 *
 * <pre class="prettyprint">
 *   KeyIterator it = fsa.iterator();
 *   while (it.next()) {
 *     BytesRef key = it.key();
 *   }
 * </pre>
 */
public interface KeyIterator {

  /**
   * Advances to the next key.
   *
   * @return true if there is a current key, false once exhausted.
   */
  boolean next();

  /**
   * The current key. The returned ref may be reused by the next call to {@link #next()},
   * so copy it with {@link BytesRef#deepCopyOf} to keep it. Writing into it never
   * changes the automaton.
   */
  BytesRef key();

  /** Value of the current key; always 0 for set-only automata. */
  long value();

  /** Rewinds to before the first key. */
  void reset();

  /**
   * Positions the cursor so that the following {@link #next()} produces the smallest
   * key &gt;= {@code target} within the bounds.
   *
   * @return true if such a key exists.
   */
  boolean seek(BytesRef target);
}
