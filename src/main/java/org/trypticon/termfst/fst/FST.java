package org.trypticon.termfst.fst;

import javax.annotation.Nullable;

import org.trypticon.termfst.util.BytesRef;

/**
 * An immutable, ordered map from byte keys to unsigned 64-bit values (a finite
 * state transducer). Iterators additionally report {@link KeyIterator#value()}.
 */
public interface FST extends FSA {

  /**
   * Looks up the value for a key.
   *
   * @return the value, or {@code null} if the key is absent.
   */
  @Nullable
  Long get(BytesRef key);
}
