package org.trypticon.termfst.fst;

import org.trypticon.termfst.DuplicateKeyException;
import org.trypticon.termfst.EmptyKeyException;
import org.trypticon.termfst.InvalidKeyException;
import org.trypticon.termfst.UnorderedKeyException;
import org.trypticon.termfst.util.BytesRef;
import org.trypticon.termfst.util.BytesRefBuilder;

/**
 * Enforces the insertion contract shared by every builder: keys are non-empty,
 * and each key sorts strictly after the previous one. Only the previous key is
 * kept, so each check costs O(key length).
 */
public final class KeyOrderValidator {

  private final BytesRefBuilder previous = new BytesRefBuilder();

  private boolean hasPrevious;

  /**
   * Checks {@code key} against the last accepted key and, if it passes, makes it the new
   * last key. On failure nothing changes.
   */
  public void validate(BytesRef key) throws InvalidKeyException {
    if (key.length == 0) {
      throw new EmptyKeyException();
    }
    if (hasPrevious) {
      int cmp = key.compareTo(previous.get());
      if (cmp == 0) {
        throw new DuplicateKeyException(BytesRef.deepCopyOf(key));
      } else if (cmp < 0) {
        throw new UnorderedKeyException(BytesRef.deepCopyOf(key), previous.toBytesRef());
      }
    }
    previous.copyBytes(key);
    hasPrevious = true;
  }

  public boolean hasPrevious() {
    return hasPrevious;
  }

  /** Returns the last accepted key; only valid while {@link #hasPrevious()}. */
  public BytesRef previous() {
    return previous.get();
  }

  public void reset() {
    previous.clear();
    hasPrevious = false;
  }
}
