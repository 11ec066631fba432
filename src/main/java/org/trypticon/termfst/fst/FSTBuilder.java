package org.trypticon.termfst.fst;

import org.trypticon.termfst.InvalidKeyException;
import org.trypticon.termfst.util.BytesRef;

/**
 * Builds an {@link FST} from key/value pairs added in strictly increasing key order.
 */
public class FSTBuilder extends AbstractKeyBuilder<FST> {

  public FSTBuilder() {
    this(new BuilderOptions());
  }

  public FSTBuilder(BuilderOptions options) {
    super(options);
  }

  /**
   * Adds the next key and its value.
   *
   * @param value an unsigned 64-bit value.
   * @throws InvalidKeyException if the key is empty, a duplicate or out of order; the builder is unchanged.
   */
  public void add(BytesRef key, long value) throws InvalidKeyException {
    addEntry(key, value);
  }

  @Override
  FST newAutomatonBacked(Automaton automaton, int size) {
    return new AutomatonFST(automaton, size);
  }

  @Override
  FST newArrayBacked(BytesRef[] keys, long[] values) {
    return new ArrayFST(keys, values);
  }
}
