package org.trypticon.termfst.fst;

import org.trypticon.termfst.InvalidKeyException;
import org.trypticon.termfst.util.BytesRef;

/**
 * Builds an {@link FSA} from keys added in strictly increasing order.
 *
 * <pre class="prettyprint">
 *   FSABuilder builder = new FSABuilder();
 *   builder.add(new BytesRef("apple"));
 *   builder.add(new BytesRef("apply"));
 *   FSA fsa = builder.build();
 * </pre>
 */
public class FSABuilder extends AbstractKeyBuilder<FSA> {

  public FSABuilder() {
    this(new BuilderOptions());
  }

  public FSABuilder(BuilderOptions options) {
    super(options);
  }

  /**
   * Adds the next key.
   *
   * @throws InvalidKeyException if the key is empty, a duplicate or out of order; the builder is unchanged.
   */
  public void add(BytesRef key) throws InvalidKeyException {
    addEntry(key, 0L);
  }

  @Override
  FSA newAutomatonBacked(Automaton automaton, int size) {
    return new AutomatonFSA(automaton, size);
  }

  @Override
  FSA newArrayBacked(BytesRef[] keys, long[] values) {
    return new ArrayFSA(keys);
  }
}
