package org.trypticon.termfst.fst;

import org.trypticon.termfst.util.BytesRef;

/**
 * {@link FST} backed by a suffix-shared {@link Automaton}; the value of a key is the
 * sum of the transition outputs along its path plus the final output of its last state.
 */
public class AutomatonFST extends AutomatonFSA implements FST {

  AutomatonFST(Automaton automaton, int size) {
    super(automaton, size);
  }

  @Override
  public Long get(BytesRef key) {
    return automaton.acceptWithOutput(key);
  }
}
