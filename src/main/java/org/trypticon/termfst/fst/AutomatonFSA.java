package org.trypticon.termfst.fst;

import org.trypticon.termfst.util.BytesRef;

/**
 * {@link FSA} backed by a suffix-shared {@link Automaton}. Membership walks one
 * transition per key byte.
 */
public class AutomatonFSA implements FSA {

  private static final BytesRef NO_PREFIX = new BytesRef();

  final Automaton automaton;

  private final int size;

  AutomatonFSA(Automaton automaton, int size) {
    this.automaton = automaton;
    this.size = size;
  }

  /**
   * Expert: the underlying state graph, for traversals that walk it directly.
   * Its mutators are package-private, so the graph is read-only to callers.
   */
  public Automaton getAutomaton() {
    return automaton;
  }

  @Override
  public boolean contains(BytesRef key) {
    return automaton.accept(key);
  }

  @Override
  public KeyIterator iterator() {
    return new AutomatonKeyIterator(automaton, NO_PREFIX, null, null);
  }

  @Override
  public KeyIterator prefixIterator(BytesRef prefix) {
    return new AutomatonKeyIterator(automaton, BytesRef.deepCopyOf(prefix), null, null);
  }

  @Override
  public KeyIterator rangeIterator(BytesRef start, BytesRef end) {
    return new AutomatonKeyIterator(automaton, NO_PREFIX,
        start == null ? null : BytesRef.deepCopyOf(start),
        end == null ? null : BytesRef.deepCopyOf(end));
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public int getNumStates() {
    return automaton.getNumStates();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(size=" + size + ", numStates=" + getNumStates() + ")";
  }
}
