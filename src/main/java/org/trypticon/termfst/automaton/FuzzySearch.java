package org.trypticon.termfst.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.trypticon.termfst.fst.Automaton;
import org.trypticon.termfst.fst.AutomatonFSA;
import org.trypticon.termfst.fst.FSA;
import org.trypticon.termfst.fst.KeyIterator;
import org.trypticon.termfst.fst.Transition;
import org.trypticon.termfst.util.BytesRef;
import org.trypticon.termfst.util.BytesRefBuilder;
import org.trypticon.termfst.util.StringHelper;

/**
 * Finds the keys of an {@link FSA} within a bounded edit distance of a pattern.
 *
 * <p>Graph-backed sets are walked depth first along their transitions with a
 * {@link LevenshteinAutomaton} stepped alongside; a branch is abandoned as soon as
 * the automaton can no longer match. Other sets are scanned in key order, and a dead
 * prefix is skipped in one {@link KeyIterator#seek} to its successor.
 */
public final class FuzzySearch {

  private FuzzySearch() {} // no instance

  public static List<BytesRef> search(FSA fsa, String pattern, int maxDistance) {
    return search(fsa, new BytesRef(pattern), maxDistance);
  }

  /**
   * @return matching keys in increasing order, the pattern itself included when present.
   */
  public static List<BytesRef> search(FSA fsa, BytesRef pattern, int maxDistance) {
    LevenshteinAutomaton lev = new LevenshteinAutomaton(pattern, maxDistance);
    List<BytesRef> results = new ArrayList<>();
    if (fsa instanceof AutomatonFSA) {
      Automaton automaton = ((AutomatonFSA) fsa).getAutomaton();
      if (automaton.getNumStates() > 0) {
        walk(automaton, automaton.getStartState(), lev, new BytesRefBuilder(), new Transition(), results);
      }
    } else {
      scan(fsa.iterator(), lev, results);
    }
    return results;
  }

  /**
   * Fuzzy search confined to the bounds of {@code iterator}. Subtrees that cannot match are
   * skipped by seeking, so the cost follows the bounded key space, not the whole automaton.
   *
   * @return matching keys within the bounds, in increasing order.
   */
  public static List<BytesRef> search(KeyIterator iterator, BytesRef pattern, int maxDistance) {
    List<BytesRef> results = new ArrayList<>();
    scan(iterator, new LevenshteinAutomaton(pattern, maxDistance), results);
    return results;
  }

  private static void walk(Automaton automaton, int state, LevenshteinAutomaton lev,
                           BytesRefBuilder path, Transition t, List<BytesRef> results) {
    if (path.length() > 0 && automaton.isFinal(state) && lev.isMatch()) {
      results.add(path.toBytesRef());
    }
    int numTransitions = automaton.getNumTransitions(state);
    for (int i = 0; i < numTransitions; i++) {
      automaton.getTransition(state, i, t);
      LevenshteinAutomaton next = lev.step(t.label);
      if (next.canMatch() == false) {
        continue;
      }
      int dest = t.dest;
      path.append((byte) t.label);
      walk(automaton, dest, next, path, t, results);
      path.setLength(path.length() - 1);
    }
  }

  private static void scan(KeyIterator iterator, LevenshteinAutomaton lev, List<BytesRef> results) {
    // stack[i] has consumed the first i bytes of the previous key
    LevenshteinAutomaton[] stack = new LevenshteinAutomaton[] {lev};
    BytesRef previous = new BytesRef();
    int depth = 0;
    while (iterator.next()) {
      BytesRef key = iterator.key();
      depth = Math.min(depth, StringHelper.bytesDifference(previous, key));
      if (stack.length < key.length + 1) {
        stack = Arrays.copyOf(stack, key.length + 1);
      }
      int dead = -1;
      while (depth < key.length) {
        LevenshteinAutomaton next = stack[depth].step(key.bytes[key.offset + depth] & 0xff);
        if (next.canMatch() == false) {
          dead = depth;
          break;
        }
        stack[++depth] = next;
      }
      previous = BytesRef.deepCopyOf(key);
      if (dead == -1) {
        if (stack[key.length].isMatch()) {
          results.add(previous);
        }
        continue;
      }
      BytesRef successor = StringHelper.prefixSuccessor(new BytesRef(previous.bytes, 0, dead + 1));
      if (successor == null || iterator.seek(successor) == false) {
        return;
      }
    }
  }
}
