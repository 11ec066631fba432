package org.trypticon.termfst.automaton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.trypticon.termfst.util.BytesRef;

/**
 * Nondeterministic edit-distance matcher for one pattern, advanced one input byte
 * at a time. Instances are immutable; {@link #step} returns the successor.
 *
 * <p>The cell table is indexed by {@code [position][errors]} and sized
 * {@code (patternLength + maxDistance + 1) x (maxDistance + 1)}. Each step applies
 * match or substitution (advance position, one error on mismatch) and insertion
 * (same position, one error), then closes over deletions (advance position
 * without input, one error).
 */
public final class LevenshteinAutomaton {

  private final byte[] pattern;
  private final int maxDistance;
  private final LevenshteinState[][] states;

  public LevenshteinAutomaton(String pattern, int maxDistance) {
    this(new BytesRef(pattern), maxDistance);
  }

  public LevenshteinAutomaton(BytesRef pattern, int maxDistance) {
    if (maxDistance < 0) {
      throw new IllegalArgumentException("maxDistance must be >= 0 (got " + maxDistance + ")");
    }
    this.pattern = BytesRef.deepCopyOf(pattern).bytes;
    this.maxDistance = maxDistance;
    this.states = newTable();
    states[0][0] = new LevenshteinState(0, 0, true);
    closeOverDeletions(states);
  }

  private LevenshteinAutomaton(byte[] pattern, int maxDistance, LevenshteinState[][] states) {
    this.pattern = pattern;
    this.maxDistance = maxDistance;
    this.states = states;
  }

  private LevenshteinState[][] newTable() {
    LevenshteinState[][] table = new LevenshteinState[pattern.length + maxDistance + 1][maxDistance + 1];
    for (LevenshteinState[] row : table) {
      Arrays.fill(row, LevenshteinState.INVALID);
    }
    return table;
  }

  private static void mark(LevenshteinState[][] table, int position, int errors) {
    if (table[position][errors].isValid() == false) {
      table[position][errors] = new LevenshteinState(position, errors, true);
    }
  }

  private void closeOverDeletions(LevenshteinState[][] table) {
    // rows are visited in increasing position so chains of deletions propagate
    for (int pos = 0; pos < pattern.length; pos++) {
      for (int err = 0; err < maxDistance; err++) {
        if (table[pos][err].isValid()) {
          mark(table, pos + 1, err + 1);
        }
      }
    }
  }

  /** Returns the automaton after consuming {@code label} (0-255). */
  public LevenshteinAutomaton step(int label) {
    LevenshteinState[][] next = newTable();
    for (int pos = 0; pos < states.length; pos++) {
      for (int err = 0; err <= maxDistance; err++) {
        if (states[pos][err].isValid() == false) {
          continue;
        }
        if (pos < pattern.length) {
          int cost = (pattern[pos] & 0xff) == label ? 0 : 1;
          if (err + cost <= maxDistance) {
            mark(next, pos + 1, err + cost);
          }
        }
        if (err < maxDistance) {
          mark(next, pos, err + 1);
        }
      }
    }
    closeOverDeletions(next);
    return new LevenshteinAutomaton(pattern, maxDistance, next);
  }

  /** Returns the automaton after consuming every byte of {@code input}. */
  public LevenshteinAutomaton step(BytesRef input) {
    LevenshteinAutomaton current = this;
    for (int i = 0; i < input.length && current.canMatch(); i++) {
      current = current.step(input.bytes[input.offset + i] & 0xff);
    }
    return current;
  }

  /** True if the input consumed so far is within {@code maxDistance} of the pattern. */
  public boolean isMatch() {
    for (int err = 0; err <= maxDistance; err++) {
      for (int pos = pattern.length; pos < states.length && pos <= pattern.length + err; pos++) {
        if (states[pos][err].isValid()) {
          return true;
        }
      }
    }
    return false;
  }

  /** True while some continuation of the input consumed so far could still match. */
  public boolean canMatch() {
    for (LevenshteinState[] row : states) {
      for (LevenshteinState state : row) {
        if (state.isValid()) {
          return true;
        }
      }
    }
    return false;
  }

  /** Smallest error count among cells that have consumed the whole pattern, or -1. */
  public int getDistance() {
    for (int err = 0; err <= maxDistance; err++) {
      if (states[pattern.length][err].isValid()) {
        return err;
      }
    }
    return -1;
  }

  public LevenshteinState getState(int position, int errors) {
    return states[position][errors];
  }

  /** Valid cells, ordered by position then errors. */
  public List<LevenshteinState> getValidStates() {
    List<LevenshteinState> valid = new ArrayList<>();
    for (LevenshteinState[] row : states) {
      for (LevenshteinState state : row) {
        if (state.isValid()) {
          valid.add(state);
        }
      }
    }
    return valid;
  }

  public int getMaxDistance() {
    return maxDistance;
  }

  public int getPatternLength() {
    return pattern.length;
  }

  @Override
  public String toString() {
    return "LevenshteinAutomaton(pattern=" + new BytesRef(pattern).utf8ToString()
        + " maxDistance=" + maxDistance + " states=" + getValidStates() + ")";
  }
}
