package org.trypticon.termfst.automaton;

import org.trypticon.termfst.util.BytesRef;

/**
 * Plain dynamic-programming edit distance over bytes. Used to rank and to verify fuzzy hits.
 */
public final class LevenshteinDistance {

  private LevenshteinDistance() {} // no instance

  public static int compute(String a, String b) {
    return compute(new BytesRef(a), new BytesRef(b));
  }

  /** Minimum number of single-byte insertions, deletions and substitutions turning {@code a} into {@code b}. */
  public static int compute(BytesRef a, BytesRef b) {
    int[] prev = new int[b.length + 1];
    int[] cur = new int[b.length + 1];
    for (int j = 0; j <= b.length; j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length; i++) {
      cur[0] = i;
      byte ca = a.bytes[a.offset + i - 1];
      for (int j = 1; j <= b.length; j++) {
        int cost = ca == b.bytes[b.offset + j - 1] ? 0 : 1;
        cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] swap = prev;
      prev = cur;
      cur = swap;
    }
    return prev[b.length];
  }
}
