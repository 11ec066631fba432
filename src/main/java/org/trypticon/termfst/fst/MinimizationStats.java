package org.trypticon.termfst.fst;

import java.util.Locale;

/**
 * Figures describing how much suffix sharing a build achieved.
 */
public final class MinimizationStats {

  private final int originalStates;

  private final int minimizedStates;

  /**
   * @param originalStates states the unshared trie over the same keys would have.
   * @param minimizedStates states actually stored.
   */
  public MinimizationStats(int originalStates, int minimizedStates) {
    this.originalStates = originalStates;
    this.minimizedStates = minimizedStates;
  }

  public int getOriginalStates() {
    return originalStates;
  }

  public int getMinimizedStates() {
    return minimizedStates;
  }

  public int getStatesRemoved() {
    return originalStates - minimizedStates;
  }

  /** Stored states divided by trie states; 1.0 means nothing was shared. */
  public double getCompressionRatio() {
    if (originalStates == 0) {
      return 0.0;
    }
    return (double) minimizedStates / originalStates;
  }

  /** Percentage of trie states saved by sharing. */
  public double getSpaceSavingPercent() {
    if (originalStates == 0) {
      return 0.0;
    }
    return (1.0 - getCompressionRatio()) * 100.0;
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "originalStates=%d minimizedStates=%d removed=%d ratio=%.3f saving=%.1f%%",
        originalStates, minimizedStates, getStatesRemoved(), getCompressionRatio(), getSpaceSavingPercent());
  }
}
