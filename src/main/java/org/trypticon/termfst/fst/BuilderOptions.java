package org.trypticon.termfst.fst;

import org.trypticon.termfst.InfoStream;

/**
 * Holds all the configuration used by {@link FSABuilder} and {@link FSTBuilder}.
 * Setters return this instance so they can be chained.
 */
public final class BuilderOptions {

  /** Default value is true: build a state graph rather than a sorted key array. */
  public static final boolean DEFAULT_USE_AUTOMATON = true;

  /** Default value is true: share equivalent suffix states. */
  public static final boolean DEFAULT_MINIMIZE = true;

  private boolean useAutomaton = DEFAULT_USE_AUTOMATON;

  private boolean minimize = DEFAULT_MINIMIZE;

  private int cacheCapacity = StateCache.DEFAULT_CAPACITY;

  private InfoStream infoStream = InfoStream.NO_OUTPUT;

  /** Creates options with the defaults. */
  public BuilderOptions() {
  }

  /**
   * Chooses between the graph-backed representation (true) and the array-backed one
   * (false). Both answer every query identically.
   */
  public BuilderOptions setUseAutomaton(boolean useAutomaton) {
    this.useAutomaton = useAutomaton;
    return this;
  }

  public boolean getUseAutomaton() {
    return useAutomaton;
  }

  /** Turns suffix sharing on or off. Off builds a plain trie. */
  public BuilderOptions setMinimize(boolean minimize) {
    this.minimize = minimize;
    return this;
  }

  public boolean getMinimize() {
    return minimize;
  }

  /**
   * Maximum number of frozen states remembered for sharing. Bounds build memory;
   * smaller values only lose sharing opportunities.
   */
  public BuilderOptions setCacheCapacity(int cacheCapacity) {
    if (cacheCapacity < 0) {
      throw new IllegalArgumentException("cacheCapacity must be >= 0, got " + cacheCapacity);
    }
    this.cacheCapacity = cacheCapacity;
    return this;
  }

  public int getCacheCapacity() {
    return cacheCapacity;
  }

  /** Where build diagnostics go; {@link InfoStream#NO_OUTPUT} by default. */
  public BuilderOptions setInfoStream(InfoStream infoStream) {
    if (infoStream == null) {
      throw new IllegalArgumentException("Cannot set InfoStream implementation to null. "+
        "To disable logging use InfoStream.NO_OUTPUT");
    }
    this.infoStream = infoStream;
    return this;
  }

  public InfoStream getInfoStream() {
    return infoStream;
  }

  /** Capacity actually handed to the state cache, taking {@link #getMinimize()} into account. */
  int effectiveCacheCapacity() {
    return minimize ? cacheCapacity : 0;
  }

  @Override
  public String toString() {
    return "useAutomaton=" + useAutomaton + " minimize=" + minimize + " cacheCapacity=" + cacheCapacity;
  }
}
