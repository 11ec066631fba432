package org.trypticon.termfst.fst;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, least-recently-used registry of frozen states, used by the
 * {@link MinimizingBuilder} to find an equivalent state to share. The size never
 * exceeds the capacity; once full, adding evicts the entry touched longest ago.
 * An evicted state is still in the automaton, it just can no longer be shared, so
 * eviction costs compression but never correctness.
 *
 * <p>Lookups reorder the recency list, so both reads and writes are done under one
 * lock. Normal use is a single builder thread and the lock is then uncontended.
 */
public final class StateCache {

  /** Default capacity; enough for good sharing on large vocabularies with a fixed memory ceiling. */
  public static final int DEFAULT_CAPACITY = 10_000;

  private final int capacity;

  // access-ordered: iteration starts at the least recently used entry
  private final Map<StateSignature, Integer> states;

  private final ReentrantLock lock;

  private long hitCount;

  private long missCount;

  private long evictionCount;

  public StateCache(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
    }
    this.capacity = capacity;
    this.states = new LinkedHashMap<>(16, 0.75f, true);
    this.lock = new ReentrantLock();
  }

  /**
   * Returns the id of the registered state equivalent to {@code signature}, marking it as
   * most recently used, or -1 if there is none.
   */
  int get(StateSignature signature) {
    lock.lock();
    try {
      Integer state = states.get(signature);
      if (state == null) {
        missCount++;
        return -1;
      }
      hitCount++;
      return state;
    } finally {
      lock.unlock();
    }
  }

  /** Registers {@code state} as the canonical state for {@code signature}. */
  void put(StateSignature signature, int state) {
    if (capacity == 0) {
      return;
    }
    lock.lock();
    try {
      states.put(signature, state);
      evictIfNecessary();
    } finally {
      lock.unlock();
    }
  }

  private void evictIfNecessary() {
    assert lock.isHeldByCurrentThread();
    if (states.size() > capacity) {
      Iterator<StateSignature> iterator = states.keySet().iterator();
      do {
        iterator.next();
        iterator.remove();
        evictionCount++;
      } while (states.size() > capacity);
    }
  }

  /** Removes every entry. Statistics are reset too. */
  public void clear() {
    lock.lock();
    try {
      states.clear();
      hitCount = 0;
      missCount = 0;
      evictionCount = 0;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return states.size();
    } finally {
      lock.unlock();
    }
  }

  public int getCapacity() {
    return capacity;
  }

  public long getHitCount() {
    lock.lock();
    try {
      return hitCount;
    } finally {
      lock.unlock();
    }
  }

  public long getMissCount() {
    lock.lock();
    try {
      return missCount;
    } finally {
      lock.unlock();
    }
  }

  public long getEvictionCount() {
    lock.lock();
    try {
      return evictionCount;
    } finally {
      lock.unlock();
    }
  }
}
