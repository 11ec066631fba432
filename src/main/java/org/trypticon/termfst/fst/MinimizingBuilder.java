/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trypticon.termfst.fst;

import org.trypticon.termfst.InfoStream;
import org.trypticon.termfst.InvalidKeyException;
import org.trypticon.termfst.util.ArrayUtil;
import org.trypticon.termfst.util.BytesRef;
import org.trypticon.termfst.util.BytesRefBuilder;
import org.trypticon.termfst.util.StringHelper;

/**
 * Builds a minimal-ish acyclic automaton from pre-sorted keys with outputs, sharing
 * equivalent suffix states as it goes.
 *
 * <p>The keys of the last added input are kept as a "frontier" of open states, one per
 * byte. When a new key arrives, every open state deeper than the prefix shared with the
 * previous key can no longer change, so it is frozen, deepest first: its signature is
 * looked up in a bounded {@link StateCache} and, on a hit, the parent is pointed at the
 * registered equivalent instead. Outputs are pushed towards the start state as far as
 * they are shared (the common output of two arcs is the smaller value), so equal
 * suffixes also end up with equal outputs.
 *
 * <p>Keys must be added in strictly increasing unsigned byte order; failures leave the
 * builder unchanged. Not thread safe.
 */
public class MinimizingBuilder {

  static final String INFO_COMPONENT = "FST";

  private final StateCache cache;

  private final InfoStream infoStream;

  private final KeyOrderValidator validator = new KeyOrderValidator();

  private final BytesRefBuilder lastInput = new BytesRefBuilder();

  private Automaton automaton;

  // current "frontier": open states for each byte of lastInput, frontier[0] is the start state
  private OpenState[] frontier;

  private int keyCount;

  private int frozenCount;

  private int sharedCount;

  private Automaton result;

  private MinimizationStats stats;

  public MinimizingBuilder() {
    this(StateCache.DEFAULT_CAPACITY, InfoStream.NO_OUTPUT);
  }

  /**
   * @param cacheCapacity maximum number of states remembered for sharing; 0 builds a plain trie.
   * @param infoStream receives build diagnostics.
   */
  public MinimizingBuilder(int cacheCapacity, InfoStream infoStream) {
    this.cache = new StateCache(cacheCapacity);
    this.infoStream = infoStream;
    init();
    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(INFO_COMPONENT, "start build with cacheCapacity=" + cacheCapacity);
    }
  }

  private void init() {
    automaton = new Automaton();
    frontier = new OpenState[10];
    for (int idx = 0; idx < frontier.length; idx++) {
      frontier[idx] = new OpenState();
    }
    lastInput.clear();
    validator.reset();
    keyCount = 0;
    frozenCount = 0;
    sharedCount = 0;
    result = null;
    stats = null;
  }

  /** Adds a key with no output, for set-only automata. */
  public void add(BytesRef key) throws InvalidKeyException {
    add(key, 0L);
  }

  /**
   * Adds the next key. Keys must sort strictly after the previous one.
   *
   * @param key a non-empty key.
   * @param value the output for the key, as an unsigned 64-bit value.
   * @throws InvalidKeyException if the key is empty, a duplicate or out of order.
   * @throws IllegalStateException if {@link #build()} was called and {@link #reset()} has not been.
   */
  public void add(BytesRef key, long value) throws InvalidKeyException {
    if (result != null) {
      throw new IllegalStateException("automaton already built; call reset() to start another");
    }
    validator.validate(key);

    final int prefixLenPlus1 = StringHelper.bytesDifference(lastInput.get(), key) + 1;

    // minimize/compile states from previous input's
    // orphan'd suffix
    freezeTail(prefixLenPlus1);

    // init tail states for current input
    if (frontier.length < key.length + 1) {
      final OpenState[] next = ArrayUtil.grow(frontier, key.length + 1);
      for (int idx = frontier.length; idx < next.length; idx++) {
        next[idx] = new OpenState();
      }
      frontier = next;
    }

    for (int idx = prefixLenPlus1; idx <= key.length; idx++) {
      frontier[idx - 1].addArc(key.byteAt(idx - 1) & 0xff);
    }

    final OpenState lastState = frontier[key.length];
    lastState.isFinal = true;
    lastState.finalOutput = 0;

    // push conflicting outputs forward, only as far as
    // needed
    long output = value;
    for (int idx = 1; idx < prefixLenPlus1; idx++) {
      final OpenState node = frontier[idx];
      final OpenState parentNode = frontier[idx - 1];

      final long lastOutput = parentNode.getLastOutput();
      final long commonOutputPrefix;
      final long wordSuffix;

      if (lastOutput != 0) {
        commonOutputPrefix = Long.compareUnsigned(output, lastOutput) < 0 ? output : lastOutput;
        wordSuffix = lastOutput - commonOutputPrefix;
        parentNode.setLastOutput(commonOutputPrefix);
        node.prependOutput(wordSuffix);
      } else {
        commonOutputPrefix = 0;
      }

      output -= commonOutputPrefix;
    }

    // the remainder rides on the first arc that is new to this key
    frontier[prefixLenPlus1 - 1].setLastOutput(output);

    lastInput.copyBytes(key);
    keyCount++;
  }

  /**
   * Freezes every remaining open state and returns the finished automaton. Further
   * {@link #add} calls fail until {@link #reset()}.
   */
  public Automaton build() {
    if (result != null) {
      return result;
    }

    freezeTail(1);
    final int root = freeze(frontier[0], false);
    automaton.setStartState(root);
    result = automaton;
    stats = new MinimizationStats(frozenCount, automaton.getNumStates());

    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(INFO_COMPONENT, "built " + keyCount + " keys: " + stats
          + " shared=" + sharedCount + " cacheEvictions=" + cache.getEvictionCount());
    }
    return result;
  }

  /** Discards all added keys and the sharing cache so the builder can be used again. */
  public void reset() {
    cache.clear();
    init();
  }

  /** Number of keys added so far. */
  public int size() {
    return keyCount;
  }

  /** Sharing statistics; only available once built. */
  public MinimizationStats getStats() {
    if (stats == null) {
      throw new IllegalStateException("automaton not built yet");
    }
    return stats;
  }

  /** Number of frozen states which were replaced by an equivalent registered state. */
  public int getSharedStateCount() {
    return sharedCount;
  }

  private void freezeTail(int prefixLenPlus1) {
    for (int idx = lastInput.length(); idx >= prefixLenPlus1; idx--) {
      final OpenState node = frontier[idx];
      final OpenState parent = frontier[idx - 1];
      parent.setLastTarget(freeze(node, true));
      node.clear();
    }
  }

  private int freeze(OpenState node, boolean share) {
    frozenCount++;

    StateSignature signature = null;
    if (share && cache.getCapacity() > 0) {
      signature = new StateSignature(node.isFinal, node.finalOutput, node.labels, node.targets, node.outputs, node.numArcs);
      final int registered = cache.get(signature);
      if (registered != -1) {
        sharedCount++;
        return registered;
      }
    }

    final int state = automaton.createState(node.isFinal, node.finalOutput);
    for (int i = 0; i < node.numArcs; i++) {
      assert node.targets[i] != -1 : "arc " + i + " still points at an open state";
      automaton.addTransition(state, node.labels[i], node.targets[i], node.outputs[i]);
    }
    automaton.finishState();

    if (signature != null) {
      cache.put(signature, state);
    }
    return state;
  }

  /** Expert: holds a pending (seen but not yet serialized) state. */
  private static final class OpenState {
    boolean isFinal;
    long finalOutput;
    int numArcs;
    int[] labels = new int[1];
    int[] targets = new int[1];
    long[] outputs = new long[1];

    void clear() {
      isFinal = false;
      finalOutput = 0;
      numArcs = 0;
    }

    void addArc(int label) {
      assert numArcs == 0 || label > labels[numArcs - 1] : "arc[-1].label=" + labels[numArcs - 1] + " new label=" + label + " numArcs=" + numArcs;
      labels = ArrayUtil.grow(labels, numArcs + 1);
      targets = ArrayUtil.grow(targets, numArcs + 1);
      outputs = ArrayUtil.grow(outputs, numArcs + 1);
      labels[numArcs] = label;
      targets[numArcs] = -1;
      outputs[numArcs] = 0;
      numArcs++;
    }

    long getLastOutput() {
      assert numArcs > 0;
      return outputs[numArcs - 1];
    }

    void setLastOutput(long output) {
      assert numArcs > 0;
      outputs[numArcs - 1] = output;
    }

    void setLastTarget(int target) {
      assert numArcs > 0;
      targets[numArcs - 1] = target;
    }

    // pushes an output prefix forward onto all arcs
    void prependOutput(long outputPrefix) {
      for (int i = 0; i < numArcs; i++) {
        outputs[i] = outputPrefix + outputs[i];
      }
      if (isFinal) {
        finalOutput = outputPrefix + finalOutput;
      }
    }
  }
}
