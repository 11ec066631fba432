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

import java.util.BitSet;

import org.trypticon.termfst.util.ArrayUtil;
import org.trypticon.termfst.util.BytesRef;

// TODO
//   - could use packed int arrays instead

/**
 * Represents an acyclic automaton over byte labels in a flat arena. States are
 * integers (0 ... numStates-1), each with a final flag and a final output, and
 * transitions are stored sorted by label per state so that dispatch is a binary
 * search.
 *
 * <p>Create states with {@link #createState}, then add all transitions leaving a
 * state before moving to the next source state, then call {@link #finishState}.
 * Outputs along a path sum (as unsigned 64-bit values) to the output of the key
 * it spells, the final state's final output included.
 *
 * <p>Only the builders in this package construct automata. Everywhere else an
 * instance is read-only.
 */
public class Automaton {

  /** Where we next write to the int[] states; this increments by 2 for
   *  each added state because we pack a pointer to the transitions
   *  array and a count of how many transitions leave the state.  */
  private int nextState;

  /** Where we next write to in the transition arrays. */
  private int nextTransition;

  /** Current state we are adding transitions to; the caller
   *  must add all transitions for this state before moving
   *  onto another state. */
  private int curState = -1;

  /** Index in the transition arrays, where this states
   *  leaving transitions are stored, or -1 if this state
   *  has not added any transitions yet, followed by number
   *  of transitions. */
  private int[] states;

  private final BitSet isFinal;

  private long[] finalOutputs;

  private int[] labels;

  private int[] dests;

  private long[] outputs;

  private int startState;

  /** Sole constructor; creates an automaton with no states. */
  Automaton() {
    this(2, 2);
  }

  /**
   * Constructor which creates an automaton with enough space for the given
   * number of states and transitions.
   */
  Automaton(int numStates, int numTransitions) {
    states = new int[numStates * 2];
    finalOutputs = new long[numStates];
    isFinal = new BitSet(numStates);
    labels = new int[numTransitions];
    dests = new int[numTransitions];
    outputs = new long[numTransitions];
  }

  /** Create a new state. */
  int createState(boolean isFinal, long finalOutput) {
    growStates();
    int state = nextState/2;
    states[nextState] = -1;
    states[nextState+1] = 0;
    nextState += 2;
    if (isFinal) {
      this.isFinal.set(state);
      finalOutputs[state] = finalOutput;
    }
    return state;
  }

  /** Add a new transition with the specified source, label, dest and output. */
  void addTransition(int source, int label, int dest, long output) {
    if (source >= nextState/2) {
      throw new IllegalArgumentException("source=" + source + " is out of bounds (maxState is " + (nextState/2-1) + ")");
    }
    if (dest >= nextState/2) {
      throw new IllegalArgumentException("dest=" + dest + " is out of bounds (max state is " + (nextState/2-1) + ")");
    }
    if (label < 0 || label > 255) {
      throw new IllegalArgumentException("label=" + label + " is not a byte");
    }

    growTransitions();
    if (curState != source) {
      if (curState != -1) {
        finishCurrentState();
      }

      // Move to next source:
      curState = source;
      if (states[2*curState] != -1) {
        throw new IllegalStateException("from state (" + source + ") already had transitions added");
      }
      assert states[2*curState+1] == 0;
      states[2*curState] = nextTransition;
    }

    labels[nextTransition] = label;
    dests[nextTransition] = dest;
    outputs[nextTransition] = output;
    nextTransition++;

    // Increment transition count for this state
    states[2*curState+1]++;
  }

  /** Finishes the current state; call this once you are done adding
   *  transitions for a state. */
  void finishState() {
    if (curState != -1) {
      finishCurrentState();
      curState = -1;
    }
  }

  private void finishCurrentState() {
    int numTransitions = states[2*curState+1];
    int start = states[2*curState];
    int end = start + numTransitions;

    // Transitions normally arrive sorted already, so insertion sort is linear here:
    for (int i = start + 1; i < end; i++) {
      int label = labels[i];
      int dest = dests[i];
      long output = outputs[i];
      int j = i - 1;
      while (j >= start && labels[j] > label) {
        labels[j+1] = labels[j];
        dests[j+1] = dests[j];
        outputs[j+1] = outputs[j];
        j--;
      }
      labels[j+1] = label;
      dests[j+1] = dest;
      outputs[j+1] = output;
    }

    for (int i = start + 1; i < end; i++) {
      if (labels[i] == labels[i-1]) {
        throw new IllegalArgumentException("state " + curState + " has two transitions labeled " + labels[i]);
      }
    }
  }

  void setStartState(int state) {
    if (state >= getNumStates()) {
      throw new IllegalArgumentException("state=" + state + " is out of bounds (numStates=" + getNumStates() + ")");
    }
    startState = state;
  }

  public int getStartState() {
    return startState;
  }

  /** How many states this automaton has. */
  public int getNumStates() {
    return nextState/2;
  }

  /** How many transitions this automaton has. */
  public int getNumTransitions() {
    return nextTransition;
  }

  /** How many transitions this state has. */
  public int getNumTransitions(int state) {
    assert state >= 0;
    return states[2*state+1];
  }

  /** Returns true if this state is final. */
  public boolean isFinal(int state) {
    return isFinal.get(state);
  }

  /** Output added when a key ends in this state; 0 for non-final states. */
  public long getFinalOutput(int state) {
    return finalOutputs[state];
  }

  /** Fill the provided {@link Transition} with the index'th
   *  transition leaving the specified state. */
  public void getTransition(int state, int index, Transition t) {
    int i = states[2*state] + index;
    t.source = state;
    t.label = labels[i];
    t.dest = dests[i];
    t.output = outputs[i];
  }

  /**
   * Binary searches the transitions leaving {@code state} for {@code label}.
   *
   * @return the transition index if found, otherwise <code>(-(insertion point) - 1)</code>
   *         as for {@link java.util.Arrays#binarySearch(int[], int)}.
   */
  public int findTransition(int state, int label) {
    int count = states[2*state+1];
    if (count == 0) {
      return -1;
    }
    int low = states[2*state];
    int high = low + count - 1;
    int first = low;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int midLabel = labels[mid];
      if (midLabel < label) {
        low = mid + 1;
      } else if (midLabel > label) {
        high = mid - 1;
      } else {
        return mid - first;
      }
    }
    return -(low - first) - 1;
  }

  /** Performs lookup in transitions, returning the destination state or -1 if there is none. */
  public int step(int state, int label) {
    int index = findTransition(state, label);
    if (index < 0) {
      return -1;
    }
    return dests[states[2*state] + index];
  }

  /** Returns true if the given key is accepted by this automaton. */
  public boolean accept(BytesRef key) {
    int state = startState;
    for (int i = 0; i < key.length; i++) {
      state = step(state, key.bytes[key.offset + i] & 0xff);
      if (state == -1) {
        return false;
      }
    }
    return isFinal(state);
  }

  /**
   * Returns the summed output for the given key, or {@code null} if the key is not accepted.
   */
  public Long acceptWithOutput(BytesRef key) {
    int state = startState;
    long output = 0;
    for (int i = 0; i < key.length; i++) {
      int index = findTransition(state, key.bytes[key.offset + i] & 0xff);
      if (index < 0) {
        return null;
      }
      int t = states[2*state] + index;
      output += outputs[t];
      state = dests[t];
    }
    if (isFinal(state) == false) {
      return null;
    }
    return output + finalOutputs[state];
  }

  private void growStates() {
    states = ArrayUtil.grow(states, nextState+2);
    finalOutputs = ArrayUtil.grow(finalOutputs, nextState/2+1);
  }

  private void growTransitions() {
    labels = ArrayUtil.grow(labels, nextTransition+1);
    dests = ArrayUtil.grow(dests, nextTransition+1);
    outputs = ArrayUtil.grow(outputs, nextTransition+1);
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder();
    b.append("numStates=").append(getNumStates()).append(" numTransitions=").append(getNumTransitions());
    b.append(" start=").append(startState).append('\n');
    Transition t = new Transition();
    for (int state = 0; state < getNumStates(); state++) {
      b.append("  ").append(state);
      if (isFinal(state)) {
        b.append(" [final/").append(Long.toUnsignedString(finalOutputs[state])).append(']');
      }
      b.append('\n');
      for (int i = 0; i < getNumTransitions(state); i++) {
        getTransition(state, i, t);
        b.append("    ").append(t).append('\n');
      }
    }
    return b.toString();
  }
}
