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

import org.trypticon.termfst.util.ArrayUtil;
import org.trypticon.termfst.util.BytesRef;
import org.trypticon.termfst.util.BytesRefBuilder;
import org.trypticon.termfst.util.StringHelper;

/**
 * Depth-first cursor over the keys of an {@link Automaton}. Keeps one stack frame per
 * byte of the current key: the state reached, the next transition to try from it and
 * the output accumulated so far. A prefix bound starts the walk at the state the prefix
 * leads to; a lower bound is applied by seeking; an upper bound ends the walk at the
 * first key past it.
 */
final class AutomatonKeyIterator implements KeyIterator {

  private final Automaton automaton;

  private final BytesRef prefix;

  private final BytesRef lower;

  private final BytesRef upper;

  // state reached by the prefix, or -1 if no key has this prefix
  private final int baseState;

  private final long baseOutput;

  private final BytesRefBuilder current = new BytesRefBuilder();

  private final Transition scratch = new Transition();

  private int[] states = new int[10];

  private int[] nextArcs = new int[10];

  private long[] outputs = new long[10];

  private int depth = -1;

  private boolean started;

  private boolean exhausted;

  private boolean pending;

  private long value;

  AutomatonKeyIterator(Automaton automaton, BytesRef prefix, BytesRef lower, BytesRef upper) {
    this.automaton = automaton;
    this.prefix = prefix;
    this.lower = lower;
    this.upper = upper;

    int state = automaton.getStartState();
    long output = 0;
    for (int i = 0; i < prefix.length && state != -1; i++) {
      int index = automaton.findTransition(state, prefix.byteAt(i) & 0xff);
      if (index < 0) {
        state = -1;
      } else {
        automaton.getTransition(state, index, scratch);
        output += scratch.output;
        state = scratch.dest;
      }
    }
    this.baseState = state;
    this.baseOutput = output;
  }

  @Override
  public boolean next() {
    if (pending) {
      pending = false;
      return true;
    }
    if (exhausted) {
      return false;
    }
    final boolean found;
    if (started == false) {
      found = start();
    } else {
      found = advance();
    }
    return checkUpper(found);
  }

  @Override
  public BytesRef key() {
    return current.get();
  }

  @Override
  public long value() {
    return value;
  }

  @Override
  public void reset() {
    started = false;
    exhausted = false;
    pending = false;
    depth = -1;
    current.clear();
    value = 0;
  }

  @Override
  public boolean seek(BytesRef target) {
    BytesRef effective = target;
    if (lower != null && target.compareTo(lower) < 0) {
      effective = lower;
    }
    exhausted = false;
    pending = false;
    if (checkUpper(seekCeil(effective))) {
      pending = true;
      return true;
    }
    return false;
  }

  private boolean start() {
    if (lower != null) {
      return seekCeil(lower);
    }
    started = true;
    if (baseState == -1) {
      return false;
    }
    pushRoot();
    if (automaton.isFinal(baseState)) {
      setValue();
      return true;
    }
    return advance();
  }

  // positions on the smallest key >= target having the prefix; does not look at the upper bound
  private boolean seekCeil(BytesRef target) {
    started = true;
    if (baseState == -1) {
      return false;
    }

    int common = StringHelper.bytesDifference(target, prefix);
    if (common < prefix.length) {
      if (common < target.length && (target.byteAt(common) & 0xff) > (prefix.byteAt(common) & 0xff)) {
        // target sorts after every key with the prefix
        depth = -1;
        return false;
      }
      // target sorts before every key with the prefix
      pushRoot();
      if (automaton.isFinal(baseState)) {
        setValue();
        return true;
      }
      return advance();
    }

    pushRoot();
    for (int i = prefix.length; i < target.length; i++) {
      final int state = states[depth];
      final int index = automaton.findTransition(state, target.byteAt(i) & 0xff);
      if (index >= 0) {
        nextArcs[depth] = index + 1;
        automaton.getTransition(state, index, scratch);
        push(scratch);
      } else {
        // no exact match: continue from the first greater label, or from the parent's siblings
        nextArcs[depth] = -index - 1;
        return advance();
      }
    }

    if (automaton.isFinal(states[depth])) {
      setValue();
      return true;
    }
    return advance();
  }

  // moves to the next final state in depth-first order
  private boolean advance() {
    while (depth >= 0) {
      final int state = states[depth];
      final int arc = nextArcs[depth];
      if (arc < automaton.getNumTransitions(state)) {
        nextArcs[depth] = arc + 1;
        automaton.getTransition(state, arc, scratch);
        push(scratch);
        if (automaton.isFinal(scratch.dest)) {
          setValue();
          return true;
        }
      } else {
        depth--;
        if (depth >= 0) {
          current.setLength(prefix.length + depth);
        }
      }
    }
    return false;
  }

  private boolean checkUpper(boolean found) {
    if (found && (upper == null || current.get().compareTo(upper) < 0)) {
      return true;
    }
    exhausted = true;
    return false;
  }

  private void pushRoot() {
    depth = 0;
    states[0] = baseState;
    nextArcs[0] = 0;
    outputs[0] = baseOutput;
    current.copyBytes(prefix);
  }

  private void push(Transition t) {
    final long output = outputs[depth] + t.output;
    depth++;
    states = ArrayUtil.grow(states, depth + 1);
    nextArcs = ArrayUtil.grow(nextArcs, depth + 1);
    outputs = ArrayUtil.grow(outputs, depth + 1);
    states[depth] = t.dest;
    nextArcs[depth] = 0;
    outputs[depth] = output;
    current.append((byte) t.label);
  }

  private void setValue() {
    value = outputs[depth] + automaton.getFinalOutput(states[depth]);
  }
}
