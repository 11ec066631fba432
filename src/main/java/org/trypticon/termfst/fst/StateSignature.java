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

import java.util.Arrays;

/**
 * Structural fingerprint of a state about to be frozen: its final flag and final
 * output plus, per transition in label order, the label, the output and the id of
 * the already-frozen target. Targets are compared by id, which is only sound
 * because children are always frozen (and canonicalized) before their parent.
 */
final class StateSignature {

  private final boolean isFinal;

  private final long finalOutput;

  private final int[] labels;

  private final int[] targets;

  private final long[] outputs;

  private final int hash;

  StateSignature(boolean isFinal, long finalOutput, int[] labels, int[] targets, long[] outputs, int numArcs) {
    this.isFinal = isFinal;
    this.finalOutput = isFinal ? finalOutput : 0;
    this.labels = Arrays.copyOf(labels, numArcs);
    this.targets = Arrays.copyOf(targets, numArcs);
    this.outputs = Arrays.copyOf(outputs, numArcs);

    int h = isFinal ? 1 : 0;
    h = 31 * h + Long.hashCode(this.finalOutput);
    for (int i = 0; i < numArcs; i++) {
      h = 31 * h + this.labels[i];
      h = 31 * h + this.targets[i];
      h = 31 * h + Long.hashCode(this.outputs[i]);
    }
    this.hash = h;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateSignature)) {
      return false;
    }
    StateSignature other = (StateSignature) obj;
    return hash == other.hash
        && isFinal == other.isFinal
        && finalOutput == other.finalOutput
        && Arrays.equals(labels, other.labels)
        && Arrays.equals(targets, other.targets)
        && Arrays.equals(outputs, other.outputs);
  }

  @Override
  public int hashCode() {
    return hash;
  }
}
