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

/**
 * Holds one transition from an {@link Automaton}, filled in by
 * {@link Automaton#getTransition}.
 */
public class Transition {

  /** Source state. */
  public int source;

  /** Destination state. */
  public int dest;

  /** Input byte, 0-255. */
  public int label;

  /** Output contributed by following this transition. */
  public long output;

  /** Sole constructor. */
  public Transition() {
  }

  @Override
  public String toString() {
    return source + " --" + (char) label + "/" + Long.toUnsignedString(output) + "--> " + dest;
  }
}
