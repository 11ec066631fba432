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
package org.trypticon.termfst.util;

/**
 * Methods for manipulating byte keys.
 */
public abstract class StringHelper {

  private StringHelper() {
  }

  /**
   * Compares two {@link BytesRef}, element by element, and returns the
   * number of elements common to both arrays (from the start of each).
   *
   * @param left The first {@link BytesRef} to compare
   * @param right The second {@link BytesRef} to compare
   * @return The number of common elements.
   */
  public static int bytesDifference(BytesRef left, BytesRef right) {
    int len = Math.min(left.length, right.length);
    for (int i = 0; i < len; i++) {
      if (left.bytes[left.offset + i] != right.bytes[right.offset + i]) {
        return i;
      }
    }
    return len;
  }

  /**
   * Returns the smallest key which sorts after every key starting with {@code prefix},
   * or {@code null} if there is none (the prefix is empty or made only of {@code 0xff} bytes).
   */
  public static BytesRef prefixSuccessor(BytesRef prefix) {
    int upto = prefix.length;
    while (upto > 0 && (prefix.bytes[prefix.offset + upto - 1] & 0xff) == 0xff) {
      upto--;
    }
    if (upto == 0) {
      return null;
    }
    byte[] bytes = ArrayUtil.copyOfSubArray(prefix.bytes, prefix.offset, prefix.offset + upto);
    bytes[upto - 1]++;
    return new BytesRef(bytes);
  }
}
