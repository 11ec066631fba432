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

import java.util.Arrays;

public final class ArrayUtil {

  private ArrayUtil() {} // no instance

  /** Returns an array size &gt;= minTargetSize, generally over-allocating
   *  exponentially to achieve amortized linear-time cost as the array grows. */
  public static int oversize(int minTargetSize, int bytesPerElement) {

    if (minTargetSize < 0) {
      // catch usage that accidentally overflows int
      throw new IllegalArgumentException("invalid array size " + minTargetSize);
    }

    if (minTargetSize == 0) {
      // wait until at least one element is requested
      return 0;
    }

    // asymptotic exponential growth by 1/8th
    int extra = minTargetSize >> 3;
    if (extra < 3) {
      // for very small arrays, where constant overhead of
      // realloc is presumably relatively high, we grow
      // faster
      extra = 3;
    }

    int newSize = minTargetSize + extra;
    if (newSize < 0) {
      // int overflowed
      return Integer.MAX_VALUE - 8;
    }

    // round up to 8 byte alignment
    switch (bytesPerElement) {
      case 8:
        return newSize;
      case 4:
        return (newSize + 1) & 0x7ffffffe;
      case 2:
        return (newSize + 3) & 0x7ffffffc;
      case 1:
        return (newSize + 7) & 0x7ffffff8;
      default:
        return newSize;
    }
  }

  public static int[] grow(int[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Integer.BYTES));
    } else
      return array;
  }

  public static long[] grow(long[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Long.BYTES));
    } else
      return array;
  }

  public static byte[] grow(byte[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, 1));
    } else
      return array;
  }

  public static <T> T[] grow(T[] array, int minSize) {
    assert minSize >= 0: "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, 8));
    } else
      return array;
  }

  /** Copies the specified range of the given array into a new sub array. */
  public static byte[] copyOfSubArray(byte[] array, int from, int to) {
    return Arrays.copyOfRange(array, from, to);
  }
}
