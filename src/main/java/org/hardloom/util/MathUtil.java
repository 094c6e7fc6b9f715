/*
 * Copyright 2025 The Hardloom Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hardloom.util;

import com.google.common.base.Preconditions;

/** Static-only class with arithmetic helpers for sizing hardware registers. */
public class MathUtil {

  private MathUtil() {}

  /**
   * Returns the number of bits used for a register that must distinguish {@code n} states.
   *
   * <p>Returns {@code n} when {@code n} is 0 or 1, and otherwise the smallest {@code w} with
   * {@code 2^w >= n}; e.g. 2 for 3 or 4, 3 for 5, and 61 for {@code 2^61}.
   */
  public static int bitWidth(long n) {
    Preconditions.checkArgument(n >= 0, "negative state count %s", n);
    if (n <= 1) {
      return (int) n;
    }
    return 64 - Long.numberOfLeadingZeros(n - 1);
  }
}
