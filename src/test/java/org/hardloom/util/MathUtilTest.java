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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.google.testing.junit.testparameterinjector.TestParameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class MathUtilTest {

  @Test
  @TestParameters({
    "{n: 0, width: 0}",
    "{n: 1, width: 1}",
    "{n: 2, width: 1}",
    "{n: 3, width: 2}",
    "{n: 4, width: 2}",
    "{n: 5, width: 3}",
    "{n: 256, width: 8}",
    "{n: 257, width: 9}",
  })
  public void bitWidth(long n, int width) {
    assertThat(MathUtil.bitWidth(n)).isEqualTo(width);
  }

  @Test
  public void bitWidthOfLargePowerOfTwo() {
    assertThat(MathUtil.bitWidth(1L << 61)).isEqualTo(61);
  }

  /** The width is the smallest one whose register has at least {@code n} distinct values. */
  @Test
  public void bitWidthIsMinimal(@TestParameter({"2", "7", "8", "9", "1000", "65537"}) long n) {
    int width = MathUtil.bitWidth(n);
    assertThat(1L << width).isAtLeast(n);
    assertThat(1L << (width - 1)).isLessThan(n);
  }

  @Test
  public void negativeCount() {
    assertThrows(IllegalArgumentException.class, () -> MathUtil.bitWidth(-1));
  }
}
