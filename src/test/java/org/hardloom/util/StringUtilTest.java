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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StringUtilTest {

  @Test
  public void joinElements() {
    assertThat(StringUtil.joinElements("[", "]", 3, i -> i * i)).isEqualTo("[0, 1, 4]");
    assertThat(StringUtil.joinElements("<", "; ", ">", 0, i -> i)).isEqualTo("<>");
  }

  @Test
  public void indentSkipsBlankLines() {
    assertThat(StringUtil.indent("a\n\nb", 2)).isEqualTo("  a\n\n  b");
  }
}
