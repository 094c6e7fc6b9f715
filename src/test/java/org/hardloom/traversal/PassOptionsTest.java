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

package org.hardloom.traversal;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.hardloom.CompileError;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PassOptionsTest {

  private static final PassInfo INFO =
      new PassInfo(
          "example",
          "An example pass",
          PassOpt.bool("verbose", "Log more"),
          PassOpt.number("limit", "Upper bound", 7));

  @Test
  public void defaults() throws CompileError {
    PassOptions opts = PassOptions.parse(INFO, List.of());
    assertThat(opts.bool("verbose")).isFalse();
    assertThat(opts.number("limit")).isEqualTo(7);
  }

  @Test
  public void settings() throws CompileError {
    PassOptions opts =
        PassOptions.parse(INFO, List.of("example:verbose", "other:limit=1", "example:limit=12"));
    assertThat(opts.bool("verbose")).isTrue();
    assertThat(opts.number("limit")).isEqualTo(12);
    opts = PassOptions.parse(INFO, List.of("example:verbose=false", "example:unknown=3"));
    assertThat(opts.bool("verbose")).isFalse();
  }

  @Test
  public void badValues() {
    CompileError e =
        assertThrows(
            CompileError.class, () -> PassOptions.parse(INFO, List.of("example:limit=lots")));
    assertThat(e.kind).isEqualTo(CompileError.Kind.MISC);
    assertThrows(
        CompileError.class, () -> PassOptions.parse(INFO, List.of("example:verbose=maybe")));
    assertThrows(CompileError.class, () -> PassOptions.parse(INFO, List.of("example:limit")));
  }

  @Test
  public void undeclaredOption() throws CompileError {
    PassOptions opts = PassOptions.parse(INFO, List.of());
    assertThrows(IllegalArgumentException.class, () -> opts.bool("limit"));
  }
}
