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

import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building strings. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code separator}, and adding
   * the given prefix and suffix.
   */
  public static String joinElements(
      String prefix, String separator, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(separator, prefix, suffix));
  }

  /** Equivalent to {@link #joinElements(String, String, String, int, IntFunction)} with ", ". */
  public static String joinElements(
      String prefix, String suffix, int size, IntFunction<Object> elements) {
    return joinElements(prefix, ", ", suffix, size, elements);
  }

  /** Prefixes every line of {@code s} with {@code n} spaces. */
  public static String indent(String s, int n) {
    String pad = " ".repeat(n);
    return s.lines().map(line -> line.isEmpty() ? line : pad + line)
        .collect(Collectors.joining("\n"));
  }
}
