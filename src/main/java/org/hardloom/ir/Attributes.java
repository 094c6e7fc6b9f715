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

package org.hardloom.ir;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.stream.Collectors;
import org.hardloom.CompileError;

/** A sparse, mutable map from {@link Attribute} kinds to non-negative values. */
public final class Attributes {

  private final EnumMap<Attribute, Long> values = new EnumMap<>(Attribute.class);

  public Attributes() {}

  /** Returns a new Attributes with a copy of the given attributes' entries. */
  public static Attributes copyOf(Attributes other) {
    Attributes result = new Attributes();
    result.values.putAll(other.values);
    return result;
  }

  /**
   * Returns a new Attributes containing the given entries. Throws a {@link CompileError} if an
   * attribute kind occurs more than once.
   */
  public static Attributes fromEntries(Iterable<Map.Entry<Attribute, Long>> entries)
      throws CompileError {
    Attributes result = new Attributes();
    for (Map.Entry<Attribute, Long> entry : entries) {
      if (result.has(entry.getKey())) {
        throw CompileError.malformedStructure(
            "Multiple entries for attribute: " + entry.getKey().name);
      }
      result.insert(entry.getKey(), entry.getValue());
    }
    return result;
  }

  public boolean has(Attribute attribute) {
    return values.containsKey(attribute);
  }

  public OptionalLong get(Attribute attribute) {
    Long value = values.get(attribute);
    return (value == null) ? OptionalLong.empty() : OptionalLong.of(value);
  }

  /** Sets the value of {@code attribute}, replacing any previous value. */
  @CanIgnoreReturnValue
  public Attributes insert(Attribute attribute, long value) {
    Preconditions.checkArgument(value >= 0, "negative value for %s", attribute);
    Preconditions.checkArgument(
        !attribute.isFlag || value == 1, "%s can only be set to 1", attribute.name);
    values.put(attribute, value);
    return this;
  }

  /** Sets a flag attribute. */
  @CanIgnoreReturnValue
  public Attributes insert(Attribute flag) {
    return insert(flag, 1);
  }

  @CanIgnoreReturnValue
  public Attributes remove(Attribute attribute) {
    values.remove(attribute);
    return this;
  }

  /** Copies each entry of {@code other} into this, replacing existing values. */
  @CanIgnoreReturnValue
  public Attributes putAll(Attributes other) {
    values.putAll(other.values);
    return this;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Attributes other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  /** Returns entries formatted as {@code @name(value)}, or {@code @name} for flags. */
  @Override
  public String toString() {
    return values.entrySet().stream()
        .map(
            e ->
                e.getKey().isFlag
                    ? "@" + e.getKey().name
                    : "@" + e.getKey().name + "(" + e.getValue() + ")")
        .collect(Collectors.joining(" "));
  }
}
