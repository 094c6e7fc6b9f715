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

import static org.hardloom.ir.Primitive.PortDef.input;
import static org.hardloom.ir.Primitive.PortDef.output;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.hardloom.CompileError;

/** The primitive signatures available to a context, keyed by primitive name. */
public final class LibrarySignatures {
  private final Map<String, Primitive> primitives = new LinkedHashMap<>();

  @CanIgnoreReturnValue
  public LibrarySignatures add(Primitive primitive) {
    primitives.put(primitive.name(), primitive);
    return this;
  }

  public Optional<Primitive> find(String name) {
    return Optional.ofNullable(primitives.get(name));
  }

  public Primitive get(String name) throws CompileError {
    Primitive result = primitives.get(name);
    if (result == null) {
      throw CompileError.undefined(name, "primitive");
    }
    return result;
  }

  public Iterable<Primitive> primitives() {
    return primitives.values();
  }

  /**
   * Returns the primitives that compiler passes instantiate, along with a handful of common
   * arithmetic primitives.
   */
  public static LibrarySignatures standard() {
    ImmutableList<String> width = ImmutableList.of("WIDTH");
    LibrarySignatures lib = new LibrarySignatures();
    for (String reg : ImmutableList.of("std_reg", "init_one_reg")) {
      lib.add(
          Primitive.of(
              reg,
              width,
              input("in", "WIDTH"),
              input("write_en", 1).with(Attribute.GO, 1).with(Attribute.INTERVAL, 1),
              output("out", "WIDTH"),
              output("done", 1).with(Attribute.DONE, 1)));
    }
    lib.add(Primitive.of("std_const", ImmutableList.of("WIDTH", "VALUE"), output("out", "WIDTH")));
    lib.add(Primitive.of("std_wire", width, input("in", "WIDTH"), output("out", "WIDTH")));
    lib.add(Primitive.of("std_not", width, input("in", "WIDTH"), output("out", "WIDTH")));
    for (String binop : ImmutableList.of("std_add", "std_sub", "std_and", "std_or")) {
      lib.add(
          Primitive.of(
              binop,
              width,
              input("left", "WIDTH"),
              input("right", "WIDTH"),
              output("out", "WIDTH")));
    }
    ImmutableList<String> comparisons =
        ImmutableList.of("std_eq", "std_neq", "std_lt", "std_gt", "std_le", "std_ge");
    for (String cmp : comparisons) {
      lib.add(
          Primitive.of(
              cmp, width, input("left", "WIDTH"), input("right", "WIDTH"), output("out", 1)));
    }
    lib.add(
        Primitive.of(
            "std_bit_slice",
            ImmutableList.of("IN_WIDTH", "START_IDX", "END_IDX", "OUT_WIDTH"),
            input("in", "IN_WIDTH"),
            output("out", "OUT_WIDTH")));
    lib.add(
        Primitive.of(
            "std_mult_pipe",
            width,
            input("left", "WIDTH"),
            input("right", "WIDTH"),
            input("go", 1).with(Attribute.GO, 1).with(Attribute.INTERVAL, 3),
            output("out", "WIDTH"),
            output("done", 1).with(Attribute.DONE, 1)));
    return lib;
  }
}
