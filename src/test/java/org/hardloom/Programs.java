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

package org.hardloom;

import java.util.List;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.ir.Interval;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.Port;
import org.jspecify.annotations.Nullable;

/** Builds the small programs used by the tests. */
public final class Programs {

  private Programs() {}

  /** Returns a context with the standard library and a go/done component named "main". */
  public static Context newContext() {
    Context ctx = new Context(LibrarySignatures.standard(), "main");
    ctx.add(Component.withGoDone("main"));
    return ctx;
  }

  public static Builder builder(Context ctx, String component) throws CompileError {
    return new Builder(ctx.component(component), ctx.lib);
  }

  /** Adds a 32-bit register. */
  public static Cell register(Builder b, String prefix) {
    return b.addPrimitive(prefix, "std_reg", 32);
  }

  /** Returns a group that stores {@code value} in {@code reg} and is done one cycle later. */
  public static Group writeGroup(Builder b, String prefix, Cell reg, long value) {
    Group g = b.addGroup(prefix);
    int width = reg.get("in").width;
    b.addTo(
        g,
        List.of(
            b.assign(reg.get("in"), b.constant(value, width)),
            b.assign(reg.get("write_en"), b.one()),
            b.assign(g.done(), reg.get("done"))));
    return g;
  }

  /** Returns a group that copies {@code from} into {@code to}. */
  public static Group copyGroup(Builder b, String prefix, Cell from, Cell to) {
    Group g = b.addGroup(prefix);
    b.addTo(
        g,
        List.of(
            b.assign(to.get("in"), from.get("out")),
            b.assign(to.get("write_en"), b.one()),
            b.assign(g.done(), to.get("done"))));
    return g;
  }

  /**
   * Returns a static group with the given latency that asserts {@code reg.write_en} during {@code
   * active}, or for its whole latency if {@code active} is null.
   */
  public static Group staticGroup(
      Builder b, String prefix, long latency, Cell reg, @Nullable Interval active) {
    Group g = b.addStaticGroup(prefix, latency);
    Port one = b.one();
    if (active == null) {
      b.addTo(g, List.of(b.assign(reg.get("write_en"), one)));
    } else {
      b.addTo(g, List.of(b.assign(reg.get("write_en"), one, Guard.TRUE, active)));
    }
    return g;
  }
}
