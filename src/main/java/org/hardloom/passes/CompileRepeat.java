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

package org.hardloom.passes;

import java.util.List;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;
import org.hardloom.util.MathUtil;

/**
 * Compiles each dynamic {@code repeat n} into a while loop driven by a counter register:
 *
 * <pre>
 * seq { init; @bound(n) while lt.out { seq { body; incr } } }
 * </pre>
 *
 * where {@code init} clears the counter, {@code incr} increments it, and {@code lt.out} is
 * continuously driven by {@code counter < n}. Repeats of zero and one iterations are replaced by
 * empty and the body respectively.
 */
public final class CompileRepeat implements Visitor {
  public static final PassInfo INFO =
      new PassInfo("compile-repeat", "Compiles repeat statements into while loops");

  private final LibrarySignatures lib;

  public CompileRepeat(Context ctx) {
    this.lib = ctx.lib;
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action finishRepeat(Control.Repeat s, Component comp) {
    long n = s.numRepeats;
    if (n == 0) {
      return Action.change(Control.empty());
    } else if (n == 1) {
      return Action.change(s.body());
    }
    Builder builder = new Builder(comp, lib);
    int width = MathUtil.bitWidth(n + 1);
    Cell idx = builder.addPrimitive("idx", "std_reg", width);
    Cell adder = builder.addPrimitive("adder", "std_add", width);
    Cell lt = builder.addPrimitive("lt", "std_lt", width);
    builder.addContinuous(
        List.of(
            builder.assign(lt.get("left"), idx.get("out")),
            builder.assign(lt.get("right"), builder.constant(n, width))));

    Group init = builder.addGroup("init_repeat");
    builder.addTo(
        init,
        List.of(
            builder.assign(idx.get("in"), builder.constant(0, width)),
            builder.assign(idx.get("write_en"), builder.one()),
            builder.assign(init.done(), idx.get("done"))));
    Group incr = builder.addGroup("incr_repeat");
    builder.addTo(
        incr,
        List.of(
            builder.assign(adder.get("left"), idx.get("out")),
            builder.assign(adder.get("right"), builder.constant(1, width)),
            builder.assign(idx.get("in"), adder.get("out")),
            builder.assign(idx.get("write_en"), builder.one()),
            builder.assign(incr.done(), idx.get("done"))));

    Control.While loop =
        new Control.While(
            lt.get("out"), null, Control.seq(s.body(), Control.enable(incr)));
    loop.attributes().insert(Attribute.BOUND, n);
    Control.Seq result = Control.seq(Control.enable(init), loop);
    result.attributes().putAll(s.attributes());
    return Action.change(result);
  }
}
