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

import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;
import org.hardloom.CompileError;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.ir.Interval;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Replaces each static statement that appears in a dynamic position with an enable of a single
 * static group that does the same thing, with each assignment active during the corresponding
 * cycles.
 *
 * <p>The condition of a static if is sampled in the first cycle and held in a 1-bit register for
 * the remaining cycles.
 *
 * <p>Static repeats are unrolled: the group gets one copy of the body's assignments per
 * iteration, so its size is the repeat count times the body's size. Long loops over large bodies
 * should stay dynamic repeats, which {@code compile-repeat} lowers to a loop around a single copy
 * of the body.
 */
public final class StaticInliner implements Visitor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final PassInfo INFO =
      new PassInfo("static-inline", "Compiles static control into static groups");

  private final LibrarySignatures lib;

  public StaticInliner(Context ctx) {
    this.lib = ctx.lib;
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action startStaticControl(StaticControl s, Component comp) throws CompileError {
    if (s instanceof StaticEnable) {
      return Action.SKIP_CHILDREN;
    } else if (s.latency() == 0) {
      return Action.change(Control.empty());
    }
    Builder builder = new Builder(comp, lib);
    Group group = builder.addStaticGroup(prefix(s), s.latency());
    group.assignments().addAll(inline(s, group, builder));
    logger.atFine().log(
        "Inlined %s cycle static control into %s", s.latency(), group.name);
    StaticEnable result = new StaticEnable(group);
    result.attributes().putAll(s.attributes());
    return Action.change(result);
  }

  private static String prefix(StaticControl s) {
    if (s instanceof StaticControl.StaticSeq) {
      return "static_seq";
    } else if (s instanceof StaticControl.StaticPar) {
      return "static_par";
    } else if (s instanceof StaticControl.StaticIf) {
      return "static_if";
    } else if (s instanceof StaticControl.StaticRepeat) {
      return "static_repeat";
    }
    return "static_group";
  }

  /**
   * Returns the assignments that run {@code s} as part of {@code target}, with intervals relative
   * to the cycle in which {@code s} starts.
   */
  private static List<Assignment> inline(StaticControl s, Group target, Builder builder)
      throws CompileError {
    List<Assignment> result = new ArrayList<>();
    if (s instanceof StaticEnable en) {
      Group group = en.group;
      for (Assignment a : group.assignments()) {
        result.add(
            a.mapPorts(p -> (p == group.go()) ? target.go() : p)
                .withInterval(a.intervalWithin(group.latency())));
      }
    } else if (s instanceof StaticControl.StaticSeq seq) {
      long offset = 0;
      for (StaticControl stmt : seq.stmts()) {
        result.addAll(shift(inline(stmt, target, builder), offset));
        offset += stmt.latency();
      }
    } else if (s instanceof StaticControl.StaticPar par) {
      for (StaticControl stmt : par.stmts()) {
        result.addAll(inline(stmt, target, builder));
      }
    } else if (s instanceof StaticControl.StaticIf sif) {
      inlineIf(sif, target, builder, result);
    } else if (s instanceof StaticControl.StaticRepeat repeat) {
      List<Assignment> body = inline(repeat.body(), target, builder);
      long bodyLatency = repeat.body().latency();
      for (long i = 0; i < repeat.numRepeats; i++) {
        result.addAll(shift(body, i * bodyLatency));
      }
      logger.atFine().log(
          "Unrolled %s iterations of %s assignments", repeat.numRepeats, body.size());
    } else if (s instanceof StaticControl.StaticInvoke) {
      throw CompileError.passAssumption(
          INFO.name(), "static invoke should have been compiled away by compile-invoke");
    }
    return result;
  }

  private static void inlineIf(
      StaticControl.StaticIf sif, Group target, Builder builder, List<Assignment> result)
      throws CompileError {
    long latency = sif.latency();
    Cell cond = builder.addPrimitive("cond", "std_reg", 1);
    Cell condWire = builder.addPrimitive("cond_wire", "std_wire", 1);
    Interval first = new Interval(0, 1);
    result.add(builder.assign(cond.get("in"), sif.port, Guard.TRUE, first));
    result.add(builder.assign(cond.get("write_en"), builder.one(), Guard.TRUE, first));
    result.add(builder.assign(condWire.get("in"), sif.port, Guard.TRUE, first));
    if (latency > 1) {
      result.add(
          builder.assign(
              condWire.get("in"), cond.get("out"), Guard.TRUE, new Interval(1, latency)));
    }
    Guard taken = Guard.port(condWire.get("out"));
    for (Assignment a : inline(sif.tbranch(), target, builder)) {
      result.add(a.andGuard(taken));
    }
    for (Assignment a : inline(sif.fbranch(), target, builder)) {
      result.add(a.andGuard(Guard.not(taken)));
    }
  }

  private static List<Assignment> shift(List<Assignment> assignments, long offset) {
    List<Assignment> result = new ArrayList<>(assignments.size());
    for (Assignment a : assignments) {
      result.add(a.withInterval(a.interval().shift(offset)));
    }
    return result;
  }
}
