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

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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
import org.hardloom.ir.Port;
import org.hardloom.ir.PortComp;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.PassOpt;
import org.hardloom.traversal.PassOptions;
import org.hardloom.traversal.Visitor;

/**
 * Compiles each enable of a static group into an enable of a dynamic "wrapper" group that runs the
 * static group's assignments under the control of a counter.
 *
 * <p>The counter starts at 0, counts up by one each cycle while the wrapper's go is asserted, and
 * the wrapper is done when the counter reaches the group's latency L. A continuous assignment then
 * returns the counter to 0, so the wrapper can be started again immediately. Each assignment is
 * active while the counter is within its interval.
 *
 * <p>A group marked {@code @one_hot}, or one with at most {@code one-hot-cutoff} cycles, counts
 * with a one-hot {@code init_one_reg} that is doubled each cycle instead of a binary counter.
 *
 * <p>Any static control other than an enable must have been inlined by {@code static-inline}.
 */
public final class CompileStatic implements Visitor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final PassInfo INFO =
      new PassInfo(
          "compile-static",
          "Compiles static groups into dynamic groups with counters",
          PassOpt.number(
              "one-hot-cutoff",
              "Latency at and below which a static group's counter is one-hot encoded",
              0));

  private final LibrarySignatures lib;
  private final long oneHotCutoff;

  /** The wrapper built for each static group of the current component. */
  private final Map<Group, Group> wrappers = new LinkedHashMap<>();

  public CompileStatic(Context ctx) throws CompileError {
    PassOptions opts = PassOptions.parse(INFO, ctx.extraOpts());
    this.lib = ctx.lib;
    this.oneHotCutoff = opts.number("one-hot-cutoff");
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action start(Component comp) {
    wrappers.clear();
    return Action.CONTINUE;
  }

  @Override
  public Action startStaticControl(StaticControl s, Component comp) throws CompileError {
    if (!(s instanceof StaticEnable en)) {
      throw CompileError.passAssumption(
          INFO.name(), "static control should have been inlined by static-inline: " + s);
    }
    Group wrapper = wrappers.get(en.group);
    if (wrapper == null) {
      wrapper = buildWrapper(en.group, new Builder(comp, lib));
      wrappers.put(en.group, wrapper);
    }
    Control.Enable result = Control.enable(wrapper);
    result.attributes().putAll(s.attributes());
    return Action.change(result);
  }

  /** Once every static enable has been replaced, no static group can be enabled. */
  @Override
  public Action finish(Component comp) {
    comp.groups(Group.Kind.STATIC).forEach(comp::removeGroup);
    return Action.CONTINUE;
  }

  /**
   * Returns the guard under which an assignment with the given interval is active, given the
   * counter's output. One-hot codes increase with the cycle number, so both encodings compare the
   * counter against the codes of the interval's first and last cycles.
   */
  public static Guard intervalGuard(
      Port counter, Interval interval, FsmEncoding encoding, Builder builder) {
    int width = counter.width;
    Port first = builder.constant(encoding.encode(interval.begin()), width);
    if (interval.length() == 1) {
      return Guard.eq(counter, first);
    }
    Port last = builder.constant(encoding.encode(interval.end() - 1), width);
    return Guard.and(
        Guard.compare(PortComp.GEQ, counter, first), Guard.compare(PortComp.LEQ, counter, last));
  }

  private Group buildWrapper(Group group, Builder builder) {
    long latency = group.latency();
    FsmEncoding encoding = FsmEncoding.choose(latency, group.attributes, oneHotCutoff);
    int width = encoding.width(latency);
    Preconditions.checkArgument(width < 64, "Counter for %s is too wide", group.name);
    Group wrapper = builder.addGroup(group.name + "_wrapper");
    Cell fsm = builder.addPrimitive("fsm", encoding.primitive, width);
    Cell incr = builder.addPrimitive("adder", "std_add", width);
    Port counter = fsm.get("out");
    Port step = (encoding == FsmEncoding.BINARY) ? builder.constant(1, width) : counter;
    Port last = builder.constant(encoding.encode(latency), width);
    Guard go = Guard.port(wrapper.go());
    Guard counting = Guard.and(go, Guard.compare(PortComp.LT, counter, last));
    Guard atLast = Guard.eq(counter, last);
    builder.addTo(
        wrapper,
        List.of(
            builder.assign(incr.get("left"), counter),
            builder.assign(incr.get("right"), step),
            builder.assign(fsm.get("in"), incr.get("out"), counting),
            builder.assign(fsm.get("write_en"), builder.one(), counting)));
    for (Assignment a : group.assignments()) {
      Guard active = intervalGuard(counter, a.intervalWithin(latency), encoding, builder);
      wrapper.assignments().add(
          a.mapPorts(p -> (p == group.go()) ? wrapper.go() : p)
              .withInterval(null)
              .andGuard(Guard.and(go, active)));
    }
    wrapper.assignments().add(builder.assign(wrapper.done(), builder.one(), atLast));
    Port reset = builder.constant(encoding.encode(0), width);
    builder.addContinuous(
        List.of(
            builder.assign(fsm.get("in"), reset, atLast),
            builder.assign(fsm.get("write_en"), builder.one(), atLast)));
    logger.atFine().log(
        "Compiled %s (latency %s) using a %s-bit %s counter", group.name, latency, width, encoding);
    return wrapper;
  }
}
