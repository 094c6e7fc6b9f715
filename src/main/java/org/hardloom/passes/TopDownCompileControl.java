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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.hardloom.CompileError;
import org.hardloom.analysis.ControlId;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Attributes;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.StaticControl;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.PassOpt;
import org.hardloom.traversal.PassOptions;
import org.hardloom.traversal.Visitor;

/**
 * Compiles each component's control program into a single enable of a group driven by an FSM.
 *
 * <p>Every enable in the program is assigned a state (see {@link ControlId}); the FSM enables a
 * group while in its state and moves to the next state when the group is done, under the guards
 * implied by the enclosing if and while statements. Each child of a {@code par} gets its own FSM so
 * that the children can progress independently; a 1-bit register per child records that it has
 * finished, and the par is done once every register is set. Seq, if, and while statements marked
 * {@code @new_fsm} are also compiled to FSMs of their own.
 *
 * <p>Invoke, repeat, static control, and conditions with combinational groups must have been
 * compiled by earlier passes.
 */
public final class TopDownCompileControl implements Visitor {
  public static final PassInfo INFO =
      new PassInfo(
          "tdcc",
          "Top-down compilation for removing control constructs",
          PassOpt.bool("dump-fsm", "Print out the state machine implementing the schedule"),
          PassOpt.bool(
              "early-transitions", "Experimental: Enable early transitions for group enables"),
          PassOpt.number(
              "one-hot-cutoff",
              "Threshold at and below which a one-hot encoding is used for dynamic group"
                  + " scheduling",
              0));

  private final LibrarySignatures lib;
  private final boolean dumpFsm;
  private final boolean earlyTransitions;
  private final long oneHotCutoff;

  public TopDownCompileControl(Context ctx) throws CompileError {
    PassOptions opts = PassOptions.parse(INFO, ctx.extraOpts());
    this.lib = ctx.lib;
    this.dumpFsm = opts.bool("dump-fsm");
    this.earlyTransitions = opts.bool("early-transitions");
    this.oneHotCutoff = opts.number("one-hot-cutoff");
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action start(Component comp) throws CompileError {
    Control con = comp.control();
    if (con instanceof StaticControl.Empty || con instanceof Control.Enable) {
      return Action.STOP;
    }
    ControlId.computeUniqueIds(con, 0);
    return Action.CONTINUE;
  }

  /** Builds an FSM group that runs {@code con}, choosing the encoding based on {@code attrs}. */
  private Group compile(Control con, Attributes attrs, Component comp) throws CompileError {
    Builder builder = new Builder(comp, lib);
    Schedule sch = new Schedule(builder, earlyTransitions);
    sch.calculateStates(con);
    FsmEncoding encoding = FsmEncoding.choose(sch.lastState(), attrs, oneHotCutoff);
    return sch.realize(encoding, dumpFsm);
  }

  /** Replaces a {@code @new_fsm} statement with an enable of its own FSM group. */
  private Action compileNewFsm(Control con, Component comp) throws CompileError {
    if (!con.attributes().has(Attribute.NEW_FSM)) {
      return Action.CONTINUE;
    }
    Group group = compile(con, con.attributes(), comp);
    return Action.change(enableWithId(group, con));
  }

  private static Control.Enable enableWithId(Group group, Control replaced) {
    Control.Enable en = Control.enable(group);
    en.attributes().insert(Attribute.NODE_ID, ControlId.guaranteedId(replaced));
    return en;
  }

  @Override
  public Action finishSeq(Control.Seq s, Component comp) throws CompileError {
    return compileNewFsm(s, comp);
  }

  @Override
  public Action finishIf(Control.If s, Component comp) throws CompileError {
    return compileNewFsm(s, comp);
  }

  @Override
  public Action finishWhile(Control.While s, Component comp) throws CompileError {
    return compileNewFsm(s, comp);
  }

  @Override
  public Action finishPar(Control.Par s, Component comp) throws CompileError {
    Builder builder = new Builder(comp, lib);
    Group parGroup = builder.addGroup("par");
    List<Cell> doneRegs = new ArrayList<>(s.stmts().size());
    for (Control con : s.stmts()) {
      Group group =
          (con instanceof Control.Enable enable)
              ? enable.group
              : compile(con, s.attributes(), comp);
      Cell pd = builder.addPrimitive("pd", "std_reg", 1);
      Guard done = Guard.port(group.done());
      Guard go = Guard.not(Guard.or(Guard.port(pd.get("out")), done));
      builder.addTo(
          parGroup,
          List.of(
              builder.assign(group.go(), builder.one(), go),
              builder.assign(pd.get("in"), builder.one(), done),
              builder.assign(pd.get("write_en"), builder.one(), done)));
      doneRegs.add(pd);
    }
    Guard allDone =
        Guard.andAll(
            doneRegs.stream()
                .map(r -> Guard.port(r.get("out")))
                .collect(ImmutableList.toImmutableList()));
    // Clear the latches once the par finishes, so it can run again.
    for (Cell pd : doneRegs) {
      builder.addContinuous(
          List.of(
              builder.assign(pd.get("in"), builder.constant(0, 1), allDone),
              builder.assign(pd.get("write_en"), builder.one(), allDone)));
    }
    parGroup.assignments().add(builder.assign(parGroup.done(), builder.one(), allDone));
    return Action.change(enableWithId(parGroup, s));
  }

  @Override
  public Action finish(Component comp) throws CompileError {
    Group group = compile(comp.control(), comp.control().attributes(), comp);
    return Action.change(Control.enable(group));
  }
}
