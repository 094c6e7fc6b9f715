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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.List;
import org.hardloom.CompileError;
import org.hardloom.Programs;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.GuardEvaluator;
import org.hardloom.ir.Port;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TopDownCompileControlTest {

  private Context ctx;
  private Component main;
  private Builder builder;
  private Group a;
  private Group b;
  private Group c;

  @Before
  public void setup() throws CompileError {
    ctx = Programs.newContext();
    main = ctx.component("main");
    builder = Programs.builder(ctx, "main");
    Cell x = Programs.register(builder, "x");
    a = Programs.writeGroup(builder, "A", x, 1);
    b = Programs.writeGroup(builder, "B", x, 2);
    c = Programs.writeGroup(builder, "C", x, 3);
  }

  private Group compile(Control con) throws CompileError {
    main.setControl(con);
    new TopDownCompileControl(ctx).doPass(ctx);
    assertThat(main.control()).isInstanceOf(Control.Enable.class);
    return ((Control.Enable) main.control()).group;
  }

  /** Returns the value written to {@code dst} by the active assignments, or -1 if none. */
  private static long written(GuardEvaluator ev, List<Assignment> assignments, Port dst) {
    return ev.active(assignments).stream()
        .filter(asgn -> asgn.dst() == dst)
        .mapToLong(asgn -> ev.value(asgn.src()))
        .findFirst()
        .orElse(-1);
  }

  @Test
  public void seqStepsThroughStates() throws CompileError {
    Group tdcc = compile(Control.seq(Control.enable(a), Control.enable(b)));
    assertThat(tdcc.name).isEqualTo("tdcc");
    Cell fsm = main.cell("fsm");
    assertThat(fsm.typeName).isEqualTo("std_reg");
    assertThat(fsm.get("out").width).isEqualTo(2);
    List<Assignment> asgns = tdcc.assignments();

    GuardEvaluator start = new GuardEvaluator();
    assertThat(start.drives(asgns, a.go())).isTrue();
    assertThat(start.drives(asgns, b.go())).isFalse();
    assertThat(written(start, asgns, fsm.get("in"))).isEqualTo(-1);
    assertThat(written(start.set(a.done(), 1), asgns, fsm.get("in"))).isEqualTo(1);

    GuardEvaluator second = new GuardEvaluator().set(fsm.get("out"), 1);
    assertThat(second.drives(asgns, a.go())).isFalse();
    assertThat(second.drives(asgns, b.go())).isTrue();
    assertThat(written(second.set(b.done(), 1), asgns, fsm.get("in"))).isEqualTo(2);

    GuardEvaluator last = new GuardEvaluator().set(fsm.get("out"), 2);
    assertThat(last.drives(asgns, tdcc.done())).isTrue();
    assertThat(written(last, main.continuousAssignments(), fsm.get("in"))).isEqualTo(0);
    assertThat(new GuardEvaluator().drives(main.continuousAssignments(), fsm.get("in")))
        .isFalse();
  }

  @Test
  public void whileLoopsUntilConditionFails() throws CompileError {
    Port flag = builder.addPrimitive("flag", "std_reg", 1).get("out");
    Group tdcc = compile(new Control.While(flag, null, Control.enable(a)));
    Cell fsm = main.cell("fsm");
    List<Assignment> asgns = tdcc.assignments();

    assertThat(written(new GuardEvaluator().set(flag, 1), asgns, fsm.get("in"))).isEqualTo(1);
    assertThat(written(new GuardEvaluator(), asgns, fsm.get("in"))).isEqualTo(2);
    GuardEvaluator body = new GuardEvaluator().set(fsm.get("out"), 1).set(a.done(), 1);
    assertThat(body.drives(asgns, a.go())).isFalse();
    assertThat(written(body.set(flag, 1), asgns, fsm.get("in"))).isEqualTo(1);
    assertThat(written(body.set(flag, 0), asgns, fsm.get("in"))).isEqualTo(2);
  }

  @Test
  public void parLatchesEachChild() throws CompileError {
    compile(Control.par(Control.enable(a), Control.seq(Control.enable(b), Control.enable(c))));
    Group par = main.group("par");
    Cell pd = main.cell("pd");
    Cell pd0 = main.cell("pd0");
    // The seq child gets its own FSM; the par itself runs inside the top-level one.
    Group child = main.group("tdcc");
    assertThat(main.findGroup("tdcc0")).isPresent();
    List<Assignment> asgns = par.assignments();

    GuardEvaluator running = new GuardEvaluator();
    assertThat(running.drives(asgns, a.go())).isTrue();
    assertThat(running.drives(asgns, child.go())).isTrue();
    assertThat(running.drives(asgns, par.done())).isFalse();

    GuardEvaluator aDone = new GuardEvaluator().set(a.done(), 1);
    assertThat(aDone.drives(asgns, a.go())).isFalse();
    assertThat(written(aDone, asgns, pd.get("in"))).isEqualTo(1);

    GuardEvaluator latched = new GuardEvaluator().set(pd.get("out"), 1);
    assertThat(latched.drives(asgns, a.go())).isFalse();
    assertThat(latched.drives(main.continuousAssignments(), pd.get("in"))).isFalse();

    GuardEvaluator finished = latched.set(pd0.get("out"), 1);
    assertThat(finished.drives(asgns, par.done())).isTrue();
    assertThat(written(finished, main.continuousAssignments(), pd.get("in"))).isEqualTo(0);
    assertThat(written(finished, main.continuousAssignments(), pd0.get("in"))).isEqualTo(0);
  }

  @Test
  public void newFsmGetsItsOwnGroup() throws CompileError {
    Control.Seq inner = Control.seq(Control.enable(b), Control.enable(c));
    inner.attributes().insert(Attribute.NEW_FSM);
    compile(Control.seq(Control.enable(a), inner));
    Group innerGroup = main.group("tdcc");
    Group outer = main.group("tdcc0");
    assertThat(((Control.Enable) main.control()).group).isSameInstanceAs(outer);
    assertThat(new GuardEvaluator().drives(innerGroup.assignments(), b.go())).isTrue();
    assertThat(main.cell("fsm0").get("out").width).isEqualTo(2);
  }

  @Test
  public void oneHotBelowCutoff() throws CompileError {
    ctx.extraOpts().add("tdcc:one-hot-cutoff=4");
    compile(Control.seq(Control.enable(a), Control.enable(b)));
    Cell fsm = main.cell("fsm");
    assertThat(fsm.typeName).isEqualTo("init_one_reg");
    assertThat(fsm.get("out").width).isEqualTo(3);
    assertThat(main.cells().stream().filter(cell -> cell.isPrimitive("std_bit_slice")).count())
        .isEqualTo(3);
    Assignment reset =
        main.continuousAssignments().stream()
            .filter(asgn -> asgn.dst() == fsm.get("in"))
            .findFirst()
            .get();
    assertThat(reset.src().isConstant(1, 3)).isTrue();
  }

  @Test
  public void oneHotAttribute() throws CompileError {
    Control.Seq seq = Control.seq(Control.enable(a), Control.enable(b), Control.enable(c));
    seq.attributes().insert(Attribute.ONE_HOT);
    compile(seq);
    assertThat(main.cell("fsm").get("out").width).isEqualTo(4);
  }

  @Test
  public void enableIsLeftAlone() throws CompileError {
    assertThat(compile(Control.enable(a))).isSameInstanceAs(a);
    assertThat(main.findGroup("tdcc")).isEmpty();
  }

  @Test
  public void conditionGroupIsRejected() throws CompileError {
    Port flag = builder.addPrimitive("flag", "std_reg", 1).get("out");
    Group cond = builder.addCombGroup("cond");
    main.setControl(new Control.If(flag, cond, Control.enable(a), Control.enable(b)));
    CompileError e =
        assertThrows(CompileError.class, () -> new TopDownCompileControl(ctx).doPass(ctx));
    assertThat(e.kind).isEqualTo(CompileError.Kind.MALFORMED_STRUCTURE);
    assertThat(e).hasMessageThat().contains("`cond`");
  }

  @Test
  public void repeatIsRejected() throws CompileError {
    main.setControl(Control.seq(new Control.Repeat(2, Control.enable(a))));
    CompileError e =
        assertThrows(CompileError.class, () -> new TopDownCompileControl(ctx).doPass(ctx));
    assertThat(e.kind).isEqualTo(CompileError.Kind.PASS_ASSUMPTION);
    assertThat(e).hasMessageThat().contains("compile-repeat");
  }
}
