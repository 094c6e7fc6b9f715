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

import org.hardloom.CompileError;
import org.hardloom.Programs;
import org.hardloom.analysis.ControlId;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Port;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ScheduleTest {

  private Builder builder;
  private Group a;
  private Group b;
  private Port flag;

  @Before
  public void setup() throws CompileError {
    Context ctx = Programs.newContext();
    builder = Programs.builder(ctx, "main");
    Cell x = Programs.register(builder, "x");
    a = Programs.writeGroup(builder, "A", x, 1);
    b = Programs.writeGroup(builder, "B", x, 2);
    flag = builder.addPrimitive("flag", "std_reg", 1).get("out");
  }

  private Schedule schedule(Control con) throws CompileError {
    ControlId.computeUniqueIds(con, 0);
    Schedule sch = new Schedule(builder, false);
    sch.calculateStates(con);
    return sch;
  }

  @Test
  public void seqRunsFirstEnableInInitialState() throws CompileError {
    Schedule sch = schedule(Control.seq(Control.enable(a), Control.enable(b)));
    assertThat(sch.lastState()).isEqualTo(2);
    String display = sch.display("main");
    assertThat(display).startsWith("======== main =========\n0:\n  A[go] = !A[done] ? 1'd1;\n");
    assertThat(display).contains("  (0, 1): A[done]\n");
    assertThat(display).contains("  (1, 2): B[done]\n");
    assertThat(display).contains("2:\n  <end>\n");
  }

  @Test
  public void topLevelIfBranchesFromInitialState() throws CompileError {
    Schedule sch =
        schedule(new Control.If(flag, null, Control.enable(a), Control.enable(b)));
    assertThat(sch.lastState()).isEqualTo(3);
    String display = sch.display("if");
    assertThat(display).contains("  (0, 1): flag.out\n");
    assertThat(display).contains("  (0, 2): !flag.out\n");
    assertThat(display).contains("  (1, 3): A[done]\n");
    assertThat(display).contains("  (2, 3): B[done]\n");
  }

  @Test
  public void emptyBranchFallsThrough() throws CompileError {
    Schedule sch = schedule(new Control.If(flag, null, Control.enable(a), Control.empty()));
    assertThat(sch.lastState()).isEqualTo(2);
    assertThat(sch.display("if")).contains("  (0, 2): !flag.out\n");
  }

  @Test
  public void earlyTransitionsStartTheNextGroup() throws CompileError {
    Control con = Control.seq(Control.enable(a), Control.enable(b));
    ControlId.computeUniqueIds(con, 0);
    Schedule sch = new Schedule(builder, true);
    sch.calculateStates(con);
    assertThat(sch.display("early"))
        .contains("0:\n  A[go] = !A[done] ? 1'd1;\n  B[go] = A[done] ? 1'd1;\n");
  }

  @Test
  public void parMustBeCompiledFirst() throws CompileError {
    Control con = Control.par(Control.enable(a), Control.enable(b));
    ControlId.computeUniqueIds(con, 0);
    Schedule sch = new Schedule(builder, false);
    assertThrows(AssertionError.class, () -> sch.calculateStates(con));
  }
}
