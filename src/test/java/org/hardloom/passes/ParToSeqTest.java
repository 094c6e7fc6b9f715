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
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Printer;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParToSeqTest {

  private Context ctx;
  private Component main;
  private Cell x;
  private Cell y;
  private Builder builder;

  @Before
  public void setup() throws CompileError {
    ctx = Programs.newContext();
    main = ctx.component("main");
    builder = Programs.builder(ctx, "main");
    x = Programs.register(builder, "x");
    y = Programs.register(builder, "y");
  }

  private void run(Control con) throws CompileError {
    main.setControl(con);
    new ParToSeq(ctx).doPass(ctx);
  }

  @Test
  public void writerRunsBeforeReader() throws CompileError {
    Group read = Programs.copyGroup(builder, "R", x, y);
    Group write = Programs.writeGroup(builder, "W", x, 7);
    Control.Par par = Control.par(Control.enable(read), Control.enable(write));
    par.attributes().insert(Attribute.NEW_FSM);
    run(par);
    assertThat(Printer.control(main.control())).isEqualTo("@new_fsm seq {\n  W;\n  R;\n}");
  }

  @Test
  public void independentChildrenKeepOrder() throws CompileError {
    Group a = Programs.writeGroup(builder, "A", x, 1);
    Group b = Programs.writeGroup(builder, "B", y, 2);
    run(Control.seq(Control.par(Control.enable(a), Control.enable(b))));
    assertThat(Printer.control(main.control())).isEqualTo("seq {\n  seq {\n    A;\n    B;\n  }\n}");
  }

  @Test
  public void raceLeavesParUnchanged() throws CompileError {
    Group a = Programs.copyGroup(builder, "A", y, x);
    Group b = Programs.copyGroup(builder, "B", x, y);
    run(Control.par(Control.enable(a), Control.enable(b)));
    assertThat(main.control()).isInstanceOf(Control.Par.class);
  }

  @Test
  public void raceIsAnErrorWhenChecking() throws CompileError {
    ctx.extraOpts().add("par-to-seq:correctness-checking");
    Group a = Programs.copyGroup(builder, "A", y, x);
    Group b = Programs.copyGroup(builder, "B", x, y);
    CompileError e =
        assertThrows(
            CompileError.class, () -> run(Control.par(Control.enable(a), Control.enable(b))));
    assertThat(e.kind).isEqualTo(CompileError.Kind.DATA_RACE);
    assertThat(e).hasMessageThat().contains("A;\n  which reads: ");
  }
}
