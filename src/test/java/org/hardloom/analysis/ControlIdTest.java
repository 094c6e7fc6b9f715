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

package org.hardloom.analysis;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.hardloom.CompileError;
import org.hardloom.Programs;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Port;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ControlIdTest {

  private Group a;
  private Group b;
  private Group c;
  private Group d;
  private Port flag;

  @Before
  public void setup() throws CompileError {
    Builder builder = Programs.builder(Programs.newContext(), "main");
    Cell r = Programs.register(builder, "r");
    a = Programs.writeGroup(builder, "A", r, 1);
    b = Programs.writeGroup(builder, "B", r, 2);
    c = Programs.writeGroup(builder, "C", r, 3);
    d = Programs.writeGroup(builder, "D", r, 4);
    flag = builder.addPrimitive("flag", "std_reg", 1).get("out");
  }

  private static long id(Control c) {
    return ControlId.guaranteedId(c);
  }

  private static long attr(Control c, Attribute attr) {
    return c.attributes().get(attr).getAsLong();
  }

  @Test
  public void seqIfWhile() throws CompileError {
    Control.Enable enA = Control.enable(a);
    Control.Enable enB = Control.enable(b);
    Control.Enable enC = Control.enable(c);
    Control.Enable enD = Control.enable(d);
    Control.If ifc = new Control.If(flag, null, enB, enC);
    Control.While loop = new Control.While(flag, null, enD);
    Control.Seq seq = Control.seq(enA, ifc, loop);
    assertThat(ControlId.computeUniqueIds(seq, 0)).isEqualTo(4);
    assertThat(id(enA)).isEqualTo(0);
    assertThat(id(enB)).isEqualTo(1);
    assertThat(id(enC)).isEqualTo(2);
    assertThat(id(enD)).isEqualTo(3);
    assertThat(attr(ifc, Attribute.BEGIN_ID)).isEqualTo(1);
    assertThat(attr(ifc, Attribute.END_ID)).isEqualTo(3);
    assertThat(attr(loop, Attribute.BEGIN_ID)).isEqualTo(3);
    assertThat(attr(seq, Attribute.END_ID)).isEqualTo(4);
  }

  @Test
  public void leadingConditionReservesStateZero() throws CompileError {
    Control.Enable enA = Control.enable(a);
    Control.While loop = new Control.While(flag, null, enA);
    assertThat(ControlId.computeUniqueIds(loop, 0)).isEqualTo(2);
    assertThat(id(enA)).isEqualTo(1);
  }

  @Test
  public void newFsmTakesOneState() throws CompileError {
    Control.Enable enB = Control.enable(b);
    Control.Enable enC = Control.enable(c);
    Control.Enable enD = Control.enable(d);
    Control.Seq inner = Control.seq(enB, enC);
    inner.attributes().insert(Attribute.NEW_FSM);
    Control.Seq outer = Control.seq(Control.enable(a), inner, enD);
    assertThat(ControlId.computeUniqueIds(outer, 0)).isEqualTo(3);
    assertThat(id(inner)).isEqualTo(1);
    assertThat(id(enB)).isEqualTo(0);
    assertThat(id(enC)).isEqualTo(1);
    assertThat(id(enD)).isEqualTo(2);
  }

  @Test
  public void parChildrenStartAgain() throws CompileError {
    Control.Enable enC = Control.enable(c);
    Control.Enable enD = Control.enable(d);
    Control.Par par = Control.par(Control.enable(b), Control.seq(enC, enD));
    Control.Seq outer = Control.seq(Control.enable(a), par, Control.empty());
    assertThat(ControlId.computeUniqueIds(outer, 0)).isEqualTo(2);
    assertThat(id(par)).isEqualTo(1);
    assertThat(id(enC)).isEqualTo(0);
    assertThat(id(enD)).isEqualTo(1);
  }

  @Test
  public void uncompiledStatements() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () -> ControlId.computeUniqueIds(new Control.Repeat(2, Control.enable(a)), 0));
    assertThat(e.kind).isEqualTo(CompileError.Kind.PASS_ASSUMPTION);
    assertThat(e).hasMessageThat().contains("compile-repeat");
    assertThrows(IllegalStateException.class, () -> ControlId.guaranteedId(Control.enable(a)));
  }
}
