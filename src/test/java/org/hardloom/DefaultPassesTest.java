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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.Iterables;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.List;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.StaticControl;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Runs the standard pass pipelines on small programs. */
@RunWith(TestParameterInjector.class)
public class DefaultPassesTest {

  private PassManager pm;
  private Context ctx;
  private Component main;
  private Builder builder;
  private Group a;
  private Group b;

  @Before
  public void setup() throws CompileError {
    pm = DefaultPasses.create();
    ctx = Programs.newContext();
    main = ctx.component("main");
    builder = Programs.builder(ctx, "main");
    a = Programs.writeGroup(builder, "A", Programs.register(builder, "r1"), 1);
    b = Programs.writeGroup(builder, "B", Programs.register(builder, "r2"), 2);
  }

  private void runAll() throws CompileError {
    pm.executePlan(ctx, List.of("all"), List.of());
  }

  private void assertFullyCompiled() {
    assertThat(main.control()).isInstanceOf(Control.Enable.class);
    assertThat(main.groups(Group.Kind.STATIC)).isEmpty();
  }

  @Test
  public void aliasesResolve(@TestParameter({"pre-opt", "compile", "all"}) String alias)
      throws CompileError {
    assertThat(pm.createPlan(List.of(alias), List.of())).isNotEmpty();
  }

  @Test
  public void allIsPreOptThenCompile() throws CompileError {
    assertThat(pm.createPlan(List.of("all"), List.of()))
        .containsExactlyElementsIn(
            Iterables.concat(DefaultPasses.PRE_OPT, DefaultPasses.COMPILE))
        .inOrder();
    assertThat(pm.createPlan(List.of("all"), List.of("compile")))
        .containsExactlyElementsIn(DefaultPasses.PRE_OPT)
        .inOrder();
  }

  @Test
  public void timedSeqIsCompactedIntoOneCounter() throws CompileError {
    main.setControl(Control.seq(Control.enable(a), Control.enable(b)));
    runAll();
    assertFullyCompiled();
    Group top = ((Control.Enable) main.control()).group;
    assertThat(top.name).isEqualTo("compact_wrapper");
    // The two writes are independent, so the whole program takes one cycle.
    assertThat(main.goPorts().get(0).attributes.get(Attribute.PROMOTABLE).getAsLong())
        .isEqualTo(1);
  }

  @Test
  public void unboundedLoopUsesFsm() throws CompileError {
    Cell flag = builder.addPrimitive("flag", "std_reg", 1);
    main.setControl(
        Control.seq(
            Control.enable(a), new Control.While(flag.get("out"), null, Control.enable(b))));
    runAll();
    assertFullyCompiled();
    assertThat(((Control.Enable) main.control()).group.name).isEqualTo("tdcc");
    assertThat(main.groups(Group.Kind.DYNAMIC).stream().map(g -> g.name))
        .containsAtLeast("A", "B", "tdcc");
  }

  @Test
  public void boundedLoopBecomesStatic() throws CompileError {
    Cell flag = builder.addPrimitive("flag", "std_reg", 1);
    Control.While loop = new Control.While(flag.get("out"), null, Control.enable(a));
    loop.attributes().insert(Attribute.BOUND, 3);
    main.setControl(Control.seq(loop));
    runAll();
    assertFullyCompiled();
    assertThat(((Control.Enable) main.control()).group.name).endsWith("_wrapper");
    assertThat(main.goPorts().get(0).attributes.get(Attribute.PROMOTABLE).getAsLong())
        .isEqualTo(3);
  }

  @Test
  public void preOptOnlyLeavesStaticControl() throws CompileError {
    main.setControl(Control.seq(Control.enable(a), Control.enable(b)));
    pm.executePlan(ctx, List.of("pre-opt"), List.of());
    assertThat(main.control()).isInstanceOf(StaticControl.StaticEnable.class);
  }

  @Test
  public void excludedPromotionKeepsDynamicControl() throws CompileError {
    main.setControl(Control.seq(Control.enable(a), Control.enable(b)));
    pm.executePlan(ctx, List.of("all"), List.of("static-promotion"));
    assertFullyCompiled();
    assertThat(((Control.Enable) main.control()).group.name).isEqualTo("tdcc");
  }
}
