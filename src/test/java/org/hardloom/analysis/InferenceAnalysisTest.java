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

import java.util.List;
import java.util.OptionalLong;
import org.hardloom.CompileError;
import org.hardloom.Programs;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.passes.InferStaticTiming;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InferenceAnalysisTest {

  private Context ctx;
  private Component main;
  private Builder builder;
  private Cell r;
  private Cell flag;

  @Before
  public void setup() throws CompileError {
    ctx = Programs.newContext();
    main = ctx.component("main");
    builder = Programs.builder(ctx, "main");
    r = Programs.register(builder, "r");
    flag = builder.addPrimitive("flag", "std_reg", 1);
  }

  private InferenceAnalysis analysis() {
    return InferenceAnalysis.fromContext(ctx);
  }

  /** Returns a register write annotated with a required latency. */
  private Group timed(String name, long latency) {
    Group g = Programs.writeGroup(builder, name, r, latency);
    g.attributes.insert(Attribute.STATIC, latency);
    return g;
  }

  private static long promotable(Control c) {
    return c.attributes().get(Attribute.PROMOTABLE).getAsLong();
  }

  @Test
  public void registerWrite() {
    Group g = Programs.writeGroup(builder, "g", r, 1);
    assertThat(analysis().inferGroupLatency(g)).isEqualTo(OptionalLong.of(1));
  }

  @Test
  public void chainOfCells() {
    Cell mult = builder.addPrimitive("mult", "std_mult_pipe", 32);
    Group g = builder.addGroup("g");
    builder.addTo(
        g,
        List.of(
            builder.assign(mult.get("left"), r.get("out")),
            builder.assign(mult.get("right"), r.get("out")),
            builder.assign(mult.get("go"), builder.one()),
            builder.assign(r.get("in"), mult.get("out")),
            builder.assign(r.get("write_en"), mult.get("done")),
            builder.assign(g.done(), r.get("done"))));
    assertThat(analysis().inferGroupLatency(g)).isEqualTo(OptionalLong.of(4));
  }

  @Test
  public void guardedDoneDefeatsInference() {
    Group g = builder.addGroup("g");
    builder.addTo(
        g,
        List.of(
            builder.assign(r.get("in"), builder.constant(1, 32)),
            builder.assign(r.get("write_en"), builder.one()),
            builder.assign(g.done(), r.get("done"), Guard.port(flag.get("out")))));
    assertThat(analysis().inferGroupLatency(g)).isEqualTo(OptionalLong.empty());
  }

  @Test
  public void doubleWriteDefeatsInference() {
    Group g = Programs.writeGroup(builder, "g", r, 1);
    g.assignments().add(builder.assign(r.get("write_en"), flag.get("out")));
    assertThat(analysis().inferGroupLatency(g)).isEqualTo(OptionalLong.empty());
  }

  @Test
  public void goNotStartedByGroup() {
    Group g = builder.addGroup("g");
    builder.addTo(g, List.of(builder.assign(g.done(), r.get("done"))));
    assertThat(analysis().inferGroupLatency(g)).isEqualTo(OptionalLong.empty());
  }

  @Test
  public void explicitLatencyWins() {
    Group g = builder.addGroup("g");
    g.attributes.insert(Attribute.STATIC, 7);
    assertThat(analysis().inferGroupLatency(g)).isEqualTo(OptionalLong.of(7));
    Group s = builder.addStaticGroup("s", 2);
    assertThat(analysis().inferGroupLatency(s)).isEqualTo(OptionalLong.empty());
  }

  @Test
  public void seqLatencyReachesComponent() throws CompileError {
    Control.Seq seq = Control.seq(Control.enable(timed("X", 2)), Control.enable(timed("Y", 3)));
    main.setControl(seq);
    new InferStaticTiming(ctx).doPass(ctx);
    assertThat(promotable(seq)).isEqualTo(5);
    assertThat(promotable(seq.stmts().get(0))).isEqualTo(2);
    assertThat(promotable(seq.stmts().get(1))).isEqualTo(3);
    assertThat(main.goPorts().get(0).attributes.get(Attribute.PROMOTABLE))
        .isEqualTo(OptionalLong.of(5));
  }

  @Test
  public void inferenceIsIdempotent() throws CompileError {
    Control.Par par = Control.par(Control.enable(timed("X", 2)), Control.enable(timed("Y", 3)));
    main.setControl(par);
    new InferStaticTiming(ctx).doPass(ctx);
    String once = main.toString();
    new InferStaticTiming(ctx).doPass(ctx);
    assertThat(main.toString()).isEqualTo(once);
    assertThat(promotable(par)).isEqualTo(3);
  }

  @Test
  public void compoundStatements() {
    Group x = timed("X", 2);
    Group y = timed("Y", 3);
    Control.If ifc =
        new Control.If(flag.get("out"), null, Control.enable(x), Control.enable(y));
    Control.While unbounded = new Control.While(flag.get("out"), null, Control.enable(y));
    Control.While bounded = new Control.While(flag.get("out"), null, Control.enable(y));
    bounded.attributes().insert(Attribute.BOUND, 4);
    Control.Repeat repeat = new Control.Repeat(3, Control.enable(x));
    Control.Seq seq = Control.seq(ifc, bounded, repeat);
    main.setControl(Control.seq(seq, unbounded));
    InferenceAnalysis analysis = analysis();
    assertThat(analysis.fixupTiming(main)).isEqualTo(OptionalLong.empty());
    assertThat(promotable(ifc)).isEqualTo(3);
    assertThat(promotable(bounded)).isEqualTo(12);
    assertThat(promotable(repeat)).isEqualTo(6);
    assertThat(promotable(seq)).isEqualTo(21);
    assertThat(unbounded.attributes().has(Attribute.PROMOTABLE)).isFalse();
    // The loop body is still annotated.
    assertThat(promotable(unbounded.body())).isEqualTo(3);
    assertThat(main.control().attributes().has(Attribute.PROMOTABLE)).isFalse();
  }

  @Test
  public void conditionGroupDefeatsInference() {
    Group cond = builder.addCombGroup("cond");
    Control.If ifc =
        new Control.If(
            flag.get("out"), cond, Control.enable(timed("X", 1)), Control.enable(timed("Y", 1)));
    assertThat(analysis().updateStatic(ifc)).isEqualTo(OptionalLong.empty());
  }

  @Test
  public void emptyControlHasNoLatency() throws CompileError {
    main.setControl(Control.seq());
    assertThat(analysis().inferComponent(main)).isEqualTo(OptionalLong.of(0));
    assertThat(main.control().attributes().isEmpty()).isTrue();
    assertThat(main.goPorts().get(0).attributes.has(Attribute.PROMOTABLE)).isFalse();
  }

  @Test
  public void invokeUsesCalleeLatency() throws CompileError {
    Component sub = ctx.add(Component.withGoDone("sub"));
    Builder subBuilder = new Builder(sub, ctx.lib);
    Group g = Programs.writeGroup(subBuilder, "g", Programs.register(subBuilder, "s"), 4);
    g.attributes.insert(Attribute.STATIC, 2);
    sub.setControl(Control.enable(g));
    Cell instance = builder.addComponentCell("sub", sub);
    Control.Invoke invoke = new Control.Invoke(instance, List.of(), List.of(), null);
    main.setControl(invoke);
    new InferStaticTiming(ctx).doPass(ctx);
    assertThat(promotable(invoke)).isEqualTo(2);
    assertThat(analysis().componentLatency("std_mult_pipe")).isEqualTo(OptionalLong.of(3));
  }
}
