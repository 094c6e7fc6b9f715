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

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.hardloom.CompileError;
import org.hardloom.Programs;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Context;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.ir.Interval;
import org.hardloom.ir.Port;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompactionAnalysisTest {

  private Builder builder;
  private Cell x;
  private Cell y;

  @Before
  public void setup() throws CompileError {
    Context ctx = Programs.newContext();
    builder = Programs.builder(ctx, "main");
    x = Programs.register(builder, "x");
    y = Programs.register(builder, "y");
  }

  /** Returns the interval of the (only) assignment to {@code dst} in {@code group}. */
  private static Interval intervalOf(Group group, Port dst) {
    return group.assignments().stream()
        .filter(a -> a.dst() == dst)
        .map(Assignment::interval)
        .findFirst()
        .orElseThrow();
  }

  /** A static group that copies x into y during its last cycle. */
  private Group copyXToY(long latency) {
    Group g = builder.addStaticGroup("copy", latency);
    Interval last = new Interval(latency - 1, latency);
    builder.addTo(
        g,
        List.of(
            builder.assign(y.get("in"), x.get("out"), Guard.TRUE, last),
            builder.assign(y.get("write_en"), builder.one(), Guard.TRUE, last)));
    return g;
  }

  private static StaticControl.StaticSeq seq(Group... groups) {
    StaticControl.StaticSeq seq =
        new StaticControl.StaticSeq(
            Arrays.stream(groups).map(StaticEnable::new).toList());
    seq.attributes().insert(Attribute.COMPACTABLE);
    return seq;
  }

  @Test
  public void asapSchedule() {
    MutableGraph<Integer> deps = GraphBuilder.directed().build();
    for (int i = 0; i < 4; i++) {
      deps.addNode(i);
    }
    deps.putEdge(0, 2);
    deps.putEdge(1, 2);
    deps.putEdge(2, 3);
    assertThat(CompactionAnalysis.asapSchedule(deps, List.of(3L, 5L, 1L, 2L)))
        .containsExactly(0L, 0L, 5L, 6L)
        .inOrder();
  }

  @Test
  public void independentGroupsOverlap() {
    Group a = Programs.staticGroup(builder, "A", 3, x, null);
    Group b = Programs.staticGroup(builder, "B", 2, y, null);
    StaticEnable result = CompactionAnalysis.compactSeq(seq(a, b), Set.of(), Set.of(), builder);
    assertThat(result.latency()).isEqualTo(3);
    assertThat(intervalOf(result.group, x.get("write_en"))).isEqualTo(new Interval(0, 3));
    assertThat(intervalOf(result.group, y.get("write_en"))).isEqualTo(new Interval(0, 2));
  }

  @Test
  public void dependentGroupsRunInSequence() {
    Group a = Programs.staticGroup(builder, "A", 3, x, new Interval(1, 2));
    Group copy = copyXToY(2);
    StaticEnable result =
        CompactionAnalysis.compactSeq(seq(a, copy), Set.of(), Set.of(), builder);
    assertThat(result.latency()).isEqualTo(5);
    assertThat(intervalOf(result.group, x.get("write_en"))).isEqualTo(new Interval(1, 2));
    assertThat(intervalOf(result.group, y.get("in"))).isEqualTo(new Interval(4, 5));
  }

  @Test
  public void continuousReadsKeepOrder() {
    Group a = Programs.staticGroup(builder, "A", 3, x, null);
    Group b = Programs.staticGroup(builder, "B", 2, y, null);
    // A continuous assignment reads both registers, so neither write may move.
    StaticEnable result =
        CompactionAnalysis.compactSeq(seq(a, b), Set.of(x, y), Set.of(), builder);
    assertThat(result.latency()).isEqualTo(5);
    assertThat(intervalOf(result.group, y.get("write_en"))).isEqualTo(new Interval(3, 5));
  }

  @Test
  public void parStartsTogether() {
    Group a = Programs.staticGroup(builder, "A", 3, x, null);
    Group b = Programs.staticGroup(builder, "B", 2, y, null);
    StaticControl.StaticPar par =
        new StaticControl.StaticPar(List.of(new StaticEnable(a), new StaticEnable(b)));
    StaticEnable result = CompactionAnalysis.compactPar(par, builder);
    assertThat(result.group.name).startsWith("compact");
    assertThat(result.latency()).isEqualTo(3);
    assertThat(intervalOf(result.group, x.get("write_en"))).isEqualTo(new Interval(0, 3));
    assertThat(intervalOf(result.group, y.get("write_en"))).isEqualTo(new Interval(0, 2));
  }

  @Test
  public void allEnables() {
    Group a = Programs.staticGroup(builder, "A", 3, x, null);
    assertThat(CompactionAnalysis.allEnables(List.of())).isFalse();
    assertThat(CompactionAnalysis.allEnables(List.of(new StaticEnable(a)))).isTrue();
    assertThat(
            CompactionAnalysis.allEnables(
                List.of(new StaticEnable(a), new StaticControl.StaticSeq(List.of()))))
        .isFalse();
  }
}
