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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.graph.Graph;
import java.util.List;
import java.util.Set;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Group;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.StaticEnable;

/**
 * Merges a sequence (or parallel composition) of static enables into a single static group in
 * which each enable starts as soon as the enables it depends on have finished.
 */
public final class CompactionAnalysis {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private CompactionAnalysis() {}

  /**
   * Returns the earliest start time of each node of {@code deps}, where node {@code i} takes {@code
   * latencies.get(i)} cycles. Every edge must go from a lower-numbered node to a higher-numbered
   * one.
   */
  public static ImmutableList<Long> asapSchedule(Graph<Integer> deps, List<Long> latencies) {
    long[] start = new long[latencies.size()];
    for (int i = 0; i < start.length; i++) {
      long s = 0;
      for (int p : deps.predecessors(i)) {
        Preconditions.checkArgument(p < i, "Dependency %s -> %s is out of order", p, i);
        s = Math.max(s, start[p] + latencies.get(p));
      }
      start[i] = s;
    }
    ImmutableList.Builder<Long> result = ImmutableList.builder();
    for (long s : start) {
      result.add(s);
    }
    return result.build();
  }

  /** Returns true if {@code stmts} is non-empty and consists only of static enables. */
  public static boolean allEnables(List<StaticControl> stmts) {
    return !stmts.isEmpty() && stmts.stream().allMatch(s -> s instanceof StaticEnable);
  }

  /**
   * Compacts a static seq of static enables, respecting the data dependencies between them and
   * the cells read ({@code contReads}) or written ({@code contWrites}) by continuous assignments.
   */
  public static StaticEnable compactSeq(
      StaticControl.StaticSeq seq, Set<Cell> contReads, Set<Cell> contWrites, Builder builder) {
    List<StaticControl> stmts = seq.stmts();
    Preconditions.checkArgument(allEnables(stmts));
    Graph<Integer> deps = ControlOrder.dependencyGraphSeq(stmts, contReads, contWrites);
    ImmutableList<Long> start = asapSchedule(deps, latencies(stmts));
    StaticEnable result = merge(stmts, start, builder);
    logger.atFine().log(
        "Compacted seq of %s enables from %s to %s cycles",
        stmts.size(),
        seq.latency(),
        result.latency());
    return result;
  }

  /** Merges a static par of static enables, all of which start in the first cycle. */
  public static StaticEnable compactPar(StaticControl.StaticPar par, Builder builder) {
    List<StaticControl> stmts = par.stmts();
    Preconditions.checkArgument(allEnables(stmts));
    return merge(stmts, zeros(stmts.size()), builder);
  }

  private static ImmutableList<Long> zeros(int n) {
    ImmutableList.Builder<Long> result = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      result.add(0L);
    }
    return result.build();
  }

  private static ImmutableList<Long> latencies(List<StaticControl> stmts) {
    return stmts.stream().map(StaticControl::latency).collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns an enable of a new static group containing the assignments of each enabled group,
   * re-timed to start at the corresponding cycle of {@code start}.
   */
  private static StaticEnable merge(
      List<StaticControl> stmts, List<Long> start, Builder builder) {
    long total = 0;
    for (int i = 0; i < stmts.size(); i++) {
      total = Math.max(total, start.get(i) + stmts.get(i).latency());
    }
    Group merged = builder.addStaticGroup("compact", total);
    for (int i = 0; i < stmts.size(); i++) {
      Group child = ((StaticEnable) stmts.get(i)).group;
      long offset = start.get(i);
      for (Assignment a : child.assignments()) {
        merged.assignments().add(
            a.mapPorts(p -> (p == child.go()) ? merged.go() : p)
                .withInterval(a.intervalWithin(child.latency()).shift(offset)));
      }
    }
    return new StaticEnable(merged);
  }
}
