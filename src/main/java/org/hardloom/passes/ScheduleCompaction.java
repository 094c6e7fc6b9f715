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

import com.google.common.collect.ImmutableSet;
import org.hardloom.analysis.CompactionAnalysis;
import org.hardloom.analysis.InferenceAnalysis;
import org.hardloom.analysis.ReadWriteSet;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.StaticControl;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.Order;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Replaces each {@code @compactable} static seq or static par of static enables with an enable of
 * a single static group in which every enable starts as early as its data dependencies allow.
 */
public final class ScheduleCompaction implements Visitor {
  public static final PassInfo INFO =
      new PassInfo(
          "schedule-compaction", "Shortens static schedules by running independent groups early");

  private final LibrarySignatures lib;
  private final InferenceAnalysis inference;
  private ImmutableSet<Cell> contReads = ImmutableSet.of();
  private ImmutableSet<Cell> contWrites = ImmutableSet.of();

  public ScheduleCompaction(Context ctx) {
    this.lib = ctx.lib;
    this.inference = InferenceAnalysis.fromContext(ctx);
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Order order() {
    return Order.POST;
  }

  @Override
  public Action start(Component comp) {
    ReadWriteSet continuous = ReadWriteSet.of(comp.continuousAssignments());
    contReads = continuous.readCells();
    contWrites = continuous.writeCells();
    return Action.CONTINUE;
  }

  @Override
  public Action finishStaticSeq(StaticControl.StaticSeq s, Component comp) {
    if (!s.attributes().has(Attribute.COMPACTABLE)
        || !CompactionAnalysis.allEnables(s.stmts())) {
      return Action.CONTINUE;
    }
    Builder builder = new Builder(comp, lib);
    return Action.staticChange(CompactionAnalysis.compactSeq(s, contReads, contWrites, builder));
  }

  @Override
  public Action finishStaticPar(StaticControl.StaticPar s, Component comp) {
    if (!s.attributes().has(Attribute.COMPACTABLE)
        || !CompactionAnalysis.allEnables(s.stmts())) {
      return Action.CONTINUE;
    }
    return Action.staticChange(CompactionAnalysis.compactPar(s, new Builder(comp, lib)));
  }

  /** Compaction can shorten the component's schedule, so its latency is inferred again. */
  @Override
  public Action finish(Component comp) {
    inference.inferComponent(comp);
    return Action.CONTINUE;
  }
}
