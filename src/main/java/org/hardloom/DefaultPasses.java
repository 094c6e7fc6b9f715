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

import com.google.common.collect.ImmutableList;
import org.hardloom.passes.AttributePromotion;
import org.hardloom.passes.CollapseControl;
import org.hardloom.passes.CompileInvoke;
import org.hardloom.passes.CompileRepeat;
import org.hardloom.passes.CompileStatic;
import org.hardloom.passes.InferStaticTiming;
import org.hardloom.passes.ParToSeq;
import org.hardloom.passes.RemoveCombGroups;
import org.hardloom.passes.ScheduleCompaction;
import org.hardloom.passes.StaticInliner;
import org.hardloom.passes.StaticPromotion;
import org.hardloom.passes.TopDownCompileControl;

/** Registers the standard passes and aliases. */
public final class DefaultPasses {
  /** Optimizations that infer and exploit static timing. */
  public static final ImmutableList<String> PRE_OPT =
      ImmutableList.of(
          AttributePromotion.INFO.name(),
          InferStaticTiming.INFO.name(),
          StaticPromotion.INFO.name(),
          ScheduleCompaction.INFO.name(),
          CollapseControl.INFO.name());

  /** The passes that lower all control to a single enable per component. */
  public static final ImmutableList<String> COMPILE =
      ImmutableList.of(
          CompileRepeat.INFO.name(),
          CompileInvoke.INFO.name(),
          StaticInliner.INFO.name(),
          CompileStatic.INFO.name(),
          RemoveCombGroups.INFO.name(),
          TopDownCompileControl.INFO.name());

  private DefaultPasses() {}

  /** Returns a PassManager with every standard pass and the aliases pre-opt, compile and all. */
  public static PassManager create() throws CompileError {
    PassManager pm = new PassManager();
    pm.registerPass(AttributePromotion.INFO, ctx -> new AttributePromotion());
    pm.registerPass(InferStaticTiming.INFO, InferStaticTiming::new);
    pm.registerPass(StaticPromotion.INFO, StaticPromotion::new);
    pm.registerPass(ScheduleCompaction.INFO, ScheduleCompaction::new);
    pm.registerPass(CollapseControl.INFO, ctx -> new CollapseControl());
    pm.registerPass(ParToSeq.INFO, ParToSeq::new);
    pm.registerPass(CompileRepeat.INFO, CompileRepeat::new);
    pm.registerPass(CompileInvoke.INFO, CompileInvoke::new);
    pm.registerPass(StaticInliner.INFO, StaticInliner::new);
    pm.registerPass(CompileStatic.INFO, CompileStatic::new);
    pm.registerPass(RemoveCombGroups.INFO, RemoveCombGroups::new);
    pm.registerPass(TopDownCompileControl.INFO, TopDownCompileControl::new);

    pm.addAlias("pre-opt", PRE_OPT);
    pm.addAlias("compile", COMPILE);
    pm.addAlias("all", ImmutableList.of("pre-opt", "compile"));
    return pm;
  }
}
