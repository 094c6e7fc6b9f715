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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.hardloom.CompileError;
import org.hardloom.analysis.ControlOrder;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.PassOpt;
import org.hardloom.traversal.PassOptions;
import org.hardloom.traversal.Visitor;

/**
 * Transforms each par into a seq whose children run in an order consistent with their data
 * dependencies. A par whose children cannot be ordered is left unchanged, or reported as an error
 * if {@code correctness-checking} is set.
 */
public final class ParToSeq implements Visitor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final PassInfo INFO =
      new PassInfo(
          "par-to-seq",
          "Transform `par` blocks to `seq`",
          PassOpt.bool(
              "correctness-checking",
              "Fail if a par block cannot be sequentialized without a data race"));

  private final boolean correctnessChecking;

  public ParToSeq(Context ctx) throws CompileError {
    PassOptions opts = PassOptions.parse(INFO, ctx.extraOpts());
    this.correctnessChecking = opts.bool("correctness-checking");
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action finishPar(Control.Par s, Component comp) throws CompileError {
    ImmutableList<Control> order;
    try {
      order = ControlOrder.totalOrder(s.stmts());
    } catch (CompileError e) {
      if (correctnessChecking || e.kind != CompileError.Kind.DATA_RACE) {
        throw e;
      }
      logger.atInfo().log("%s: leaving par unchanged: %s", comp.name, e.getMessage());
      return Action.CONTINUE;
    }
    Control.Seq seq = new Control.Seq(order);
    seq.attributes().putAll(s.attributes());
    return Action.change(seq);
  }
}
