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

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.hardloom.CompileError;
import org.hardloom.analysis.InferenceAnalysis;
import org.hardloom.analysis.PromotionAnalysis;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.StaticControl;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.Order;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.PassOpt;
import org.hardloom.traversal.PassOptions;
import org.hardloom.traversal.Visitor;

/**
 * Converts dynamic control whose latency has been inferred into static control, bottom up.
 *
 * <p>Whether a statement is worth promoting is decided by its approximate size, the number of
 * dynamic FSM states it would otherwise need: a statement is promoted only if its size exceeds
 * {@code threshold} and its latency is below {@code cycle-limit}. An if is also left dynamic when
 * its branches' latencies differ by more than {@code if-diff-limit}.
 *
 * <p>A seq or par that cannot be promoted as a whole is split up. In a seq, each run of
 * consecutive promotable children becomes a {@code @compactable} static seq, halving runs that
 * take too long. In a par, the promotable children are gathered into one static par, leaving out
 * the largest ones while the par would take too long.
 */
public final class StaticPromotion implements Visitor {
  public static final PassInfo INFO =
      new PassInfo(
          "static-promotion",
          "Promotes control with inferred latencies to static control",
          PassOpt.number(
              "threshold",
              "Size at and below which control is not worth promoting",
              1),
          PassOpt.number(
              "cycle-limit",
              "Latency at and above which control is not promoted",
              33554432),
          PassOpt.number(
              "if-diff-limit",
              "Largest difference between the latencies of an if's branches that is promoted",
              1));

  private static final long ENABLE_SIZE = 1;
  private static final long IF_SIZE = 3;
  private static final long LOOP_SIZE = 3;

  private final LibrarySignatures lib;
  private final InferenceAnalysis inference;
  private final long threshold;
  private final long cycleLimit;
  private final long ifDiffLimit;
  private PromotionAnalysis promotion = new PromotionAnalysis();

  public StaticPromotion(Context ctx) throws CompileError {
    PassOptions opts = PassOptions.parse(INFO, ctx.extraOpts());
    this.lib = ctx.lib;
    this.inference = InferenceAnalysis.fromContext(ctx);
    this.threshold = opts.number("threshold");
    this.cycleLimit = opts.number("cycle-limit");
    this.ifDiffLimit = opts.number("if-diff-limit");
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
    promotion = new PromotionAnalysis();
    return Action.CONTINUE;
  }

  @Override
  public Action finish(Component comp) {
    inference.inferComponent(comp);
    return Action.CONTINUE;
  }

  /**
   * Returns the approximate number of dynamic FSM states needed for {@code c}. A static
   * statement counts as one, since it runs as a single group.
   */
  static long approxSize(Control c) {
    if (c instanceof StaticControl.Empty) {
      return 0;
    } else if (c instanceof StaticControl) {
      return 1;
    } else if (c instanceof Control.Seq s) {
      return totalSize(s.stmts());
    } else if (c instanceof Control.Par s) {
      return totalSize(s.stmts());
    } else if (c instanceof Control.If s) {
      return approxSize(s.tbranch()) + approxSize(s.fbranch()) + IF_SIZE;
    } else if (c instanceof Control.While s) {
      return approxSize(s.body()) + LOOP_SIZE;
    } else if (c instanceof Control.Repeat s) {
      return approxSize(s.body()) + LOOP_SIZE;
    }
    return ENABLE_SIZE;
  }

  static long totalSize(List<Control> stmts) {
    return stmts.stream().mapToLong(StaticPromotion::approxSize).sum();
  }

  private boolean withinCycleLimit(long latency) {
    return latency < cycleLimit;
  }

  private Builder builder(Component comp) {
    return new Builder(comp, lib);
  }

  /** Promotes a single enable or invoke, which only happens if {@code threshold} is 0. */
  private Action promoteLeaf(Control c, Component comp) {
    OptionalLong latency = c.attributes().get(Attribute.PROMOTABLE);
    if (latency.isPresent()
        && withinCycleLimit(latency.getAsLong())
        && ENABLE_SIZE > threshold) {
      return Action.change(promotion.convertToStatic(c, builder(comp)));
    }
    return Action.CONTINUE;
  }

  @Override
  public Action enable(Control.Enable s, Component comp) {
    return promoteLeaf(s, comp);
  }

  @Override
  public Action invoke(Control.Invoke s, Component comp) {
    if (s.combGroup != null) {
      return Action.CONTINUE;
    }
    return promoteLeaf(s, comp);
  }

  /**
   * Promotes {@code c} if it is promotable, larger than {@code threshold}, and takes fewer than
   * {@code cycle-limit} cycles. A statement that takes too long is marked as not promotable, so
   * that its parents do not try either.
   */
  private Action promoteWhole(Control c, long size, Component comp) {
    OptionalLong latency = c.attributes().get(Attribute.PROMOTABLE);
    if (latency.isEmpty() || size <= threshold) {
      return Action.CONTINUE;
    } else if (!withinCycleLimit(latency.getAsLong())) {
      c.attributes().remove(Attribute.PROMOTABLE);
      return Action.CONTINUE;
    }
    return Action.change(promotion.convertToStatic(c, builder(comp)));
  }

  @Override
  public Action finishIf(Control.If s, Component comp) {
    OptionalLong latency = s.attributes().get(Attribute.PROMOTABLE);
    if (latency.isPresent() && withinCycleLimit(latency.getAsLong())) {
      long t = PromotionAnalysis.inferredLatency(s.tbranch());
      long f = PromotionAnalysis.inferredLatency(s.fbranch());
      if (Math.abs(t - f) > ifDiffLimit) {
        return Action.CONTINUE;
      }
    }
    return promoteWhole(s, approxSize(s), comp);
  }

  @Override
  public Action finishWhile(Control.While s, Component comp) {
    return promoteWhole(s, approxSize(s), comp);
  }

  @Override
  public Action finishRepeat(Control.Repeat s, Component comp) {
    return promoteWhole(s, approxSize(s), comp);
  }

  @Override
  public Action finishSeq(Control.Seq s, Component comp) {
    OptionalLong latency = s.attributes().get(Attribute.PROMOTABLE);
    if (latency.isPresent()) {
      if (totalSize(s.stmts()) <= threshold) {
        return Action.CONTINUE;
      } else if (withinCycleLimit(latency.getAsLong())) {
        return Action.change(promotion.convertToStatic(s, builder(comp)));
      }
    }
    Builder builder = builder(comp);
    List<Control> result = new ArrayList<>();
    List<Control> run = new ArrayList<>();
    for (Control stmt : s.stmts()) {
      if (PromotionAnalysis.canBePromoted(stmt) && !(stmt instanceof StaticControl.Empty)) {
        run.add(stmt);
      } else {
        result.addAll(promoteSeqRun(run, builder));
        result.add(stmt);
        run = new ArrayList<>();
      }
    }
    result.addAll(promoteSeqRun(run, builder));
    s.stmts().clear();
    s.stmts().addAll(result);
    return Action.CONTINUE;
  }

  /** Returns the statements that replace a run of consecutive promotable children of a seq. */
  private List<Control> promoteSeqRun(List<Control> run, Builder builder) {
    if (run.size() <= 1 || totalSize(run) <= threshold) {
      return run;
    }
    long latency = run.stream().mapToLong(PromotionAnalysis::inferredLatency).sum();
    if (!withinCycleLimit(latency)) {
      int mid = run.size() / 2;
      List<Control> result = new ArrayList<>(promoteSeqRun(run.subList(0, mid), builder));
      result.addAll(promoteSeqRun(run.subList(mid, run.size()), builder));
      return result;
    }
    StaticControl.StaticSeq seq = new StaticControl.StaticSeq(promotion.convertAll(run, builder));
    seq.attributes().insert(Attribute.COMPACTABLE);
    return List.of(seq);
  }

  @Override
  public Action finishPar(Control.Par s, Component comp) {
    OptionalLong latency = s.attributes().get(Attribute.PROMOTABLE);
    if (latency.isPresent()) {
      if (totalSize(s.stmts()) <= threshold) {
        return Action.CONTINUE;
      } else if (withinCycleLimit(latency.getAsLong())) {
        return Action.change(promotion.convertToStatic(s, builder(comp)));
      }
    }
    List<Control> promotable = new ArrayList<>();
    List<Control> dynamic = new ArrayList<>();
    for (Control stmt : s.stmts()) {
      if (PromotionAnalysis.canBePromoted(stmt)) {
        promotable.add(stmt);
      } else {
        dynamic.add(stmt);
      }
    }
    List<Control> result = promoteParThreads(promotable, builder(comp));
    result.addAll(dynamic);
    s.stmts().clear();
    s.stmts().addAll(result);
    return Action.CONTINUE;
  }

  /**
   * Returns the statements that replace the promotable children of a par, combining as many of
   * them as possible into a single static par.
   */
  private List<Control> promoteParThreads(List<Control> threads, Builder builder) {
    if (threads.size() <= 1 || totalSize(threads) <= threshold) {
      return new ArrayList<>(threads);
    }
    long latency =
        threads.stream().mapToLong(PromotionAnalysis::inferredLatency).max().getAsLong();
    if (!withinCycleLimit(latency)) {
      Control largest = threads.get(0);
      for (Control c : threads) {
        if (approxSize(c) > approxSize(largest)) {
          largest = c;
        }
      }
      List<Control> rest = new ArrayList<>(threads);
      rest.remove(largest);
      List<Control> result = promoteParThreads(rest, builder);
      result.add(largest);
      return result;
    }
    List<Control> result = new ArrayList<>();
    result.add(new StaticControl.StaticPar(promotion.convertAll(threads, builder)));
    return result;
  }
}
