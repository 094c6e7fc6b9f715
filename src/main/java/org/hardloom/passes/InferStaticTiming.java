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

import org.hardloom.analysis.InferenceAnalysis;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.Order;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Infers the latency of dynamic groups, control statements, and whole components, annotating each
 * with {@code @promotable}. Components are visited after the components they instantiate, so an
 * invoke of a component whose latency was inferred is itself timed.
 */
public final class InferStaticTiming implements Visitor {
  public static final PassInfo INFO =
      new PassInfo(
          "infer-static-timing", "Infers the latencies of groups, control, and components");

  private final InferenceAnalysis inference;

  public InferStaticTiming(Context ctx) {
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
    inference.inferComponent(comp);
    return Action.SKIP_CHILDREN;
  }
}
