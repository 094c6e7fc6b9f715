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

package org.hardloom.traversal;

import org.hardloom.CompileError;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control.Enable;
import org.hardloom.ir.Control.If;
import org.hardloom.ir.Control.Invoke;
import org.hardloom.ir.Control.Par;
import org.hardloom.ir.Control.Repeat;
import org.hardloom.ir.Control.Seq;
import org.hardloom.ir.Control.While;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.Empty;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.hardloom.ir.StaticControl.StaticIf;
import org.hardloom.ir.StaticControl.StaticInvoke;
import org.hardloom.ir.StaticControl.StaticPar;
import org.hardloom.ir.StaticControl.StaticRepeat;
import org.hardloom.ir.StaticControl.StaticSeq;
import org.jspecify.annotations.Nullable;

/**
 * A compiler pass, expressed as hooks that are called while traversing each component's control
 * program. Compound statements have a start hook (called before the children are visited) and a
 * finish hook (called after); leaf statements have a single hook. Every hook defaults to returning
 * {@link Action#CONTINUE}.
 *
 * <p>A static statement that appears in a dynamic position is bracketed by {@link
 * #startStaticControl} and {@link #finishStaticControl}, in addition to its own hooks.
 *
 * <p>Visitors are constructed fresh for each run, so they may keep state across components.
 */
public interface Visitor {

  PassInfo info();

  /** The order in which components are visited. */
  default Order order() {
    return Order.NONE;
  }

  /** If this returns non-null the pass is skipped, and the result is logged as the reason. */
  default @Nullable String precondition(Context ctx) {
    return null;
  }

  /** Called before traversing a component's control. */
  default Action start(Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  /** Called after traversing a component's control. */
  default Action finish(Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  /** Called once, after every component has been visited. */
  default void finishContext(Context ctx) throws CompileError {}

  default Action startSeq(Seq s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishSeq(Seq s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startPar(Par s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishPar(Par s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startIf(If s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishIf(If s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startWhile(While s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishWhile(While s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startRepeat(Repeat s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishRepeat(Repeat s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action enable(Enable s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action invoke(Invoke s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  /** Called for Empty statements in both dynamic and static positions. */
  default Action empty(Empty s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startStaticControl(StaticControl s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishStaticControl(StaticControl s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startStaticSeq(StaticSeq s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishStaticSeq(StaticSeq s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startStaticPar(StaticPar s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishStaticPar(StaticPar s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startStaticIf(StaticIf s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishStaticIf(StaticIf s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action startStaticRepeat(StaticRepeat s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action finishStaticRepeat(StaticRepeat s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action staticEnable(StaticEnable s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  default Action staticInvoke(StaticInvoke s, Component comp) throws CompileError {
    return Action.CONTINUE;
  }

  /** Runs this pass over every component of {@code ctx}. */
  default void doPass(Context ctx) throws CompileError {
    ControlWalker.run(this, ctx);
  }

  /** Runs this pass over a single component, ignoring {@link #order} and {@link #precondition}. */
  default void traverseComponent(Component comp) throws CompileError {
    ControlWalker.traverseComponent(this, comp);
  }
}
