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

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.util.List;
import org.hardloom.CompileError;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.Empty;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.hardloom.ir.StaticControl.StaticIf;
import org.hardloom.ir.StaticControl.StaticInvoke;
import org.hardloom.ir.StaticControl.StaticPar;
import org.hardloom.ir.StaticControl.StaticRepeat;
import org.hardloom.ir.StaticControl.StaticSeq;

/**
 * Drives a {@link Visitor} over a component's control tree, interpreting the {@link Action}
 * returned by each hook and storing replacements into the parent statement.
 */
public final class ControlWalker {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Visitor visitor;
  private final Component comp;

  /** Set when a hook returns STOP; no further hooks are called once it is set. */
  private boolean stopped;

  private ControlWalker(Visitor visitor, Component comp) {
    this.visitor = visitor;
    this.comp = comp;
  }

  /** Runs {@code visitor} over the components of {@code ctx} in the order it requests. */
  static void run(Visitor visitor, Context ctx) throws CompileError {
    String name = visitor.info().name();
    String skipReason = visitor.precondition(ctx);
    if (skipReason != null) {
      logger.atInfo().log("Skipping pass %s: %s", name, skipReason);
      return;
    }
    for (Component comp : CompTraversal.order(ctx, visitor.order())) {
      logger.atFine().log("Running %s on %s", name, comp.name);
      traverseComponent(visitor, comp);
    }
    visitor.finishContext(ctx);
  }

  static void traverseComponent(Visitor visitor, Component comp) throws CompileError {
    Action start = visitor.start(comp);
    if (start.isChange()) {
      comp.setControl(start.replacement());
      return;
    }
    Action walked =
        start
            .andThen(
                () -> {
                  ControlWalker walker = new ControlWalker(visitor, comp);
                  comp.setControl(walker.walk(comp.control()));
                  return walker.stopped ? Action.STOP : Action.CONTINUE;
                })
            .pop();
    if (walked.kind == Action.Kind.CONTINUE) {
      Action finish = visitor.finish(comp);
      if (finish.isChange()) {
        comp.setControl(finish.replacement());
      }
    }
  }

  /** Visits {@code c} and its descendants, returning the statement that should replace it. */
  private Control walk(Control c) throws CompileError {
    Action start = startHook(c);
    if (start.kind == Action.Kind.STOP) {
      stopped = true;
      return c;
    } else if (start.isChange()) {
      return start.replacement();
    } else if (start.kind == Action.Kind.CONTINUE) {
      c = walkChildren(c);
      if (stopped) {
        return c;
      }
    }
    return applyFinish(finishHook(c), c);
  }

  /** Like {@link #walk}, but {@code c} is in a position that requires a static statement. */
  private StaticControl walkStatic(StaticControl c) throws CompileError {
    Action start = staticStartHook(c);
    Control result;
    if (start.kind == Action.Kind.STOP) {
      stopped = true;
      return c;
    } else if (start.isChange()) {
      result = start.replacement();
    } else {
      if (start.kind == Action.Kind.CONTINUE) {
        c = walkStaticChildren(c);
        if (stopped) {
          return c;
        }
      }
      result = applyFinish(staticFinishHook(c), c);
    }
    Preconditions.checkState(
        result instanceof StaticControl, "Static position replaced by dynamic %s", result);
    return (StaticControl) result;
  }

  /** Returns the statement that should replace {@code c}, given its finish hook's action. */
  private Control applyFinish(Action action, Control c) {
    if (action.kind == Action.Kind.STOP) {
      stopped = true;
    } else if (action.isChange()) {
      return action.replacement();
    }
    return c;
  }

  private Action startHook(Control c) throws CompileError {
    if (c instanceof Empty empty) {
      return visitor.empty(empty, comp);
    } else if (c instanceof StaticControl sc) {
      return visitor.startStaticControl(sc, comp);
    } else if (c instanceof Control.Seq s) {
      return visitor.startSeq(s, comp);
    } else if (c instanceof Control.Par s) {
      return visitor.startPar(s, comp);
    } else if (c instanceof Control.If s) {
      return visitor.startIf(s, comp);
    } else if (c instanceof Control.While s) {
      return visitor.startWhile(s, comp);
    } else if (c instanceof Control.Repeat s) {
      return visitor.startRepeat(s, comp);
    } else if (c instanceof Control.Enable s) {
      return visitor.enable(s, comp);
    } else if (c instanceof Control.Invoke s) {
      return visitor.invoke(s, comp);
    }
    throw new AssertionError();
  }

  private Action finishHook(Control c) throws CompileError {
    if (c instanceof Empty) {
      return Action.CONTINUE;
    } else if (c instanceof StaticControl sc) {
      return visitor.finishStaticControl(sc, comp);
    } else if (c instanceof Control.Seq s) {
      return visitor.finishSeq(s, comp);
    } else if (c instanceof Control.Par s) {
      return visitor.finishPar(s, comp);
    } else if (c instanceof Control.If s) {
      return visitor.finishIf(s, comp);
    } else if (c instanceof Control.While s) {
      return visitor.finishWhile(s, comp);
    } else if (c instanceof Control.Repeat s) {
      return visitor.finishRepeat(s, comp);
    }
    return Action.CONTINUE;
  }

  private Control walkChildren(Control c) throws CompileError {
    if (c instanceof Empty) {
      return c;
    } else if (c instanceof StaticControl sc) {
      // A static statement in a dynamic position; its own hooks run inside the bracketing
      // startStaticControl/finishStaticControl calls.
      return walkStatic(sc);
    } else if (c instanceof Control.Seq s) {
      walkList(s.stmts());
    } else if (c instanceof Control.Par s) {
      walkList(s.stmts());
    } else if (c instanceof Control.If s) {
      s.setTbranch(walk(s.tbranch()));
      if (!stopped) {
        s.setFbranch(walk(s.fbranch()));
      }
    } else if (c instanceof Control.While s) {
      s.setBody(walk(s.body()));
    } else if (c instanceof Control.Repeat s) {
      s.setBody(walk(s.body()));
    }
    return c;
  }

  private void walkList(List<Control> stmts) throws CompileError {
    for (int i = 0; i < stmts.size() && !stopped; i++) {
      stmts.set(i, walk(stmts.get(i)));
    }
  }

  private Action staticStartHook(StaticControl c) throws CompileError {
    if (c instanceof Empty empty) {
      return visitor.empty(empty, comp);
    } else if (c instanceof StaticSeq s) {
      return visitor.startStaticSeq(s, comp);
    } else if (c instanceof StaticPar s) {
      return visitor.startStaticPar(s, comp);
    } else if (c instanceof StaticIf s) {
      return visitor.startStaticIf(s, comp);
    } else if (c instanceof StaticRepeat s) {
      return visitor.startStaticRepeat(s, comp);
    } else if (c instanceof StaticEnable s) {
      return visitor.staticEnable(s, comp);
    } else if (c instanceof StaticInvoke s) {
      return visitor.staticInvoke(s, comp);
    }
    throw new AssertionError();
  }

  private Action staticFinishHook(StaticControl c) throws CompileError {
    if (c instanceof StaticSeq s) {
      return visitor.finishStaticSeq(s, comp);
    } else if (c instanceof StaticPar s) {
      return visitor.finishStaticPar(s, comp);
    } else if (c instanceof StaticIf s) {
      return visitor.finishStaticIf(s, comp);
    } else if (c instanceof StaticRepeat s) {
      return visitor.finishStaticRepeat(s, comp);
    }
    return Action.CONTINUE;
  }

  private StaticControl walkStaticChildren(StaticControl c) throws CompileError {
    if (c instanceof StaticSeq s) {
      walkStaticList(s.stmts());
    } else if (c instanceof StaticPar s) {
      walkStaticList(s.stmts());
    } else if (c instanceof StaticIf s) {
      s.setTbranch(walkStatic(s.tbranch()));
      if (!stopped) {
        s.setFbranch(walkStatic(s.fbranch()));
      }
    } else if (c instanceof StaticRepeat s) {
      s.setBody(walkStatic(s.body()));
    }
    return c;
  }

  private void walkStaticList(List<StaticControl> stmts) throws CompileError {
    for (int i = 0; i < stmts.size() && !stopped; i++) {
      stmts.set(i, walkStatic(stmts.get(i)));
    }
  }
}
