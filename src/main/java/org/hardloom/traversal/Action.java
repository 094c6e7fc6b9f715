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
import org.hardloom.CompileError;
import org.hardloom.ir.Control;
import org.hardloom.ir.StaticControl;
import org.jspecify.annotations.Nullable;

/**
 * The result of a visitor hook, telling the traversal how to proceed.
 *
 * <ul>
 *   <li>CONTINUE visits the node's children and then runs its finish hook.
 *   <li>SKIP_CHILDREN does not descend into the node's children, but still runs its finish hook
 *       and continues with its siblings.
 *   <li>STOP abandons the rest of the traversal of the current component.
 *   <li>CHANGE and STATIC_CHANGE replace the current node. When returned by a start hook the
 *       replacement's children are not visited and the finish hook is not run.
 * </ul>
 */
public final class Action {

  public enum Kind {
    CONTINUE,
    SKIP_CHILDREN,
    STOP,
    CHANGE,
    STATIC_CHANGE
  }

  public static final Action CONTINUE = new Action(Kind.CONTINUE, null);
  public static final Action SKIP_CHILDREN = new Action(Kind.SKIP_CHILDREN, null);
  public static final Action STOP = new Action(Kind.STOP, null);

  public final Kind kind;
  private final @Nullable Control replacement;

  private Action(Kind kind, @Nullable Control replacement) {
    this.kind = kind;
    this.replacement = replacement;
  }

  /** Replaces the current node with {@code replacement}. */
  public static Action change(Control replacement) {
    return new Action(Kind.CHANGE, Preconditions.checkNotNull(replacement));
  }

  /** Replaces the current node with a static statement; legal in static positions. */
  public static Action staticChange(StaticControl replacement) {
    return new Action(Kind.STATIC_CHANGE, Preconditions.checkNotNull(replacement));
  }

  public boolean isChange() {
    return kind == Kind.CHANGE || kind == Kind.STATIC_CHANGE;
  }

  public Control replacement() {
    Preconditions.checkState(replacement != null, "%s has no replacement", kind);
    return replacement;
  }

  /** Something that computes an Action and may fail. */
  @FunctionalInterface
  public interface Step {
    Action get() throws CompileError;
  }

  /** If this is CONTINUE, returns the result of {@code next}; otherwise returns this. */
  public Action andThen(Step next) throws CompileError {
    return (kind == Kind.CONTINUE) ? next.get() : this;
  }

  /** Turns SKIP_CHILDREN into CONTINUE, once the children have been (not) visited. */
  public Action pop() {
    return (kind == Kind.SKIP_CHILDREN) ? CONTINUE : this;
  }

  @Override
  public String toString() {
    return (replacement == null) ? kind.name() : kind + "(" + replacement + ")";
  }
}
