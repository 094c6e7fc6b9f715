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

package org.hardloom.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A named set of assignments that is activated by control.
 *
 * <ul>
 *   <li>A DYNAMIC group has {@code go} and {@code done} holes; exactly one assignment is expected
 *       to drive {@code done}.
 *   <li>A STATIC group has a positive latency and only a {@code go} hole; its assignments may carry
 *       intervals relative to the cycle in which it was started.
 *   <li>A COMBINATIONAL group has no holes; it is used to compute the condition of an if or while.
 * </ul>
 */
public final class Group {

  public enum Kind {
    DYNAMIC,
    STATIC,
    COMBINATIONAL
  }

  public final String name;
  public final Kind kind;
  public final Attributes attributes = new Attributes();

  private final List<Assignment> assignments = new ArrayList<>();
  private final @Nullable Port go;
  private final @Nullable Port done;
  private final long latency;

  Group(String name, Kind kind, long latency) {
    Preconditions.checkArgument(
        (kind == Kind.STATIC) == (latency > 0), "Bad latency %s for %s group", latency, kind);
    this.name = name;
    this.kind = kind;
    this.latency = latency;
    this.go = (kind == Kind.COMBINATIONAL) ? null : new Port("go", this);
    this.done = (kind == Kind.DYNAMIC) ? new Port("done", this) : null;
  }

  public Port go() {
    Preconditions.checkState(go != null, "%s has no go hole", name);
    return go;
  }

  public Port done() {
    Preconditions.checkState(done != null, "%s has no done hole", name);
    return done;
  }

  public boolean isStatic() {
    return kind == Kind.STATIC;
  }

  /** Returns the latency of a static group. */
  public long latency() {
    Preconditions.checkState(kind == Kind.STATIC, "%s is not static", name);
    return latency;
  }

  /** The (mutable) list of this group's assignments. */
  public List<Assignment> assignments() {
    return assignments;
  }

  /** Returns the assignments that drive this group's done hole. */
  public ImmutableList<Assignment> doneAssignments() {
    if (done == null) {
      return ImmutableList.of();
    }
    return assignments.stream()
        .filter(a -> a.dst() == done)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    return name;
  }
}
