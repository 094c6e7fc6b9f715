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
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Drives {@code dst} from {@code src} whenever {@code guard} holds. A static assignment also has an
 * interval, relative to the start of its static group, outside of which it is inactive.
 */
public record Assignment(Port dst, Port src, Guard guard, @Nullable Interval interval) {

  public Assignment {
    Preconditions.checkNotNull(dst);
    Preconditions.checkNotNull(src);
    Preconditions.checkNotNull(guard);
  }

  public Assignment(Port dst, Port src, Guard guard) {
    this(dst, src, guard, null);
  }

  public boolean isStatic() {
    return interval != null;
  }

  /** Returns this assignment with its guard replaced. */
  public Assignment withGuard(Guard newGuard) {
    return new Assignment(dst, src, newGuard, interval);
  }

  /** Returns this assignment with its guard conjoined with {@code extra}. */
  public Assignment andGuard(Guard extra) {
    return withGuard(Guard.and(guard, extra));
  }

  public Assignment withInterval(@Nullable Interval newInterval) {
    return new Assignment(dst, src, guard, newInterval);
  }

  /**
   * Returns the interval of this assignment, treating an assignment without one as active during
   * every cycle of a group with the given latency.
   */
  public Interval intervalWithin(long latency) {
    return (interval != null) ? interval : new Interval(0, latency);
  }

  /** Returns this assignment with every port (destination, source and guard) mapped by fn. */
  public Assignment mapPorts(UnaryOperator<Port> fn) {
    return new Assignment(fn.apply(dst), fn.apply(src), guard.mapPorts(fn), interval);
  }

  @Override
  public String toString() {
    return Printer.assignment(this);
  }
}
