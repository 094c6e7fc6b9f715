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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates guards against a fixed assignment of values to ports. Constant ports have their own
 * values; any other port without a value reads as 0.
 */
public final class GuardEvaluator {
  private final Map<Port, Long> values = new HashMap<>();

  public GuardEvaluator set(Port port, long value) {
    values.put(port, value);
    return this;
  }

  public long value(Port port) {
    if (!port.isHole() && port.cell().kind == Cell.Kind.CONSTANT) {
      return port.cell().constantValue();
    }
    return values.getOrDefault(port, 0L);
  }

  public boolean eval(Guard g) {
    if (g.isTrue()) {
      return true;
    } else if (g instanceof Guard.PortGuard pg) {
      return value(pg.port()) != 0;
    } else if (g instanceof Guard.Not not) {
      return !eval(not.inner());
    } else if (g instanceof Guard.And and) {
      return eval(and.left()) && eval(and.right());
    } else if (g instanceof Guard.Or or) {
      return eval(or.left()) || eval(or.right());
    } else if (g instanceof Guard.CompOp cmp) {
      return cmp.op().test(value(cmp.left()), value(cmp.right()));
    }
    throw new AssertionError();
  }

  /** Returns the assignments whose guards currently hold. */
  public ImmutableList<Assignment> active(List<Assignment> assignments) {
    return assignments.stream()
        .filter(a -> eval(a.guard()))
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns true if some active assignment writes {@code dst}. */
  public boolean drives(List<Assignment> assignments, Port dst) {
    return active(assignments).stream().anyMatch(a -> a.dst() == dst);
  }
}
