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
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A boolean expression over port values that gates an assignment. There are exactly six classes
 * that implement Guard, all defined in this file: True, PortGuard, Not, And, Or, and CompOp.
 *
 * <p>Guards should be built with the static factory methods ({@link #port}, {@link #and}, {@link
 * #or}, {@link #not}, {@link #compare}), which fold constants and drop redundant terms; in
 * particular a guard on a 1-bit constant 1 (the {@code 1'd1 ?} pattern) is canonicalized to {@link
 * #TRUE}.
 */
public sealed interface Guard {
  Guard TRUE = new True();

  /** There is no separate False class; false is represented as {@code !true}. */
  Guard FALSE = new Not(TRUE);

  record True() implements Guard {
    @Override
    public String toString() {
      return Printer.guard(this);
    }
  }

  record PortGuard(Port port) implements Guard {
    @Override
    public String toString() {
      return Printer.guard(this);
    }
  }

  record Not(Guard inner) implements Guard {
    @Override
    public String toString() {
      return Printer.guard(this);
    }
  }

  record And(Guard left, Guard right) implements Guard {
    @Override
    public String toString() {
      return Printer.guard(this);
    }
  }

  record Or(Guard left, Guard right) implements Guard {
    @Override
    public String toString() {
      return Printer.guard(this);
    }
  }

  record CompOp(PortComp op, Port left, Port right) implements Guard {
    @Override
    public String toString() {
      return Printer.guard(this);
    }
  }

  static Guard port(Port port) {
    return port.isConstant(1, 1) ? TRUE : new PortGuard(port);
  }

  static Guard not(Guard g) {
    if (g instanceof Not not) {
      return not.inner;
    } else if (g instanceof CompOp cmp) {
      return new CompOp(cmp.op.negate(), cmp.left, cmp.right);
    }
    return new Not(g);
  }

  static Guard and(Guard left, Guard right) {
    if (left.isTrue() || right.isFalse()) {
      return right;
    } else if (right.isTrue() || left.isFalse() || left.equals(right)) {
      return left;
    }
    return new And(left, right);
  }

  static Guard or(Guard left, Guard right) {
    if (left.isTrue() || right.isFalse()) {
      return left;
    } else if (right.isTrue() || left.isFalse() || left.equals(right)) {
      return right;
    }
    return new Or(left, right);
  }

  static Guard compare(PortComp op, Port left, Port right) {
    return new CompOp(op, left, right);
  }

  static Guard eq(Port left, Port right) {
    return new CompOp(PortComp.EQ, left, right);
  }

  /** Returns the conjunction of the given guards, or TRUE if there are none. */
  static Guard andAll(Iterable<Guard> guards) {
    Guard result = TRUE;
    for (Guard g : guards) {
      result = and(result, g);
    }
    return result;
  }

  /** Returns the disjunction of the given guards, or FALSE if there are none. */
  static Guard orAll(Iterable<Guard> guards) {
    Guard result = FALSE;
    for (Guard g : guards) {
      result = or(result, g);
    }
    return result;
  }

  default boolean isTrue() {
    return this instanceof True;
  }

  default boolean isFalse() {
    return this instanceof Not not && not.inner.isTrue();
  }

  /** Returns each port read by this guard, without duplicates, in left-to-right order. */
  default ImmutableList<Port> allPorts() {
    Set<Port> ports = new LinkedHashSet<>();
    collectPorts(this, ports);
    return ImmutableList.copyOf(ports);
  }

  private static void collectPorts(Guard g, Set<Port> ports) {
    if (g instanceof PortGuard pg) {
      ports.add(pg.port);
    } else if (g instanceof Not not) {
      collectPorts(not.inner, ports);
    } else if (g instanceof And and) {
      collectPorts(and.left, ports);
      collectPorts(and.right, ports);
    } else if (g instanceof Or or) {
      collectPorts(or.left, ports);
      collectPorts(or.right, ports);
    } else if (g instanceof CompOp cmp) {
      ports.add(cmp.left);
      ports.add(cmp.right);
    }
  }

  /** Returns an equivalent guard with each port replaced by the result of {@code fn}. */
  default Guard mapPorts(UnaryOperator<Port> fn) {
    if (this instanceof PortGuard pg) {
      return port(fn.apply(pg.port));
    } else if (this instanceof Not not) {
      return not(not.inner.mapPorts(fn));
    } else if (this instanceof And and) {
      return and(and.left.mapPorts(fn), and.right.mapPorts(fn));
    } else if (this instanceof Or or) {
      return or(or.left.mapPorts(fn), or.right.mapPorts(fn));
    } else if (this instanceof CompOp cmp) {
      return compare(cmp.op, fn.apply(cmp.left), fn.apply(cmp.right));
    }
    return this;
  }

  /**
   * Returns a guard in which each single-port term has been replaced by the result of {@code fn}.
   * Ports that appear in comparisons are left unchanged.
   */
  default Guard substitute(Function<Port, Guard> fn) {
    if (this instanceof PortGuard pg) {
      return fn.apply(pg.port);
    } else if (this instanceof Not not) {
      return not(not.inner.substitute(fn));
    } else if (this instanceof And and) {
      return and(and.left.substitute(fn), and.right.substitute(fn));
    } else if (this instanceof Or or) {
      return or(or.left.substitute(fn), or.right.substitute(fn));
    }
    return this;
  }
}
