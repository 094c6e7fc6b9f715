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

package org.hardloom.analysis;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Control;
import org.hardloom.ir.Control.Binding;
import org.hardloom.ir.Group;
import org.hardloom.ir.Port;
import org.hardloom.ir.StaticControl;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.hardloom.ir.StaticControl.StaticIf;
import org.hardloom.ir.StaticControl.StaticInvoke;
import org.hardloom.ir.StaticControl.StaticPar;
import org.hardloom.ir.StaticControl.StaticRepeat;
import org.hardloom.ir.StaticControl.StaticSeq;
import org.jspecify.annotations.Nullable;

/**
 * The ports read and written by a control statement or a set of assignments. Group holes are never
 * included.
 */
public record ReadWriteSet(ImmutableSet<Port> reads, ImmutableSet<Port> writes) {

  /** Returns the ports read and written by the given assignments. */
  public static ReadWriteSet of(Iterable<Assignment> assignments) {
    Accumulator acc = new Accumulator();
    acc.addAssignments(assignments);
    return acc.build();
  }

  /**
   * Returns the ports read and written by {@code c}: the ports of every assignment in a group it
   * enables (including guards), the condition ports and condition groups of ifs and whiles, and
   * the ports of any cell it invokes.
   */
  public static ReadWriteSet of(Control c) {
    Accumulator acc = new Accumulator();
    acc.addControl(c);
    return acc.build();
  }

  /** Returns the cells read by this set, ignoring constants and the component's own signature. */
  public ImmutableSet<Cell> readCells() {
    return cells(reads);
  }

  /** Returns the cells written by this set, ignoring constants and the component's signature. */
  public ImmutableSet<Cell> writeCells() {
    return cells(writes);
  }

  /** Returns the cells that own the given ports, ignoring constants and THIS_COMPONENT. */
  public static ImmutableSet<Cell> cells(Collection<Port> ports) {
    return ports.stream()
        .filter(p -> !p.isHole())
        .map(Port::cell)
        .filter(c -> c.kind != Cell.Kind.CONSTANT && c.kind != Cell.Kind.THIS_COMPONENT)
        .collect(ImmutableSet.toImmutableSet());
  }

  private static class Accumulator {
    final Set<Port> reads = new LinkedHashSet<>();
    final Set<Port> writes = new LinkedHashSet<>();

    ReadWriteSet build() {
      return new ReadWriteSet(ImmutableSet.copyOf(reads), ImmutableSet.copyOf(writes));
    }

    void read(Port p) {
      if (!p.isHole()) {
        reads.add(p);
      }
    }

    void write(Port p) {
      if (!p.isHole()) {
        writes.add(p);
      }
    }

    void addAssignments(Iterable<Assignment> assignments) {
      for (Assignment a : assignments) {
        read(a.src());
        a.guard().allPorts().forEach(this::read);
        write(a.dst());
      }
    }

    void addGroup(@Nullable Group g) {
      if (g != null) {
        addAssignments(g.assignments());
      }
    }

    void addInvoke(Cell comp, Collection<Binding> inputs, Collection<Binding> outputs) {
      for (Binding b : inputs) {
        read(b.actual());
        write(b.formal());
      }
      for (Binding b : outputs) {
        read(b.formal());
        write(b.actual());
      }
      comp.portsWith(Attribute.GO).forEach(this::write);
      comp.portsWith(Attribute.DONE).forEach(this::read);
    }

    void addControl(Control c) {
      if (c instanceof Control.Seq s) {
        s.stmts().forEach(this::addControl);
      } else if (c instanceof Control.Par s) {
        s.stmts().forEach(this::addControl);
      } else if (c instanceof Control.If s) {
        read(s.port);
        addGroup(s.cond);
        addControl(s.tbranch());
        addControl(s.fbranch());
      } else if (c instanceof Control.While s) {
        read(s.port);
        addGroup(s.cond);
        addControl(s.body());
      } else if (c instanceof Control.Repeat s) {
        addControl(s.body());
      } else if (c instanceof Control.Enable s) {
        addGroup(s.group);
      } else if (c instanceof Control.Invoke s) {
        addInvoke(s.comp, s.inputs, s.outputs);
        addGroup(s.combGroup);
      } else if (c instanceof StaticControl sc) {
        addStatic(sc);
      }
    }

    void addStatic(StaticControl c) {
      if (c instanceof StaticSeq s) {
        s.stmts().forEach(this::addStatic);
      } else if (c instanceof StaticPar s) {
        s.stmts().forEach(this::addStatic);
      } else if (c instanceof StaticIf s) {
        read(s.port);
        addStatic(s.tbranch());
        addStatic(s.fbranch());
      } else if (c instanceof StaticRepeat s) {
        addStatic(s.body());
      } else if (c instanceof StaticEnable s) {
        addGroup(s.group);
      } else if (c instanceof StaticInvoke s) {
        addInvoke(s.comp, s.inputs, s.outputs);
      }
    }
  }
}
