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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Optional;
import org.hardloom.ir.Primitive.PortDef;

/**
 * Adds cells, groups and assignments to a component, choosing fresh names and sharing constant
 * cells.
 */
public final class Builder {
  public final Component comp;
  private final LibrarySignatures lib;

  public Builder(Component comp, LibrarySignatures lib) {
    this.comp = comp;
    this.lib = lib;
  }

  /**
   * Adds an instance of the named primitive, binding the given values to its parameters in order.
   * The primitive must be in the library.
   */
  public Cell addPrimitive(String prefix, String primitive, long... params) {
    Optional<Primitive> found = lib.find(primitive);
    Preconditions.checkArgument(found.isPresent(), "Unknown primitive %s", primitive);
    Primitive prim = found.get();
    Preconditions.checkArgument(
        params.length == prim.params().size(), "Wrong number of parameters for %s", primitive);
    ImmutableMap.Builder<String, Long> bindings = ImmutableMap.builder();
    for (int i = 0; i < params.length; i++) {
      bindings.put(prim.params().get(i), params[i]);
    }
    ImmutableMap<String, Long> bound = bindings.buildOrThrow();
    Cell cell =
        new Cell(comp.generateName(prefix), Cell.Kind.PRIMITIVE, primitive, bound, 0);
    for (PortDef def : prim.ports()) {
      cell.addPort(
          def.name(),
          def.resolveWidth(bound),
          def.direction(),
          Attributes.copyOf(def.attributes()));
    }
    comp.addCell(cell);
    return cell;
  }

  /** Adds an instance of another component. */
  public Cell addComponentCell(String prefix, Component callee) {
    Cell cell =
        new Cell(comp.generateName(prefix), Cell.Kind.COMPONENT, callee.name, ImmutableMap.of(), 0);
    for (Port p : callee.signature.ports()) {
      cell.addPort(p.name, p.width, p.direction.reverse(), Attributes.copyOf(p.attributes));
    }
    comp.addCell(cell);
    return cell;
  }

  /** Returns a constant cell with the given value and width, creating it if necessary. */
  public Cell addConstant(long value, int width) {
    Preconditions.checkArgument(
        width >= 64 || value >>> width == 0, "%s does not fit in %s bits", value, width);
    String name = "const" + value + "_" + width;
    Optional<Cell> existing = comp.findCell(name);
    if (existing.isPresent()) {
      return existing.get();
    }
    Cell cell = new Cell(name, Cell.Kind.CONSTANT, "std_const", ImmutableMap.of(), value);
    cell.addPort("out", width, Direction.OUTPUT, new Attributes());
    comp.addCell(cell);
    return cell;
  }

  /** Returns the output port of a constant cell. */
  public Port constant(long value, int width) {
    return addConstant(value, width).get("out");
  }

  /** Returns the output of the 1-bit constant 1. */
  public Port one() {
    return constant(1, 1);
  }

  public Group addGroup(String prefix) {
    return addGroup(new Group(comp.generateName(prefix), Group.Kind.DYNAMIC, 0));
  }

  public Group addStaticGroup(String prefix, long latency) {
    return addGroup(new Group(comp.generateName(prefix), Group.Kind.STATIC, latency));
  }

  public Group addCombGroup(String prefix) {
    return addGroup(new Group(comp.generateName(prefix), Group.Kind.COMBINATIONAL, 0));
  }

  private Group addGroup(Group group) {
    comp.addGroup(group);
    return group;
  }

  /** Returns an unconditional assignment; it is not added anywhere. */
  public Assignment assign(Port dst, Port src) {
    return assign(dst, src, Guard.TRUE);
  }

  /** Returns a guarded assignment; it is not added anywhere. */
  public Assignment assign(Port dst, Port src, Guard guard) {
    Preconditions.checkArgument(
        dst.width == src.width, "Width mismatch in %s = %s", dst, src);
    return new Assignment(dst, src, guard);
  }

  /** Returns a static assignment that is active during {@code interval}. */
  public Assignment assign(Port dst, Port src, Guard guard, Interval interval) {
    return assign(dst, src, guard).withInterval(interval);
  }

  /** Adds the given assignments to {@code group}. */
  @CanIgnoreReturnValue
  public Builder addTo(Group group, List<Assignment> assignments) {
    group.assignments().addAll(assignments);
    return this;
  }

  /** Adds the given assignments to the component's continuous assignments. */
  @CanIgnoreReturnValue
  public Builder addContinuous(List<Assignment> assignments) {
    comp.continuousAssignments().addAll(assignments);
    return this;
  }
}
