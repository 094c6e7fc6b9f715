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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hardloom.CompileError;
import org.hardloom.ir.Primitive.PortDef;

/**
 * A component: a signature, cells, groups, continuous assignments, and a control program.
 *
 * <p>Cells and groups are owned by the component and addressed by name; control statements,
 * assignments and guards refer to them directly. Use a {@link Builder} to add cells and groups.
 */
public final class Component {
  public final String name;

  /** The THIS_COMPONENT cell whose ports are the component's interface, seen from inside. */
  public final Cell signature;

  public final Attributes attributes = new Attributes();

  private final Map<String, Cell> cells = new LinkedHashMap<>();
  private final Map<String, Group> groups = new LinkedHashMap<>();
  private final List<Assignment> continuousAssignments = new ArrayList<>();
  private final Map<String, Integer> nameCounters = new HashMap<>();
  private Control control = Control.empty();

  /**
   * Creates a component with the given interface. Port directions are given as seen by users of
   * the component, so {@code go} is an input.
   */
  public Component(String name, List<PortDef> interfacePorts) {
    this.name = name;
    this.signature = new Cell(name, Cell.Kind.THIS_COMPONENT, name, ImmutableMap.of(), 0);
    for (PortDef def : interfacePorts) {
      signature.addPort(
          def.name(),
          def.resolveWidth(ImmutableMap.of()),
          def.direction().reverse(),
          Attributes.copyOf(def.attributes()));
    }
  }

  /** Creates a component with 1-bit {@code go} and {@code done} ports plus the given ports. */
  public static Component withGoDone(String name, PortDef... ports) {
    List<PortDef> all = new ArrayList<>();
    all.add(PortDef.input("go", 1).with(Attribute.GO, 1));
    all.add(PortDef.output("done", 1).with(Attribute.DONE, 1));
    Collections.addAll(all, ports);
    return new Component(name, all);
  }

  public Optional<Cell> findCell(String cellName) {
    return Optional.ofNullable(cells.get(cellName));
  }

  public Cell cell(String cellName) throws CompileError {
    Cell cell = cells.get(cellName);
    if (cell == null) {
      throw CompileError.undefined(cellName, "cell");
    }
    return cell;
  }

  public Optional<Group> findGroup(String groupName) {
    return Optional.ofNullable(groups.get(groupName));
  }

  public Group group(String groupName) throws CompileError {
    Group group = groups.get(groupName);
    if (group == null) {
      throw CompileError.undefined(groupName, "group");
    }
    return group;
  }

  public Collection<Cell> cells() {
    return Collections.unmodifiableCollection(cells.values());
  }

  public Collection<Group> groups() {
    return Collections.unmodifiableCollection(groups.values());
  }

  /** Returns the groups of the given kind, in the order they were added. */
  public ImmutableList<Group> groups(Group.Kind kind) {
    return groups.values().stream()
        .filter(g -> g.kind == kind)
        .collect(ImmutableList.toImmutableList());
  }

  public void removeGroup(Group group) {
    Preconditions.checkArgument(groups.remove(group.name, group), "%s not in %s", group, name);
  }

  /** The (mutable) list of assignments that are active whenever the component is. */
  public List<Assignment> continuousAssignments() {
    return continuousAssignments;
  }

  public Control control() {
    return control;
  }

  public void setControl(Control control) {
    this.control = control;
  }

  /** Returns the component's go ports, in declaration order. */
  public ImmutableList<Port> goPorts() {
    return signature.portsWith(Attribute.GO);
  }

  /** Returns true if the component has no groups and no control, i.e. only continuous wires. */
  public boolean isStructural() {
    return groups.isEmpty() && control instanceof StaticControl.Empty;
  }

  /**
   * Returns a name based on {@code prefix} that is not yet used by any cell or group of this
   * component.
   */
  public String generateName(String prefix) {
    String result = prefix;
    while (cells.containsKey(result) || groups.containsKey(result)) {
      int n = nameCounters.merge(prefix, 1, Integer::sum) - 1;
      result = prefix + n;
    }
    return result;
  }

  void addCell(Cell cell) {
    Preconditions.checkArgument(cells.putIfAbsent(cell.name, cell) == null, "Duplicate %s", cell);
  }

  void addGroup(Group group) {
    Preconditions.checkArgument(
        !cells.containsKey(group.name) && groups.putIfAbsent(group.name, group) == null,
        "Duplicate %s",
        group);
  }

  @Override
  public String toString() {
    return Printer.component(this);
  }
}
