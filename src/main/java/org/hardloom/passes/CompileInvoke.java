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

package org.hardloom.passes;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.hardloom.CompileError;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Control.Binding;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.ir.Interval;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.Port;
import org.hardloom.ir.StaticControl;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Compiles each invoke into an enable of a group that drives the invoked cell's inputs and go
 * port, and connects its outputs, until the cell is done. A static invoke becomes a static group
 * that holds go for its whole latency, since every invocable cell follows the go/done protocol.
 */
public final class CompileInvoke implements Visitor {
  public static final PassInfo INFO =
      new PassInfo("compile-invoke", "Rewrites invoke statements to group enables");

  private final LibrarySignatures lib;

  public CompileInvoke(Context ctx) {
    this.lib = ctx.lib;
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  /** Returns the cell's only port with the given attribute. */
  private static Port interfacePort(Cell cell, Attribute attr) throws CompileError {
    ImmutableList<Port> ports = cell.portsWith(attr);
    if (ports.size() != 1) {
      throw CompileError.malformedStructure(
          String.format(
              "%s: cannot invoke %s, which has %s @%s ports",
              INFO.name(),
              cell.name,
              ports.size(),
              attr.name));
    }
    return ports.get(0);
  }

  /** Returns unguarded assignments that connect the bindings to the cell. */
  private static List<Assignment> bindings(
      List<Binding> inputs, List<Binding> outputs, Builder builder) {
    List<Assignment> result = new ArrayList<>();
    for (Binding b : inputs) {
      result.add(builder.assign(b.formal(), b.actual()));
    }
    for (Binding b : outputs) {
      result.add(builder.assign(b.actual(), b.formal()));
    }
    return result;
  }

  @Override
  public Action invoke(Control.Invoke s, Component comp) throws CompileError {
    Builder builder = new Builder(comp, lib);
    Port go = interfacePort(s.comp, Attribute.GO);
    Port done = interfacePort(s.comp, Attribute.DONE);
    Group group = builder.addGroup("invoke");
    Guard notDone = Guard.not(Guard.port(done));
    group.assignments().add(builder.assign(go, builder.one(), notDone));
    group.assignments().addAll(bindings(s.inputs, s.outputs, builder));
    if (s.combGroup != null) {
      group.assignments().addAll(s.combGroup.assignments());
    }
    group.assignments().add(builder.assign(group.done(), done));
    Control.Enable result = Control.enable(group);
    result.attributes().putAll(s.attributes());
    return Action.change(result);
  }

  @Override
  public Action staticInvoke(StaticControl.StaticInvoke s, Component comp) throws CompileError {
    Builder builder = new Builder(comp, lib);
    Port go = interfacePort(s.comp, Attribute.GO);
    Group group = builder.addStaticGroup("static_invoke", s.latency());
    Interval whole = new Interval(0, s.latency());
    group.assignments().add(builder.assign(go, builder.one(), Guard.TRUE, whole));
    group.assignments().addAll(bindings(s.inputs, s.outputs, builder));
    StaticControl.StaticEnable result = new StaticControl.StaticEnable(group);
    result.attributes().putAll(s.attributes());
    return Action.staticChange(result);
  }
}
