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
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A control statement. The dynamic statements (Seq, Par, If, While, Repeat, Invoke, and Enable)
 * are defined in this file; the statically-timed statements (including Empty, which may appear in
 * either position) implement {@link StaticControl}.
 *
 * <p>Statements own their children. Passes rewrite the tree by replacing a whole subtree (see
 * {@link org.hardloom.traversal.Action}); the mutators here exist for the traversal driver and for
 * passes that rebuild a statement's children in place.
 */
public sealed interface Control
    permits Control.Seq,
        Control.Par,
        Control.If,
        Control.While,
        Control.Repeat,
        Control.Invoke,
        Control.Enable,
        StaticControl {

  Attributes attributes();

  static Seq seq(Control... stmts) {
    return new Seq(Arrays.asList(stmts));
  }

  static Par par(Control... stmts) {
    return new Par(Arrays.asList(stmts));
  }

  static Enable enable(Group group) {
    return new Enable(group);
  }

  static StaticControl.Empty empty() {
    return new StaticControl.Empty();
  }

  /** Returns true for an Empty statement, or a Seq or Par with no children. */
  static boolean isEmpty(Control c) {
    return c instanceof StaticControl.Empty
        || (c instanceof Seq seq && seq.stmts.isEmpty())
        || (c instanceof Par par && par.stmts.isEmpty());
  }

  /** Executes its children one after another. */
  final class Seq extends ControlNode implements Control {
    private final List<Control> stmts;

    public Seq(List<? extends Control> stmts) {
      this.stmts = new ArrayList<>(stmts);
    }

    /** The (mutable) list of children. */
    public List<Control> stmts() {
      return stmts;
    }
  }

  /** Executes its children simultaneously, finishing when all have finished. */
  final class Par extends ControlNode implements Control {
    private final List<Control> stmts;

    public Par(List<? extends Control> stmts) {
      this.stmts = new ArrayList<>(stmts);
    }

    /** The (mutable) list of children. */
    public List<Control> stmts() {
      return stmts;
    }
  }

  /**
   * Executes {@code tbranch} if {@code port} is high and {@code fbranch} otherwise. If {@code
   * cond} is non-null it is a combinational group that must be active while {@code port} is read.
   */
  final class If extends ControlNode implements Control {
    public final Port port;
    public final @Nullable Group cond;
    private Control tbranch;
    private Control fbranch;

    public If(Port port, @Nullable Group cond, Control tbranch, Control fbranch) {
      Preconditions.checkArgument(
          cond == null || cond.kind == Group.Kind.COMBINATIONAL, "%s is not combinational", cond);
      this.port = port;
      this.cond = cond;
      this.tbranch = tbranch;
      this.fbranch = fbranch;
    }

    public Control tbranch() {
      return tbranch;
    }

    public Control fbranch() {
      return fbranch;
    }

    public void setTbranch(Control tbranch) {
      this.tbranch = tbranch;
    }

    public void setFbranch(Control fbranch) {
      this.fbranch = fbranch;
    }
  }

  /** Executes {@code body} as long as {@code port} is high when checked. */
  final class While extends ControlNode implements Control {
    public final Port port;
    public final @Nullable Group cond;
    private Control body;

    public While(Port port, @Nullable Group cond, Control body) {
      Preconditions.checkArgument(
          cond == null || cond.kind == Group.Kind.COMBINATIONAL, "%s is not combinational", cond);
      this.port = port;
      this.cond = cond;
      this.body = body;
    }

    public Control body() {
      return body;
    }

    public void setBody(Control body) {
      this.body = body;
    }
  }

  /** Executes {@code body} a fixed number of times. */
  final class Repeat extends ControlNode implements Control {
    public final long numRepeats;
    private Control body;

    public Repeat(long numRepeats, Control body) {
      Preconditions.checkArgument(numRepeats >= 0);
      this.numRepeats = numRepeats;
      this.body = body;
    }

    public Control body() {
      return body;
    }

    public void setBody(Control body) {
      this.body = body;
    }
  }

  /** Connects a port of an invoked cell ({@code formal}) to a port of the invoking component. */
  record Binding(Port formal, Port actual) {}

  /**
   * Runs a component instance (or a primitive with a go/done interface): drives each input binding
   * into the cell, asserts its go port, and connects each output binding until done.
   */
  final class Invoke extends ControlNode implements Control {
    public final Cell comp;
    public final ImmutableList<Binding> inputs;
    public final ImmutableList<Binding> outputs;
    public final @Nullable Group combGroup;

    public Invoke(
        Cell comp,
        List<Binding> inputs,
        List<Binding> outputs,
        @Nullable Group combGroup) {
      this.comp = comp;
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
      this.combGroup = combGroup;
    }
  }

  /** Runs a dynamic group until its done hole is asserted. */
  final class Enable extends ControlNode implements Control {
    public final Group group;

    public Enable(Group group) {
      Preconditions.checkArgument(
          group.kind == Group.Kind.DYNAMIC, "Only dynamic groups can be enabled: %s", group);
      this.group = group;
    }
  }
}
