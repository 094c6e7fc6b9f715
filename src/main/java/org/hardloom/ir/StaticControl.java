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

/**
 * A control statement whose latency is known at compile time. There are exactly seven classes that
 * implement StaticControl, all defined in this file.
 *
 * <p>Latencies are computed from the children rather than stored, so rewriting a child keeps its
 * parent consistent.
 */
public sealed interface StaticControl extends Control {

  /** The number of cycles between starting this statement and its completion. */
  long latency();

  /** Does nothing, in zero cycles. May appear in both dynamic and static positions. */
  final class Empty extends ControlNode implements StaticControl {
    @Override
    public long latency() {
      return 0;
    }
  }

  /** Starts each child in the cycle after the previous child's last cycle. */
  final class StaticSeq extends ControlNode implements StaticControl {
    private final List<StaticControl> stmts;

    public StaticSeq(List<? extends StaticControl> stmts) {
      this.stmts = new ArrayList<>(stmts);
    }

    /** The (mutable) list of children. */
    public List<StaticControl> stmts() {
      return stmts;
    }

    @Override
    public long latency() {
      return stmts.stream().mapToLong(StaticControl::latency).sum();
    }
  }

  /** Starts all children in the same cycle; takes as long as the longest child. */
  final class StaticPar extends ControlNode implements StaticControl {
    private final List<StaticControl> stmts;

    public StaticPar(List<? extends StaticControl> stmts) {
      this.stmts = new ArrayList<>(stmts);
    }

    /** The (mutable) list of children. */
    public List<StaticControl> stmts() {
      return stmts;
    }

    @Override
    public long latency() {
      return stmts.stream().mapToLong(StaticControl::latency).max().orElse(0);
    }
  }

  /**
   * Samples {@code port} in the first cycle and runs one of the branches; takes as long as the
   * longer branch regardless of which is chosen.
   */
  final class StaticIf extends ControlNode implements StaticControl {
    public final Port port;
    private StaticControl tbranch;
    private StaticControl fbranch;

    public StaticIf(Port port, StaticControl tbranch, StaticControl fbranch) {
      this.port = port;
      this.tbranch = tbranch;
      this.fbranch = fbranch;
    }

    public StaticControl tbranch() {
      return tbranch;
    }

    public StaticControl fbranch() {
      return fbranch;
    }

    public void setTbranch(StaticControl tbranch) {
      this.tbranch = tbranch;
    }

    public void setFbranch(StaticControl fbranch) {
      this.fbranch = fbranch;
    }

    @Override
    public long latency() {
      return Math.max(tbranch.latency(), fbranch.latency());
    }
  }

  /** Runs {@code body} back to back {@code numRepeats} times. */
  final class StaticRepeat extends ControlNode implements StaticControl {
    public final long numRepeats;
    private StaticControl body;

    public StaticRepeat(long numRepeats, StaticControl body) {
      Preconditions.checkArgument(numRepeats >= 0);
      this.numRepeats = numRepeats;
      this.body = body;
    }

    public StaticControl body() {
      return body;
    }

    public void setBody(StaticControl body) {
      this.body = body;
    }

    @Override
    public long latency() {
      return Math.multiplyExact(numRepeats, body.latency());
    }
  }

  /** Runs a static group for its latency. */
  final class StaticEnable extends ControlNode implements StaticControl {
    public final Group group;

    public StaticEnable(Group group) {
      Preconditions.checkArgument(group.isStatic(), "%s is not a static group", group);
      this.group = group;
    }

    @Override
    public long latency() {
      return group.latency();
    }
  }

  /** Runs a component instance whose go-to-done latency is known. */
  final class StaticInvoke extends ControlNode implements StaticControl {
    public final Cell comp;
    public final ImmutableList<Binding> inputs;
    public final ImmutableList<Binding> outputs;
    private final long latency;

    public StaticInvoke(Cell comp, List<Binding> inputs, List<Binding> outputs, long latency) {
      Preconditions.checkArgument(latency > 0, "Invalid latency %s", latency);
      this.comp = comp;
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
      this.latency = latency;
    }

    @Override
    public long latency() {
      return latency;
    }
  }
}
