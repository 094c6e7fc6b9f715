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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.hardloom.CompileError;
import org.hardloom.analysis.ControlId;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Guard;
import org.hardloom.ir.Port;
import org.hardloom.ir.Printer;
import org.hardloom.ir.StaticControl;
import org.jspecify.annotations.Nullable;

/**
 * The states of a dynamic FSM, the groups enabled in each state, and the guarded transitions
 * between states. A Schedule is computed from a control program whose enables have been numbered
 * by {@link ControlId}, and then realized as a group that drives an FSM register.
 *
 * <p>State 0 is the initial state. If the program starts with an enable, that enable runs in state
 * 0; otherwise state 0 only evaluates the program's first condition. The last state is entered
 * when the program is complete; it asserts the group's done and resets the FSM.
 */
final class Schedule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** A transition into the current statement from {@code state}, taken when {@code guard} holds. */
  record PredEdge(long state, Guard guard) {
    PredEdge andGuard(Guard g) {
      return new PredEdge(state, Guard.and(guard, g));
    }
  }

  record Transition(long from, long to, Guard guard) {}

  private final Builder builder;
  private final boolean earlyTransitions;

  /** The assignments that are active in each state. */
  private final Map<Long, List<Assignment>> enables = new TreeMap<>();

  private final List<Transition> transitions = new ArrayList<>();

  Schedule(Builder builder, boolean earlyTransitions) {
    this.builder = builder;
    this.earlyTransitions = earlyTransitions;
  }

  /** Adds the states and transitions that run {@code con} to completion from state 0. */
  void calculateStates(Control con) throws CompileError {
    List<PredEdge> prev = calculate(con, List.of(new PredEdge(0, Guard.TRUE)));
    long next = prev.stream().mapToLong(PredEdge::state).max().orElseThrow() + 1;
    for (PredEdge edge : prev) {
      transitions.add(new Transition(edge.state, next, edge.guard));
    }
  }

  /**
   * Adds the states for {@code con}, entered through {@code preds}, and returns the edges by which
   * it exits.
   */
  private List<PredEdge> calculate(Control con, List<PredEdge> preds) throws CompileError {
    if (con instanceof Control.Enable enable) {
      return calculateEnable(enable, preds);
    } else if (con instanceof Control.Seq seq) {
      List<PredEdge> prev = preds;
      for (Control stmt : seq.stmts()) {
        prev = calculate(stmt, prev);
      }
      return prev;
    } else if (con instanceof Control.If s) {
      return calculateIf(s, preds);
    } else if (con instanceof Control.While s) {
      return calculateWhile(s, preds);
    } else if (con instanceof StaticControl.Empty) {
      return preds;
    } else if (con instanceof Control.Par) {
      throw new AssertionError("par should have been compiled to an enable");
    }
    throw ControlId.notCompiledAway(con);
  }

  private List<PredEdge> calculateEnable(Control.Enable enable, List<PredEdge> preds) {
    Group group = enable.group;
    long state = ControlId.guaranteedId(enable);
    // A program that starts with an enable runs it in the initial state.
    if (preds.size() == 1 && preds.get(0).guard.isTrue()) {
      state = preds.get(0).state;
      preds = List.of();
    }
    Guard notDone = Guard.not(Guard.port(group.done()));
    addEnable(state, builder.assign(group.go(), builder.one(), notDone));
    if (earlyTransitions) {
      // Start the group in the cycle in which the previous state finishes.
      for (PredEdge edge : preds) {
        addEnable(edge.state, builder.assign(group.go(), builder.one(), edge.guard));
      }
    }
    for (PredEdge edge : preds) {
      transitions.add(new Transition(edge.state, state, edge.guard));
    }
    return List.of(new PredEdge(state, Guard.port(group.done())));
  }

  private void addEnable(long state, Assignment a) {
    enables.computeIfAbsent(state, k -> new ArrayList<>()).add(a);
  }

  private List<PredEdge> calculateIf(Control.If s, List<PredEdge> preds) throws CompileError {
    checkNoCondition(s.cond);
    Guard port = Guard.port(s.port);
    List<PredEdge> result =
        new ArrayList<>(calculate(s.tbranch(), andAll(preds, port)));
    result.addAll(calculate(s.fbranch(), andAll(preds, Guard.not(port))));
    return result;
  }

  private List<PredEdge> calculateWhile(Control.While s, List<PredEdge> preds)
      throws CompileError {
    checkNoCondition(s.cond);
    Guard port = Guard.port(s.port);
    List<PredEdge> entries = new ArrayList<>(preds);
    exits(s.body(), entries);
    List<PredEdge> bodyExits = calculate(s.body(), andAll(entries, port));
    List<PredEdge> all = new ArrayList<>(preds);
    all.addAll(bodyExits);
    return andAll(all, Guard.not(port));
  }

  private static void checkNoCondition(@Nullable Group cond) throws CompileError {
    if (cond != null) {
      throw CompileError.malformedStructure(
          String.format(
              "tdcc: Found group `%s` in with position of conditional. This should have"
                  + " compiled away.",
              cond.name));
    }
  }

  private static List<PredEdge> andAll(List<PredEdge> edges, Guard g) {
    return edges.stream().map(e -> e.andGuard(g)).collect(ImmutableList.toImmutableList());
  }

  /**
   * Adds the edges by which {@code con} exits to {@code result}, using the states that have
   * already been assigned to its enables.
   */
  private static void exits(Control con, List<PredEdge> result) throws CompileError {
    if (con instanceof Control.Enable enable) {
      result.add(new PredEdge(ControlId.guaranteedId(enable), Guard.port(enable.group.done())));
    } else if (con instanceof Control.Seq seq) {
      if (!seq.stmts().isEmpty()) {
        exits(seq.stmts().get(seq.stmts().size() - 1), result);
      }
    } else if (con instanceof Control.If s) {
      exits(s.tbranch(), result);
      exits(s.fbranch(), result);
    } else if (con instanceof Control.While s) {
      List<PredEdge> loopExits = new ArrayList<>();
      exits(s.body(), loopExits);
      result.addAll(andAll(loopExits, Guard.not(Guard.port(s.port))));
    } else if (!(con instanceof StaticControl.Empty)) {
      throw ControlId.notCompiledAway(con);
    }
  }

  /** The state that is entered once the program completes. */
  long lastState() {
    Preconditions.checkState(!transitions.isEmpty(), "Schedule has no transitions");
    return transitions.stream().mapToLong(Transition::to).max().getAsLong();
  }

  /** Checks that every state is connected to the initial state. */
  private void validate() throws CompileError {
    MutableGraph<Long> graph = GraphBuilder.undirected().allowsSelfLoops(true).build();
    for (Transition t : transitions) {
      graph.putEdge(t.from, t.to);
    }
    if (Graphs.reachableNodes(graph, 0L).size() != graph.nodes().size()) {
      throw CompileError.malformedControl(
          builder.comp.name + ": state transition graph has unreachable states");
    }
  }

  /** Returns a readable listing of the states and transitions, headed by {@code title}. */
  String display(String title) {
    StringBuilder sb = new StringBuilder();
    sb.append("======== ").append(title).append(" =========\n");
    enables.forEach(
        (state, assigns) -> {
          sb.append(state).append(":\n");
          assigns.forEach(a -> sb.append("  ").append(Printer.assignment(a)).append('\n'));
        });
    sb.append(lastState()).append(":\n  <end>\n");
    sb.append("transitions:\n");
    transitions.stream()
        .sorted((t1, t2) -> Long.compare(t1.from, t2.from))
        .forEach(
            t ->
                sb.append(
                    String.format("  (%s, %s): %s\n", t.from, t.to, Printer.guard(t.guard))));
    return sb.toString();
  }

  /**
   * Builds a group named {@code tdcc} that implements this schedule using a new FSM register with
   * the given encoding. The register is reset to the initial state by a continuous assignment
   * once it reaches the last state.
   */
  Group realize(FsmEncoding encoding, boolean dumpFsm) throws CompileError {
    validate();
    Group group = builder.addGroup("tdcc");
    if (dumpFsm) {
      logger.atInfo().log("%s", display(builder.comp.name + ":" + group.name));
    }
    long last = lastState();
    int width = encoding.width(last);
    Preconditions.checkArgument(width < 64, "FSM with %s states is too large", last + 1);
    Cell fsm = builder.addPrimitive("fsm", encoding.primitive, width);
    StateQuery query = new StateQuery(fsm, encoding, width);

    enables.forEach(
        (state, assigns) -> {
          Guard inState = query.inState(state);
          assigns.forEach(a -> group.assignments().add(a.andGuard(inState)));
        });
    for (Transition t : transitions) {
      Guard guard = Guard.and(query.inState(t.from), t.guard);
      group.assignments().add(
          builder.assign(fsm.get("in"), builder.constant(encoding.encode(t.to), width), guard));
      group.assignments().add(builder.assign(fsm.get("write_en"), builder.one(), guard));
    }
    Guard inLast = query.inState(last);
    group.assignments().add(builder.assign(group.done(), builder.one(), inLast));
    Port first = builder.constant(encoding.encode(0), width);
    builder.addContinuous(
        List.of(
            builder.assign(fsm.get("in"), first, inLast),
            builder.assign(fsm.get("write_en"), builder.one(), inLast)));
    logger.atFine().log(
        "%s: %s FSM %s with %s states", builder.comp.name, encoding, fsm.name, last + 1);
    return group;
  }

  /** Builds the guards that test the FSM register's state, sharing bit slices where needed. */
  private class StateQuery {
    final Cell fsm;
    final FsmEncoding encoding;
    final int width;
    final Map<Long, Cell> slicers = new HashMap<>();

    StateQuery(Cell fsm, FsmEncoding encoding, int width) {
      this.fsm = fsm;
      this.encoding = encoding;
      this.width = width;
    }

    Guard inState(long state) {
      if (encoding == FsmEncoding.BINARY) {
        return Guard.eq(fsm.get("out"), builder.constant(state, width));
      }
      Cell slicer =
          slicers.computeIfAbsent(
              state,
              s -> {
                Cell c = builder.addPrimitive("slicer", "std_bit_slice", width, s, s, 1);
                builder.addContinuous(List.of(builder.assign(c.get("in"), fsm.get("out"))));
                return c;
              });
      return Guard.eq(slicer.get("out"), builder.one());
    }
  }
}
