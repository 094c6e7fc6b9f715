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

import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.BinaryOperator;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.Port;
import org.hardloom.ir.Primitive;
import org.hardloom.ir.StaticControl;

/**
 * Infers fixed latencies for dynamic groups and control statements, recording them as
 * {@code @promotable} attributes.
 *
 * <p>Latency information for primitives and components comes from their go/done port pairs (see
 * {@link GoDone}). Components processed later can use the latencies of components processed
 * earlier once they are registered with {@link #addComponent}.
 */
public final class InferenceAnalysis {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Go/done information for each primitive and component, keyed by name. */
  private final Map<String, GoDone> latencyData = new HashMap<>();

  /** The latency of each primitive or component that has exactly one go/done pair. */
  private final Map<String, Long> componentLatencies = new HashMap<>();

  private InferenceAnalysis() {}

  /** Builds an analysis from the library and the component signatures of {@code ctx}. */
  public static InferenceAnalysis fromContext(Context ctx) {
    InferenceAnalysis result = new InferenceAnalysis();
    for (Primitive prim : ctx.lib.primitives()) {
      result.record(prim.name(), GoDone.of(prim));
    }
    for (Component comp : ctx.components()) {
      result.record(comp.name, GoDone.of(comp.signature.ports()));
    }
    return result;
  }

  private void record(String name, GoDone goDone) {
    latencyData.put(name, goDone);
    if (goDone.ports().size() == 1) {
      componentLatencies.put(name, goDone.ports().get(0).latency());
    } else {
      componentLatencies.remove(name);
    }
  }

  /** Records that the named component has the given go/done pairs. */
  public void addComponent(String name, GoDone goDone) {
    record(name, goDone);
  }

  /** Returns the latency of invoking an instance of the named primitive or component. */
  public OptionalLong componentLatency(String typeName) {
    Long latency = componentLatencies.get(typeName);
    return (latency == null) ? OptionalLong.empty() : OptionalLong.of(latency);
  }

  private Optional<GoDone> goDone(Cell cell) {
    if (cell.kind != Cell.Kind.PRIMITIVE && cell.kind != Cell.Kind.COMPONENT) {
      return Optional.empty();
    }
    return Optional.ofNullable(latencyData.get(cell.typeName));
  }

  private boolean isGoPort(Port p) {
    return !p.isHole() && goDone(p.cell()).map(gd -> gd.isGo(p.name)).orElse(false);
  }

  /** True for a known done port or a positive constant. */
  private boolean isDoneOrConstant(Port p) {
    if (p.isHole()) {
      return false;
    }
    Cell cell = p.cell();
    if (cell.kind == Cell.Kind.CONSTANT) {
      return cell.constantValue() > 0;
    }
    return goDone(cell).map(gd -> gd.isDone(p.name)).orElse(false);
  }

  /**
   * Returns the number of cycles between asserting the group's go and its done, if that is fixed.
   *
   * <p>An explicit {@code @static} attribute is used if present. Otherwise the group must have the
   * shape of a chain of cells with known latencies: the done hole is driven (unguarded) by a
   * cell's done port, that cell's go port is driven (unguarded) either by a positive constant or
   * by the done port of another cell in the chain, and so on. Any other write to a go port or to
   * the done hole, or more than one write to any of them, defeats inference.
   */
  public OptionalLong inferGroupLatency(Group group) {
    if (group.kind != Group.Kind.DYNAMIC) {
      return OptionalLong.empty();
    }
    OptionalLong explicit = group.attributes.get(Attribute.STATIC);
    if (explicit.isPresent()) {
      return explicit;
    }
    Map<Port, List<Assignment>> writes = new LinkedHashMap<>();
    for (Assignment a : group.assignments()) {
      writes.computeIfAbsent(a.dst(), k -> new ArrayList<>()).add(a);
    }
    for (Map.Entry<Port, List<Assignment>> entry : writes.entrySet()) {
      Port dst = entry.getKey();
      if (dst != group.done() && !isGoPort(dst)) {
        continue;
      }
      if (entry.getValue().size() != 1) {
        logger.atFine().log("%s: multiple writes to %s", group, dst);
        return OptionalLong.empty();
      }
      Assignment a = entry.getValue().get(0);
      if (!a.guard().isTrue() || !isDoneOrConstant(a.src())) {
        logger.atFine().log("%s: %s is not driven by a done port", group, dst);
        return OptionalLong.empty();
      }
    }
    List<Assignment> doneWrites = writes.get(group.done());
    if (doneWrites == null) {
      logger.atFine().log("%s: done is never written", group);
      return OptionalLong.empty();
    }
    long sum = 0;
    Set<Cell> visited = new HashSet<>();
    Port p = doneWrites.get(0).src();
    while (p.cell().kind != Cell.Kind.CONSTANT) {
      Cell cell = p.cell();
      String doneName = p.name;
      GoDone.Entry entry = goDone(cell).flatMap(gd -> gd.byDone(doneName)).orElseThrow();
      List<Assignment> goWrites = writes.get(cell.get(entry.go()));
      if (!visited.add(cell) || goWrites == null) {
        logger.atFine().log("%s: %s is not started by the group", group, cell);
        return OptionalLong.empty();
      }
      sum += entry.latency();
      p = goWrites.get(0).src();
    }
    if (sum == 0) {
      return OptionalLong.empty();
    }
    logger.atFine().log("%s: inferred latency %s", group, sum);
    return OptionalLong.of(sum);
  }

  /**
   * Returns the latency of a control statement: the latency of a static statement, or the value of
   * a dynamic statement's {@code @promotable} attribute.
   */
  public static OptionalLong possibleLatency(Control c) {
    if (c instanceof StaticControl sc) {
      return OptionalLong.of(sc.latency());
    }
    return c.attributes().get(Attribute.PROMOTABLE);
  }

  /**
   * Computes the latency of {@code c} and of each of its descendants, annotating each dynamic
   * statement whose latency is known and positive with {@code @promotable}.
   */
  public OptionalLong updateStatic(Control c) {
    OptionalLong latency = computeStatic(c);
    if (latency.isPresent()
        && latency.getAsLong() > 0
        && !(c instanceof StaticControl)) {
      c.attributes().insert(Attribute.PROMOTABLE, latency.getAsLong());
    }
    return latency;
  }

  private OptionalLong computeStatic(Control c) {
    if (c instanceof StaticControl sc) {
      return OptionalLong.of(sc.latency());
    } else if (c instanceof Control.Seq s) {
      return walk(s.stmts(), Long::sum);
    } else if (c instanceof Control.Par s) {
      return walk(s.stmts(), Math::max);
    } else if (c instanceof Control.If s) {
      OptionalLong t = updateStatic(s.tbranch());
      OptionalLong f = updateStatic(s.fbranch());
      if (s.cond != null || t.isEmpty() || f.isEmpty()) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(Math.max(t.getAsLong(), f.getAsLong()));
    } else if (c instanceof Control.While s) {
      OptionalLong body = updateStatic(s.body());
      OptionalLong bound = s.attributes().get(Attribute.BOUND);
      if (s.cond != null || body.isEmpty() || bound.isEmpty()) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(bound.getAsLong() * body.getAsLong());
    } else if (c instanceof Control.Repeat s) {
      OptionalLong body = updateStatic(s.body());
      return body.isPresent()
          ? OptionalLong.of(s.numRepeats * body.getAsLong())
          : OptionalLong.empty();
    } else if (c instanceof Control.Enable s) {
      OptionalLong own = s.attributes().get(Attribute.PROMOTABLE);
      return own.isPresent() ? own : s.group.attributes.get(Attribute.PROMOTABLE);
    } else if (c instanceof Control.Invoke s) {
      OptionalLong own = s.attributes().get(Attribute.PROMOTABLE);
      if (own.isPresent() || s.combGroup != null) {
        return own;
      }
      return componentLatency(s.comp.typeName);
    }
    throw new AssertionError();
  }

  /** Updates every statement, even after one turns out not to be timed. */
  private OptionalLong walk(List<Control> stmts, BinaryOperator<Long> merge) {
    long total = 0;
    boolean timed = true;
    for (Control stmt : stmts) {
      OptionalLong latency = updateStatic(stmt);
      if (latency.isPresent()) {
        total = merge.apply(total, latency.getAsLong());
      } else {
        timed = false;
      }
    }
    return timed ? OptionalLong.of(total) : OptionalLong.empty();
  }

  /** Removes {@code @promotable} from {@code c} and all its dynamic descendants. */
  public static void removePromotable(Control c) {
    if (c instanceof StaticControl) {
      return;
    }
    c.attributes().remove(Attribute.PROMOTABLE);
    if (c instanceof Control.Seq s) {
      s.stmts().forEach(InferenceAnalysis::removePromotable);
    } else if (c instanceof Control.Par s) {
      s.stmts().forEach(InferenceAnalysis::removePromotable);
    } else if (c instanceof Control.If s) {
      removePromotable(s.tbranch());
      removePromotable(s.fbranch());
    } else if (c instanceof Control.While s) {
      removePromotable(s.body());
    } else if (c instanceof Control.Repeat s) {
      removePromotable(s.body());
    }
  }

  /**
   * Re-infers the latencies of the component's groups and control. Groups whose latency cannot be
   * inferred keep any {@code @promotable} they already had; the control program's annotations are
   * recomputed from scratch.
   *
   * @return the latency of the whole control program, if known
   */
  public OptionalLong fixupTiming(Component comp) {
    for (Group group : comp.groups(Group.Kind.DYNAMIC)) {
      OptionalLong latency = inferGroupLatency(group);
      if (latency.isPresent()) {
        group.attributes.insert(Attribute.PROMOTABLE, latency.getAsLong());
      }
    }
    removePromotable(comp.control());
    return updateStatic(comp.control());
  }

  /**
   * Re-infers the timing of {@code comp} (see {@link #fixupTiming}). If the whole control program
   * takes a fixed, nonzero number of cycles, the component's go ports are annotated with it.
   * Either way the component's go/done pairs are recorded so that components using this one see
   * the result.
   *
   * @return the latency of the component's control program, if known
   */
  public OptionalLong inferComponent(Component comp) {
    OptionalLong latency = fixupTiming(comp);
    if (latency.isPresent() && latency.getAsLong() > 0) {
      for (Port go : comp.goPorts()) {
        go.attributes.insert(Attribute.PROMOTABLE, latency.getAsLong());
      }
      logger.atFine().log("%s: inferred latency %s", comp.name, latency.getAsLong());
    }
    addComponent(comp.name, GoDone.of(comp.signature.ports()));
    return latency;
  }
}
