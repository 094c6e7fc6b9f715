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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.hardloom.ir.Assignment;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Attributes;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.StaticControl;

/**
 * Converts promotable dynamic control into equivalent static control. Each dynamic group is
 * converted to a static group at most once; later enables of the same group share it.
 */
public final class PromotionAnalysis {
  private final Map<Group, Group> staticGroups = new HashMap<>();

  /** True if {@code c} is already static or has a known latency. */
  public static boolean canBePromoted(Control c) {
    return c instanceof StaticControl || c.attributes().has(Attribute.PROMOTABLE);
  }

  /** Returns the latency of a static or promotable statement. */
  public static long inferredLatency(Control c) {
    OptionalLong latency = InferenceAnalysis.possibleLatency(c);
    Preconditions.checkArgument(latency.isPresent(), "%s is neither static nor promotable", c);
    return latency.getAsLong();
  }

  private static void checkLatenciesMatch(long actual, long inferred) {
    Preconditions.checkState(
        actual == inferred,
        "Inferred and annotated latencies do not match. Latency: %s. Inferred: %s",
        actual,
        inferred);
  }

  /** Returns the static counterpart of {@code group}, creating it on first use. */
  private Group staticGroup(Builder builder, Group group, long latency) {
    Group result = staticGroups.get(group);
    if (result != null) {
      return result;
    }
    Group sg = builder.addStaticGroup(group.name, latency);
    for (Assignment a : group.assignments()) {
      if (a.dst() == group.done()) {
        continue;
      }
      sg.assignments().add(a.mapPorts(p -> (p == group.go()) ? sg.go() : p));
    }
    staticGroups.put(group, sg);
    return sg;
  }

  /** Moves the attributes of {@code from} (other than {@code @promotable}) onto {@code to}. */
  private static <T extends StaticControl> T withAttributes(T to, Control from) {
    Attributes attrs = from.attributes();
    attrs.remove(Attribute.PROMOTABLE);
    to.attributes().putAll(attrs);
    return to;
  }

  /**
   * Returns a static statement equivalent to {@code c}, which must be static or promotable. The
   * children of {@code c} are consumed.
   */
  public StaticControl convertToStatic(Control c, Builder builder) {
    Preconditions.checkArgument(canBePromoted(c), "%s is neither static nor promotable", c);
    if (c instanceof StaticControl sc) {
      return sc;
    }
    long inferred = inferredLatency(c);
    StaticControl result;
    if (c instanceof Control.Enable e) {
      OptionalLong latency = e.group.attributes.get(Attribute.PROMOTABLE);
      result = withAttributes(
          new StaticControl.StaticEnable(
              staticGroup(builder, e.group, latency.orElse(inferred))),
          c);
    } else if (c instanceof Control.Seq s) {
      StaticControl.StaticSeq seq = withAttributes(
          new StaticControl.StaticSeq(convertAll(s.stmts(), builder)), c);
      seq.attributes().insert(Attribute.COMPACTABLE);
      result = seq;
    } else if (c instanceof Control.Par s) {
      result = withAttributes(new StaticControl.StaticPar(convertAll(s.stmts(), builder)), c);
    } else if (c instanceof Control.If s) {
      Preconditions.checkArgument(s.cond == null, "Cannot promote if with condition group");
      result = withAttributes(
          new StaticControl.StaticIf(
              s.port,
              convertToStatic(s.tbranch(), builder),
              convertToStatic(s.fbranch(), builder)),
          c);
    } else if (c instanceof Control.While s) {
      long bound = s.attributes().get(Attribute.BOUND).orElseThrow();
      s.attributes().remove(Attribute.BOUND);
      result = withAttributes(
          new StaticControl.StaticRepeat(bound, convertToStatic(s.body(), builder)), c);
    } else if (c instanceof Control.Repeat s) {
      result = withAttributes(
          new StaticControl.StaticRepeat(s.numRepeats, convertToStatic(s.body(), builder)), c);
    } else if (c instanceof Control.Invoke s) {
      Preconditions.checkArgument(
          s.combGroup == null, "Cannot promote invoke with a combinational group");
      result = withAttributes(
          new StaticControl.StaticInvoke(s.comp, s.inputs, s.outputs, inferred), c);
    } else {
      throw new AssertionError();
    }
    checkLatenciesMatch(result.latency(), inferred);
    return result;
  }

  /** Converts each of {@code stmts} to static control. */
  public List<StaticControl> convertAll(List<Control> stmts, Builder builder) {
    List<StaticControl> result = new ArrayList<>(stmts.size());
    for (Control stmt : stmts) {
      result.add(convertToStatic(stmt, builder));
    }
    return result;
  }
}
