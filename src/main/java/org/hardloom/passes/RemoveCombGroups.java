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

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.hardloom.ir.Builder;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.ir.LibrarySignatures;
import org.hardloom.ir.Port;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Removes the combinational groups of if and while statements. The condition is computed by a
 * dynamic group that runs the combinational group's assignments and latches the condition port
 * into a 1-bit register, and the statement then tests the register's output:
 *
 * <pre>
 * if p with g { t } else { f }  =>  seq { g'; if r.out { t } else { f } }
 * while p with g { b }          =>  seq { g'; while r.out { seq { b; g' } } }
 * </pre>
 */
public final class RemoveCombGroups implements Visitor {
  public static final PassInfo INFO =
      new PassInfo(
          "remove-comb-groups", "Transforms combinational groups into normal groups");

  private final LibrarySignatures lib;

  /** The latched condition for each (combinational group, port) pair seen so far. */
  private final Map<String, LatchedCondition> latched = new HashMap<>();

  private final Set<Group> replaced = new LinkedHashSet<>();

  private record LatchedCondition(Group group, Port out) {}

  public RemoveCombGroups(Context ctx) {
    this.lib = ctx.lib;
  }

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action start(Component comp) {
    latched.clear();
    replaced.clear();
    return Action.CONTINUE;
  }

  private LatchedCondition latch(Group cond, Port port, Component comp) {
    replaced.add(cond);
    return latched.computeIfAbsent(
        cond.name + "/" + port,
        k -> {
          Builder builder = new Builder(comp, lib);
          Cell reg = builder.addPrimitive(cond.name + "_reg", "std_reg", 1);
          Group group = builder.addGroup(cond.name);
          group.assignments().addAll(cond.assignments());
          builder.addTo(
              group,
              List.of(
                  builder.assign(reg.get("in"), port),
                  builder.assign(reg.get("write_en"), builder.one()),
                  builder.assign(group.done(), reg.get("done"))));
          return new LatchedCondition(group, reg.get("out"));
        });
  }

  @Override
  public Action finishIf(Control.If s, Component comp) {
    if (s.cond == null) {
      return Action.CONTINUE;
    }
    LatchedCondition c = latch(s.cond, s.port, comp);
    Control.If result = new Control.If(c.out, null, s.tbranch(), s.fbranch());
    result.attributes().putAll(s.attributes());
    return Action.change(Control.seq(Control.enable(c.group), result));
  }

  @Override
  public Action finishWhile(Control.While s, Component comp) {
    if (s.cond == null) {
      return Action.CONTINUE;
    }
    LatchedCondition c = latch(s.cond, s.port, comp);
    Control.While result =
        new Control.While(c.out, null, Control.seq(s.body(), Control.enable(c.group)));
    result.attributes().putAll(s.attributes());
    return Action.change(Control.seq(Control.enable(c.group), result));
  }

  /** Removes the combinational groups that have been replaced. */
  @Override
  public Action finish(Component comp) {
    replaced.forEach(comp::removeGroup);
    return Action.CONTINUE;
  }
}
