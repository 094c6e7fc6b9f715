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

import java.util.ArrayList;
import java.util.List;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Component;
import org.hardloom.ir.Control;
import org.hardloom.ir.StaticControl;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Simplifies control programs.
 *
 * <ul>
 *   <li>A seq nested directly in a seq is flattened into its parent, unless it is marked {@code
 *       @new_fsm}; likewise for par, static seq, and static par.
 *   <li>A seq or par with no children is replaced by empty, and one with a single child is
 *       replaced by that child.
 *   <li>Repeats (static or dynamic) of zero iterations are replaced by empty, and those of one
 *       iteration by their body.
 * </ul>
 */
public final class CollapseControl implements Visitor {
  public static final PassInfo INFO =
      new PassInfo("collapse-control", "Collapse nested seq and par.");

  @Override
  public PassInfo info() {
    return INFO;
  }

  @Override
  public Action finishSeq(Control.Seq s, Component comp) {
    if (s.stmts().size() <= 1) {
      return Action.change(s.stmts().isEmpty() ? Control.empty() : s.stmts().get(0));
    }
    List<Control> stmts = new ArrayList<>();
    for (Control con : s.stmts()) {
      if (con instanceof Control.Seq inner && !inner.attributes().has(Attribute.NEW_FSM)) {
        stmts.addAll(inner.stmts());
      } else {
        stmts.add(con);
      }
    }
    replace(s.stmts(), stmts);
    return Action.CONTINUE;
  }

  @Override
  public Action finishPar(Control.Par s, Component comp) {
    if (s.stmts().size() <= 1) {
      return Action.change(s.stmts().isEmpty() ? Control.empty() : s.stmts().get(0));
    }
    List<Control> stmts = new ArrayList<>();
    for (Control con : s.stmts()) {
      if (con instanceof Control.Par inner) {
        stmts.addAll(inner.stmts());
      } else {
        stmts.add(con);
      }
    }
    replace(s.stmts(), stmts);
    return Action.CONTINUE;
  }

  @Override
  public Action finishStaticSeq(StaticControl.StaticSeq s, Component comp) {
    if (s.stmts().size() <= 1) {
      return Action.staticChange(single(s.stmts(), s));
    }
    List<StaticControl> stmts = new ArrayList<>();
    for (StaticControl con : s.stmts()) {
      if (con instanceof StaticControl.StaticSeq inner) {
        stmts.addAll(inner.stmts());
      } else {
        stmts.add(con);
      }
    }
    replace(s.stmts(), stmts);
    return Action.CONTINUE;
  }

  @Override
  public Action finishStaticPar(StaticControl.StaticPar s, Component comp) {
    if (s.stmts().size() <= 1) {
      return Action.staticChange(single(s.stmts(), s));
    }
    List<StaticControl> stmts = new ArrayList<>();
    for (StaticControl con : s.stmts()) {
      if (con instanceof StaticControl.StaticPar inner) {
        stmts.addAll(inner.stmts());
      } else {
        stmts.add(con);
      }
    }
    replace(s.stmts(), stmts);
    return Action.CONTINUE;
  }

  /** Returns the only element of {@code stmts} (or empty), keeping the parent's @one_hot. */
  private static StaticControl single(List<StaticControl> stmts, StaticControl parent) {
    if (stmts.isEmpty()) {
      return Control.empty();
    }
    StaticControl result = stmts.get(0);
    if (parent.attributes().has(Attribute.ONE_HOT)) {
      result.attributes().insert(Attribute.ONE_HOT);
    }
    return result;
  }

  @Override
  public Action finishStaticRepeat(StaticControl.StaticRepeat s, Component comp) {
    if (s.numRepeats == 0) {
      return Action.staticChange(Control.empty());
    } else if (s.numRepeats == 1) {
      return Action.staticChange(s.body());
    }
    return Action.CONTINUE;
  }

  @Override
  public Action finishRepeat(Control.Repeat s, Component comp) {
    if (s.numRepeats == 0) {
      return Action.change(Control.empty());
    } else if (s.numRepeats == 1) {
      return Action.change(s.body());
    }
    return Action.CONTINUE;
  }

  private static <T> void replace(List<T> target, List<T> contents) {
    target.clear();
    target.addAll(contents);
  }
}
