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
import java.util.OptionalLong;
import org.hardloom.CompileError;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Control;
import org.hardloom.ir.StaticControl;

/**
 * Assigns FSM state numbers to the statements of a dynamic control program.
 *
 * <p>Each enable gets the next state. A {@code par} takes a single state, and each of its
 * children is numbered from 0 since it will get its own FSM. A seq, if, or while marked
 * {@code @new_fsm} likewise takes a single state of the enclosing FSM and numbers its contents
 * from scratch. If and while statements never use state 0 for their contents, since state 0 must
 * evaluate the condition.
 *
 * <p>Every seq, if, and while also records the range of states used by its contents as {@code
 * @begin_id} (inclusive) and {@code @end_id} (exclusive).
 */
public final class ControlId {
  private ControlId() {}

  /**
   * Numbers {@code con} and its descendants starting at {@code curState}, and returns the next
   * unused state.
   */
  public static long computeUniqueIds(Control con, long curState) throws CompileError {
    if (con instanceof Control.Enable) {
      con.attributes().insert(Attribute.NODE_ID, curState);
      return curState + 1;
    } else if (con instanceof Control.Par par) {
      con.attributes().insert(Attribute.NODE_ID, curState);
      for (Control stmt : par.stmts()) {
        computeUniqueIds(stmt, 0);
      }
      return curState + 1;
    } else if (con instanceof StaticControl.Empty) {
      return curState;
    }
    boolean newFsm = con.attributes().has(Attribute.NEW_FSM);
    if (newFsm) {
      con.attributes().insert(Attribute.NODE_ID, curState);
    }
    long begin;
    long end;
    if (con instanceof Control.Seq seq) {
      begin = newFsm ? 0 : curState;
      end = begin;
      for (Control stmt : seq.stmts()) {
        end = computeUniqueIds(stmt, end);
      }
    } else if (con instanceof Control.If s) {
      begin = (newFsm || curState == 0) ? 1 : curState;
      end = computeUniqueIds(s.fbranch(), computeUniqueIds(s.tbranch(), begin));
    } else if (con instanceof Control.While s) {
      begin = (newFsm || curState == 0) ? 1 : curState;
      end = computeUniqueIds(s.body(), begin);
    } else {
      throw notCompiledAway(con);
    }
    con.attributes().insert(Attribute.BEGIN_ID, begin).insert(Attribute.END_ID, end);
    return newFsm ? curState + 1 : end;
  }

  /** Returns the error for a statement that earlier passes should have removed. */
  public static CompileError notCompiledAway(Control con) {
    String kind;
    if (con instanceof Control.Repeat) {
      kind = "repeat statements should have been compiled away by compile-repeat";
    } else if (con instanceof Control.Invoke) {
      kind = "invoke statements should have been compiled away by compile-invoke";
    } else {
      kind = "static control should have been compiled away by compile-static";
    }
    return CompileError.passAssumption("tdcc", kind);
  }

  /** Returns the state assigned to {@code con}, which must have been numbered. */
  public static long guaranteedId(Control con) {
    OptionalLong id = con.attributes().get(Attribute.NODE_ID);
    Preconditions.checkState(id.isPresent(), "%s has no node id", con);
    return id.getAsLong();
  }
}
