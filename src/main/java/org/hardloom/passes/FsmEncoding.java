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

import org.hardloom.ir.Attribute;
import org.hardloom.ir.Attributes;
import org.hardloom.util.MathUtil;

/** How the state of a dynamic FSM is stored in its register. */
public enum FsmEncoding {
  /** A {@code std_reg} holding the state number. */
  BINARY("std_reg"),
  /** An {@code init_one_reg} with one bit per state, exactly one of which is set. */
  ONE_HOT("init_one_reg");

  public final String primitive;

  FsmEncoding(String primitive) {
    this.primitive = primitive;
  }

  /**
   * Chooses one-hot if the statement asks for it or the FSM has at most {@code oneHotCutoff}
   * states after the initial one, binary otherwise.
   */
  public static FsmEncoding choose(long lastState, Attributes attrs, long oneHotCutoff) {
    return (attrs.has(Attribute.ONE_HOT) || lastState <= oneHotCutoff) ? ONE_HOT : BINARY;
  }

  /** The width of a register that can hold every state up to and including {@code lastState}. */
  public int width(long lastState) {
    return switch (this) {
      case BINARY -> MathUtil.bitWidth(lastState + 1);
      case ONE_HOT -> Math.toIntExact(lastState + 1);
    };
  }

  /** The register value that represents {@code state}. */
  public long encode(long state) {
    return switch (this) {
      case BINARY -> state;
      case ONE_HOT -> 1L << state;
    };
  }
}
