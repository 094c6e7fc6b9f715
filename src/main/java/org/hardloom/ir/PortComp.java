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

/** The comparison operators that may appear in a guard. */
public enum PortComp {
  EQ("=="),
  NEQ("!="),
  GT(">"),
  LT("<"),
  GEQ(">="),
  LEQ("<=");

  public final String symbol;

  PortComp(String symbol) {
    this.symbol = symbol;
  }

  /** Returns the operator whose result is always the opposite of this one's. */
  public PortComp negate() {
    return switch (this) {
      case EQ -> NEQ;
      case NEQ -> EQ;
      case GT -> LEQ;
      case LT -> GEQ;
      case GEQ -> LT;
      case LEQ -> GT;
    };
  }

  /** Applies this comparison to two unsigned values. */
  public boolean test(long left, long right) {
    int cmp = Long.compareUnsigned(left, right);
    return switch (this) {
      case EQ -> cmp == 0;
      case NEQ -> cmp != 0;
      case GT -> cmp > 0;
      case LT -> cmp < 0;
      case GEQ -> cmp >= 0;
      case LEQ -> cmp <= 0;
    };
  }
}
