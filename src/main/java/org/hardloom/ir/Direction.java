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

/** The direction of a port, as seen from inside the component that uses it. */
public enum Direction {
  /** Driven by assignments in the using component. */
  INPUT,
  /** Read by assignments in the using component. */
  OUTPUT,
  /** Both driven and read; only used for group holes. */
  INOUT;

  /** Returns the direction of this port as seen from the other side of the interface. */
  public Direction reverse() {
    return switch (this) {
      case INPUT -> OUTPUT;
      case OUTPUT -> INPUT;
      case INOUT -> INOUT;
    };
  }
}
