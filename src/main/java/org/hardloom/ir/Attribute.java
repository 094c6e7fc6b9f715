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

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of attribute kinds that may be attached to ports, cells, groups, control
 * statements and components. Attributes are the only way passes communicate with each other.
 */
public enum Attribute {
  /** Marks a go port; the value pairs it with the done port carrying the same value. */
  GO("go", false),
  /** Marks a done port; the value pairs it with the go port carrying the same value. */
  DONE("done", false),
  /** On a primitive's go port, the number of cycles between asserting go and seeing done. */
  INTERVAL("interval", false),
  /** A fixed latency that the program author requires. */
  STATIC("static", false),
  /** A latency the compiler inferred; passes may use it but are not required to. */
  PROMOTABLE("promotable", false),
  /** The number of iterations a while loop is known to execute. */
  BOUND("bound", false),
  /** The statement must be compiled with its own FSM register. */
  NEW_FSM("new_fsm", true),
  /** The static seq was created by the compiler and its children may be reordered. */
  COMPACTABLE("compactable", true),
  /** The statement's FSM should use a one-hot encoding. */
  ONE_HOT("one_hot", true),
  /** The statement or group was created by promoting dynamic control. */
  PROMOTED("promoted", true),
  /** The FSM state assigned to an enable. */
  NODE_ID("NODE_ID", false),
  /** The first FSM state owned by a compound statement. */
  BEGIN_ID("BEGIN_ID", false),
  /** One past the last FSM state owned by a compound statement. */
  END_ID("END_ID", false);

  /** The name used when printing this attribute. */
  public final String name;

  /** If true, the only legal value for this attribute is 1. */
  public final boolean isFlag;

  Attribute(String name, boolean isFlag) {
    this.name = name;
    this.isFlag = isFlag;
  }

  /** Returns the attribute with the given printed name, if there is one. */
  public static Optional<Attribute> fromName(String name) {
    return Arrays.stream(values()).filter(a -> a.name.equals(name)).findFirst();
  }
}
