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

package org.hardloom;

/**
 * Thrown when a pass or analysis rejects the program it was given. There is no local recovery from
 * a CompileError; it aborts the pass and the driver decides whether to stop the whole compilation.
 */
public class CompileError extends Exception {

  /** What kind of problem was found. */
  public enum Kind {
    /** The structure of a component (cells, groups, attributes) is malformed. */
    MALFORMED_STRUCTURE,
    /** A control program is malformed. */
    MALFORMED_CONTROL,
    /** Sibling statements have no sequential ordering that respects their data dependencies. */
    DATA_RACE,
    /** A pass was run on a program it does not handle. */
    PASS_ASSUMPTION,
    /** A referenced cell, port, group, component or pass does not exist. */
    UNDEFINED,
    MISC
  }

  public final Kind kind;

  public CompileError(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public static CompileError malformedStructure(String message) {
    return new CompileError(Kind.MALFORMED_STRUCTURE, message);
  }

  public static CompileError malformedControl(String message) {
    return new CompileError(Kind.MALFORMED_CONTROL, message);
  }

  /** Returns an error reporting that {@code pass} cannot handle the program it was given. */
  public static CompileError passAssumption(String pass, String message) {
    return new CompileError(Kind.PASS_ASSUMPTION, String.format("%s: %s", pass, message));
  }

  /** Returns an error reporting that no {@code type} named {@code name} exists. */
  public static CompileError undefined(String name, String type) {
    return new CompileError(Kind.UNDEFINED, String.format("Undefined %s name: %s", type, name));
  }

  public static CompileError misc(String message) {
    return new CompileError(Kind.MISC, message);
  }

  @Override
  public String toString() {
    return kind + ": " + getMessage();
  }
}
