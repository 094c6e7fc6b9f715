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

package org.hardloom.traversal;

/**
 * An option accepted by a pass. Options are given on the command line as {@code <pass>:<name>}
 * (for a boolean) or {@code <pass>:<name>=<value>}.
 */
public record PassOpt(String name, String description, Type type, long defaultValue) {

  public enum Type {
    BOOL,
    NUMBER
  }

  public static PassOpt bool(String name, String description) {
    return new PassOpt(name, description, Type.BOOL, 0);
  }

  public static PassOpt number(String name, String description, long defaultValue) {
    return new PassOpt(name, description, Type.NUMBER, defaultValue);
  }
}
