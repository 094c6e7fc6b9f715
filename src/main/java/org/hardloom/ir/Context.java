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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.hardloom.CompileError;

/** Everything a pass needs: the components, the primitive library, and the command-line options. */
public final class Context {
  public final LibrarySignatures lib;

  /** The name of the top-level component. */
  public final String entrypoint;

  private final List<Component> components = new ArrayList<>();
  private final List<String> extraOpts = new ArrayList<>();

  public Context(LibrarySignatures lib, String entrypoint) {
    this.lib = lib;
    this.entrypoint = entrypoint;
  }

  /** Adds a component and returns it. */
  public Component add(Component component) {
    components.add(component);
    return component;
  }

  public ImmutableList<Component> components() {
    return ImmutableList.copyOf(components);
  }

  public Optional<Component> find(String name) {
    return components.stream().filter(c -> c.name.equals(name)).findFirst();
  }

  public Component component(String name) throws CompileError {
    return find(name).orElseThrow(() -> CompileError.undefined(name, "component"));
  }

  /**
   * Pass options, each of the form {@code <pass>:<option>} (setting a boolean option) or {@code
   * <pass>:<option>=<value>}.
   */
  public List<String> extraOpts() {
    return extraOpts;
  }
}
