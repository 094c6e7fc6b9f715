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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A cell is an instance of a primitive or of another component, a constant, or the signature of
 * the component that contains it. Cells own ports, which are created when the cell is.
 */
public final class Cell {

  /** The four kinds of cell. */
  public enum Kind {
    /** An instance of a library primitive. */
    PRIMITIVE,
    /** An instance of another component in the same context. */
    COMPONENT,
    /** A constant value; its only port is {@code out}. */
    CONSTANT,
    /** The signature of the enclosing component. */
    THIS_COMPONENT
  }

  public final String name;
  public final Kind kind;

  /**
   * The name of the primitive or component this cell instantiates; for a THIS_COMPONENT cell, the
   * enclosing component's name.
   */
  public final String typeName;

  /** The parameter bindings of a primitive instance. */
  public final ImmutableMap<String, Long> params;

  public final Attributes attributes = new Attributes();

  private final Map<String, Port> ports = new LinkedHashMap<>();
  private final long value;

  Cell(String name, Kind kind, String typeName, ImmutableMap<String, Long> params, long value) {
    this.name = name;
    this.kind = kind;
    this.typeName = typeName;
    this.params = params;
    this.value = value;
  }

  Port addPort(String portName, int width, Direction direction, Attributes portAttributes) {
    Port port = new Port(portName, width, direction, portAttributes, this);
    Port prev = ports.putIfAbsent(portName, port);
    Preconditions.checkArgument(prev == null, "Duplicate port %s on %s", portName, name);
    return port;
  }

  /**
   * Returns the port with the given name. A missing port means the cell does not match its
   * signature, which earlier checks should have ruled out.
   */
  public Port get(String portName) {
    Port port = ports.get(portName);
    Preconditions.checkArgument(port != null, "Cell %s has no port named %s", name, portName);
    return port;
  }

  public Optional<Port> find(String portName) {
    return Optional.ofNullable(ports.get(portName));
  }

  public ImmutableList<Port> ports() {
    return ImmutableList.copyOf(ports.values());
  }

  /** Returns the ports with the given attribute, in declaration order. */
  public ImmutableList<Port> portsWith(Attribute attribute) {
    return ports.values().stream()
        .filter(p -> p.attributes.has(attribute))
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the value of a CONSTANT cell. */
  public long constantValue() {
    Preconditions.checkState(kind == Kind.CONSTANT, "%s is not a constant", name);
    return value;
  }

  /** Returns true if this is an instance of the named primitive. */
  public boolean isPrimitive(String primitive) {
    return kind == Kind.PRIMITIVE && typeName.equals(primitive);
  }

  @Override
  public String toString() {
    return name;
  }
}
