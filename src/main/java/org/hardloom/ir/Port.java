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
import org.jspecify.annotations.Nullable;

/**
 * A port is either owned by a cell or is one of a group's two holes ({@code go} and {@code done}).
 * Ports are compared by identity.
 */
public final class Port {
  public final String name;
  public final int width;
  public final Direction direction;
  public final Attributes attributes;

  private final @Nullable Cell cell;
  private final @Nullable Group group;

  Port(String name, int width, Direction direction, Attributes attributes, Cell cell) {
    this(name, width, direction, attributes, cell, null);
  }

  Port(String name, Group group) {
    this(name, 1, Direction.INOUT, new Attributes(), null, group);
  }

  private Port(
      String name,
      int width,
      Direction direction,
      Attributes attributes,
      @Nullable Cell cell,
      @Nullable Group group) {
    Preconditions.checkArgument(width >= 0);
    this.name = name;
    this.width = width;
    this.direction = direction;
    this.attributes = attributes;
    this.cell = cell;
    this.group = group;
  }

  public boolean isHole() {
    return group != null;
  }

  /** Returns the cell that owns this port; should not be called on a hole. */
  public Cell cell() {
    Preconditions.checkState(cell != null, "%s is a hole", this);
    return cell;
  }

  /** Returns the group that owns this hole; should only be called on a hole. */
  public Group group() {
    Preconditions.checkState(group != null, "%s is not a hole", this);
    return group;
  }

  /** Returns the name of the cell or group that owns this port. */
  public String parentName() {
    return (cell != null) ? cell.name : group.name;
  }

  /** Returns true if this is the output of a constant with the given value and width. */
  public boolean isConstant(long value, int width) {
    return cell != null
        && cell.kind == Cell.Kind.CONSTANT
        && cell.constantValue() == value
        && this.width == width;
  }

  @Override
  public String toString() {
    if (group != null) {
      return group.name + "[" + name + "]";
    } else if (cell.kind == Cell.Kind.CONSTANT) {
      return width + "'d" + cell.constantValue();
    } else if (cell.kind == Cell.Kind.THIS_COMPONENT) {
      return name;
    }
    return cell.name + "." + name;
  }
}
