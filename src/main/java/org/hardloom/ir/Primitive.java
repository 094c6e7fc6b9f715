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
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The signature of a library primitive: its parameters and its ports. A port's width is either a
 * fixed number or the value bound to one of the parameters.
 */
public record Primitive(String name, ImmutableList<String> params, ImmutableList<PortDef> ports) {

  /** A port declaration; exactly one of {@code width} and {@code widthParam} is meaningful. */
  public record PortDef(
      String name,
      int width,
      @Nullable String widthParam,
      Direction direction,
      Attributes attributes) {

    /** Returns the width of this port given the instance's parameter bindings. */
    public int resolveWidth(Map<String, Long> bindings) {
      if (widthParam == null) {
        return width;
      }
      Long bound = bindings.get(widthParam);
      Preconditions.checkArgument(bound != null, "Unbound parameter %s", widthParam);
      return Math.toIntExact(bound);
    }

    public static PortDef input(String name, int width) {
      return new PortDef(name, width, null, Direction.INPUT, new Attributes());
    }

    public static PortDef input(String name, String widthParam) {
      return new PortDef(name, 0, widthParam, Direction.INPUT, new Attributes());
    }

    public static PortDef output(String name, int width) {
      return new PortDef(name, width, null, Direction.OUTPUT, new Attributes());
    }

    public static PortDef output(String name, String widthParam) {
      return new PortDef(name, 0, widthParam, Direction.OUTPUT, new Attributes());
    }

    /** Returns this declaration with an additional attribute. */
    public PortDef with(Attribute attribute, long value) {
      Attributes copy = Attributes.copyOf(attributes).insert(attribute, value);
      return new PortDef(name, width, widthParam, direction, copy);
    }
  }

  public static Primitive of(String name, ImmutableList<String> params, PortDef... ports) {
    return new Primitive(name, params, ImmutableList.copyOf(ports));
  }
}
