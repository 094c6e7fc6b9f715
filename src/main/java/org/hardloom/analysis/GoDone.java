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

package org.hardloom.analysis;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Attributes;
import org.hardloom.ir.Port;
import org.hardloom.ir.Primitive;

/** The go/done port pairs of a primitive or component, each with its fixed latency. */
public record GoDone(ImmutableList<GoDone.Entry> ports) {

  /** Asserting {@code go} leads to {@code done} being asserted {@code latency} cycles later. */
  public record Entry(String go, String done, long latency) {}

  /**
   * Returns the go/done pairs of a primitive. Only go ports with an {@code @interval} attribute are
   * included.
   */
  public static GoDone of(Primitive prim) {
    return build(
        prim.ports().stream()
            .map(p -> new NamedAttributes(p.name(), p.attributes()))
            .collect(ImmutableList.toImmutableList()),
        false);
  }

  /**
   * Returns the go/done pairs of a component signature or cell. A go port's latency is taken from
   * its {@code @interval} attribute or, failing that, its {@code @promotable} attribute.
   */
  public static GoDone of(List<Port> ports) {
    return build(
        ports.stream()
            .map(p -> new NamedAttributes(p.name, p.attributes))
            .collect(ImmutableList.toImmutableList()),
        true);
  }

  private record NamedAttributes(String name, Attributes attributes) {}

  private static GoDone build(List<NamedAttributes> ports, boolean allowPromotable) {
    Map<Long, String> doneByIndex = new HashMap<>();
    for (NamedAttributes p : ports) {
      p.attributes.get(Attribute.DONE).ifPresent(i -> doneByIndex.put(i, p.name));
    }
    ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    for (NamedAttributes p : ports) {
      OptionalLong index = p.attributes.get(Attribute.GO);
      if (index.isEmpty()) {
        continue;
      }
      OptionalLong latency = p.attributes.get(Attribute.INTERVAL);
      if (latency.isEmpty() && allowPromotable) {
        latency = p.attributes.get(Attribute.PROMOTABLE);
      }
      String done = doneByIndex.get(index.getAsLong());
      if (latency.isPresent() && done != null) {
        entries.add(new Entry(p.name, done, latency.getAsLong()));
      }
    }
    return new GoDone(entries.build());
  }

  public boolean isGo(String name) {
    return ports.stream().anyMatch(e -> e.go.equals(name));
  }

  public boolean isDone(String name) {
    return ports.stream().anyMatch(e -> e.done.equals(name));
  }

  /** Returns the entry whose done port has the given name. */
  public Optional<Entry> byDone(String name) {
    return ports.stream().filter(e -> e.done.equals(name)).findFirst();
  }
}
