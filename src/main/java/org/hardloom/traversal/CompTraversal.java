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

import com.google.common.collect.ImmutableList;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.hardloom.CompileError;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Component;
import org.hardloom.ir.Context;

/** Computes the order in which a pass visits components. */
public final class CompTraversal {

  private CompTraversal() {}

  /**
   * Returns the components of {@code ctx} in the given order. POST order lists every component
   * after all the components it instantiates, otherwise preserving definition order as far as
   * possible; PRE order is the reverse.
   */
  public static ImmutableList<Component> order(Context ctx, Order order) throws CompileError {
    ImmutableList<Component> components = ctx.components();
    if (order == Order.NONE) {
      return components;
    }
    ImmutableList<Component> post = postOrder(components);
    return (order == Order.POST) ? post : post.reverse();
  }

  private static ImmutableList<Component> postOrder(List<Component> components)
      throws CompileError {
    Map<String, Component> byName = new HashMap<>();
    for (Component comp : components) {
      byName.put(comp.name, comp);
    }
    // An edge from callee to caller.
    MutableGraph<Component> graph =
        GraphBuilder.directed()
            .allowsSelfLoops(true)
            .incidentEdgeOrder(ElementOrder.stable())
            .expectedNodeCount(components.size())
            .build();
    components.forEach(graph::addNode);
    for (Component caller : components) {
      for (Cell cell : caller.cells()) {
        if (cell.kind == Cell.Kind.COMPONENT) {
          Component callee = byName.get(cell.typeName);
          if (callee == null) {
            throw CompileError.undefined(cell.typeName, "component");
          }
          graph.putEdge(callee, caller);
        }
      }
    }
    Map<Component, Integer> pending = new HashMap<>();
    Deque<Component> ready = new ArrayDeque<>();
    for (Component comp : components) {
      int inDegree = graph.inDegree(comp);
      pending.put(comp, inDegree);
      if (inDegree == 0) {
        ready.add(comp);
      }
    }
    ImmutableList.Builder<Component> result = ImmutableList.builder();
    int count = 0;
    while (!ready.isEmpty()) {
      Component next = ready.remove();
      result.add(next);
      count++;
      for (Component caller : graph.successors(next)) {
        if (pending.merge(caller, -1, Integer::sum) == 0) {
          ready.add(caller);
        }
      }
    }
    if (count != components.size()) {
      throw CompileError.malformedStructure("Components instantiate each other cyclically");
    }
    return result.build();
  }
}
