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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.Graph;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import org.hardloom.CompileError;
import org.hardloom.ir.Cell;
import org.hardloom.ir.Control;
import org.hardloom.ir.Printer;
import org.jspecify.annotations.Nullable;

/**
 * Orders sibling control statements so that their data dependencies are respected. Dependencies
 * are computed from the cells each statement reads and writes; constants and the component's own
 * signature are ignored.
 *
 * <p>Dependency graphs have one node per statement, identified by its index in the input list.
 */
public final class ControlOrder {

  private ControlOrder() {}

  /**
   * Returns the statements in an order where each statement that writes a cell comes before every
   * statement that reads it. Statements with no dependency between them keep their relative order.
   *
   * @throws CompileError with kind DATA_RACE if no such order exists; the message lists the
   *     statements of a smallest cycle with the cells each reads and writes
   */
  public static ImmutableList<Control> totalOrder(List<? extends Control> stmts)
      throws CompileError {
    List<ReadWriteSet> rwSets = stmts.stream().map(ReadWriteSet::of).collect(toImmutableList());
    MutableGraph<Integer> graph = newGraph(stmts.size());
    // Index the writers of each cell, then connect them to the readers.
    Map<Cell, List<Integer>> writers = new HashMap<>();
    for (int i = 0; i < stmts.size(); i++) {
      for (Cell cell : rwSets.get(i).writeCells()) {
        writers.computeIfAbsent(cell, k -> new ArrayList<>()).add(i);
      }
    }
    for (int reader = 0; reader < stmts.size(); reader++) {
      for (Cell cell : rwSets.get(reader).readCells()) {
        for (int writer : writers.getOrDefault(cell, List.of())) {
          if (writer != reader) {
            graph.putEdge(writer, reader);
          }
        }
      }
    }
    Optional<ImmutableList<Integer>> order = topologicalOrder(graph);
    if (order.isPresent()) {
      return order.get().stream().map(stmts::get).collect(toImmutableList());
    }
    ImmutableSet<Integer> cycle = smallestCycle(graph);
    String members =
        cycle.stream()
            .map(
                i ->
                    String.format(
                        "%s\n  which reads: %s\n  and writes: %s",
                        Printer.control(stmts.get(i)),
                        names(rwSets.get(i).readCells()),
                        names(rwSets.get(i).writeCells())))
            .collect(Collectors.joining("\n"));
    throw new CompileError(
        CompileError.Kind.DATA_RACE,
        "No possible sequential ordering. Control programs exhibit data race:\n" + members);
  }

  /**
   * Returns the dependency graph of statements that execute in program order: there is an edge
   * from an earlier statement to a later one if the later one reads a cell the earlier one writes,
   * writes a cell the earlier one reads, or writes a cell the earlier one also writes. Statements
   * that read cells driven by continuous assignments ({@code contWrites}), or write cells read by
   * them ({@code contReads}), are additionally kept in program order with respect to each other.
   */
  public static ImmutableGraph<Integer> dependencyGraphSeq(
      List<? extends Control> stmts, Set<Cell> contReads, Set<Cell> contWrites) {
    MutableGraph<Integer> graph = newGraph(stmts.size());
    Map<Cell, List<Integer>> reads = new HashMap<>();
    Map<Cell, List<Integer>> writes = new HashMap<>();
    List<Integer> continuous = new ArrayList<>();
    for (int i = 0; i < stmts.size(); i++) {
      ReadWriteSet rw = ReadWriteSet.of(stmts.get(i));
      boolean touchesContinuous = false;
      for (Cell cell : rw.readCells()) {
        addEdges(graph, writes.get(cell), i);
        touchesContinuous |= contWrites.contains(cell);
        reads.computeIfAbsent(cell, k -> new ArrayList<>()).add(i);
      }
      for (Cell cell : rw.writeCells()) {
        addEdges(graph, writes.get(cell), i);
        addEdges(graph, reads.get(cell), i);
        touchesContinuous |= contReads.contains(cell);
        writes.computeIfAbsent(cell, k -> new ArrayList<>()).add(i);
      }
      if (touchesContinuous) {
        addEdges(graph, continuous, i);
        continuous.add(i);
      }
    }
    return ImmutableGraph.copyOf(graph);
  }

  private static void addEdges(
      MutableGraph<Integer> graph, @Nullable List<Integer> from, int to) {
    if (from != null) {
      for (int i : from) {
        if (i != to) {
          graph.putEdge(i, to);
        }
      }
    }
  }

  /**
   * Returns the nodes of {@code graph} in topological order, choosing the lowest-numbered ready
   * node at each step, or empty if the graph has a cycle.
   */
  public static Optional<ImmutableList<Integer>> topologicalOrder(Graph<Integer> graph) {
    Map<Integer, Integer> pending = new HashMap<>();
    PriorityQueue<Integer> ready = new PriorityQueue<>(Comparator.naturalOrder());
    for (int node : graph.nodes()) {
      int inDegree = graph.inDegree(node);
      pending.put(node, inDegree);
      if (inDegree == 0) {
        ready.add(node);
      }
    }
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    int count = 0;
    while (!ready.isEmpty()) {
      int next = ready.remove();
      result.add(next);
      count++;
      for (int succ : graph.successors(next)) {
        if (pending.merge(succ, -1, Integer::sum) == 0) {
          ready.add(succ);
        }
      }
    }
    return (count == graph.nodes().size()) ? Optional.of(result.build()) : Optional.empty();
  }

  /** Returns the smallest strongly-connected component of {@code graph} with more than one node. */
  private static ImmutableSet<Integer> smallestCycle(Graph<Integer> graph) {
    Graph<Integer> transposed = Graphs.transpose(graph);
    Set<Integer> seen = new HashSet<>();
    ImmutableSet<Integer> best = null;
    for (int node : graph.nodes()) {
      if (seen.contains(node)) {
        continue;
      }
      ImmutableSet<Integer> scc =
          Sets.intersection(
                  Graphs.reachableNodes(graph, node), Graphs.reachableNodes(transposed, node))
              .immutableCopy();
      seen.addAll(scc);
      if (scc.size() > 1 && (best == null || scc.size() < best.size())) {
        best = scc;
      }
    }
    if (best == null) {
      throw new AssertionError("No cycle found");
    }
    return best;
  }

  private static MutableGraph<Integer> newGraph(int size) {
    MutableGraph<Integer> graph =
        GraphBuilder.directed()
            .nodeOrder(ElementOrder.insertion())
            .incidentEdgeOrder(ElementOrder.stable())
            .expectedNodeCount(size)
            .build();
    for (int i = 0; i < size; i++) {
      graph.addNode(i);
    }
    return graph;
  }

  private static String names(Set<Cell> cells) {
    return cells.stream().map(c -> c.name).collect(Collectors.joining(", "));
  }
}
