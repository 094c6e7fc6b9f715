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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.hardloom.ir.Context;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.PassOpt;
import org.hardloom.traversal.Visitor;

/**
 * A registry of passes and of aliases for sequences of passes, which can run a plan consisting of
 * pass and alias names.
 */
public final class PassManager {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Creates a pass for a context; a new instance is created each time the pass runs. */
  @FunctionalInterface
  public interface Factory {
    Visitor create(Context ctx) throws CompileError;
  }

  private record Registration(PassInfo info, Factory factory) {}

  private final Map<String, Registration> passes = new TreeMap<>();
  private final Map<String, ImmutableList<String>> aliases = new TreeMap<>();

  /** Registers a pass under {@code info.name()}. */
  public void registerPass(PassInfo info, Factory factory) throws CompileError {
    if (passes.containsKey(info.name())) {
      throw CompileError.misc(
          String.format("Pass with name '%s' is already registered.", info.name()));
    }
    passes.put(info.name(), new Registration(info, factory));
  }

  /**
   * Registers an alias for a sequence of passes. Each element of {@code names} is either a pass or
   * a previously registered alias, which is expanded.
   */
  public void addAlias(String name, List<String> names) throws CompileError {
    if (aliases.containsKey(name)) {
      throw CompileError.misc(String.format("Alias with name '%s' already registered.", name));
    }
    ImmutableList.Builder<String> expanded = ImmutableList.builder();
    for (String pass : names) {
      if (aliases.containsKey(pass)) {
        expanded.addAll(aliases.get(pass));
      } else if (passes.containsKey(pass)) {
        expanded.add(pass);
      } else {
        throw CompileError.undefined(pass, "pass or alias");
      }
    }
    aliases.put(name, expanded.build());
  }

  private ImmutableList<String> resolveAlias(String maybeAlias) {
    ImmutableList<String> result = aliases.get(maybeAlias);
    return (result != null) ? result : ImmutableList.of(maybeAlias);
  }

  private ImmutableList<String> resolveAll(List<String> names) throws CompileError {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (String name : names) {
      for (String pass : resolveAlias(name)) {
        if (!passes.containsKey(pass)) {
          throw CompileError.misc(String.format("Unknown pass: %s.", pass));
        }
        result.add(pass);
      }
    }
    return result.build();
  }

  /**
   * Returns the passes that {@link #executePlan} would run: the expansion of {@code incls}, minus
   * the expansion of {@code excls}.
   */
  public ImmutableList<String> createPlan(List<String> incls, List<String> excls)
      throws CompileError {
    ImmutableSet<String> excluded = ImmutableSet.copyOf(resolveAll(excls));
    return resolveAll(incls).stream()
        .filter(p -> !excluded.contains(p))
        .collect(ImmutableList.toImmutableList());
  }

  /** Runs the passes named by {@code incls}, except those named by {@code excls}, in order. */
  public void executePlan(Context ctx, List<String> incls, List<String> excls)
      throws CompileError {
    ImmutableSet<String> excluded = ImmutableSet.copyOf(resolveAll(excls));
    for (String name : resolveAll(incls)) {
      if (excluded.contains(name)) {
        logger.atInfo().log("%s: Ignored", name);
        continue;
      }
      long start = System.nanoTime();
      passes.get(name).factory.create(ctx).doPass(ctx);
      long millis = (System.nanoTime() - start) / 1_000_000;
      if (millis > 5000) {
        logger.atWarning().log("%s: %sms", name, millis);
      } else {
        logger.atInfo().log("%s: %sms", name, millis);
      }
    }
  }

  /** Returns a description of every registered pass (with its options) and alias. */
  public String help() {
    StringBuilder sb = new StringBuilder("Passes:\n");
    for (Registration r : passes.values()) {
      sb.append("- ").append(r.info.name()).append(": ").append(r.info.description()).append('\n');
      for (PassOpt opt : r.info.opts()) {
        sb.append(
            String.format(
                "  * %s: %s (default: %s)\n",
                opt.name(),
                opt.description(),
                defaultString(opt)));
      }
    }
    sb.append("\nAliases:\n");
    aliases.forEach(
        (alias, names) ->
            sb.append(String.format("- %s: %s\n", alias, String.join(", ", names))));
    return sb.toString();
  }

  private static String defaultString(PassOpt opt) {
    if (opt.type() == PassOpt.Type.BOOL) {
      return (opt.defaultValue() != 0) ? "true" : "false";
    }
    return String.valueOf(opt.defaultValue());
  }
}
