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

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hardloom.CompileError;
import org.jspecify.annotations.Nullable;

/** The values of a pass's options, parsed from a context's extra options. */
public final class PassOptions {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PassInfo info;
  private final Map<String, Long> values = new HashMap<>();

  private PassOptions(PassInfo info) {
    this.info = info;
    for (PassOpt opt : info.opts()) {
      values.put(opt.name(), opt.defaultValue());
    }
  }

  /**
   * Returns the options for the given pass. Options for other passes are ignored; an option this
   * pass does not declare is logged and ignored.
   */
  public static PassOptions parse(PassInfo info, List<String> extraOpts) throws CompileError {
    PassOptions result = new PassOptions(info);
    String prefix = info.name() + ":";
    for (String arg : extraOpts) {
      if (!arg.startsWith(prefix)) {
        continue;
      }
      String setting = arg.substring(prefix.length());
      int eq = setting.indexOf('=');
      String name = (eq < 0) ? setting : setting.substring(0, eq);
      Optional<PassOpt> opt =
          info.opts().stream().filter(o -> o.name().equals(name)).findFirst();
      if (opt.isEmpty()) {
        logger.atWarning().log("Ignoring unknown option %s for pass %s", name, info.name());
        continue;
      }
      result.values.put(name, parseValue(opt.get(), (eq < 0) ? null : setting.substring(eq + 1)));
    }
    return result;
  }

  private static long parseValue(PassOpt opt, @Nullable String value) throws CompileError {
    if (opt.type() == PassOpt.Type.BOOL) {
      if (value == null || value.equals("true")) {
        return 1;
      } else if (value.equals("false")) {
        return 0;
      }
    } else if (value != null) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        throw CompileError.misc(
            String.format("Option %s expects a number, got \"%s\"", opt.name(), value));
      }
    }
    throw CompileError.misc(
        String.format("Invalid value %s for option %s", value, opt.name()));
  }

  public boolean bool(String name) {
    return get(name, PassOpt.Type.BOOL) != 0;
  }

  public long number(String name) {
    return get(name, PassOpt.Type.NUMBER);
  }

  private long get(String name, PassOpt.Type type) {
    Preconditions.checkArgument(
        info.opts().stream().anyMatch(o -> o.name().equals(name) && o.type() == type),
        "%s has no %s option %s",
        info.name(),
        type,
        name);
    return values.get(name);
  }
}
