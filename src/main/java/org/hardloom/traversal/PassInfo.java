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

/** The name under which a pass is registered, a one-line description, and its options. */
public record PassInfo(String name, String description, ImmutableList<PassOpt> opts) {

  public PassInfo(String name, String description, PassOpt... opts) {
    this(name, description, ImmutableList.copyOf(opts));
  }
}
