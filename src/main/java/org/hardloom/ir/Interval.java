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

/** A half-open range of cycles {@code [begin, end)} during which a static assignment is active. */
public record Interval(long begin, long end) {

  public Interval {
    Preconditions.checkArgument(
        begin >= 0 && end > begin, "Invalid interval [%s, %s)", begin, end);
  }

  public long length() {
    return end - begin;
  }

  public boolean contains(long cycle) {
    return cycle >= begin && cycle < end;
  }

  /** Returns this interval moved {@code offset} cycles later. */
  public Interval shift(long offset) {
    return new Interval(begin + offset, end + offset);
  }

  @Override
  public String toString() {
    return "%[" + begin + ":" + end + "]";
  }
}
