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

package org.hardloom.passes;

import java.util.OptionalLong;
import org.hardloom.ir.Attribute;
import org.hardloom.ir.Attributes;
import org.hardloom.ir.Component;
import org.hardloom.ir.Control;
import org.hardloom.ir.Group;
import org.hardloom.traversal.Action;
import org.hardloom.traversal.PassInfo;
import org.hardloom.traversal.Visitor;

/**
 * Turns each {@code @static(n)} annotation on a dynamic group or dynamic control statement into
 * {@code @promotable(n)}, so that later passes treat the latency as a hint rather than a promise.
 */
public final class AttributePromotion implements Visitor {
  public static final PassInfo INFO =
      new PassInfo(
          "attr-promotion",
          "Turns @static annotations on dynamic groups and control into @promotable");

  @Override
  public PassInfo info() {
    return INFO;
  }

  private static void promote(Attributes attrs) {
    OptionalLong latency = attrs.get(Attribute.STATIC);
    if (latency.isPresent()) {
      attrs.remove(Attribute.STATIC);
      attrs.insert(Attribute.PROMOTABLE, latency.getAsLong());
    }
  }

  private static Action promote(Control c) {
    promote(c.attributes());
    return Action.CONTINUE;
  }

  @Override
  public Action start(Component comp) {
    for (Group group : comp.groups(Group.Kind.DYNAMIC)) {
      promote(group.attributes);
    }
    return Action.CONTINUE;
  }

  @Override
  public Action startSeq(Control.Seq s, Component comp) {
    return promote(s);
  }

  @Override
  public Action startPar(Control.Par s, Component comp) {
    return promote(s);
  }

  @Override
  public Action startIf(Control.If s, Component comp) {
    return promote(s);
  }

  @Override
  public Action startWhile(Control.While s, Component comp) {
    return promote(s);
  }

  @Override
  public Action startRepeat(Control.Repeat s, Component comp) {
    return promote(s);
  }

  @Override
  public Action enable(Control.Enable s, Component comp) {
    return promote(s);
  }

  @Override
  public Action invoke(Control.Invoke s, Component comp) {
    return promote(s);
  }
}
