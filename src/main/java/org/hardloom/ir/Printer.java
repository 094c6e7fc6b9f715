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

import static org.hardloom.util.StringUtil.indent;
import static org.hardloom.util.StringUtil.joinElements;

import java.util.List;
import java.util.stream.Collectors;
import org.hardloom.ir.Control.Binding;
import org.hardloom.ir.StaticControl.StaticEnable;
import org.hardloom.ir.StaticControl.StaticIf;
import org.hardloom.ir.StaticControl.StaticInvoke;
import org.hardloom.ir.StaticControl.StaticPar;
import org.hardloom.ir.StaticControl.StaticRepeat;
import org.hardloom.ir.StaticControl.StaticSeq;
import org.jspecify.annotations.Nullable;

/** Renders the IR in a readable textual form, for logs and error messages. */
public class Printer {

  private Printer() {}

  private static final int INDENT = 2;

  /** Returns the guard with the minimal parentheses needed. */
  public static String guard(Guard g) {
    return guard(g, 0);
  }

  // Precedence: 0 for or, 1 for and, 2 for not and atoms.
  private static String guard(Guard g, int context) {
    String result;
    int precedence;
    if (g.isTrue()) {
      return "1'd1";
    } else if (g instanceof Guard.PortGuard pg) {
      return pg.port().toString();
    } else if (g instanceof Guard.CompOp cmp) {
      result = cmp.left() + " " + cmp.op().symbol + " " + cmp.right();
      precedence = 1;
    } else if (g instanceof Guard.Not not) {
      return "!" + guard(not.inner(), 2);
    } else if (g instanceof Guard.And and) {
      result = guard(and.left(), 1) + " & " + guard(and.right(), 1);
      precedence = 1;
    } else if (g instanceof Guard.Or or) {
      result = guard(or.left(), 0) + " | " + guard(or.right(), 0);
      precedence = 0;
    } else {
      throw new AssertionError();
    }
    return (precedence < context) ? "(" + result + ")" : result;
  }

  public static String assignment(Assignment a) {
    StringBuilder sb = new StringBuilder();
    sb.append(a.dst()).append(" = ");
    if (a.interval() != null) {
      sb.append(a.interval()).append(' ');
    }
    if (!a.guard().isTrue()) {
      sb.append(guard(a.guard(), 1)).append(" ? ");
    } else if (a.interval() != null) {
      sb.append("? ");
    }
    return sb.append(a.src()).append(';').toString();
  }

  public static String group(Group g) {
    String header =
        switch (g.kind) {
          case DYNAMIC -> "group " + g.name;
          case STATIC -> "static<" + g.latency() + "> group " + g.name;
          case COMBINATIONAL -> "comb group " + g.name;
        };
    return withAttributes(g.attributes, header) + " {\n" + assignments(g.assignments()) + "}";
  }

  private static String assignments(List<Assignment> assignments) {
    return assignments.stream()
        .map(a -> " ".repeat(INDENT) + assignment(a) + "\n")
        .collect(Collectors.joining());
  }

  public static String component(Component comp) {
    StringBuilder sb = new StringBuilder();
    sb.append("component ").append(comp.name);
    sb.append(
        comp.signature.ports().stream()
            .map(p -> withAttributes(p.attributes, p.name + ": " + p.width))
            .collect(Collectors.joining(", ", "(", ")")));
    sb.append(" {\n");
    StringBuilder body = new StringBuilder("cells {\n");
    for (Cell cell : comp.cells()) {
      if (cell.kind == Cell.Kind.CONSTANT) {
        continue;
      }
      String params =
          cell.params.values().stream().map(String::valueOf).collect(Collectors.joining(", "));
      body.append(" ".repeat(INDENT))
          .append(withAttributes(cell.attributes, cell.name))
          .append(" = ")
          .append(cell.typeName)
          .append('(')
          .append(params)
          .append(");\n");
    }
    body.append("}\nwires {\n");
    for (Group g : comp.groups()) {
      body.append(indent(group(g), INDENT)).append('\n');
    }
    body.append(assignments(comp.continuousAssignments()));
    body.append("}\ncontrol {\n");
    if (!(comp.control() instanceof StaticControl.Empty)) {
      body.append(indent(control(comp.control()), INDENT)).append('\n');
    }
    body.append("}");
    return sb.append(indent(body.toString(), INDENT)).append("\n}").toString();
  }

  /** Returns a multi-line rendering of the given control statement. */
  public static String control(Control c) {
    String text;
    if (c instanceof Control.Seq seq) {
      text = "seq " + block(seq.stmts());
    } else if (c instanceof Control.Par par) {
      text = "par " + block(par.stmts());
    } else if (c instanceof Control.If ifc) {
      text = "if " + ifc.port + with(ifc.cond) + " " + block(List.of(ifc.tbranch()));
      if (!(ifc.fbranch() instanceof StaticControl.Empty)) {
        text += " else " + block(List.of(ifc.fbranch()));
      }
    } else if (c instanceof Control.While whilec) {
      text = "while " + whilec.port + with(whilec.cond) + " " + block(List.of(whilec.body()));
    } else if (c instanceof Control.Repeat repeat) {
      text = "repeat " + repeat.numRepeats + " " + block(List.of(repeat.body()));
    } else if (c instanceof Control.Invoke invoke) {
      text = invoke(invoke.comp, invoke.inputs, invoke.outputs) + with(invoke.combGroup) + ";";
    } else if (c instanceof Control.Enable enable) {
      text = enable.group.name + ";";
    } else if (c instanceof StaticControl.Empty) {
      text = "empty;";
    } else if (c instanceof StaticSeq seq) {
      text = "static<" + seq.latency() + "> seq " + block(seq.stmts());
    } else if (c instanceof StaticPar par) {
      text = "static<" + par.latency() + "> par " + block(par.stmts());
    } else if (c instanceof StaticIf ifc) {
      text = "static<" + ifc.latency() + "> if " + ifc.port + " " + block(List.of(ifc.tbranch()));
      if (!(ifc.fbranch() instanceof StaticControl.Empty)) {
        text += " else " + block(List.of(ifc.fbranch()));
      }
    } else if (c instanceof StaticRepeat repeat) {
      text = "static repeat " + repeat.numRepeats + " " + block(List.of(repeat.body()));
    } else if (c instanceof StaticInvoke invoke) {
      text =
          "static<" + invoke.latency() + "> "
              + invoke(invoke.comp, invoke.inputs, invoke.outputs) + ";";
    } else if (c instanceof StaticEnable enable) {
      text = enable.group.name + ";";
    } else {
      throw new AssertionError();
    }
    return withAttributes(c.attributes(), text);
  }

  private static String with(@Nullable Group cond) {
    return (cond == null) ? "" : " with " + cond.name;
  }

  private static String invoke(Cell comp, List<Binding> inputs, List<Binding> outputs) {
    return "invoke " + comp.name + bindings(inputs) + bindings(outputs);
  }

  private static String bindings(List<Binding> bindings) {
    return joinElements(
        "(",
        ")",
        bindings.size(),
        i -> bindings.get(i).formal().name + "=" + bindings.get(i).actual());
  }

  private static String block(List<? extends Control> stmts) {
    if (stmts.isEmpty()) {
      return "{}";
    }
    return stmts.stream()
        .map(s -> indent(control(s), INDENT))
        .collect(Collectors.joining("\n", "{\n", "\n}"));
  }

  private static String withAttributes(Attributes attributes, String text) {
    return attributes.isEmpty() ? text : attributes + " " + text;
  }
}
