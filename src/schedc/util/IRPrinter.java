package schedc.util;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import schedc.ir.Assignment;
import schedc.ir.Attributes;
import schedc.ir.Cell;
import schedc.ir.CombGroup;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlVisitor;
import schedc.ir.GroupBase;
import schedc.ir.Port;
import schedc.ir.StaticControl;

/**
 * Textual rendering of the IR. Assignments and guards use the syntax read by the front end.
 */
public class IRPrinter {
  private static final String INDENT = "  ";

  public static String print(Context ctx) {
    var sb = new StringBuilder();
    for (Component comp : ctx.components()) {
      if (sb.length() > 0)
        sb.append('\n');
      sb.append(print(comp));
    }
    return sb.toString();
  }

  public static String print(Component comp) {
    var sb = new StringBuilder();
    sb.append("component ").append(comp.name());
    if (!comp.attributes().isEmpty())
      sb.append(' ').append(comp.attributes());
    sb.append('(').append(ports(comp, Port.Direction.INPUT)).append(") -> (").append(ports(comp, Port.Direction.OUTPUT)).append(") {\n");
    sb.append(INDENT).append("cells {\n");
    for (Cell cell : comp.cells())
      sb.append(INDENT).append(INDENT).append(cell).append(cell.isGenerated() ? "; // generated\n" : ";\n");
    sb.append(INDENT).append("}\n");
    sb.append(INDENT).append("wires {\n");
    for (GroupBase group : comp.allGroups()) {
      sb.append(INDENT).append(INDENT).append(group);
      if (!group.attributes().isEmpty())
        sb.append(' ').append(group.attributes());
      sb.append(" {\n");
      assignments(sb, group.assignments(), 3);
      sb.append(INDENT).append(INDENT).append("}\n");
    }
    assignments(sb, comp.continuous(), 2);
    sb.append(INDENT).append("}\n");
    sb.append(INDENT).append("control {\n");
    if (!(comp.control() instanceof Control.Empty))
      sb.append(print(comp.control(), 2));
    sb.append(INDENT).append("}\n");
    sb.append("}\n");
    return sb.toString();
  }

  /** Renders a control tree, one statement per line, starting at the given indentation level. */
  public static String print(Control control, int level) {
    var printer = new ControlPrinter(level);
    control.accept(printer);
    return printer.sb.toString();
  }

  private static String ports(Component comp, Port.Direction direction) {
    return comp.signature()
        .stream()
        .filter(p -> p.direction() == direction && p.role() == Port.Role.NONE)
        .map(p -> p.name() + ": " + p.width())
        .collect(Collectors.joining(", "));
  }

  private static void assignments(StringBuilder sb, List<Assignment> assignments, int level) {
    for (Assignment a : assignments)
      sb.append(INDENT.repeat(level)).append(a).append('\n');
  }

  private static class ControlPrinter implements ControlVisitor<Void> {
    private final StringBuilder sb = new StringBuilder();
    private int level;

    ControlPrinter(int level) { this.level = level; }

    private StringBuilder line(Attributes attributes) {
      sb.append(INDENT.repeat(level));
      if (!attributes.isEmpty())
        sb.append(attributes).append(' ');
      return sb;
    }

    private void block(Attributes attributes, String header, List<? extends Control> children) {
      line(attributes).append(header).append(" {\n");
      ++level;
      children.forEach(c -> c.accept(this));
      --level;
      sb.append(INDENT.repeat(level)).append("}\n");
    }

    private static String comb(Optional<CombGroup> comb) { return comb.map(g -> " with " + g.name()).orElse(""); }

    private static String bindings(Control.Bindings b) {
      String inputs = b.inputs().entrySet().stream().map(e -> e.getKey() + " = " + e.getValue()).collect(Collectors.joining(", "));
      String outputs = b.outputs().entrySet().stream().map(e -> e.getKey() + " = " + e.getValue()).collect(Collectors.joining(", "));
      String refs = b.refCells().isEmpty()
                        ? ""
                        : "[" + b.refCells().entrySet().stream().map(Map.Entry::toString).collect(Collectors.joining(", ")) + "]";
      return refs + "(" + inputs + ")(" + outputs + ")";
    }

    @Override
    public Void visitEmpty(Control.Empty c) {
      line(c.attributes()).append("empty;\n");
      return null;
    }
    @Override
    public Void visitEnable(Control.Enable c) {
      line(c.attributes()).append(c.group().name()).append(";\n");
      return null;
    }
    @Override
    public Void visitInvoke(Control.Invoke c) {
      line(c.attributes()).append("invoke ").append(c.cell().name()).append(bindings(c.bindings())).append(comb(c.comb())).append(";\n");
      return null;
    }
    @Override
    public Void visitSeq(Control.Seq c) {
      block(c.attributes(), "seq", c.stmts());
      return null;
    }
    @Override
    public Void visitPar(Control.Par c) {
      block(c.attributes(), "par", c.stmts());
      return null;
    }
    @Override
    public Void visitIf(Control.If c) {
      block(c.attributes(), "if " + c.port() + comb(c.comb()), List.of(c.tbranch()));
      if (!(c.fbranch() instanceof Control.Empty)) {
        sb.setLength(sb.length() - 1);
        sb.append(" else {\n");
        ++level;
        c.fbranch().accept(this);
        --level;
        sb.append(INDENT.repeat(level)).append("}\n");
      }
      return null;
    }
    @Override
    public Void visitWhile(Control.While c) {
      block(c.attributes(), "while " + c.port() + comb(c.comb()), List.of(c.body()));
      return null;
    }
    @Override
    public Void visitRepeat(Control.Repeat c) {
      block(c.attributes(), "repeat " + c.count(), List.of(c.body()));
      return null;
    }
    @Override
    public Void visitStaticEnable(StaticControl.StaticEnable c) {
      line(c.attributes()).append(c.group().name()).append(";\n");
      return null;
    }
    @Override
    public Void visitStaticSeq(StaticControl.StaticSeq c) {
      block(c.attributes(), "static<" + c.latency() + "> seq", c.stmts());
      return null;
    }
    @Override
    public Void visitStaticPar(StaticControl.StaticPar c) {
      block(c.attributes(), "static<" + c.latency() + "> par", c.stmts());
      return null;
    }
    @Override
    public Void visitStaticIf(StaticControl.StaticIf c) {
      block(c.attributes(), "static<" + c.latency() + "> if " + c.port() + comb(c.comb()), List.of(c.tbranch()));
      sb.setLength(sb.length() - 1);
      sb.append(" else {\n");
      ++level;
      c.fbranch().accept(this);
      --level;
      sb.append(INDENT.repeat(level)).append("}\n");
      return null;
    }
    @Override
    public Void visitStaticRepeat(StaticControl.StaticRepeat c) {
      block(c.attributes(), "static repeat " + c.count(), List.of(c.body()));
      return null;
    }
    @Override
    public Void visitStaticInvoke(StaticControl.StaticInvoke c) {
      line(c.attributes()).append("static<").append(c.latency()).append("> invoke ").append(c.cell().name()).append(bindings(c.bindings())).append(";\n");
      return null;
    }
  }
}
