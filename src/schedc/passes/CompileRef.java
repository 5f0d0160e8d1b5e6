package schedc.passes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Atom;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.GroupBase;
import schedc.ir.Group;
import schedc.ir.Guard;
import schedc.ir.Port;
import schedc.ir.StaticControl;
import schedc.ir.StaticGroup;

/**
 * Removes reference cells. Each port of a reference cell, except clock and reset, becomes a signature port
 * {@code <cell>_<port>} of opposite direction; instances of the component gain the same ports and invokes bind the
 * supplied cells to them. An invoke of a reference cell itself becomes a group driving the signature ports.
 * Callees are processed before their callers.
 */
public class CompileRef implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "compile-ref";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Moves the ports of reference cells into the component signature";
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.WELL_FORMED);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.NO_REF_CELLS);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    // component -> reference cell -> port of the cell -> signature port
    Map<String, Map<String, Map<String, Port>>> dumped = new HashMap<>();
    for (Component comp : ctx.postOrder()) {
      for (Cell cell : comp.cells()) {
        var callee = ctx.callee(cell);
        if (callee.isEmpty() || !dumped.containsKey(callee.get().name()))
          continue;
        for (Map<String, Port> ports : dumped.get(callee.get().name()).values())
          for (Port port : ports.values())
            cell.addPort(new Port(Port.Owner.CELL, cell.name(), port.name(), port.width(), port.direction(), Port.Role.NONE, false));
      }

      var own = new LinkedHashMap<String, Map<String, Port>>();
      var mapping = new HashMap<Port, Port>();
      for (Cell cell : comp.cells()) {
        if (!cell.isReference())
          continue;
        var ports = new LinkedHashMap<String, Port>();
        for (Port port : cell.ports()) {
          if (port.role() == Port.Role.CLK || port.role() == Port.Role.RESET)
            continue;
          var direction = port.direction() == Port.Direction.INPUT ? Port.Direction.OUTPUT : Port.Direction.INPUT;
          Port sig = comp.addPort(freshPortName(comp, cell.name() + "_" + port.name()), port.width(), direction, Port.Role.NONE);
          ports.put(port.name(), sig);
          mapping.put(port, sig);
        }
        own.put(cell.name(), ports);
      }

      var rewriter = new Rewriter(ctx, comp, dumped, mapping, diags);
      comp.setControl(rewriter.rewrite(comp.control()));
      for (GroupBase group : comp.allGroups())
        group.rewritePorts(mapping);
      comp.continuous().replaceAll(a -> a.mapPorts(rewriter::map));
      for (String cellName : own.keySet())
        comp.removeCell(comp.cell(cellName));
      if (!own.isEmpty()) {
        dumped.put(comp.name(), own);
        logger.debug("{}: moved reference cells {} into the signature", comp.name(), own.keySet());
      }
    }
  }

  private static String freshPortName(Component comp, String prefix) {
    if (!comp.hasPort(prefix))
      return prefix;
    for (int i = 0;; ++i)
      if (!comp.hasPort(prefix + i))
        return prefix + i;
  }

  private static class Rewriter {
    private final Context ctx;
    private final Component comp;
    private final Map<String, Map<String, Map<String, Port>>> dumped;
    private final Map<Port, Port> mapping;
    private final Diagnostics diags;
    private final Builder builder;

    Rewriter(Context ctx, Component comp, Map<String, Map<String, Map<String, Port>>> dumped, Map<Port, Port> mapping, Diagnostics diags) {
      this.ctx = ctx;
      this.comp = comp;
      this.dumped = dumped;
      this.mapping = mapping;
      this.diags = diags;
      this.builder = new Builder(ctx, comp, true);
    }

    Port map(Port port) { return mapping.getOrDefault(port, port); }

    private Atom mapAtom(Atom atom) { return atom instanceof Port ? map((Port)atom) : atom; }

    private static <C extends Control> C withAttributes(C ret, Control old) {
      ret.attributes().addAll(old.attributes());
      return ret;
    }

    Control rewrite(Control c) {
      if (c instanceof StaticControl)
        return rewriteStatic((StaticControl)c);
      if (c instanceof Control.Seq) {
        ((Control.Seq)c).stmts().replaceAll(this::rewrite);
      } else if (c instanceof Control.Par) {
        ((Control.Par)c).stmts().replaceAll(this::rewrite);
      } else if (c instanceof Control.Repeat) {
        var rc = (Control.Repeat)c;
        rc.setBody(rewrite(rc.body()));
      } else if (c instanceof Control.If) {
        var ifc = (Control.If)c;
        return withAttributes(new Control.If(map(ifc.port()), ifc.comb().orElse(null), rewrite(ifc.tbranch()), rewrite(ifc.fbranch())), c);
      } else if (c instanceof Control.While) {
        var wc = (Control.While)c;
        return withAttributes(new Control.While(map(wc.port()), wc.comb().orElse(null), rewrite(wc.body())), c);
      } else if (c instanceof Control.Invoke) {
        var invoke = (Control.Invoke)c;
        Control.Bindings bindings = bindings(invoke.cell(), invoke.bindings(), c.describe());
        if (!invoke.cell().isReference())
          return withAttributes(new Control.Invoke(invoke.cell(), bindings, invoke.comb().orElse(null)), c);
        Group group = builder.addGroup("invoke_" + invoke.cell().name());
        Port go = map(invoke.cell().port(Port.Role.GO).orElseThrow());
        Port done = map(invoke.cell().port(Port.Role.DONE).orElseThrow());
        group.add(new Assignment(go, Constant.one(), Guard.port(done).not()));
        group.addAll(assignments(invoke.cell(), bindings));
        invoke.comb().ifPresent(comb -> group.addAll(comb.assignments()));
        group.add(new Assignment(group.done(), done));
        logger.debug("{}: {} of a reference cell lowered into {}", comp.name(), c.describe(), group);
        return withAttributes(new Control.Enable(group), c);
      }
      return c;
    }

    StaticControl rewriteStatic(StaticControl c) {
      if (c instanceof StaticControl.StaticSeq) {
        var stmts = new ArrayList<StaticControl>();
        ((StaticControl.StaticSeq)c).stmts().forEach(s -> stmts.add(rewriteStatic(s)));
        return withAttributes(new StaticControl.StaticSeq(stmts), c);
      }
      if (c instanceof StaticControl.StaticPar) {
        var stmts = new ArrayList<StaticControl>();
        ((StaticControl.StaticPar)c).stmts().forEach(s -> stmts.add(rewriteStatic(s)));
        return withAttributes(new StaticControl.StaticPar(stmts), c);
      }
      if (c instanceof StaticControl.StaticIf) {
        var ifc = (StaticControl.StaticIf)c;
        return withAttributes(new StaticControl.StaticIf(map(ifc.port()), ifc.comb().orElse(null), rewriteStatic(ifc.tbranch()),
                                                         rewriteStatic(ifc.fbranch())),
                              c);
      }
      if (c instanceof StaticControl.StaticRepeat) {
        var rc = (StaticControl.StaticRepeat)c;
        return withAttributes(new StaticControl.StaticRepeat(rc.count(), rewriteStatic(rc.body())), c);
      }
      if (c instanceof StaticControl.StaticInvoke) {
        var invoke = (StaticControl.StaticInvoke)c;
        Control.Bindings bindings = bindings(invoke.cell(), invoke.bindings(), c.describe());
        if (!invoke.cell().isReference())
          return withAttributes(new StaticControl.StaticInvoke(invoke.cell(), bindings, invoke.latency()), c);
        StaticGroup group = builder.addStaticGroup("static_invoke_" + invoke.cell().name(), invoke.latency());
        group.add(new Assignment(map(invoke.cell().port(Port.Role.GO).orElseThrow()), Constant.one()));
        group.addAll(assignments(invoke.cell(), bindings));
        logger.debug("{}: {} of a reference cell lowered into {}", comp.name(), c.describe(), group);
        return withAttributes(new StaticControl.StaticEnable(group), c);
      }
      return c;
    }

    /** Maps the bound ports and turns the reference cell bindings into port bindings of the callee's new signature ports. */
    private Control.Bindings bindings(Cell cell, Control.Bindings old, String path) {
      var inputs = new LinkedHashMap<String, Atom>();
      old.inputs().forEach((name, value) -> inputs.put(name, mapAtom(value)));
      var outputs = new LinkedHashMap<String, Port>();
      old.outputs().forEach((name, port) -> outputs.put(name, map(port)));
      var calleeRefs = ctx.callee(cell).map(callee -> dumped.get(callee.name())).orElse(null);
      for (Map.Entry<String, String> ref : old.refCells().entrySet()) {
        Map<String, Port> ports = calleeRefs == null ? null : calleeRefs.get(ref.getKey());
        if (ports == null) {
          diags.error(comp.name(), path, "Cell " + cell.name() + " has no reference cell " + ref.getKey());
          continue;
        }
        Cell supplied = comp.cell(ref.getValue());
        for (Map.Entry<String, Port> entry : ports.entrySet()) {
          Port sig = entry.getValue();
          if (!supplied.hasPort(entry.getKey()) || supplied.port(entry.getKey()).width() != sig.width()) {
            diags.error(comp.name(), path,
                        "Supplied cell " + supplied.name() + " has no " + sig.width() + "-bit port " + entry.getKey() + " for reference cell " +
                            ref.getKey());
            continue;
          }
          Port port = map(supplied.port(entry.getKey()));
          if (sig.direction() == Port.Direction.INPUT)
            inputs.put(sig.name(), port);
          else
            outputs.put(sig.name(), port);
        }
      }
      return new Control.Bindings(inputs, outputs, Map.of());
    }

    /** Assignments of an invoke of a reference cell, whose ports are now signature ports. */
    private List<Assignment> assignments(Cell cell, Control.Bindings bindings) {
      var ret = new ArrayList<Assignment>();
      bindings.inputs().forEach((name, value) -> ret.add(new Assignment(map(cell.port(name)), value)));
      bindings.outputs().forEach((name, port) -> ret.add(new Assignment(port, map(cell.port(name)))));
      return ret;
    }
  }
}
