package schedc.analysis;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.Diagnostic.Category;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Attr;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlVisitor;
import schedc.ir.Group;
import schedc.ir.Guard;
import schedc.ir.Port;
import schedc.ir.StaticControl;

/**
 * Infers fixed latencies of groups, control nodes and components and records them as {@code @promotable(N)}.
 */
public class LatencyInference {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Context ctx;
  private final Diagnostics diags;
  private final Set<Control> reportedLoops = Collections.newSetFromMap(new IdentityHashMap<>());

  public LatencyInference(Context ctx, Diagnostics diags) {
    this.ctx = ctx;
    this.diags = diags;
  }

  /** Cycles from go to done of a cell, if fixed. */
  public OptionalLong cellLatency(Cell cell) {
    if (cell.prototype() instanceof Cell.PrimitiveProto)
      return ctx.primitives().get(((Cell.PrimitiveProto)cell.prototype()).primitive()).latency();
    return ctx.callee(cell).map(Component::latency).orElse(OptionalLong.empty());
  }

  private OptionalLong doneLatency(Port port, Component comp) {
    if (!port.isCellPort() || port.role() != Port.Role.DONE)
      return OptionalLong.empty();
    return comp.findCell(port.parent()).map(this::cellLatency).orElse(OptionalLong.empty());
  }

  /**
   * Proves that a dynamic group completes a fixed number of cycles after go.
   * The done hole must be driven by the done port of a cell whose go is driven by a constant
   * or by the done port of another fixed-latency cell; latencies add up along that chain.
   */
  public OptionalLong inferGroupLatency(Component comp, Group group) {
    var doneWrites = group.doneAssignments();
    if (doneWrites.size() != 1 || !doneWrites.get(0).guard().isTrue() || !(doneWrites.get(0).src() instanceof Port)) {
      logger.debug("{}: done is not driven by a single unconditional port", group);
      return OptionalLong.empty();
    }
    Set<Port> reads = group.reads();
    if (reads.contains(group.go()) || reads.contains(group.done())) {
      logger.debug("{}: reads its own holes", group);
      return OptionalLong.empty();
    }
    for (Assignment a : group.assignments()) {
      if (a.dst().isCellPort() && a.dst().role() == Port.Role.GO && !isStaticTrigger(a, comp)) {
        logger.debug("{}: dynamic write `{}`", group, a);
        return OptionalLong.empty();
      }
    }
    Port donePort = (Port)doneWrites.get(0).src();
    long total = 0;
    var visited = new HashSet<String>();
    while (true) {
      OptionalLong latency = doneLatency(donePort, comp);
      if (latency.isEmpty() || !visited.add(donePort.parent()))
        return OptionalLong.empty();
      total += latency.getAsLong();
      Cell cell = comp.cell(donePort.parent());
      Port go = cell.port(Port.Role.GO).orElse(null);
      if (go == null)
        return OptionalLong.empty();
      List<Assignment> goWrites = group.writesTo(go);
      if (goWrites.size() != 1)
        return OptionalLong.empty();
      Assignment goWrite = goWrites.get(0);
      if (!goWrite.guard().isTrue() && !goWrite.guard().equals(Guard.port(cell.port(Port.Role.DONE).get()).not()))
        return OptionalLong.empty();
      if (goWrite.src() instanceof Constant)
        return ((Constant)goWrite.src()).value() > 0 ? OptionalLong.of(total) : OptionalLong.empty();
      donePort = (Port)goWrite.src();
    }
  }

  /** A write to a fixed-latency go port whose value does not depend on data. */
  private boolean isStaticTrigger(Assignment a, Component comp) {
    if (comp.findCell(a.dst().parent()).map(this::cellLatency).orElse(OptionalLong.empty()).isEmpty())
      return true;
    if (a.src() instanceof Constant)
      return true;
    return a.src() instanceof Port && ((Port)a.src()).role() == Port.Role.DONE;
  }

  /** Latency of a node from the annotations below it; annotates nothing. */
  public OptionalLong controlLatency(Component comp, Control control) { return control.accept(new Visitor(comp, false)); }

  /**
   * Removes stale {@code @promotable} annotations of the control program and of the component and infers them again.
   * Group annotations are replaced where inference succeeds and kept otherwise.
   */
  public void annotate(Component comp) {
    for (Group group : comp.groups()) {
      OptionalLong latency = inferGroupLatency(comp, group);
      if (latency.isPresent() && latency.getAsLong() > 0)
        group.attributes().set(Attr.PROMOTABLE, latency.getAsLong());
    }
    if (comp.isStatic())
      return;
    OptionalLong total = comp.control().accept(new Visitor(comp, true));
    if (total.isPresent() && total.getAsLong() > 0) {
      comp.attributes().set(Attr.PROMOTABLE, total.getAsLong());
      logger.debug("{} is promotable with latency {}", comp, total.getAsLong());
    } else
      comp.attributes().remove(Attr.PROMOTABLE);
  }

  private static OptionalLong note(Control control, OptionalLong latency, boolean annotate) {
    if (annotate) {
      control.attributes().remove(Attr.PROMOTABLE);
      if (latency.isPresent() && latency.getAsLong() > 0)
        control.attributes().set(Attr.PROMOTABLE, latency.getAsLong());
    }
    return latency;
  }

  private class Visitor implements ControlVisitor<OptionalLong> {
    private final Component comp;
    private final boolean annotate;

    Visitor(Component comp, boolean annotate) {
      this.comp = comp;
      this.annotate = annotate;
    }

    @Override
    public OptionalLong visitEmpty(Control.Empty c) {
      return OptionalLong.of(0);
    }

    @Override
    public OptionalLong visitEnable(Control.Enable c) {
      return note(c, c.group().attributes().get(Attr.PROMOTABLE), annotate);
    }

    @Override
    public OptionalLong visitInvoke(Control.Invoke c) {
      OptionalLong latency = OptionalLong.empty();
      if (c.comb().isEmpty())
        latency = cellLatency(c.cell());
      return note(c, latency, annotate);
    }

    @Override
    public OptionalLong visitSeq(Control.Seq c) {
      long sum = 0;
      boolean defined = true;
      Control previous = null;
      for (Control child : c.stmts()) {
        OptionalLong latency = child instanceof Control.While ? visitWhile((Control.While)child, previous) : child.accept(this);
        if (latency.isEmpty())
          defined = false;
        else
          sum += latency.getAsLong();
        previous = child;
      }
      return note(c, defined ? OptionalLong.of(sum) : OptionalLong.empty(), annotate);
    }

    @Override
    public OptionalLong visitPar(Control.Par c) {
      long max = 0;
      boolean defined = true;
      for (Control child : c.stmts()) {
        OptionalLong latency = child.accept(this);
        if (latency.isEmpty())
          defined = false;
        else
          max = Math.max(max, latency.getAsLong());
      }
      return note(c, defined ? OptionalLong.of(max) : OptionalLong.empty(), annotate);
    }

    @Override
    public OptionalLong visitIf(Control.If c) {
      OptionalLong t = c.tbranch().accept(this);
      OptionalLong f = c.fbranch().accept(this);
      OptionalLong latency = OptionalLong.empty();
      if (t.isPresent() && f.isPresent() && t.getAsLong() == f.getAsLong())
        latency = t;
      return note(c, latency, annotate);
    }

    @Override
    public OptionalLong visitWhile(Control.While c) {
      return visitWhile(c, null);
    }

    private OptionalLong visitWhile(Control.While c, Control previous) {
      OptionalLong body = c.body().accept(this);
      OptionalLong bound = c.attributes().get(Attr.BOUND);
      OptionalLong latency = OptionalLong.empty();
      if (bound.isPresent() && body.isPresent()) {
        OptionalLong trips = new TripCountAnalysis(comp).tripCount(c, previous);
        if (trips.isPresent() && trips.getAsLong() != bound.getAsLong()) {
          if (reportedLoops.add(c))
            diags.warning(Category.LATENCY_CONTRACT, comp.name(), c.describe(),
                          "@bound(" + bound.getAsLong() + ") contradicts the inferred trip count " + trips.getAsLong() + "; the loop stays dynamic");
        } else
          latency = OptionalLong.of(Math.multiplyExact(bound.getAsLong(), body.getAsLong()));
      }
      return note(c, latency, annotate);
    }

    @Override
    public OptionalLong visitRepeat(Control.Repeat c) {
      OptionalLong body = c.body().accept(this);
      OptionalLong latency = body.isPresent() ? OptionalLong.of(Math.multiplyExact(c.count(), body.getAsLong())) : OptionalLong.empty();
      return note(c, latency, annotate);
    }

    @Override
    public OptionalLong visitStaticEnable(StaticControl.StaticEnable c) {
      return OptionalLong.of(c.latency());
    }
    @Override
    public OptionalLong visitStaticSeq(StaticControl.StaticSeq c) {
      return OptionalLong.of(c.latency());
    }
    @Override
    public OptionalLong visitStaticPar(StaticControl.StaticPar c) {
      return OptionalLong.of(c.latency());
    }
    @Override
    public OptionalLong visitStaticIf(StaticControl.StaticIf c) {
      return OptionalLong.of(c.latency());
    }
    @Override
    public OptionalLong visitStaticRepeat(StaticControl.StaticRepeat c) {
      return OptionalLong.of(c.latency());
    }
    @Override
    public OptionalLong visitStaticInvoke(StaticControl.StaticInvoke c) {
      return OptionalLong.of(c.latency());
    }
  }
}
