package schedc.passes;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.analysis.ReadWriteSets;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.ControlRewriter;
import schedc.ir.Guard;
import schedc.ir.Port;
import schedc.ir.Primitives;
import schedc.ir.StaticControl;
import schedc.ir.StaticGroup;

/**
 * Collapses every maximal static control subtree into a single static group, so that each static island is one
 * {@code StaticEnable}.
 */
public class StaticInliner implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "static-inliner";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Inlines static control into static groups with cycle guards";
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.WELL_FORMED, PassCondition.NO_REF_CELLS);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.STATIC_INLINED);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components()) {
      var builder = new Builder(ctx, comp, true);
      ControlRewriter.rewrite(comp, c -> {
        if (!(c instanceof StaticControl) || c instanceof StaticControl.StaticEnable)
          return c;
        var sc = (StaticControl)c;
        StaticGroup group = builder.addStaticGroup(prefix(sc), sc.latency());
        group.addAll(inline(builder, sc));
        logger.debug("{}: inlined {} into {}", comp.name(), sc.describe(), group);
        return new StaticControl.StaticEnable(group);
      });
    }
  }

  private static String prefix(StaticControl c) {
    if (c instanceof StaticControl.StaticSeq)
      return "static_seq";
    if (c instanceof StaticControl.StaticPar)
      return "static_par";
    if (c instanceof StaticControl.StaticIf)
      return "static_if";
    if (c instanceof StaticControl.StaticRepeat)
      return "static_repeat";
    return "static_invoke";
  }

  /** Restricts a child's assignments to its window {@code [offset, offset + latency)} inside a parent of latency {@code total}. */
  private static List<Assignment> place(List<Assignment> assignments, long offset, long latency, long total) {
    var ret = new ArrayList<Assignment>(assignments.size());
    boolean fullWindow = offset == 0 && latency == total;
    for (Assignment a : assignments) {
      Assignment shifted = a.withGuard(a.guard().shift(offset));
      ret.add(fullWindow ? shifted : shifted.and(Guard.range(offset, offset + latency)));
    }
    return ret;
  }

  /**
   * Assignments of a static subtree, with cycle guards relative to the start of the subtree.
   * Cells needed by conditionals are added to the component.
   */
  static List<Assignment> inline(Builder builder, StaticControl c) {
    long total = c.latency();
    var ret = new ArrayList<Assignment>();
    if (c instanceof StaticControl.StaticEnable) {
      ret.addAll(((StaticControl.StaticEnable)c).group().assignments());
    } else if (c instanceof StaticControl.StaticSeq) {
      long offset = 0;
      for (StaticControl child : ((StaticControl.StaticSeq)c).stmts()) {
        ret.addAll(place(inline(builder, child), offset, child.latency(), total));
        offset += child.latency();
      }
    } else if (c instanceof StaticControl.StaticPar) {
      for (StaticControl child : ((StaticControl.StaticPar)c).stmts())
        ret.addAll(place(inline(builder, child), 0, child.latency(), total));
    } else if (c instanceof StaticControl.StaticRepeat) {
      var rc = (StaticControl.StaticRepeat)c;
      List<Assignment> body = inline(builder, rc.body());
      long bodyLatency = rc.body().latency();
      for (long k = 0; k < rc.count(); ++k)
        ret.addAll(place(body, k * bodyLatency, bodyLatency, total));
    } else if (c instanceof StaticControl.StaticIf) {
      ret.addAll(inlineIf(builder, (StaticControl.StaticIf)c));
    } else {
      var ic = (StaticControl.StaticInvoke)c;
      Port go = ic.cell().port(Port.Role.GO).orElseThrow(() -> new IllegalStateException("Invoked cell " + ic.cell().name() + " has no go port"));
      ret.add(new Assignment(go, Constant.one()));
      ret.addAll(ReadWriteSets.invokeAssignments(ic.cell(), ic.bindings()));
    }
    return ret;
  }

  /**
   * The condition is sampled into a register in cycle 0. A wire carries the port in cycle 0 and the register afterwards,
   * and selects the branch in every cycle of the conditional.
   */
  private static List<Assignment> inlineIf(Builder builder, StaticControl.StaticIf ic) {
    long total = ic.latency();
    var ret = new ArrayList<Assignment>();
    Cell cond = builder.addPrimitive("cond", Primitives.REG, 1);
    Cell wire = builder.addPrimitive("cond_wire", Primitives.WIRE, 1);
    Guard first = Guard.cycle(0);
    ret.add(new Assignment(cond.port("in"), ic.port(), first));
    ret.add(new Assignment(cond.port("write_en"), Constant.one(), first));
    ret.add(new Assignment(wire.port("in"), ic.port(), first));
    if (total > 1)
      ret.add(new Assignment(wire.port("in"), cond.port("out"), Guard.range(1, total)));
    ic.comb().ifPresent(comb -> comb.assignments().forEach(a -> ret.add(a.and(first))));
    Guard selected = Guard.port(wire.port("out"));
    for (Assignment a : place(inline(builder, ic.tbranch()), 0, ic.tbranch().latency(), total))
      ret.add(a.and(selected));
    for (Assignment a : place(inline(builder, ic.fbranch()), 0, ic.fbranch().latency(), total))
      ret.add(a.and(selected.not()));
    return ret;
  }
}
