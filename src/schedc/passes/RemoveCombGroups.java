package schedc.passes;

import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Attr;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.CombGroup;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.Group;
import schedc.ir.Port;
import schedc.ir.Primitives;

/**
 * Replaces the comb groups of conditionals and loops by a group that stores the condition in a register.
 * The register is written in a cycle of its own; loops write it again at the end of every iteration.
 */
public class RemoveCombGroups implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "remove-comb-groups";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Latches if and while conditions computed by comb groups";
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.NO_INVOKE);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.NO_COMB_GROUPS);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components()) {
      var builder = new Builder(ctx, comp, true);
      ControlRewriter.rewrite(comp, c -> {
        if (c instanceof Control.If && ((Control.If)c).comb().isPresent()) {
          var ifc = (Control.If)c;
          Latch latch = latch(builder, ifc.port(), ifc.comb().get());
          return wrap(c, latch, new Control.If(latch.out(), null, ifc.tbranch(), ifc.fbranch()));
        }
        if (c instanceof Control.While && ((Control.While)c).comb().isPresent()) {
          var loop = (Control.While)c;
          Latch latch = latch(builder, loop.port(), loop.comb().get());
          var body = new Control.Seq(List.of(loop.body(), new Control.Enable(latch.group())));
          var lowered = new Control.While(latch.out(), null, body);
          loop.attributes().get(Attr.BOUND).ifPresent(bound -> lowered.attributes().set(Attr.BOUND, bound));
          return wrap(c, latch, lowered);
        }
        return c;
      });
    }
  }

  /** Group storing a condition and the register output holding it. */
  private record Latch(Group group, Port out) {}

  private static Control wrap(Control original, Latch latch, Control lowered) {
    var ret = new Control.Seq(List.of(new Control.Enable(latch.group()), lowered));
    if (original.attributes().has(Attr.NEW_FSM))
      ret.attributes().set(Attr.NEW_FSM);
    return ret;
  }

  private static Latch latch(Builder builder, Port port, CombGroup comb) {
    Cell reg = builder.addPrimitive("comb_reg", Primitives.REG, 1);
    Group group = builder.addGroup("cond_" + comb.name());
    group.addAll(comb.assignments());
    group.add(new Assignment(reg.port("in"), port));
    group.add(new Assignment(reg.port("write_en"), Constant.one()));
    group.add(new Assignment(group.done(), reg.port("done")));
    logger.debug("{}: {} latched by {}", builder.component().name(), comb, group);
    return new Latch(group, reg.port("out"));
  }
}
