package schedc.passes;

import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.analysis.ReadWriteSets;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Attr;
import schedc.ir.Builder;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.Group;
import schedc.ir.Guard;
import schedc.ir.Port;

/**
 * Replaces dynamic invokes by groups that run the invoked cell through its go/done interface.
 */
public class CompileInvoke implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "compile-invoke";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Lowers invoke statements into groups";
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.NO_REF_CELLS);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.NO_INVOKE);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components()) {
      var builder = new Builder(ctx, comp, true);
      ControlRewriter.rewrite(comp, c -> {
        if (!(c instanceof Control.Invoke))
          return c;
        var invoke = (Control.Invoke)c;
        Group group = builder.addGroup("invoke_" + invoke.cell().name());
        Port go = invoke.cell().port(Port.Role.GO).orElseThrow();
        Port done = invoke.cell().port(Port.Role.DONE).orElseThrow();
        group.add(new Assignment(go, Constant.one(), Guard.port(done).not()));
        group.addAll(ReadWriteSets.invokeAssignments(invoke.cell(), invoke.bindings()));
        invoke.comb().ifPresent(comb -> group.addAll(comb.assignments()));
        group.add(new Assignment(group.done(), done));
        logger.debug("{}: {} lowered into {}", comp.name(), invoke.describe(), group);
        var ret = new Control.Enable(group);
        if (invoke.attributes().has(Attr.NEW_FSM))
          ret.attributes().set(Attr.NEW_FSM);
        return ret;
      });
    }
  }
}
