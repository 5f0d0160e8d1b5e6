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
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.Group;
import schedc.ir.Primitives;
import schedc.util.Log2;

/**
 * Replaces dynamic repeats by a counting while loop over an index register.
 */
public class CompileRepeat implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "compile-repeat";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Lowers repeat statements into while loops";
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.NO_REPEAT);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components()) {
      var builder = new Builder(ctx, comp, true);
      ControlRewriter.rewrite(comp, c -> c instanceof Control.Repeat ? lower(builder, (Control.Repeat)c) : c);
    }
  }

  static Control lower(Builder builder, Control.Repeat repeat) {
    if (repeat.count() == 0)
      return new Control.Empty();
    if (repeat.count() == 1)
      return repeat.body();
    long count = repeat.count();
    int width = Log2.bitsFor(count);
    Cell idx = builder.addPrimitive("idx", Primitives.REG, width);
    Cell adder = builder.addPrimitive("idx_adder", Primitives.ADD, width);
    Cell lt = builder.addPrimitive("idx_lt", Primitives.LT, width);

    Group init = builder.addGroup("init_repeat");
    init.add(new Assignment(idx.port("in"), Constant.of(0, width)));
    init.add(new Assignment(idx.port("write_en"), Constant.one()));
    init.add(new Assignment(init.done(), idx.port("done")));

    Group incr = builder.addGroup("incr_repeat");
    incr.add(new Assignment(adder.port("left"), idx.port("out")));
    incr.add(new Assignment(adder.port("right"), Constant.of(1, width)));
    incr.add(new Assignment(idx.port("in"), adder.port("out")));
    incr.add(new Assignment(idx.port("write_en"), Constant.one()));
    incr.add(new Assignment(incr.done(), idx.port("done")));

    Component comp = builder.component();
    comp.continuous().add(new Assignment(lt.port("left"), idx.port("out")));
    comp.continuous().add(new Assignment(lt.port("right"), Constant.of(count, width)));

    var loop = new Control.While(lt.port("out"), null, new Control.Seq(List.of(repeat.body(), new Control.Enable(incr))));
    loop.attributes().set(Attr.BOUND, count);
    logger.debug("{}: repeat {} lowered to a loop over {}", comp.name(), count, idx.name());
    var ret = new Control.Seq(List.of(new Control.Enable(init), loop));
    if (repeat.attributes().has(Attr.NEW_FSM))
      ret.attributes().set(Attr.NEW_FSM);
    return ret;
  }
}
