package schedc.passes;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import schedc.ir.Attr;
import schedc.ir.Builder;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.sim.CycleSimulator;
import schedc.sim.Programs;

class CompileRepeatTest {

  private static String repeat(long count) {
    return Programs.WHILE.replace("      while: {port: lt.out, comb: cond, body: incr}", "      repeat: {count: " + count + ", body: incr}");
  }

  @ParameterizedTest
  @ValueSource(longs = {2, 3, 5})
  void testBodyRunsCountTimes(long count) throws Exception {
    Context ctx = Programs.compile(repeat(count), "validate,compile");
    Component main = ctx.component("main");
    Assertions.assertTrue(main.findCell("idx").isPresent());
    CycleSimulator sim = Programs.simulate(ctx);
    sim.run(100);
    Assertions.assertEquals(count, sim.reg("i"));
    Assertions.assertEquals(count, sim.reg("idx"));
  }

  @Test
  void testLoweredShape() throws Exception {
    Context ctx = Programs.read(repeat(4));
    Component main = ctx.component("main");
    var lowered = (Control.Seq)CompileRepeat.lower(new Builder(ctx, main, true), (Control.Repeat)main.control());
    Assertions.assertEquals("init_repeat", ((Control.Enable)lowered.stmts().get(0)).group().name());
    var loop = (Control.While)lowered.stmts().get(1);
    Assertions.assertEquals(4, loop.attributes().get(Attr.BOUND).getAsLong());
    // idx counts up to 4
    Assertions.assertEquals(3, main.cell("idx").port("out").width());
    Assertions.assertEquals(2, main.continuous().size());
  }

  @Test
  void testTrivialCounts() throws Exception {
    Context ctx = Programs.read(repeat(1));
    Component main = ctx.component("main");
    var builder = new Builder(ctx, main, true);
    var body = ((Control.Repeat)main.control()).body();
    Assertions.assertSame(body, CompileRepeat.lower(builder, (Control.Repeat)main.control()));
    Assertions.assertTrue(CompileRepeat.lower(builder, new Control.Repeat(0, body)) instanceof Control.Empty);
    Assertions.assertTrue(main.findCell("idx").isEmpty());
  }
}
