package schedc.passes;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.sim.CycleSimulator;
import schedc.sim.Programs;

class CompileStaticTest {

  @Test
  void testPromotedSeqFinishesAfterTwoCycles() throws Exception {
    Context ctx = Programs.compile(Programs.SEQ, "all");
    Component main = ctx.component("main");
    // the entrypoint keeps its handshake and runs the promoted seq as an island
    Assertions.assertFalse(main.isStatic());
    Assertions.assertTrue(main.staticGroups().isEmpty());
    Assertions.assertTrue(main.groups().stream().anyMatch(g -> g.name().startsWith("wrapper_early_reset_")));

    CycleSimulator sim = Programs.simulate(ctx);
    sim.set("go", 1);
    sim.step();
    Assertions.assertEquals(5, sim.reg("r1"));
    Assertions.assertEquals(0, sim.reg("r2"));
    sim.step();
    Assertions.assertEquals(5, sim.reg("r2"));
    Assertions.assertEquals(0, sim.get("done"));
    sim.step();
    Assertions.assertEquals(1, sim.get("done"));
  }

  @Test
  void testPromotedParTakesLongestThread() throws Exception {
    Context ctx = Programs.compile(Programs.PAR, "all");
    CycleSimulator sim = Programs.simulate(ctx);
    Assertions.assertEquals(3, sim.run(10));
    Assertions.assertEquals(42, sim.get("m.out"));
    Assertions.assertEquals(1, sim.reg("r"));
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1})
  void testPromotedIf(long sel) throws Exception {
    Context ctx = Programs.compile(Programs.IF, "all");
    CycleSimulator sim = Programs.simulate(ctx);
    sim.set("sel", sel);
    Assertions.assertEquals(1, sim.run(10));
    Assertions.assertEquals(sel == 1 ? 1 : 2, sim.reg("r"));
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void testIslandInDynamicControl(boolean earlyReset) throws Exception {
    Context ctx = Programs.compile(Programs.ISLAND, "validate,compile", "compile-static:early-reset=" + earlyReset);
    Component main = ctx.component("main");
    Assertions.assertTrue(main.staticGroups().isEmpty());
    // the island counts 0..3 with early reset and 0..4 without
    int counterWidth = main.cell("fsm").port("out").width();
    Assertions.assertEquals(earlyReset ? 2 : 3, counterWidth);
    Assertions.assertEquals(earlyReset, main.findGroup("wrapper_early_reset_S").isPresent());
    Assertions.assertEquals(!earlyReset, main.findGroup("run_S").isPresent());

    CycleSimulator sim = Programs.simulate(ctx);
    sim.run(30);
    Assertions.assertEquals(9, sim.reg("r"));
    Assertions.assertEquals(9, sim.reg("q"));
    Assertions.assertEquals(0, sim.reg("fsm"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"seq: [S, D]", "seq: [S, D, S, D]"})
  void testEarlyResetKeepsDoneCycle(String control) throws Exception {
    String yaml = Programs.ISLAND.replace("seq: [S, D]", control);
    int withReset = Programs.simulate(Programs.compile(yaml, "validate,compile")).run(60);
    int without = Programs.simulate(Programs.compile(yaml, "validate,compile", "compile-static:early-reset=false")).run(60);
    Assertions.assertEquals(without, withReset);
  }

  @Test
  void testRepeatedIslandIsRerun() throws Exception {
    String yaml = Programs.ISLAND.replace("      seq: [S, D]", "      seq: [S, D, S, D]");
    Context ctx = Programs.compile(yaml, "validate,compile");
    CycleSimulator sim = Programs.simulate(ctx);
    sim.run(60);
    Assertions.assertEquals(9, sim.reg("q"));
    Assertions.assertEquals(0, sim.reg("fsm"));
  }

  @Test
  void testBoundedLoopBecomesStatic() throws Exception {
    Context ctx = Programs.compile(Programs.BOUNDED_LOOP, "all");
    CycleSimulator sim = Programs.simulate(ctx);
    Assertions.assertEquals(4, sim.run(20));
    Assertions.assertEquals(3, sim.reg("i"));
  }

  @Test
  void testLoopOverIslandRunsBackToBack() throws Exception {
    String yaml = String.join("\n",
                              "components:",
                              "  - name: main",
                              "    cells:",
                              "      - {name: i, primitive: std_reg, width: 4}",
                              "      - {name: c, primitive: std_reg, width: 1}",
                              "      - {name: add, primitive: std_add, width: 4}",
                              "      - {name: lt, primitive: std_lt, width: 4}",
                              "    continuous:",
                              "      - \"lt.left = add.out\"",
                              "      - \"lt.right = 4'd3\"",
                              "    groups:",
                              "      - name: init",
                              "        assignments:",
                              "          - \"c.in = 1'd1\"",
                              "          - \"c.write_en = 1'd1\"",
                              "          - \"init[done] = c.done\"",
                              "      - name: incr",
                              "        assignments:",
                              "          - \"add.left = i.out\"",
                              "          - \"add.right = 4'd1\"",
                              "          - \"i.in = add.out\"",
                              "          - \"i.write_en = 1'd1\"",
                              "          - \"c.in = lt.out\"",
                              "          - \"c.write_en = 1'd1\"",
                              "          - \"incr[done] = i.done\"",
                              "    control:",
                              "      seq: [init, {while: {port: c.out, body: incr}}]",
                              "");
    Context ctx = Programs.compile(yaml, "all");
    Component main = ctx.component("main");
    Assertions.assertTrue(main.findGroup("while_wrapper_incr_static").isPresent());
    CycleSimulator sim = Programs.simulate(ctx);
    sim.run(40);
    Assertions.assertEquals(3, sim.reg("i"));
    Assertions.assertEquals(0, sim.reg("c"));
  }

  private static final String COUNTER = String.join("\n",
                                                    "components:",
                                                    "  - name: main",
                                                    "    cells:",
                                                    "      - {name: i, primitive: std_reg, width: 4}",
                                                    "      - {name: c, primitive: std_reg, width: 1}",
                                                    "      - {name: add, primitive: std_add, width: 4}",
                                                    "      - {name: lt, primitive: std_lt, width: 4}",
                                                    "    continuous:",
                                                    "      - \"lt.left = add.out\"",
                                                    "      - \"lt.right = 4'd3\"",
                                                    "    groups:",
                                                    "      - name: incr",
                                                    "        assignments:",
                                                    "          - \"add.left = i.out\"",
                                                    "          - \"add.right = 4'd1\"",
                                                    "          - \"i.in = add.out\"",
                                                    "          - \"i.write_en = 1'd1\"",
                                                    "          - \"c.in = lt.out\"",
                                                    "          - \"c.write_en = 1'd1\"",
                                                    "          - \"incr[done] = i.done\"",
                                                    "    control:",
                                                    "");

  private static int donesWithGoLow(CycleSimulator sim, int cycles) {
    sim.set("go", 0);
    int ret = 0;
    for (int k = 0; k < cycles; ++k) {
      sim.step();
      ret += sim.get("done");
    }
    return ret;
  }

  @Test
  void testPromotedEntrypointRunsOncePerActivation() throws Exception {
    Context ctx = Programs.compile(COUNTER + "      seq: [incr, incr]\n", "all");
    Assertions.assertFalse(ctx.component("main").isStatic());
    CycleSimulator sim = Programs.simulate(ctx);
    Assertions.assertEquals(2, sim.run(10));
    Assertions.assertEquals(0, donesWithGoLow(sim, 8));
    Assertions.assertEquals(2, sim.reg("i"));
    // a second activation runs the body once more
    Assertions.assertEquals(2, sim.run(10));
    Assertions.assertEquals(0, donesWithGoLow(sim, 8));
    Assertions.assertEquals(4, sim.reg("i"));
  }

  @Test
  void testTopLevelLoopOverIslandRaisesDoneOnce() throws Exception {
    Context ctx = Programs.compile(COUNTER + "      while: {port: c.out, body: incr}\n", "all");
    Component main = ctx.component("main");
    // nothing samples a top-level loop in one state, so it is not lowered to a while_wrapper
    Assertions.assertTrue(main.groups().stream().noneMatch(g -> g.name().startsWith("while_wrapper")));
    CycleSimulator sim = Programs.simulate(ctx);
    Assertions.assertEquals(0, donesWithGoLow(sim, 5));
    sim.run(10);
    Assertions.assertEquals(0, donesWithGoLow(sim, 5));
    Assertions.assertEquals(0, sim.reg("i"));
  }
}
