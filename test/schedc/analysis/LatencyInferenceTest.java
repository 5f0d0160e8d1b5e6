package schedc.analysis;

import java.util.OptionalLong;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import schedc.drc.Diagnostic;
import schedc.drc.Diagnostics;
import schedc.ir.Attr;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.sim.Programs;

class LatencyInferenceTest {

  private static Component annotated(Context ctx, Diagnostics diags) {
    Component main = ctx.component("main");
    new LatencyInference(ctx, diags).annotate(main);
    return main;
  }

  @Test
  void testRegisterWrite() throws Exception {
    Context ctx = Programs.read(Programs.SEQ);
    Component main = annotated(ctx, new Diagnostics());
    Assertions.assertEquals(OptionalLong.of(1), main.findGroup("A").get().attributes().get(Attr.PROMOTABLE));
    Assertions.assertEquals(OptionalLong.of(2), main.control().attributes().get(Attr.PROMOTABLE));
    Assertions.assertEquals(OptionalLong.of(2), main.attributes().get(Attr.PROMOTABLE));
  }

  @Test
  void testControlLatencyOnlyReads() throws Exception {
    Context ctx = Programs.read(Programs.SEQ);
    Component main = ctx.component("main");
    var inference = new LatencyInference(ctx, new Diagnostics());
    // groups are not annotated yet
    Assertions.assertEquals(OptionalLong.empty(), inference.controlLatency(main, main.control()));
    main.findGroup("A").get().attributes().set(Attr.PROMOTABLE, 1);
    main.findGroup("B").get().attributes().set(Attr.PROMOTABLE, 3);
    Assertions.assertEquals(OptionalLong.of(4), inference.controlLatency(main, main.control()));
    Assertions.assertFalse(main.control().attributes().has(Attr.PROMOTABLE));
  }

  @Test
  void testPipelinedMultiplier() throws Exception {
    Context ctx = Programs.read(Programs.PAR);
    Component main = annotated(ctx, new Diagnostics());
    var inference = new LatencyInference(ctx, new Diagnostics());
    Assertions.assertEquals(OptionalLong.of(3), inference.cellLatency(main.cell("m")));
    Assertions.assertEquals(OptionalLong.of(3), inference.inferGroupLatency(main, main.findGroup("B").get()));
    // par takes its longest thread
    Assertions.assertEquals(OptionalLong.of(3), main.control().attributes().get(Attr.PROMOTABLE));
  }

  @Test
  void testDataDependentGoIsNotStatic() throws Exception {
    String yaml = Programs.PAR.replace("m.go = !m.done ? 1'd1", "m.go = r.out");
    Context ctx = Programs.read(yaml);
    Component main = annotated(ctx, new Diagnostics());
    Assertions.assertFalse(main.findGroup("B").get().attributes().has(Attr.PROMOTABLE));
    Assertions.assertFalse(main.control().attributes().has(Attr.PROMOTABLE));
    Assertions.assertFalse(main.attributes().has(Attr.PROMOTABLE));
  }

  @Test
  void testUnequalBranchesStayDynamic() throws Exception {
    String yaml = Programs.IF.replace("F[done] = r.done", "F[done] = r.done & r.out == 8'd2 ? 1'd1");
    Context ctx = Programs.read(yaml);
    Component main = annotated(ctx, new Diagnostics());
    Assertions.assertTrue(main.findGroup("T").get().attributes().has(Attr.PROMOTABLE));
    Assertions.assertFalse(main.findGroup("F").get().attributes().has(Attr.PROMOTABLE));
    Assertions.assertFalse(main.control().attributes().has(Attr.PROMOTABLE));
  }

  @Test
  void testBoundedLoop() throws Exception {
    Context ctx = Programs.read(Programs.BOUNDED_LOOP);
    Component main = annotated(ctx, new Diagnostics());
    var seq = (Control.Seq)main.control();
    Assertions.assertEquals(OptionalLong.of(3), seq.stmts().get(1).attributes().get(Attr.PROMOTABLE));
    Assertions.assertEquals(OptionalLong.of(4), main.attributes().get(Attr.PROMOTABLE));
  }

  @Test
  void testContradictingBoundIsReported() throws Exception {
    Context ctx = Programs.read(Programs.BOUNDED_LOOP.replace("bound: 3", "bound: 5"));
    var diags = new Diagnostics();
    Component main = annotated(ctx, diags);
    var seq = (Control.Seq)main.control();
    Assertions.assertFalse(seq.stmts().get(1).attributes().has(Attr.PROMOTABLE));
    Assertions.assertEquals(1, diags.warnings().size());
    Assertions.assertEquals(Diagnostic.Category.LATENCY_CONTRACT, diags.warnings().get(0).category());
    Assertions.assertFalse(diags.hasFatalError());
  }

  @Test
  void testUnboundedLoopStaysDynamic() throws Exception {
    Context ctx = Programs.read(Programs.BOUNDED_LOOP.replace("          attributes: {bound: 3}\n", ""));
    Component main = annotated(ctx, new Diagnostics());
    Assertions.assertTrue(main.findGroup("incr").get().attributes().has(Attr.PROMOTABLE));
    Assertions.assertFalse(main.attributes().has(Attr.PROMOTABLE));
  }
}
