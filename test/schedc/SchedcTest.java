package schedc;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import schedc.drc.Diagnostic;
import schedc.ir.Attr;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.StaticControl;
import schedc.passes.PassManager;
import schedc.sim.Programs;
import schedc.ui.SchedcConfig;

class SchedcTest {

  @Test
  void testCompileWithDefaults() throws Exception {
    Context ctx = Programs.read(Programs.WHILE);
    var schedc = new Schedc();
    Assertions.assertTrue(schedc.compile(ctx));
    Assertions.assertTrue(ctx.component("main").control() instanceof Control.Empty);
    Assertions.assertTrue(ctx.component("main").combGroups().isEmpty());
    var sim = Programs.simulate(ctx);
    sim.run(100);
    Assertions.assertEquals(3, sim.get("i.out"));
  }

  @Test
  void testConfiguredPipeline() throws Exception {
    var cfg = new SchedcConfig();
    cfg.passes = List.of("validate", "pre-opt");
    Context ctx = Programs.read(Programs.SEQ);
    Assertions.assertTrue(new Schedc(cfg).compile(ctx));
    Assertions.assertTrue(ctx.component("main").control() instanceof StaticControl);
  }

  @Test
  void testCustomPassManager() throws Exception {
    var cfg = new SchedcConfig();
    cfg.passes = List.of("checks");
    var pm = PassManager.standard();
    pm.registerAlias("checks", List.of("well-formed", "static-inference"));
    var schedc = new Schedc(cfg, pm);
    Assertions.assertSame(cfg, schedc.config());
    Assertions.assertSame(pm, schedc.passManager());
    Context ctx = Programs.read(Programs.SEQ);
    Assertions.assertTrue(schedc.compile(ctx));
    // inference only annotates
    Assertions.assertTrue(ctx.component("main").attributes().has(Attr.PROMOTABLE));
    Assertions.assertTrue(ctx.component("main").control() instanceof Control.Seq);
  }

  @Test
  void testFailedCompilationKeepsDiagnostics() throws Exception {
    var cfg = new SchedcConfig();
    cfg.pass_options = List.of("tdcc:early-transitions=soon");
    var schedc = new Schedc(cfg);
    Assertions.assertFalse(schedc.compile(Programs.read(Programs.SEQ)));
    Assertions.assertTrue(schedc.diagnostics().isEmpty());

    Context bad = Programs.read(Programs.SEQ.replace("\"A[done] = r1.done\"", "\"A[done] = 1'd1\""));
    schedc = new Schedc();
    Assertions.assertFalse(schedc.compile(bad));
    Assertions.assertEquals(1, schedc.diagnostics().size());
    Assertions.assertEquals(Diagnostic.Category.STRUCTURE, schedc.diagnostics().get(0).category());
  }
}
