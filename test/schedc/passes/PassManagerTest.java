package schedc.passes;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import schedc.drc.CompileException;
import schedc.drc.Diagnostics;
import schedc.ir.Context;
import schedc.sim.Programs;

class PassManagerTest {

  private static List<String> names(List<Pass> pipeline) { return pipeline.stream().map(Pass::name).collect(Collectors.toList()); }

  @Test
  void testAliasesExpandInOrder() throws CompileException {
    var pm = PassManager.standard();
    Assertions.assertEquals(List.of("well-formed", "static-inference", "static-promotion", "compile-ref", "static-inliner",
                                    "simplify-static-guards", "compile-static", "compile-invoke", "compile-repeat", "remove-comb-groups", "tdcc",
                                    "dead-group-removal"),
                            names(pm.resolve(List.of("all"), List.of())));
    Assertions.assertEquals(List.of("well-formed", "static-inliner", "simplify-static-guards", "compile-static", "compile-invoke", "compile-repeat",
                                    "remove-comb-groups", "tdcc"),
                            names(pm.resolve(List.of("all"), List.of("pre-opt", "compile-ref", "dead-group-removal"))));
  }

  @Test
  void testRegistry() {
    var pm = PassManager.standard();
    Assertions.assertEquals(12, pm.passes().size());
    Assertions.assertEquals(Set.of("validate", "pre-opt", "compile", "all"), pm.aliases().keySet());
    Assertions.assertEquals(List.of("validate", "pre-opt", "compile"), pm.aliases().get("all"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> pm.aliases().remove("all"));
  }

  @Test
  void testUnknownNames() {
    var pm = PassManager.standard();
    Assertions.assertThrows(CompileException.class, () -> pm.resolve(List.of("validate", "inline-everything"), List.of()));
    Assertions.assertThrows(CompileException.class, () -> pm.resolve(List.of("all"), List.of("inline-everything")));
    Assertions.assertThrows(IllegalArgumentException.class, () -> pm.registerAlias("tdcc", List.of("validate")));
    Assertions.assertThrows(IllegalArgumentException.class, () -> pm.register(new DeadGroupRemoval()));
  }

  @Test
  void testSelfReferencingAlias() {
    var pm = PassManager.standard();
    pm.registerAlias("ping", List.of("validate", "pong"));
    pm.registerAlias("pong", List.of("ping"));
    var e = Assertions.assertThrows(CompileException.class, () -> pm.resolve(List.of("ping"), List.of()));
    Assertions.assertTrue(e.getMessage().contains("refers to itself"), e.getMessage());
  }

  @Test
  void testParseOptions() throws CompileException {
    var options = PassManager.standard().parseOptions(List.of("tdcc:early-transitions", "static-promotion:threshold=3", "tdcc:one-hot-cutoff=8"));
    Assertions.assertEquals(Map.of("early-transitions", "true", "one-hot-cutoff", "8"), options.get("tdcc"));
    Assertions.assertEquals(Map.of("threshold", "3"), options.get("static-promotion"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"tdcc", ":early-transitions", "tdcc:", "fsm:early-transitions"})
  void testMalformedOptions(String setting) {
    Assertions.assertThrows(CompileException.class, () -> PassManager.standard().parseOptions(List.of(setting)));
  }

  @ParameterizedTest
  @ValueSource(strings = {"static-promotion:threshold=few", "tdcc:early-transitions=maybe", "compile-static:unroll=true"})
  void testInvalidOptionValues(String setting) {
    Assertions.assertThrows(CompileException.class, () -> Programs.compile(Programs.SEQ, "all", setting));
  }

  @Test
  void testOptionDefaultsAndValues() throws CompileException {
    var pass = new TopDownCompileControl();
    var defaults = PassOptions.defaults(pass);
    Assertions.assertFalse(defaults.flag("early-transitions"));
    Assertions.assertEquals(0, defaults.number("one-hot-cutoff"));
    var given = new PassOptions(pass.name(), pass.options(), Map.of("early-transitions", "TRUE", "one-hot-cutoff", " 4 "));
    Assertions.assertTrue(given.flag("early-transitions"));
    Assertions.assertEquals(4, given.number("one-hot-cutoff"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> given.number("threshold"));
  }

  @Test
  void testMissingPrecondition() throws Exception {
    // nothing established that the program is well formed
    var e = Assertions.assertThrows(CompileException.class, () -> Programs.compile(Programs.SEQ, "static-inliner"));
    Assertions.assertTrue(e.getMessage().contains("WELL_FORMED"), e.getMessage());
    // static groups are left
    e = Assertions.assertThrows(CompileException.class, () -> Programs.compile(Programs.ISLAND, "tdcc"));
    Assertions.assertTrue(e.getMessage().contains("NO_STATIC"), e.getMessage());
    // conditions that hold in the IR need no pass
    Context ctx = Programs.compile(Programs.SEQ, "tdcc");
    Assertions.assertEquals(1, ctx.component("main").groups().stream().filter(g -> g.name().startsWith("tdcc")).count());
  }

  @Test
  void testFatalDiagnosticsAbort() {
    var diags = new Diagnostics();
    String yaml = Programs.SEQ.replace("\"A[done] = r1.done\"", "\"A[done] = 1'd1\"");
    var e = Assertions.assertThrows(CompileException.class, () -> Programs.compile(yaml, "all", diags));
    Assertions.assertEquals(1, e.diagnostics().size());
    Assertions.assertEquals(diags.errors(), e.diagnostics());
  }

  @Test
  void testDescribe() {
    String text = PassManager.standard().describe();
    Assertions.assertTrue(text.contains("tdcc:early-transitions (default false)"), text);
    Assertions.assertTrue(text.contains("  pre-opt: static-inference, static-promotion\n"), text);
    Assertions.assertTrue(text.contains("  all: validate, pre-opt, compile\n"), text);
  }
}
