package schedc.drc;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import schedc.ir.Context;
import schedc.sim.Programs;

class WellFormedCheckTest {

  private static Diagnostics check(String yaml) throws Exception {
    Context ctx = Programs.read(yaml);
    var diags = new Diagnostics();
    new WellFormedCheck(ctx, diags).checkAll();
    return diags;
  }

  private static void assertSingleError(Diagnostics diags, String message) {
    Assertions.assertEquals(1, diags.errors().size(), diags.all().toString());
    Assertions.assertEquals(Diagnostic.Category.STRUCTURE, diags.errors().get(0).category());
    Assertions.assertTrue(diags.errors().get(0).message().contains(message), diags.errors().get(0).toString());
    Assertions.assertTrue(diags.hasFatalError());
  }

  @Test
  void testWellFormedProgramsAreClean() throws Exception {
    for (String yaml : new String[] {Programs.SEQ, Programs.PAR, Programs.WHILE, Programs.ISLAND})
      Assertions.assertTrue(check(yaml).all().isEmpty(), yaml);
  }

  @Test
  void testConflictingDrivers() throws Exception {
    var diags = check(Programs.SEQ.replace("\"r1.in = 32'd5\"", "\"r1.in = 32'd5\"\n          - \"r1.in = 32'd6\""));
    assertSingleError(diags, "conflicting drivers");
  }

  @ParameterizedTest
  @CsvSource(quoteCharacter = '"', delimiter = '|', value = {"r1.in = 32'd5|r1.in = 32'd5", "r1.in = r2.done ? 32'd5|r1.in = !r2.done ? 32'd6"})
  void testDriversThatDoNotConflict(String first, String second) throws Exception {
    var diags = check(Programs.SEQ.replace("\"r1.in = 32'd5\"", "\"" + first + "\"\n          - \"" + second + "\""));
    Assertions.assertTrue(diags.errors().isEmpty(), diags.all().toString());
  }

  @Test
  void testParallelThreadsDrivingOnePort() throws Exception {
    var diags = check(Programs.SEQ.replace("seq: [A, B]", "par: [A, B]").replace("r2.in = r1.out", "r1.in = 32'd7"));
    assertSingleError(diags, "Parallel threads both drive r1.in");
  }

  @ParameterizedTest
  @CsvSource(quoteCharacter = '"', delimiter = '|',
             value = {"A[done] = r1.done|r2.write_en = r1.done|does not write its done hole",
                      "A[done] = r1.done|A[done] = 1'd1|driven by a constant",
                      "r1.write_en = 1'd1|r1.write_en = %0 ? 1'd1|outside of a static group",
                      "seq: [A, B]|seq: [A, B, {invoke: {cell: r1, inputs: {foo: 32'd1}}}]|has no input port foo"})
  void testStructuralErrors(String from, String to, String message) throws Exception {
    String yaml = Programs.SEQ.replace(from, to);
    Assertions.assertNotEquals(Programs.SEQ, yaml);
    Assertions.assertTrue(check(yaml).errors().stream().anyMatch(d -> d.message().contains(message)));
  }

  @Test
  void testCycleRangeBeyondLatency() throws Exception {
    assertSingleError(check(Programs.ISLAND.replace("%3 ?", "%5 ?")), "exceeds the latency 4");
  }

  @Test
  void testAdvisoryWarnings() throws Exception {
    // lt.out is combinational and the loop has no comb group
    var diags = check(Programs.BOUNDED_LOOP);
    Assertions.assertTrue(diags.errors().isEmpty());
    Assertions.assertEquals(1, diags.warnings().size());
    Assertions.assertEquals(Diagnostic.Category.ADVISORY, diags.warnings().get(0).category());
    Assertions.assertFalse(diags.hasFatalError());

    diags = check(Programs.SEQ.replace("seq: [A, B]", "seq: [A]"));
    Assertions.assertEquals(1, diags.warnings().size());
    Assertions.assertEquals("Group is never used", diags.warnings().get(0).message());
  }
}
