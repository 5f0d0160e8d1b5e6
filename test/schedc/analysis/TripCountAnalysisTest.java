package schedc.analysis;

import java.util.OptionalLong;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.sim.Programs;

class TripCountAnalysisTest {

  private static OptionalLong tripCount(String yaml) throws Exception {
    Context ctx = Programs.read(yaml);
    Component main = ctx.component("main");
    var seq = (Control.Seq)main.control();
    return new TripCountAnalysis(main).tripCount((Control.While)seq.stmts().get(1), seq.stmts().get(0));
  }

  @ParameterizedTest
  @CsvSource(quoteCharacter = '"', value = {"std_lt, 4'd0, 4'd3, 4'd1, 3",
              "std_lt, 4'd0, 4'd7, 4'd2, 4",
              "std_lt, 4'd5, 4'd3, 4'd1, 0",
              "std_le, 4'd0, 4'd3, 4'd1, 4",
              "std_neq, 4'd1, 4'd7, 4'd2, 3"})
  void testCountingLoop(String cmp, String init, String bound, String step, long expected) throws Exception {
    String yaml = Programs.BOUNDED_LOOP.replace("name: lt, primitive: std_lt", "name: lt, primitive: " + cmp)
                      .replace("i.in = 4'd0", "i.in = " + init)
                      .replace("lt.right = 4'd3", "lt.right = " + bound)
                      .replace("add.right = 4'd1", "add.right = " + step);
    Assertions.assertEquals(OptionalLong.of(expected), tripCount(yaml));
  }

  @ParameterizedTest
  @CsvSource(quoteCharacter = '"', value = {"i.in = 4'd0, i.in = r.out",
              "add.right = 4'd1, add.right = i.out",
              "lt.right = 4'd3, lt.right = r.out",
              "std_lt, std_gt"})
  void testUnrecognizedShape(String from, String to) throws Exception {
    String yaml = Programs.BOUNDED_LOOP.replace("      - {name: add,", "      - {name: r, primitive: std_reg, width: 4}\n      - {name: add,")
                      .replace(from, to);
    Assertions.assertEquals(OptionalLong.empty(), tripCount(yaml));
  }

  @Test
  void testNeqThatSkipsTheBound() throws Exception {
    String yaml = Programs.BOUNDED_LOOP.replace("name: lt, primitive: std_lt", "name: lt, primitive: std_neq")
                      .replace("lt.right = 4'd3", "lt.right = 4'd7")
                      .replace("add.right = 4'd1", "add.right = 4'd2");
    Assertions.assertEquals(OptionalLong.empty(), tripCount(yaml));
  }
}
