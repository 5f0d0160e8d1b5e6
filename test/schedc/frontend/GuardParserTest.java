package schedc.frontend;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import schedc.ir.Assignment;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Group;
import schedc.ir.Guard;
import schedc.ir.Port;
import schedc.ir.Primitives;

class GuardParserTest {
  private Component comp;
  private Cell reg;
  private Group group;
  private GuardParser parser;

  @BeforeEach
  void setUp() {
    var ctx = new Context();
    comp = ctx.add(new Component("main"));
    comp.addPort("sel", 1, Port.Direction.INPUT, Port.Role.NONE);
    var builder = new Builder(ctx, comp, false);
    reg = builder.addPrimitive("r", Primitives.REG, 8);
    group = comp.addGroup(new Group("A"));
    parser = new GuardParser(comp);
  }

  @Test
  void testAssignment() throws FrontendException {
    Assignment a = parser.parseAssignment("r.in = sel & !A[done] ? 8'hff;");
    Assertions.assertEquals(reg.port("in"), a.dst());
    Assertions.assertEquals(Constant.of(255, 8), a.src());
    Assertions.assertEquals(new Guard.And(Guard.port(comp.port("sel")), new Guard.Not(Guard.port(group.done()))), a.guard());
  }

  @Test
  void testUnguardedAssignment() throws FrontendException {
    Assignment a = parser.parseAssignment("A[done] = r.done");
    Assertions.assertEquals(group.done(), a.dst());
    Assertions.assertEquals(reg.port("done"), a.src());
    Assertions.assertTrue(a.guard().isTrue());
  }

  @Test
  void testPrecedence() throws FrontendException {
    Guard g = parser.parseGuard("sel | r.out >= 8'd3 & !(A[go] | sel)");
    Guard expected = new Guard.Or(Guard.port(comp.port("sel")),
                                  new Guard.And(Guard.compare(Guard.CompOp.GEQ, reg.port("out"), Constant.of(3, 8)),
                                                new Guard.Not(new Guard.Or(Guard.port(group.go()), Guard.port(comp.port("sel"))))));
    Assertions.assertEquals(expected, g);
  }

  @Test
  void testCycleRanges() throws FrontendException {
    Assertions.assertEquals(Guard.cycle(3), parser.parseGuard("%3"));
    Assertions.assertEquals(new Guard.And(Guard.range(1, 4), Guard.port(comp.port("sel"))), parser.parseGuard("%[1:4] & sel"));
  }

  @Test
  void testConstantsAsGuards() throws FrontendException {
    Assertions.assertTrue(parser.parseGuard("1'd1").isTrue());
    Assertions.assertTrue(parser.parseGuard("1'd0").isFalse());
    Assertions.assertEquals(Constant.of(5, 4), parser.parseAtom("4'b0101"));
  }

  @Test
  void testPrintedGuardsParseBack() throws FrontendException {
    Guard g = Guard.port(comp.port("sel")).or(Guard.port(group.done())).and(Guard.eq(reg.port("out"), Constant.of(7, 8))).not();
    Assertions.assertEquals(g, parser.parseGuard(g.toString()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"r.in = ", "r.foo = 8'd1", "q.in = 8'd1", "r.in = 8'q1", "B[done] = r.done", "A[start] = r.done", "r.in = %[3:1] ? 8'd1",
                          "r.in = 8'd1 8'd2", "r.in = sel $ sel ? 8'd1", "nope = sel"})
  void testErrors(String text) {
    var e = Assertions.assertThrows(FrontendException.class, () -> parser.parseAssignment(text));
    Assertions.assertTrue(e.getMessage().startsWith("main"), e.getMessage());
  }
}
