package schedc.ir;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GuardAnalysisTest {
  private Port fsm;
  private Port x;
  private Port y;

  @BeforeEach
  void setUp() {
    var ctx = new Context();
    Component comp = ctx.add(new Component("main"));
    var builder = new Builder(ctx, comp, false);
    fsm = builder.addPrimitive("fsm", Primitives.REG, 3).port("out");
    x = Port.hole("X", Port.Role.DONE);
    y = Port.hole("Y", Port.Role.DONE);
  }

  private Guard state(long value) { return Guard.eq(fsm, Constant.of(value, 3)); }

  @Test
  void testComplementsAreExclusive() {
    Guard px = Guard.port(x);
    Assertions.assertTrue(GuardAnalysis.exclusive(px, px.not()));
    Assertions.assertTrue(GuardAnalysis.exclusive(px.and(Guard.port(y)), px.not()));
    Assertions.assertFalse(GuardAnalysis.exclusive(px, Guard.port(y)));
    Assertions.assertFalse(GuardAnalysis.exclusive(Guard.TRUE, px));
  }

  @Test
  void testStatesAreExclusive() {
    Assertions.assertTrue(GuardAnalysis.exclusive(state(1).and(Guard.port(x)), state(2)));
    Assertions.assertFalse(GuardAnalysis.exclusive(state(1), Guard.compare(Guard.CompOp.LT, fsm, Constant.of(2, 3))));
    Assertions.assertTrue(GuardAnalysis.exclusive(state(4), Guard.compare(Guard.CompOp.LT, fsm, Constant.of(4, 3))));
  }

  @Test
  void testNegatedConjunctionIsExclusive() {
    // latch writes of a par are gated by the negation of its done condition
    Guard allDone = Guard.port(x).and(Guard.port(y));
    Assertions.assertTrue(GuardAnalysis.exclusive(Guard.port(x).and(allDone.not()), allDone));
  }

  @Test
  void testStatesWithManyPortsAreExclusive() {
    var ports = new ArrayList<Guard>();
    for (int i = 0; i < 24; ++i)
      ports.add(Guard.port(Port.hole("G" + i, Port.Role.DONE)));
    Guard many = Guard.andAll(ports);
    Assertions.assertTrue(GuardAnalysis.satisfiable(many.and(state(0)), 0).isEmpty());
    Assertions.assertTrue(GuardAnalysis.exclusive(state(0).and(many), state(3).and(many)));
  }

  @Test
  void testCycles() {
    Assertions.assertTrue(GuardAnalysis.exclusive(Guard.range(0, 2), Guard.range(2, 4), 4));
    Assertions.assertFalse(GuardAnalysis.exclusive(Guard.range(0, 3), Guard.range(2, 4), 4));
    Assertions.assertTrue(GuardAnalysis.equivalent(Guard.range(0, 4), Guard.TRUE, 4));
    Assertions.assertFalse(GuardAnalysis.equivalent(Guard.range(0, 3), Guard.TRUE, 4));
  }

  @Test
  void testSatisfiable() {
    Assertions.assertEquals(false, GuardAnalysis.satisfiable(state(1).and(state(2)), 0).get());
    Assertions.assertEquals(true, GuardAnalysis.satisfiable(state(7), 0).get());
    Assertions.assertEquals(false, GuardAnalysis.satisfiable(Guard.FALSE, 0).get());
  }

  @Test
  void testEquivalent() {
    Guard px = Guard.port(x);
    Guard py = Guard.port(y);
    Assertions.assertTrue(GuardAnalysis.equivalent(px.and(py).not(), px.not().or(py.not()), 0));
    Assertions.assertFalse(GuardAnalysis.equivalent(px.or(py), px, 0));
    Assertions.assertTrue(GuardAnalysis.equivalent(Guard.orAll(List.of(state(0), state(1))), Guard.compare(Guard.CompOp.LT, fsm, Constant.of(2, 3)), 0));
  }
}
