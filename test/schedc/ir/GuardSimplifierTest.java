package schedc.ir;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GuardSimplifierTest {
  private final Guard x = Guard.port(Port.hole("X", Port.Role.DONE));
  private final Guard y = Guard.port(Port.hole("Y", Port.Role.DONE));

  @Test
  void testAdjacentRangesMerge() {
    Guard g = Guard.cycle(0).or(Guard.cycle(1)).or(Guard.range(2, 4));
    Assertions.assertTrue(GuardSimplifier.simplify(g, 4).isTrue());
    Assertions.assertEquals(Guard.range(0, 3), GuardSimplifier.simplify(Guard.range(0, 2).or(Guard.cycle(2)), 8));
  }

  @Test
  void testRangeIntersection() {
    Guard g = new Guard.And(Guard.range(0, 3), new Guard.And(x, Guard.range(2, 6)));
    Assertions.assertEquals(new Guard.And(Guard.cycle(2), x), GuardSimplifier.simplify(g, 8));
    Assertions.assertTrue(GuardSimplifier.simplify(new Guard.And(Guard.range(0, 2), Guard.range(3, 5)), 8).isFalse());
  }

  @Test
  void testRangesOutsideTheWindow() {
    Assertions.assertTrue(GuardSimplifier.simplify(Guard.range(0, 6), 4).isTrue());
    Assertions.assertTrue(GuardSimplifier.simplify(Guard.range(5, 6), 4).isFalse());
    // without a window nothing is known about the counter
    Assertions.assertEquals(Guard.range(0, 6), GuardSimplifier.simplify(Guard.range(0, 6), 0));
  }

  @Test
  void testDuplicatesAndConstants() {
    Assertions.assertEquals(x, GuardSimplifier.simplify(new Guard.And(x, new Guard.And(Guard.TRUE, x)), 0));
    Assertions.assertEquals(new Guard.Or(x, y), GuardSimplifier.simplify(Guard.orAll(List.of(x, y, x)), 0));
    Assertions.assertEquals(x, GuardSimplifier.simplify(new Guard.Not(new Guard.Not(x)), 0));
    Guard constant = Guard.eq(Constant.of(2, 4), Constant.of(2, 4));
    Assertions.assertTrue(GuardSimplifier.simplify(constant.and(x), 0).equals(x));
  }

  @Test
  void testMergeRanges() {
    var merged = GuardSimplifier.mergeRanges(List.of(new Guard.CycleRange(4, 5), new Guard.CycleRange(0, 2), new Guard.CycleRange(1, 3)));
    Assertions.assertEquals(List.of(new Guard.CycleRange(0, 3), new Guard.CycleRange(4, 5)), merged);
  }
}
