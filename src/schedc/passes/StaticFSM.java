package schedc.passes;

import java.util.ArrayList;
import java.util.List;
import schedc.ir.Assignment;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.Constant;
import schedc.ir.Guard;
import schedc.ir.Port;
import schedc.ir.Primitives;
import schedc.util.Log2;

/**
 * Counter register with its incrementer, used to step through the cycles of static islands.
 * One counter may be shared by islands that never run at the same time.
 */
public class StaticFSM {
  private final Cell reg;
  private final Cell adder;
  private final int width;

  private StaticFSM(Cell reg, Cell adder, int width) {
    this.reg = reg;
    this.adder = adder;
    this.width = width;
  }

  /** Adds a counter able to hold the values {@code 0..maxValue}. */
  public static StaticFSM create(Builder builder, long maxValue) {
    int width = Log2.bitsFor(maxValue);
    Cell reg = builder.addPrimitive("fsm", Primitives.REG, width);
    Cell adder = builder.addPrimitive("adder", Primitives.ADD, width);
    return new StaticFSM(reg, adder, width);
  }

  public Cell register() { return reg; }
  public int width() { return width; }
  public Port out() { return reg.port("out"); }

  public Guard eq(long value) { return Guard.eq(out(), Constant.of(value, width)); }

  /**
   * Counter condition for a cycle range of an island whose counter spans {@code [0, window)}.
   * A range covering the whole window is always true.
   */
  public Guard query(Guard.CycleRange range, long window) {
    long begin = range.begin();
    long end = Math.min(range.end(), window);
    if (begin >= end)
      return Guard.FALSE;
    if (begin == 0 && end >= window)
      return Guard.TRUE;
    if (end - begin == 1)
      return eq(begin);
    Guard upper = Guard.compare(Guard.CompOp.LT, out(), Constant.of(end, width));
    if (begin == 0)
      return upper;
    Guard lower = Guard.compare(Guard.CompOp.GEQ, out(), Constant.of(begin, width));
    if (end >= window)
      return lower;
    return lower.and(upper);
  }

  /** Replaces every cycle range in the guard by the corresponding counter condition. */
  public Guard translate(Guard guard, long window) { return guard.mapRanges(r -> query(r, window)); }

  public Assignment translate(Assignment a, long window) { return a.withGuard(translate(a.guard(), window)); }

  /** Incrementer inputs; they may be driven unconditionally. */
  public List<Assignment> adderInputs() {
    var ret = new ArrayList<Assignment>();
    ret.add(new Assignment(adder.port("left"), out()));
    ret.add(new Assignment(adder.port("right"), Constant.of(1, width)));
    return ret;
  }

  /** Counts up while {@code increment} holds and returns to 0 while {@code reset} holds. The two guards must be exclusive. */
  public List<Assignment> step(Guard increment, Guard reset) {
    var ret = new ArrayList<Assignment>();
    if (!increment.isFalse()) {
      ret.add(new Assignment(reg.port("in"), adder.port("out"), increment));
      ret.add(new Assignment(reg.port("write_en"), Constant.one(), increment));
    }
    if (!reset.isFalse()) {
      ret.add(new Assignment(reg.port("in"), Constant.of(0, width), reset));
      ret.add(new Assignment(reg.port("write_en"), Constant.one(), reset));
    }
    return ret;
  }
}
