package schedc.ir;

/**
 * Port values (and, inside static groups, the current cycle) against which guards are evaluated.
 */
public interface Valuation {
  long get(Port port);

  /** Current cycle of the enclosing static group, negative if not evaluated in a static context. */
  default long cycle() { return -1; }
}
