package schedc.ir;

/**
 * Value that can drive an assignment or be compared in a guard: either a {@link Port} or a {@link Constant}.
 */
public interface Atom {
  int width();
}
