package schedc.ir;

/**
 * Constant of a fixed bit width. The value is masked to the width.
 */
public record Constant(long value, int width) implements Atom {
  public Constant {
    if (width <= 0 || width > 64)
      throw new IllegalArgumentException("Constant width must be in 1..64, got " + width);
    value = value & mask(width);
  }

  public static Constant of(long value, int width) { return new Constant(value, width); }
  public static Constant one() { return new Constant(1, 1); }
  public static Constant zero() { return new Constant(0, 1); }

  public static long mask(int width) { return width >= 64 ? -1L : (1L << width) - 1; }

  @Override
  public String toString() {
    return width + "'d" + Long.toUnsignedString(value);
  }
}
