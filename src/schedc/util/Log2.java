package schedc.util;

public class Log2 {
  public static int log2(long n) {
    if (n < 0)
      throw new IllegalArgumentException();
    return 63 - Long.numberOfLeadingZeros(n);
  }

  public static int clog2(long n) {
    if (n <= 0)
      throw new IllegalArgumentException();
    return log2(n - 1) + 1;
  }

  /** Width of a register that must hold the values 0..maxValue; never narrower than one bit. */
  public static int bitsFor(long maxValue) { return Math.max(1, clog2(maxValue + 1)); }
}
