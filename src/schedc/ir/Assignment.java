package schedc.ir;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Guarded connection {@code dst = guard ? src}. Immutable.
 */
public final class Assignment {
  private final Port dst;
  private final Atom src;
  private final Guard guard;

  public Assignment(Port dst, Atom src, Guard guard) {
    this.dst = Objects.requireNonNull(dst);
    this.src = Objects.requireNonNull(src);
    this.guard = Objects.requireNonNull(guard);
  }
  public Assignment(Port dst, Atom src) { this(dst, src, Guard.TRUE); }

  public Port dst() { return dst; }
  public Atom src() { return src; }
  public Guard guard() { return guard; }

  public Assignment withGuard(Guard newGuard) { return new Assignment(dst, src, newGuard); }
  public Assignment withDst(Port newDst) { return new Assignment(newDst, src, guard); }
  /** Conjoins {@code extra} to the guard. */
  public Assignment and(Guard extra) { return new Assignment(dst, src, extra.and(guard)); }

  public Assignment mapPorts(UnaryOperator<Port> fn) {
    Atom newSrc = src instanceof Port ? fn.apply((Port)src) : src;
    return new Assignment(fn.apply(dst), newSrc, guard.mapPorts(fn));
  }

  /** Ports read by the assignment: the source if it is a port, and all ports of the guard. */
  public Set<Port> reads() {
    var ret = new LinkedHashSet<Port>();
    if (src instanceof Port)
      ret.add((Port)src);
    guard.collectPorts(ret);
    return ret;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Assignment))
      return false;
    Assignment other = (Assignment)o;
    return dst.equals(other.dst) && src.equals(other.src) && guard.equals(other.guard);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dst, src, guard);
  }

  @Override
  public String toString() {
    if (guard.isTrue())
      return dst + " = " + src + ";";
    return dst + " = " + guard + " ? " + src + ";";
  }
}
