package schedc.ir;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Boolean condition gating an assignment.
 * Cycle ranges ({@code %[i:j]}) are relative to the counter of the enclosing static group.
 * False is represented as {@code !true}.
 */
public interface Guard {

  Guard TRUE = new True();
  Guard FALSE = new Not(TRUE);

  /** Comparison operators, unsigned. */
  enum CompOp {
    EQ("=="),
    NEQ("!="),
    LT("<"),
    GT(">"),
    LEQ("<="),
    GEQ(">=");

    public final String symbol;
    CompOp(String symbol) { this.symbol = symbol; }

    public boolean apply(long a, long b) {
      int c = Long.compareUnsigned(a, b);
      switch (this) {
      case EQ:
        return c == 0;
      case NEQ:
        return c != 0;
      case LT:
        return c < 0;
      case GT:
        return c > 0;
      case LEQ:
        return c <= 0;
      default:
        return c >= 0;
      }
    }

    public static CompOp fromSymbol(String symbol) {
      for (CompOp op : values())
        if (op.symbol.equals(symbol))
          return op;
      throw new IllegalArgumentException("Unknown comparison operator " + symbol);
    }
  }

  /** Evaluates the guard. */
  boolean eval(Valuation valuation);

  /** Rebuilds the guard with every cycle range replaced by the result of {@code fn}. */
  Guard mapRanges(Function<CycleRange, Guard> fn);

  /** Rebuilds the guard with every port reference replaced. */
  Guard mapPorts(UnaryOperator<Port> fn);

  /** Adds all ports referenced by the guard to {@code out}. */
  void collectPorts(Set<Port> out);

  int precedence();

  default boolean isTrue() { return this instanceof True; }
  default boolean isFalse() { return this instanceof Not && ((Not)this).inner() instanceof True; }

  default boolean hasCycles() {
    boolean[] found = {false};
    mapRanges(r -> {
      found[0] = true;
      return r;
    });
    return found[0];
  }

  default Set<Port> ports() {
    var ret = new LinkedHashSet<Port>();
    collectPorts(ret);
    return ret;
  }

  /** Moves every cycle range later by {@code offset} cycles. */
  default Guard shift(long offset) {
    if (offset == 0)
      return this;
    return mapRanges(r -> new CycleRange(r.begin() + offset, r.end() + offset));
  }

  default Guard and(Guard other) {
    if (isTrue() || other.isFalse())
      return other;
    if (other.isTrue() || isFalse())
      return this;
    return new And(this, other);
  }

  default Guard or(Guard other) {
    if (isTrue() || other.isFalse())
      return this;
    if (other.isTrue() || isFalse())
      return other;
    return new Or(this, other);
  }

  default Guard not() {
    if (this instanceof Not)
      return ((Not)this).inner();
    return new Not(this);
  }

  static Guard port(Port port) { return new PortGuard(port); }
  static Guard cycle(long cycle) { return new CycleRange(cycle, cycle + 1); }
  static Guard range(long begin, long end) { return new CycleRange(begin, end); }
  static Guard compare(CompOp op, Atom left, Atom right) { return new Comp(op, left, right); }
  static Guard eq(Atom left, Atom right) { return new Comp(CompOp.EQ, left, right); }

  static Guard andAll(Collection<Guard> guards) {
    Guard ret = TRUE;
    for (Guard g : guards)
      ret = ret.and(g);
    return ret;
  }

  static Guard orAll(Collection<Guard> guards) {
    Guard ret = FALSE;
    for (Guard g : guards)
      ret = ret.or(g);
    return ret;
  }

  private static long valueOf(Atom atom, Valuation valuation) {
    if (atom instanceof Constant)
      return ((Constant)atom).value();
    return valuation.get((Port)atom);
  }

  private static Atom mapAtom(Atom atom, UnaryOperator<Port> fn) { return atom instanceof Port ? fn.apply((Port)atom) : atom; }

  private static String wrap(Guard g, int parentPrecedence) {
    return g.precedence() < parentPrecedence ? "(" + g + ")" : g.toString();
  }

  record True() implements Guard {
    @Override
    public boolean eval(Valuation valuation) {
      return true;
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return this;
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return this;
    }
    @Override
    public void collectPorts(Set<Port> out) {}
    @Override
    public int precedence() {
      return 4;
    }
    @Override
    public String toString() {
      return "1'd1";
    }
  }

  /** True iff the port value is non-zero. */
  record PortGuard(Port port) implements Guard {
    public PortGuard { Objects.requireNonNull(port); }
    @Override
    public boolean eval(Valuation valuation) {
      return valuation.get(port) != 0;
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return this;
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return new PortGuard(fn.apply(port));
    }
    @Override
    public void collectPorts(Set<Port> out) {
      out.add(port);
    }
    @Override
    public int precedence() {
      return 4;
    }
    @Override
    public String toString() {
      return port.toString();
    }
  }

  record Not(Guard inner) implements Guard {
    @Override
    public boolean eval(Valuation valuation) {
      return !inner.eval(valuation);
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return new Not(inner.mapRanges(fn));
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return new Not(inner.mapPorts(fn));
    }
    @Override
    public void collectPorts(Set<Port> out) {
      inner.collectPorts(out);
    }
    @Override
    public int precedence() {
      return 3;
    }
    @Override
    public String toString() {
      if (inner instanceof True)
        return "1'd0";
      return "!" + wrap(inner, 4);
    }
  }

  record And(Guard left, Guard right) implements Guard {
    @Override
    public boolean eval(Valuation valuation) {
      return left.eval(valuation) && right.eval(valuation);
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return new And(left.mapRanges(fn), right.mapRanges(fn));
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return new And(left.mapPorts(fn), right.mapPorts(fn));
    }
    @Override
    public void collectPorts(Set<Port> out) {
      left.collectPorts(out);
      right.collectPorts(out);
    }
    @Override
    public int precedence() {
      return 1;
    }
    @Override
    public String toString() {
      return wrap(left, 1) + " & " + wrap(right, 1);
    }
  }

  record Or(Guard left, Guard right) implements Guard {
    @Override
    public boolean eval(Valuation valuation) {
      return left.eval(valuation) || right.eval(valuation);
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return new Or(left.mapRanges(fn), right.mapRanges(fn));
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return new Or(left.mapPorts(fn), right.mapPorts(fn));
    }
    @Override
    public void collectPorts(Set<Port> out) {
      left.collectPorts(out);
      right.collectPorts(out);
    }
    @Override
    public int precedence() {
      return 0;
    }
    @Override
    public String toString() {
      return wrap(left, 0) + " | " + wrap(right, 0);
    }
  }

  record Comp(CompOp op, Atom left, Atom right) implements Guard {
    public Comp {
      Objects.requireNonNull(op);
      Objects.requireNonNull(left);
      Objects.requireNonNull(right);
    }
    @Override
    public boolean eval(Valuation valuation) {
      return op.apply(valueOf(left, valuation), valueOf(right, valuation));
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return this;
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return new Comp(op, mapAtom(left, fn), mapAtom(right, fn));
    }
    @Override
    public void collectPorts(Set<Port> out) {
      if (left instanceof Port)
        out.add((Port)left);
      if (right instanceof Port)
        out.add((Port)right);
    }
    @Override
    public int precedence() {
      return 2;
    }
    @Override
    public String toString() {
      return left + " " + op.symbol + " " + right;
    }
  }

  /** Cycle interval {@code [begin, end)} relative to the start of the enclosing static group. */
  record CycleRange(long begin, long end) implements Guard {
    public CycleRange {
      if (begin < 0 || begin >= end)
        throw new IllegalArgumentException("Invalid cycle range %[" + begin + ":" + end + "]");
    }
    public boolean contains(long cycle) { return cycle >= begin && cycle < end; }
    public long length() { return end - begin; }
    @Override
    public boolean eval(Valuation valuation) {
      long cycle = valuation.cycle();
      if (cycle < 0)
        throw new IllegalStateException("Cycle guard " + this + " evaluated outside of a static group");
      return contains(cycle);
    }
    @Override
    public Guard mapRanges(Function<CycleRange, Guard> fn) {
      return fn.apply(this);
    }
    @Override
    public Guard mapPorts(UnaryOperator<Port> fn) {
      return this;
    }
    @Override
    public void collectPorts(Set<Port> out) {}
    @Override
    public int precedence() {
      return 4;
    }
    @Override
    public String toString() {
      return end - begin == 1 ? "%" + begin : "%[" + begin + ":" + end + "]";
    }
  }
}
