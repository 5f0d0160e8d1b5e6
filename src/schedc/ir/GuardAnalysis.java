package schedc.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Decision procedures over guards: satisfiability, exclusivity and equivalence.
 * <p>
 * Each port is enumerated over the values at which a comparison against a constant can change its outcome,
 * the static cycle over the boundaries of the cycle ranges, and comparisons between two ports are treated as free booleans.
 * The result is exact for port-vs-constant and cycle conditions and conservative otherwise.
 * If the enumeration exceeds {@link #MAX_CASES}, the procedures answer "unknown" (exclusive/equivalent return false).
 */
public class GuardAnalysis {
  public static final long MAX_CASES = 1L << 16;

  /** True if both guards can never hold in the same cycle. */
  public static boolean exclusive(Guard a, Guard b) { return exclusive(a, b, 0); }

  /**
   * True if both guards can never hold in the same cycle.
   * @param latency latency of the enclosing static group, bounds the cycle domain; 0 if unbounded
   */
  public static boolean exclusive(Guard a, Guard b, long latency) {
    if (contradictoryConjuncts(a, b))
      return true;
    return satisfiable(new Guard.And(a, b), latency).map(sat -> !sat).orElse(false);
  }

  /**
   * Cheap syntactic test: one guard conjoins {@code x} and the other {@code !x}, or the two compare one port
   * for equality with different constants.
   */
  private static boolean contradictoryConjuncts(Guard a, Guard b) {
    var left = new ArrayList<Guard>();
    var right = new ArrayList<Guard>();
    conjuncts(a, left);
    conjuncts(b, right);
    for (Guard x : left)
      for (Guard y : right)
        if (x.equals(y.not()) || y.equals(x.not()) || differentValues(x, y))
          return true;
    return false;
  }

  private static boolean differentValues(Guard x, Guard y) {
    if (!(x instanceof Guard.Comp) || !(y instanceof Guard.Comp))
      return false;
    var cx = (Guard.Comp)x;
    var cy = (Guard.Comp)y;
    if (cx.op() != Guard.CompOp.EQ || cy.op() != Guard.CompOp.EQ)
      return false;
    if (!(cx.left() instanceof Port) || !(cx.right() instanceof Constant) || !(cy.right() instanceof Constant))
      return false;
    return cx.left().equals(cy.left()) && ((Constant)cx.right()).value() != ((Constant)cy.right()).value();
  }

  /** Collects {@code g} and, if it is a conjunction, all of its sub-conjunctions and conjuncts. */
  private static void conjuncts(Guard g, List<Guard> out) {
    out.add(g);
    if (g instanceof Guard.And) {
      conjuncts(((Guard.And)g).left(), out);
      conjuncts(((Guard.And)g).right(), out);
    }
  }

  /** True if both guards have the same value under every valuation (within the cycle window of {@code latency} if non-zero). */
  public static boolean equivalent(Guard a, Guard b, long latency) {
    var domain = new Domain(latency);
    domain.add(a);
    domain.add(b);
    return domain.forAll(v -> evalWith(a, v) == evalWith(b, v)).orElse(false);
  }

  /** Decides satisfiability; empty if the guard is too large to enumerate. */
  public static Optional<Boolean> satisfiable(Guard g, long latency) {
    var domain = new Domain(latency);
    domain.add(g);
    return domain.forAll(v -> !evalWith(g, v)).map(none -> !none);
  }

  /** One point in the enumeration. */
  private static class Point {
    final Map<Port, Long> ports = new HashMap<>();
    final Map<Guard.Comp, Boolean> opaque = new HashMap<>();
    long cycle = -1;
  }

  private static class Domain {
    final long latency;
    final LinkedHashMap<Port, TreeSet<Long>> portValues = new LinkedHashMap<>();
    final List<Guard.Comp> opaque = new ArrayList<>();
    final TreeSet<Long> cycles = new TreeSet<>();
    boolean usesCycles = false;

    Domain(long latency) { this.latency = latency; }

    void addValue(Port port, long value) {
      long max = Constant.mask(port.width());
      var set = portValues.computeIfAbsent(port, p -> {
        var init = new TreeSet<Long>();
        init.add(0L);
        init.add(max);
        return init;
      });
      if (value >= 0 && (max < 0 || value <= max))
        set.add(value);
    }

    void addCycle(long cycle) {
      if (cycle >= 0 && (latency <= 0 || cycle < latency))
        cycles.add(cycle);
    }

    void add(Guard g) {
      if (g instanceof Guard.PortGuard) {
        Port p = ((Guard.PortGuard)g).port();
        addValue(p, 1);
      } else if (g instanceof Guard.Not) {
        add(((Guard.Not)g).inner());
      } else if (g instanceof Guard.And) {
        add(((Guard.And)g).left());
        add(((Guard.And)g).right());
      } else if (g instanceof Guard.Or) {
        add(((Guard.Or)g).left());
        add(((Guard.Or)g).right());
      } else if (g instanceof Guard.Comp) {
        var comp = (Guard.Comp)g;
        if (comp.left() instanceof Port && comp.right() instanceof Port) {
          if (!opaque.contains(comp))
            opaque.add(comp);
        } else if (comp.left() instanceof Port || comp.right() instanceof Port) {
          Port p = (Port)(comp.left() instanceof Port ? comp.left() : comp.right());
          long c = ((Constant)(comp.left() instanceof Port ? comp.right() : comp.left())).value();
          addValue(p, c - 1);
          addValue(p, c);
          addValue(p, c + 1);
        }
      } else if (g instanceof Guard.CycleRange) {
        var range = (Guard.CycleRange)g;
        usesCycles = true;
        addCycle(range.begin() - 1);
        addCycle(range.begin());
        addCycle(range.end() - 1);
        addCycle(range.end());
      }
    }

    /** Checks the predicate on every point; empty if there are too many points. */
    Optional<Boolean> forAll(Predicate<Point> pred) {
      if (usesCycles) {
        addCycle(0);
        if (latency > 0)
          addCycle(latency - 1);
      } else {
        cycles.clear();
        cycles.add(-1L);
      }
      long cases = cycles.size();
      for (var values : portValues.values()) {
        cases *= values.size();
        if (cases > MAX_CASES)
          return Optional.empty();
      }
      if (opaque.size() > 16 || (cases << opaque.size()) > MAX_CASES)
        return Optional.empty();
      var ports = new ArrayList<>(portValues.keySet());
      var lists = new ArrayList<List<Long>>();
      for (Port p : ports)
        lists.add(new ArrayList<>(portValues.get(p)));
      var point = new Point();
      for (long cycle : cycles) {
        point.cycle = cycle;
        if (!forAllPorts(point, ports, lists, 0, pred))
          return Optional.of(false);
      }
      return Optional.of(true);
    }

    private boolean forAllPorts(Point point, List<Port> ports, List<List<Long>> lists, int i, Predicate<Point> pred) {
      if (i == ports.size())
        return forAllOpaque(point, 0, pred);
      for (long value : lists.get(i)) {
        point.ports.put(ports.get(i), value);
        if (!forAllPorts(point, ports, lists, i + 1, pred))
          return false;
      }
      return true;
    }

    private boolean forAllOpaque(Point point, int i, Predicate<Point> pred) {
      if (i == opaque.size())
        return pred.test(point);
      for (boolean value : new boolean[] {false, true}) {
        point.opaque.put(opaque.get(i), value);
        if (!forAllOpaque(point, i + 1, pred))
          return false;
      }
      return true;
    }
  }

  private static long atomValue(Atom atom, Point point) {
    if (atom instanceof Constant)
      return ((Constant)atom).value();
    return point.ports.getOrDefault((Port)atom, 0L);
  }

  private static boolean evalWith(Guard g, Point point) {
    if (g instanceof Guard.True)
      return true;
    if (g instanceof Guard.PortGuard)
      return point.ports.getOrDefault(((Guard.PortGuard)g).port(), 0L) != 0;
    if (g instanceof Guard.Not)
      return !evalWith(((Guard.Not)g).inner(), point);
    if (g instanceof Guard.And)
      return evalWith(((Guard.And)g).left(), point) && evalWith(((Guard.And)g).right(), point);
    if (g instanceof Guard.Or)
      return evalWith(((Guard.Or)g).left(), point) || evalWith(((Guard.Or)g).right(), point);
    if (g instanceof Guard.Comp) {
      var comp = (Guard.Comp)g;
      Boolean opaqueValue = point.opaque.get(comp);
      if (opaqueValue != null)
        return opaqueValue;
      return comp.op().apply(atomValue(comp.left(), point), atomValue(comp.right(), point));
    }
    return ((Guard.CycleRange)g).contains(point.cycle);
  }
}
