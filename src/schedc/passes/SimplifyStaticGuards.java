package schedc.passes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Atom;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Guard;
import schedc.ir.GuardSimplifier;
import schedc.ir.Port;
import schedc.ir.StaticGroup;

/**
 * Simplifies the guards of static groups and merges assignments that only differ in adjacent cycle ranges.
 */
public class SimplifyStaticGuards implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "simplify-static-guards";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Folds static guards and merges adjacent cycle ranges";
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.STATIC_INLINED);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components())
      for (StaticGroup group : comp.staticGroups())
        simplify(group);
  }

  /** Assignment identity apart from its cycle range. */
  private record Key(Port dst, Atom src, Guard rest) {}

  /** A guard split into one cycle range and the remaining conjuncts. */
  private record Split(Guard.CycleRange range, Guard rest) {}

  private static void conjuncts(Guard g, List<Guard> out) {
    if (g instanceof Guard.And) {
      conjuncts(((Guard.And)g).left(), out);
      conjuncts(((Guard.And)g).right(), out);
    } else
      out.add(g);
  }

  /** @return null if the guard has more than one range conjunct or ranges below the top-level conjunction */
  private static Split split(Guard g, long latency) {
    var parts = new ArrayList<Guard>();
    conjuncts(g, parts);
    Guard.CycleRange range = null;
    var rest = new ArrayList<Guard>();
    for (Guard part : parts) {
      if (part instanceof Guard.CycleRange) {
        if (range != null)
          return null;
        range = (Guard.CycleRange)part;
      } else if (part.hasCycles())
        return null;
      else
        rest.add(part);
    }
    if (range == null)
      range = new Guard.CycleRange(0, latency);
    return new Split(range, Guard.andAll(rest));
  }

  static void simplify(StaticGroup group) {
    long latency = group.latency();
    var simplifier = new GuardSimplifier(latency);
    var simplified = new ArrayList<Assignment>();
    for (Assignment a : group.assignments()) {
      Guard g = simplifier.simplify(a.guard());
      if (!g.isFalse())
        simplified.add(a.withGuard(g));
    }

    var merged = new LinkedHashMap<Object, List<Guard.CycleRange>>();
    var keep = new LinkedHashMap<Object, Assignment>();
    int opaque = 0;
    for (Assignment a : simplified) {
      Split s = split(a.guard(), latency);
      if (s == null) {
        keep.put(Integer.valueOf(opaque++), a);
        continue;
      }
      var key = new Key(a.dst(), a.src(), s.rest());
      keep.putIfAbsent(key, a);
      merged.computeIfAbsent(key, k -> new ArrayList<>()).add(s.range());
    }

    var out = new ArrayList<Assignment>();
    for (var entry : keep.entrySet()) {
      if (!(entry.getKey() instanceof Key)) {
        out.add(entry.getValue());
        continue;
      }
      var key = (Key)entry.getKey();
      for (Guard.CycleRange range : GuardSimplifier.mergeRanges(merged.get(key))) {
        Guard rangeGuard = range.begin() == 0 && range.end() >= latency ? Guard.TRUE : range;
        out.add(new Assignment(key.dst(), key.src(), rangeGuard.and(key.rest())));
      }
    }
    if (!Objects.equals(out, group.assignments())) {
      logger.debug("{}: {} assignments simplified to {}", group, group.assignments().size(), out.size());
      group.clear();
      group.addAll(out);
    }
  }
}
