package schedc.ir;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Algebraic simplification of guards.
 * Every result is checked with {@link GuardAnalysis#equivalent}; if equivalence cannot be shown, the input guard is returned unchanged.
 */
public class GuardSimplifier {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final long latency;

  /** @param latency latency of the static group the guards belong to, or 0 for dynamic contexts */
  public GuardSimplifier(long latency) { this.latency = latency; }

  public static Guard simplify(Guard guard, long latency) { return new GuardSimplifier(latency).simplify(guard); }

  public Guard simplify(Guard guard) {
    Guard folded = fold(guard);
    if (folded.equals(guard))
      return guard;
    if (!GuardAnalysis.equivalent(guard, folded, latency)) {
      logger.debug("Keeping guard {}: could not verify simplification to {}", guard, folded);
      return guard;
    }
    return folded;
  }

  Guard fold(Guard g) {
    if (g instanceof Guard.Not) {
      Guard inner = fold(((Guard.Not)g).inner());
      if (inner instanceof Guard.Not)
        return ((Guard.Not)inner).inner();
      return new Guard.Not(inner);
    }
    if (g instanceof Guard.And)
      return foldAnd(g);
    if (g instanceof Guard.Or)
      return foldOr(g);
    if (g instanceof Guard.Comp) {
      var comp = (Guard.Comp)g;
      if (comp.left() instanceof Constant && comp.right() instanceof Constant)
        return comp.op().apply(((Constant)comp.left()).value(), ((Constant)comp.right()).value()) ? Guard.TRUE : Guard.FALSE;
      return g;
    }
    if (g instanceof Guard.CycleRange)
      return foldRange((Guard.CycleRange)g);
    return g;
  }

  private Guard foldRange(Guard.CycleRange range) {
    if (latency > 0 && range.begin() == 0 && range.end() >= latency)
      return Guard.TRUE;
    if (latency > 0 && range.begin() >= latency)
      return Guard.FALSE;
    return range;
  }

  private static void flatten(Guard g, boolean conjunction, List<Guard> out) {
    if (conjunction && g instanceof Guard.And) {
      flatten(((Guard.And)g).left(), true, out);
      flatten(((Guard.And)g).right(), true, out);
    } else if (!conjunction && g instanceof Guard.Or) {
      flatten(((Guard.Or)g).left(), false, out);
      flatten(((Guard.Or)g).right(), false, out);
    } else
      out.add(g);
  }

  private Guard foldAnd(Guard g) {
    var raw = new ArrayList<Guard>();
    flatten(g, true, raw);
    var terms = new ArrayList<Guard>();
    long begin = -1, end = -1;
    int rangeIndex = -1;
    for (Guard term : raw) {
      Guard folded = fold(term);
      if (folded.isTrue())
        continue;
      if (folded.isFalse())
        return Guard.FALSE;
      if (folded instanceof Guard.CycleRange) {
        var range = (Guard.CycleRange)folded;
        if (rangeIndex < 0) {
          rangeIndex = terms.size();
          begin = range.begin();
          end = range.end();
        } else {
          begin = Math.max(begin, range.begin());
          end = Math.min(end, range.end());
          if (begin >= end)
            return Guard.FALSE;
        }
        continue;
      }
      if (!terms.contains(folded))
        terms.add(folded);
    }
    if (rangeIndex >= 0) {
      Guard range = foldRange(new Guard.CycleRange(begin, end));
      if (range.isFalse())
        return Guard.FALSE;
      if (!range.isTrue())
        terms.add(rangeIndex, range);
    }
    if (terms.isEmpty())
      return Guard.TRUE;
    Guard ret = terms.get(0);
    for (int i = 1; i < terms.size(); ++i)
      ret = new Guard.And(ret, terms.get(i));
    return ret;
  }

  private Guard foldOr(Guard g) {
    var raw = new ArrayList<Guard>();
    flatten(g, false, raw);
    var terms = new ArrayList<Guard>();
    var ranges = new ArrayList<Guard.CycleRange>();
    int rangeIndex = -1;
    for (Guard term : raw) {
      Guard folded = fold(term);
      if (folded.isFalse())
        continue;
      if (folded.isTrue())
        return Guard.TRUE;
      if (folded instanceof Guard.CycleRange) {
        if (rangeIndex < 0)
          rangeIndex = terms.size();
        ranges.add((Guard.CycleRange)folded);
        continue;
      }
      if (!terms.contains(folded))
        terms.add(folded);
    }
    if (!ranges.isEmpty()) {
      var merged = mergeRanges(ranges);
      if (merged.size() == 1 && foldRange(merged.get(0)).isTrue())
        return Guard.TRUE;
      terms.addAll(rangeIndex, merged);
    }
    if (terms.isEmpty())
      return Guard.FALSE;
    Guard ret = terms.get(0);
    for (int i = 1; i < terms.size(); ++i)
      ret = new Guard.Or(ret, terms.get(i));
    return ret;
  }

  /** Merges touching or overlapping ranges, sorted by start cycle. */
  public static List<Guard.CycleRange> mergeRanges(List<Guard.CycleRange> ranges) {
    var sorted = new ArrayList<>(ranges);
    sorted.sort(Comparator.comparingLong(Guard.CycleRange::begin));
    var ret = new ArrayList<Guard.CycleRange>();
    Guard.CycleRange cur = null;
    for (var range : sorted) {
      if (cur == null)
        cur = range;
      else if (range.begin() <= cur.end())
        cur = new Guard.CycleRange(cur.begin(), Math.max(cur.end(), range.end()));
      else {
        ret.add(cur);
        cur = range;
      }
    }
    if (cur != null)
      ret.add(cur);
    return ret;
  }
}
