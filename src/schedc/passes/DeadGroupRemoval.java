package schedc.passes;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.analysis.ReadWriteSets;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.GroupBase;
import schedc.ir.Port;

/**
 * Removes groups that are neither referenced by control nor enabled through their holes by a live group or a continuous assignment.
 */
public class DeadGroupRemoval implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "dead-group-removal";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Removes unreferenced groups";
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components())
      removeDead(comp);
  }

  private static void holeGroups(Iterable<Port> ports, Set<String> out) {
    for (Port p : ports)
      if (p.isHole())
        out.add(p.parent());
  }

  static int removeDead(Component comp) {
    var live = new HashSet<String>();
    var work = new ArrayDeque<String>();
    for (GroupBase group : ReadWriteSets.groupsOf(comp.control()))
      if (live.add(group.name()))
        work.add(group.name());
    var fromContinuous = new HashSet<String>();
    for (Assignment a : comp.continuous()) {
      holeGroups(List.of(a.dst()), fromContinuous);
      holeGroups(a.reads(), fromContinuous);
    }
    for (String name : fromContinuous)
      if (live.add(name))
        work.add(name);

    while (!work.isEmpty()) {
      String name = work.poll();
      var referenced = new HashSet<String>();
      for (GroupBase group : comp.allGroups()) {
        if (group.name().equals(name)) {
          holeGroups(group.writes(), referenced);
          holeGroups(group.reads(), referenced);
        }
      }
      for (String other : referenced)
        if (live.add(other))
          work.add(other);
    }

    int removed = 0;
    for (GroupBase group : List.copyOf(comp.allGroups())) {
      if (live.contains(group.name()))
        continue;
      comp.removeGroup(group);
      logger.debug("{}: removed dead {}", comp.name(), group);
      ++removed;
    }
    return removed;
  }
}
