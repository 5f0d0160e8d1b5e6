package schedc.drc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.analysis.ReadWriteSets;
import schedc.drc.Diagnostic.Category;
import schedc.ir.Assignment;
import schedc.ir.Attr;
import schedc.ir.Cell;
import schedc.ir.CombGroup;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.Group;
import schedc.ir.GroupBase;
import schedc.ir.GuardAnalysis;
import schedc.ir.Port;
import schedc.ir.StaticControl;
import schedc.ir.StaticGroup;

/**
 * Design rule checks on the IR. Errors are fatal for the pipeline, warnings are advisory.
 */
public class WellFormedCheck {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Context ctx;
  private final Diagnostics diags;

  public WellFormedCheck(Context ctx, Diagnostics diags) {
    this.ctx = ctx;
    this.diags = diags;
  }

  public boolean hasFatalError() { return diags.hasFatalError(); }

  /** Runs all checks on all components. */
  public void checkAll() {
    for (Component comp : ctx.components()) {
      logger.debug("Checking {}", comp);
      checkGroups(comp);
      checkControl(comp, comp.control(), comp.control().describe());
      checkUnused(comp);
      checkSignatureDone(comp);
      checkDrivers(comp);
    }
  }

  /** Checks only for conflicting drivers; used after each rewriting pass. */
  public void checkDrivers() {
    for (Component comp : ctx.components())
      checkDrivers(comp);
  }

  public void checkDrivers(Component comp) {
    for (GroupBase group : comp.allGroups()) {
      long latency = group instanceof StaticGroup ? ((StaticGroup)group).latency() : 0;
      checkConflicts(comp, group.toString(), group.assignments(), latency);
      for (Assignment x : comp.continuous())
        for (Assignment y : group.assignments())
          if (x.dst().equals(y.dst()) && conflicts(x, y, 0))
            diags.error(comp.name(), group.toString(),
                        "Port " + x.dst() + " is driven by the group and by a continuous assignment: `" + y + "` and `" + x + "`");
    }
    checkConflicts(comp, "continuous assignments", comp.continuous(), 0);
    checkParThreads(comp, comp.control(), comp.control().describe());
  }

  private void checkConflicts(Component comp, String origin, List<Assignment> assignments, long latency) {
    var byDst = new LinkedHashMap<Port, List<Assignment>>();
    for (Assignment a : assignments)
      byDst.computeIfAbsent(a.dst(), p -> new ArrayList<>()).add(a);
    for (var entry : byDst.entrySet()) {
      var list = entry.getValue();
      for (int i = 0; i < list.size(); ++i)
        for (int j = i + 1; j < list.size(); ++j)
          if (conflicts(list.get(i), list.get(j), latency))
            diags.error(comp.name(), origin,
                        "Port " + entry.getKey() + " has conflicting drivers: `" + list.get(i) + "` and `" + list.get(j) + "`");
    }
  }

  /** Two drivers conflict if they may drive different values in the same cycle. */
  public static boolean conflicts(Assignment a, Assignment b, long latency) {
    if (a.src().equals(b.src()))
      return false;
    return !GuardAnalysis.exclusive(a.guard(), b.guard(), latency);
  }

  private void checkParThreads(Component comp, Control control, String path) {
    if (control instanceof Control.Par || control instanceof StaticControl.StaticPar) {
      var threads = control.children();
      var threadAssigns = new ArrayList<List<Assignment>>();
      for (Control thread : threads)
        threadAssigns.add(ReadWriteSets.assignmentsOf(thread));
      for (int i = 0; i < threads.size(); ++i)
        for (int j = i + 1; j < threads.size(); ++j)
          checkThreadPair(comp, path, threadAssigns.get(i), threadAssigns.get(j));
    }
    int index = 0;
    for (Control child : control.children())
      checkParThreads(comp, child, path + "/" + (index++) + ":" + child.describe());
  }

  private void checkThreadPair(Component comp, String path, List<Assignment> a, List<Assignment> b) {
    for (Assignment x : a)
      for (Assignment y : b)
        if (x.dst().equals(y.dst()) && conflicts(x, y, 0))
          diags.error(comp.name(), path, "Parallel threads both drive " + x.dst() + ": `" + x + "` and `" + y + "`");
  }

  private void checkGroups(Component comp) {
    for (GroupBase group : comp.allGroups()) {
      if (group.attributes().get(Attr.PROMOTABLE).orElse(1) == 0)
        diags.error(comp.name(), group.toString(), "@promotable(0) is not a valid latency");
      if (group instanceof StaticGroup) {
        long latency = ((StaticGroup)group).latency();
        for (Assignment a : group.assignments()) {
          a.guard().mapRanges(range -> {
            if (range.end() > latency)
              diags.error(comp.name(), group.toString(), "Cycle range " + range + " in `" + a + "` exceeds the latency " + latency);
            return range;
          });
        }
        continue;
      }
      for (Assignment a : group.assignments())
        if (a.guard().hasCycles())
          diags.error(comp.name(), group.toString(), "Cycle guard in `" + a + "` outside of a static group");
      if (group instanceof Group) {
        var done = ((Group)group).doneAssignments();
        if (done.isEmpty())
          diags.error(comp.name(), group.toString(), "Group does not write its done hole");
        for (Assignment a : done)
          if (a.src() instanceof Constant && ((Constant)a.src()).value() != 0 && a.guard().isTrue())
            diags.error(comp.name(), group.toString(), "Done hole is driven by a constant; use a comb group instead");
      }
    }
    for (Assignment a : comp.continuous())
      if (a.guard().hasCycles())
        diags.error(comp.name(), "continuous assignments", "Cycle guard in `" + a + "` outside of a static group");
  }

  private void checkControl(Component comp, Control control, String path) {
    if (control.attributes().get(Attr.PROMOTABLE).orElse(1) == 0)
      diags.error(comp.name(), path, "@promotable(0) is not a valid latency");
    if (control instanceof Control.Enable) {
      Group group = ((Control.Enable)control).group();
      if (comp.findGroup(group.name()).orElse(null) != group)
        diags.error(comp.name(), path, "Enabled group " + group.name() + " is not part of the component");
    } else if (control instanceof StaticControl.StaticEnable) {
      StaticGroup group = ((StaticControl.StaticEnable)control).group();
      if (comp.findStaticGroup(group.name()).orElse(null) != group)
        diags.error(comp.name(), path, "Enabled group " + group.name() + " is not part of the component");
    } else if (control instanceof Control.Invoke) {
      var invoke = (Control.Invoke)control;
      checkInvoke(comp, path, invoke.cell(), invoke.bindings());
    } else if (control instanceof StaticControl.StaticInvoke) {
      var invoke = (StaticControl.StaticInvoke)control;
      checkInvoke(comp, path, invoke.cell(), invoke.bindings());
    } else if (control instanceof Control.If) {
      var ifc = (Control.If)control;
      checkCondition(comp, path, ifc.port(), ifc.comb().orElse(null));
    } else if (control instanceof Control.While) {
      var wc = (Control.While)control;
      checkCondition(comp, path, wc.port(), wc.comb().orElse(null));
    } else if (control instanceof StaticControl.StaticIf) {
      var ifc = (StaticControl.StaticIf)control;
      checkPortExists(comp, path, ifc.port());
    }
    int index = 0;
    for (Control child : control.children())
      checkControl(comp, child, path + "/" + (index++) + ":" + child.describe());
  }

  private void checkCondition(Component comp, String path, Port port, CombGroup comb) {
    checkPortExists(comp, path, port);
    if (comb == null && !port.isStable())
      diags.warning(Category.ADVISORY, comp.name(), path,
                    "Condition port " + port + " is not stable and has no comb group; a transient value may be sampled");
  }

  private void checkPortExists(Component comp, String path, Port port) {
    boolean exists;
    if (port.isSignature())
      exists = comp.hasPort(port.name());
    else if (port.isCellPort())
      exists = comp.findCell(port.parent()).map(c -> c.hasPort(port.name())).orElse(false);
    else
      exists = comp.findGroup(port.parent()).isPresent();
    if (!exists)
      diags.error(comp.name(), path, "Port " + port + " does not exist in the component");
  }

  private void checkInvoke(Component comp, String path, Cell cell, Control.Bindings bindings) {
    if (comp.findCell(cell.name()).orElse(null) != cell) {
      diags.error(comp.name(), path, "Invoked cell " + cell.name() + " is not part of the component");
      return;
    }
    for (String input : bindings.inputs().keySet())
      if (!cell.hasPort(input) || cell.port(input).direction() != Port.Direction.INPUT)
        diags.error(comp.name(), path, "Cell " + cell.name() + " has no input port " + input);
    for (String output : bindings.outputs().keySet())
      if (!cell.hasPort(output) || cell.port(output).direction() != Port.Direction.OUTPUT)
        diags.error(comp.name(), path, "Cell " + cell.name() + " has no output port " + output);
    if (cell.port(Port.Role.GO).isEmpty() || cell.port(Port.Role.DONE).isEmpty())
      diags.error(comp.name(), path, "Invoked cell " + cell.name() + " has no go/done interface");
    var callee = ctx.callee(cell);
    if (callee.isEmpty()) {
      if (!bindings.refCells().isEmpty())
        diags.error(comp.name(), path, "Primitive " + cell.name() + " has no reference cells");
      return;
    }
    for (Cell calleeCell : callee.get().cells()) {
      if (calleeCell.isReference() && !bindings.refCells().containsKey(calleeCell.name()))
        diags.error(comp.name(), path, "Reference cell " + calleeCell.name() + " of " + callee.get().name() + " is not supplied");
    }
    for (Map.Entry<String, String> ref : bindings.refCells().entrySet()) {
      var calleeCell = callee.get().findCell(ref.getKey());
      if (calleeCell.isEmpty() || !calleeCell.get().isReference())
        diags.error(comp.name(), path, callee.get().name() + " has no reference cell " + ref.getKey());
      if (comp.findCell(ref.getValue()).isEmpty())
        diags.error(comp.name(), path, "Supplied cell " + ref.getValue() + " does not exist");
    }
  }

  private void checkUnused(Component comp) {
    Set<GroupBase> used = new HashSet<>(ReadWriteSets.groupsOf(comp.control()));
    var all = new ArrayList<Assignment>(comp.continuous());
    comp.allGroups().forEach(g -> all.addAll(g.assignments()));
    for (GroupBase group : comp.allGroups()) {
      boolean referenced = used.contains(group);
      if (!referenced && group instanceof Group) {
        // writes of a group to its own done hole do not count
        referenced = all.stream().anyMatch(a -> !((Group)group).doneAssignments().contains(a) &&
                                                (a.dst().isHole() && a.dst().parent().equals(group.name()) ||
                                                 a.reads().stream().anyMatch(p -> p.isHole() && p.parent().equals(group.name()))));
      }
      if (!referenced)
        diags.warning(Category.ADVISORY, comp.name(), group.toString(), "Group is never used");
    }
  }

  private void checkSignatureDone(Component comp) {
    var all = new ArrayList<Assignment>(comp.continuous());
    comp.allGroups().forEach(g -> all.addAll(g.assignments()));
    for (Assignment a : all) {
      if (!a.dst().isSignature() || a.dst().role() != Port.Role.DONE)
        continue;
      boolean fromDone = a.src() instanceof Port && ((Port)a.src()).role() == Port.Role.DONE;
      if (!fromDone)
        diags.warning(Category.ADVISORY, comp.name(), "`" + a + "`", "Component done is driven by a signal that is not a done signal");
    }
  }
}
