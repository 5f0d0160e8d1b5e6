package schedc.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import schedc.ir.Assignment;
import schedc.ir.Atom;
import schedc.ir.Cell;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.GroupBase;
import schedc.ir.Port;
import schedc.ir.StaticControl;

/**
 * Groups and assignments reachable from a control subtree.
 */
public class ReadWriteSets {
  /** Groups enabled by the subtree, including comb groups of conditions and invokes. */
  public static Set<GroupBase> groupsOf(Control control) {
    var ret = new LinkedHashSet<GroupBase>();
    ControlRewriter.forEach(control, c -> {
      if (c instanceof Control.Enable)
        ret.add(((Control.Enable)c).group());
      else if (c instanceof StaticControl.StaticEnable)
        ret.add(((StaticControl.StaticEnable)c).group());
      else if (c instanceof Control.If)
        ((Control.If)c).comb().ifPresent(ret::add);
      else if (c instanceof Control.While)
        ((Control.While)c).comb().ifPresent(ret::add);
      else if (c instanceof Control.Invoke)
        ((Control.Invoke)c).comb().ifPresent(ret::add);
      else if (c instanceof StaticControl.StaticIf)
        ((StaticControl.StaticIf)c).comb().ifPresent(ret::add);
    });
    return ret;
  }

  /** Port connections of an invocation: inputs of the invoked cell and outputs into the caller. */
  public static List<Assignment> invokeAssignments(Cell cell, Control.Bindings bindings) {
    var ret = new ArrayList<Assignment>();
    for (Map.Entry<String, Atom> input : bindings.inputs().entrySet())
      ret.add(new Assignment(cell.port(input.getKey()), input.getValue()));
    for (Map.Entry<String, Port> output : bindings.outputs().entrySet())
      ret.add(new Assignment(output.getValue(), cell.port(output.getKey())));
    return ret;
  }

  /** All assignments that may be active while the subtree runs. */
  public static List<Assignment> assignmentsOf(Control control) {
    var ret = new ArrayList<Assignment>();
    for (GroupBase group : groupsOf(control))
      ret.addAll(group.assignments());
    ControlRewriter.forEach(control, c -> {
      if (c instanceof Control.Invoke)
        ret.addAll(invokeAssignments(((Control.Invoke)c).cell(), ((Control.Invoke)c).bindings()));
      else if (c instanceof StaticControl.StaticInvoke)
        ret.addAll(invokeAssignments(((StaticControl.StaticInvoke)c).cell(), ((StaticControl.StaticInvoke)c).bindings()));
    });
    return ret;
  }

  /** Ports written while the subtree runs. */
  public static Set<Port> writesOf(Control control) {
    var ret = new LinkedHashSet<Port>();
    assignmentsOf(control).forEach(a -> ret.add(a.dst()));
    return ret;
  }

  /** Ports read while the subtree runs, including condition ports. */
  public static Set<Port> readsOf(Control control) {
    var ret = new LinkedHashSet<Port>();
    assignmentsOf(control).forEach(a -> ret.addAll(a.reads()));
    ControlRewriter.forEach(control, c -> {
      if (c instanceof Control.If)
        ret.add(((Control.If)c).port());
      else if (c instanceof Control.While)
        ret.add(((Control.While)c).port());
      else if (c instanceof StaticControl.StaticIf)
        ret.add(((StaticControl.StaticIf)c).port());
    });
    return ret;
  }
}
