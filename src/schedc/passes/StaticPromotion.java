package schedc.passes;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.analysis.LatencyInference;
import schedc.drc.Diagnostic.Category;
import schedc.drc.Diagnostics;
import schedc.ir.Attr;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.Group;
import schedc.ir.StaticControl;
import schedc.ir.StaticGroup;

/**
 * Rewrites control annotated {@code @promotable(N)} into static control, and components other than the entrypoint whose
 * whole control became static into {@code static<N>} components. Runs to a fixpoint over the components, callees first.
 */
public class StaticPromotion implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "static-promotion";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Converts control with a fixed latency into static control";
  }
  @Override
  public List<PassOptions.Option> options() {
    return List.of(PassOptions.Option.number("threshold", "Minimum number of enables in a promoted subtree", 1),
                   PassOptions.Option.number("cycle-limit", "Maximum latency of a promoted subtree", 33554432));
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.INFERRED);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.INFERRED);
  }
  @Override
  public Set<PassCondition> invalidates() {
    return Set.of(PassCondition.STATIC_INLINED, PassCondition.NO_STATIC);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    long threshold = options.number("threshold");
    long cycleLimit = options.number("cycle-limit");
    var inference = new LatencyInference(ctx, diags);
    Map<Group, StaticGroup> promotedGroups = new IdentityHashMap<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Component comp : ctx.postOrder()) {
        if (comp.isStatic())
          continue;
        inference.annotate(comp);
        var promoter = new Promoter(comp, threshold, cycleLimit, promotedGroups, diags);
        comp.setControl(promoter.promote(comp.control(), true));
        if (comp.control() instanceof StaticControl) {
          long latency = ((StaticControl)comp.control()).latency();
          comp.attributes().remove(Attr.PROMOTABLE);
          // the entrypoint is driven by a go held until done; its control stays a static island behind that handshake
          if (!comp.name().equals(ctx.entrypoint())) {
            comp.attributes().set(Attr.STATIC, latency);
            comp.attributes().set(Attr.PROMOTED);
            logger.debug("Promoted {} to static<{}>", comp, latency);
          }
        }
        changed |= promoter.changed;
      }
    }
  }

  /** Number of enables and invokes in a subtree. */
  static long enables(Control control) {
    long[] count = {0};
    ControlRewriter.forEach(control, c -> {
      if (c instanceof Control.Enable || c instanceof Control.Invoke || c instanceof StaticControl.StaticEnable ||
          c instanceof StaticControl.StaticInvoke)
        ++count[0];
    });
    return count[0];
  }

  private static class Promoter {
    private final Component comp;
    private final long threshold;
    private final long cycleLimit;
    private final Map<Group, StaticGroup> promotedGroups;
    private final Diagnostics diags;
    boolean changed = false;

    Promoter(Component comp, long threshold, long cycleLimit, Map<Group, StaticGroup> promotedGroups, Diagnostics diags) {
      this.comp = comp;
      this.threshold = threshold;
      this.cycleLimit = cycleLimit;
      this.promotedGroups = promotedGroups;
      this.diags = diags;
    }

    private boolean candidate(Control c) { return c instanceof StaticControl || c.attributes().has(Attr.PROMOTABLE); }

    private long latencyOf(Control c) {
      if (c instanceof StaticControl)
        return ((StaticControl)c).latency();
      return c.attributes().get(Attr.PROMOTABLE).orElseThrow();
    }

    /** @return null if promotion is allowed, otherwise why it is declined */
    private String declineReason(long enableCount, long latency) {
      if (enableCount < threshold)
        return "it contains " + enableCount + " enables, fewer than the threshold " + threshold;
      if (latency > cycleLimit)
        return "its latency " + latency + " exceeds the cycle limit " + cycleLimit;
      return null;
    }

    private void decline(Control c, String reason, boolean warn) {
      if (warn)
        diags.warning(Category.ADVISORY, comp.name(), c.describe(), "Not promoted because " + reason);
      else
        logger.debug("{}: {} not promoted because {}", comp.name(), c.describe(), reason);
    }

    Control promote(Control c, boolean warn) {
      if (c instanceof StaticControl)
        return c;
      if (c.attributes().has(Attr.PROMOTABLE)) {
        String reason = declineReason(enables(c), latencyOf(c));
        if (reason == null)
          return convert(c);
        decline(c, reason, warn);
        warn = false;
      }
      if (c instanceof Control.Seq)
        promoteSeq((Control.Seq)c, warn);
      else if (c instanceof Control.Par)
        promotePar((Control.Par)c, warn);
      else if (c instanceof Control.If) {
        var ifc = (Control.If)c;
        ifc.setTbranch(promote(ifc.tbranch(), warn));
        ifc.setFbranch(promote(ifc.fbranch(), warn));
      } else if (c instanceof Control.While) {
        var wc = (Control.While)c;
        wc.setBody(promote(wc.body(), warn));
      } else if (c instanceof Control.Repeat) {
        var rc = (Control.Repeat)c;
        rc.setBody(promote(rc.body(), warn));
      }
      return c;
    }

    /** Wraps maximal runs of promotable children into static sequences. */
    private void promoteSeq(Control.Seq seq, boolean warn) {
      var out = new ArrayList<Control>();
      var run = new ArrayList<Control>();
      for (Control child : seq.stmts()) {
        if (candidate(child)) {
          run.add(child);
          continue;
        }
        flushRun(run, out, warn);
        out.add(promote(child, warn));
      }
      flushRun(run, out, warn);
      seq.stmts().clear();
      seq.stmts().addAll(out);
    }

    private void flushRun(List<Control> run, List<Control> out, boolean warn) {
      if (run.isEmpty())
        return;
      long latency = 0, enableCount = 0;
      for (Control c : run) {
        latency += latencyOf(c);
        enableCount += enables(c);
      }
      String reason = declineReason(enableCount, latency);
      if (reason == null) {
        var converted = new ArrayList<StaticControl>();
        run.forEach(c -> converted.add(convert(c)));
        out.add(converted.size() == 1 ? converted.get(0) : promoted(new StaticControl.StaticSeq(converted)));
      } else {
        decline(run.get(0), reason, warn);
        for (Control c : run)
          out.add(promote(c, false));
      }
      run.clear();
    }

    /** Collects the promotable threads into one static par. */
    private void promotePar(Control.Par par, boolean warn) {
      var threads = new ArrayList<Control>();
      long latency = 0, enableCount = 0;
      for (Control child : par.stmts())
        if (candidate(child)) {
          threads.add(child);
          latency = Math.max(latency, latencyOf(child));
          enableCount += enables(child);
        }
      String reason = threads.isEmpty() ? null : declineReason(enableCount, latency);
      if (threads.isEmpty() || reason != null) {
        boolean warnThreads = warn && reason == null;
        if (reason != null)
          decline(threads.get(0), reason, warn);
        par.stmts().replaceAll(c -> promote(c, warnThreads));
        return;
      }
      var out = new ArrayList<Control>();
      var converted = new ArrayList<StaticControl>();
      for (Control child : par.stmts()) {
        if (candidate(child)) {
          if (converted.isEmpty())
            out.add(null);
          converted.add(convert(child));
        } else
          out.add(promote(child, warn));
      }
      Control merged = converted.size() == 1 ? converted.get(0) : promoted(new StaticControl.StaticPar(converted));
      out.set(out.indexOf(null), merged);
      par.stmts().clear();
      par.stmts().addAll(out);
    }

    private StaticControl promoted(StaticControl c) {
      c.attributes().set(Attr.PROMOTED);
      changed = true;
      return c;
    }

    /** Children of a sequence or par that carry latency; zero-latency children are dropped. */
    private List<StaticControl> convertAll(List<Control> children) {
      var ret = new ArrayList<StaticControl>();
      for (Control child : children)
        if (candidate(child))
          ret.add(convert(child));
      return ret;
    }

    StaticControl convert(Control c) {
      if (c instanceof StaticControl)
        return (StaticControl)c;
      long latency = latencyOf(c);
      StaticControl ret;
      if (c instanceof Control.Enable)
        ret = new StaticControl.StaticEnable(staticGroup(((Control.Enable)c).group(), latency));
      else if (c instanceof Control.Invoke)
        ret = new StaticControl.StaticInvoke(((Control.Invoke)c).cell(), ((Control.Invoke)c).bindings(), latency);
      else if (c instanceof Control.Seq)
        ret = new StaticControl.StaticSeq(convertAll(((Control.Seq)c).stmts()));
      else if (c instanceof Control.Par)
        ret = new StaticControl.StaticPar(convertAll(((Control.Par)c).stmts()));
      else if (c instanceof Control.If) {
        var ifc = (Control.If)c;
        ret = new StaticControl.StaticIf(ifc.port(), ifc.comb().orElse(null), convert(ifc.tbranch()), convert(ifc.fbranch()));
      } else if (c instanceof Control.While) {
        var wc = (Control.While)c;
        ret = new StaticControl.StaticRepeat(wc.attributes().get(Attr.BOUND).orElseThrow(), convert(wc.body()));
      } else if (c instanceof Control.Repeat) {
        var rc = (Control.Repeat)c;
        ret = new StaticControl.StaticRepeat(rc.count(), convert(rc.body()));
      } else
        throw new IllegalStateException("Cannot promote " + c.describe());
      if (ret.latency() != latency)
        throw new IllegalStateException(c.describe() + " was annotated @promotable(" + latency + ") but has latency " + ret.latency());
      logger.debug("{}: promoted {} to {}", comp.name(), c.describe(), ret.describe());
      return promoted(ret);
    }

    /** Static copy of a dynamic group, without the done handshake. Shared by all enables of the group. */
    private StaticGroup staticGroup(Group group, long latency) {
      StaticGroup ret = promotedGroups.get(group);
      if (ret != null && ret.latency() == latency)
        return ret;
      ret = comp.addGroup(new StaticGroup(comp.freshName(group.name() + "_static"), latency));
      ret.addAll(group.assignments());
      ret.removeIf(group::isDoneWrite);
      ret.attributes().set(Attr.PROMOTED);
      promotedGroups.put(group, ret);
      return ret;
    }
  }
}
