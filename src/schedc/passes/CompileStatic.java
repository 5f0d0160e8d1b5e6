package schedc.passes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.analysis.ReadWriteSets;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.Group;
import schedc.ir.GroupBase;
import schedc.ir.Guard;
import schedc.ir.Port;
import schedc.ir.Primitives;
import schedc.ir.StaticControl;
import schedc.ir.StaticGroup;

/**
 * Compiles static islands into counter-driven dynamic groups and static components into a counter-driven interface.
 * Afterwards no static groups or static control remain.
 */
public class CompileStatic implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "compile-static";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Compiles static islands to counters";
  }
  @Override
  public List<PassOptions.Option> options() {
    return List.of(PassOptions.Option.flag("early-reset", "Let counters wrap to 0 in the last cycle of an island", true));
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.STATIC_INLINED);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.NO_STATIC);
  }
  @Override
  public Set<PassCondition> invalidates() {
    return Set.of(PassCondition.STATIC_INLINED);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    boolean earlyReset = options.flag("early-reset");
    for (Component comp : ctx.components()) {
      var compiler = new IslandCompiler(new Builder(ctx, comp, true), earlyReset, diags);
      if (comp.isStatic())
        compiler.compileInterface();
      else
        compiler.compileControl();
      for (StaticGroup group : new ArrayList<>(comp.staticGroups()))
        comp.removeGroup(group);
    }
  }

  private static class IslandCompiler {
    private final Builder builder;
    private final Component comp;
    private final boolean earlyReset;
    private final Diagnostics diags;
    private final Map<StaticGroup, StaticFSM> fsms = new IdentityHashMap<>();
    private final Map<StaticGroup, Group> islandGroups = new IdentityHashMap<>();
    private final Map<StaticGroup, Group> wrappers = new IdentityHashMap<>();

    IslandCompiler(Builder builder, boolean earlyReset, Diagnostics diags) {
      this.builder = builder;
      this.comp = builder.component();
      this.earlyReset = earlyReset;
      this.diags = diags;
    }

    void compileControl() {
      var islands = new LinkedHashSet<StaticGroup>();
      ControlRewriter.forEach(comp.control(), c -> {
        if (c instanceof StaticControl.StaticEnable)
          islands.add(((StaticControl.StaticEnable)c).group());
        else if (c instanceof StaticControl)
          throw new IllegalStateException(comp.name() + ": static control " + c.describe() + " was not inlined");
      });
      if (islands.isEmpty())
        return;
      allocateCounters(islands);
      if (earlyReset) {
        Set<Control> scheduled = Collections.newSetFromMap(new IdentityHashMap<>());
        scheduledLoops(comp.control(), false, scheduled);
        ControlRewriter.rewrite(comp, c -> scheduled.contains(c) ? lowerWhile(c) : c);
      }
      ControlRewriter.rewrite(comp, c -> {
        if (!(c instanceof StaticControl.StaticEnable))
          return c;
        StaticGroup island = ((StaticControl.StaticEnable)c).group();
        return new Control.Enable(earlyReset ? wrapper(island) : counted(island));
      });
    }

    /** Islands in different threads of one par run concurrently and need separate counters. */
    private Map<StaticGroup, Set<StaticGroup>> conflicts() {
      var ret = new IdentityHashMap<StaticGroup, Set<StaticGroup>>();
      ControlRewriter.forEach(comp.control(), c -> {
        if (!(c instanceof Control.Par))
          return;
        var threads = new ArrayList<Set<StaticGroup>>();
        for (Control thread : c.children()) {
          var set = new HashSet<StaticGroup>();
          for (GroupBase group : ReadWriteSets.groupsOf(thread))
            if (group instanceof StaticGroup)
              set.add((StaticGroup)group);
          threads.add(set);
        }
        for (int i = 0; i < threads.size(); ++i)
          for (int j = i + 1; j < threads.size(); ++j)
            for (StaticGroup a : threads.get(i))
              for (StaticGroup b : threads.get(j)) {
                ret.computeIfAbsent(a, k -> new HashSet<>()).add(b);
                ret.computeIfAbsent(b, k -> new HashSet<>()).add(a);
              }
      });
      return ret;
    }

    private long maxCount(StaticGroup island) { return earlyReset ? island.latency() - 1 : island.latency(); }

    /**
     * Greedy coloring of the conflict graph; each color gets one counter wide enough for all its islands.
     * Without early reset the idle value of a counter resets it, so only islands of equal latency share one.
     */
    private void allocateCounters(Set<StaticGroup> islands) {
      var conflicts = conflicts();
      var colors = new ArrayList<List<StaticGroup>>();
      for (StaticGroup island : islands) {
        Set<StaticGroup> blocked = conflicts.getOrDefault(island, Set.of());
        List<StaticGroup> chosen = null;
        for (List<StaticGroup> color : colors)
          if (color.stream().noneMatch(blocked::contains) && (earlyReset || color.get(0).latency() == island.latency())) {
            chosen = color;
            break;
          }
        if (chosen == null) {
          chosen = new ArrayList<>();
          colors.add(chosen);
        }
        chosen.add(island);
      }
      for (List<StaticGroup> color : colors) {
        long max = color.stream().mapToLong(this::maxCount).max().orElse(0);
        StaticFSM fsm = StaticFSM.create(builder, max);
        color.forEach(island -> fsms.put(island, fsm));
        logger.debug("{}: counter {} ({} bits) shared by {}", comp.name(), fsm.register().name(), fsm.width(), color);
      }
    }

    /** Counts {@code 0..N-1} and wraps to 0 in the last cycle, so the next activation can start right away. */
    private Group earlyResetGroup(StaticGroup island) {
      Group ret = islandGroups.get(island);
      if (ret != null)
        return ret;
      StaticFSM fsm = fsms.get(island);
      long n = island.latency();
      ret = builder.addGroup("early_reset_" + island.name());
      for (Assignment a : island.assignments())
        ret.add(fsm.translate(a, n));
      ret.addAll(fsm.adderInputs());
      Guard last = fsm.eq(n - 1);
      ret.addAll(fsm.step(last.not(), last));
      islandGroups.put(island, ret);
      return ret;
    }

    /**
     * Runs an early-reset island once. The signal register is set in the first cycle; the next time the counter is 0
     * with the signal set, the island has finished and the signal is cleared.
     */
    private Group wrapper(StaticGroup island) {
      Group ret = wrappers.get(island);
      if (ret != null)
        return ret;
      Group er = earlyResetGroup(island);
      StaticFSM fsm = fsms.get(island);
      Cell signal = builder.addPrimitive("signal_reg", Primitives.REG, 1);
      Guard set = Guard.port(signal.port("out"));
      Guard finished = fsm.eq(0).and(set);
      Guard starting = fsm.eq(0).and(set.not());
      ret = builder.addGroup("wrapper_" + er.name());
      ret.add(new Assignment(er.go(), Constant.one(), finished.not()));
      ret.add(new Assignment(signal.port("in"), Constant.one(), starting));
      ret.add(new Assignment(signal.port("write_en"), Constant.one(), starting));
      ret.add(new Assignment(ret.done(), Constant.one(), finished));
      comp.continuous().add(new Assignment(signal.port("in"), Constant.zero(), finished));
      comp.continuous().add(new Assignment(signal.port("write_en"), Constant.one(), finished));
      wrappers.put(island, ret);
      return ret;
    }

    /**
     * Loops below a seq, if, while or repeat. Those run in one state of a schedule, which samples the done of a
     * {@code while_wrapper} only while it is enabled.
     */
    private static void scheduledLoops(Control c, boolean scheduled, Set<Control> out) {
      if (scheduled && c instanceof Control.While)
        out.add(c);
      boolean below = scheduled || c instanceof Control.Seq || c instanceof Control.If || c instanceof Control.While ||
                      c instanceof Control.Repeat;
      for (Control child : c.children())
        scheduledLoops(child, below, out);
    }

    /**
     * A loop around an island that re-checks its stable condition every time the counter wraps, without a gap cycle.
     * Done is a level while the condition is low and the counter idle.
     */
    private Control lowerWhile(Control c) {
      if (!(c instanceof Control.While))
        return c;
      var loop = (Control.While)c;
      if (loop.comb().isPresent() || !loop.port().isStable() || !(loop.body() instanceof StaticControl.StaticEnable))
        return c;
      StaticGroup island = ((StaticControl.StaticEnable)loop.body()).group();
      Group er = earlyResetGroup(island);
      StaticFSM fsm = fsms.get(island);
      Guard cond = Guard.port(loop.port());
      Group ret = builder.addGroup("while_wrapper_" + island.name());
      ret.add(new Assignment(er.go(), Constant.one(), cond.or(fsm.eq(0).not())));
      ret.add(new Assignment(ret.done(), Constant.one(), cond.not().and(fsm.eq(0))));
      logger.debug("{}: {} compiled into {}", comp.name(), loop.describe(), ret);
      return new Control.Enable(ret);
    }

    /**
     * Counts {@code 0..N}; done is raised in the idle state {@code N}. Go is already low in that cycle,
     * so the return to 0 is a continuous assignment.
     */
    private Group counted(StaticGroup island) {
      Group ret = islandGroups.get(island);
      if (ret != null)
        return ret;
      StaticFSM fsm = fsms.get(island);
      long n = island.latency();
      ret = builder.addGroup("run_" + island.name());
      Guard active = fsm.query(new Guard.CycleRange(0, n), n + 1);
      Guard idle = fsm.eq(n);
      for (Assignment a : island.assignments())
        ret.add(fsm.translate(a, n).and(active));
      ret.addAll(fsm.adderInputs());
      ret.addAll(fsm.step(active, Guard.FALSE));
      ret.add(new Assignment(ret.done(), Constant.one(), idle));
      for (Assignment a : fsm.step(Guard.FALSE, idle))
        if (!comp.continuous().contains(a))
          comp.continuous().add(a);
      islandGroups.put(island, ret);
      return ret;
    }

    /**
     * Compiles a static component into continuous assignments. Cycle 0 only happens while go is high,
     * and done is raised when the counter is back at 0 after an activation.
     */
    void compileInterface() {
      long latency = comp.latency().getAsLong();
      if (!(comp.control() instanceof StaticControl.StaticEnable) || ((StaticControl.StaticEnable)comp.control()).latency() != latency) {
        diags.error(comp.name(), comp.control().describe(), "Control of a static<" + latency + "> component must be a static island of that latency");
        return;
      }
      StaticGroup island = ((StaticControl.StaticEnable)comp.control()).group();
      Port go = comp.go();
      Guard goHigh = Guard.port(go);
      Cell sig = builder.addPrimitive("sig_reg", Primitives.REG, 1);
      var out = comp.continuous();
      if (latency == 1) {
        for (Assignment a : island.assignments())
          out.add(a.withGuard(a.guard().mapRanges(r -> Guard.TRUE)).and(goHigh));
        out.add(new Assignment(sig.port("in"), go));
        out.add(new Assignment(sig.port("write_en"), Constant.one()));
        out.add(new Assignment(comp.done(), sig.port("out")));
      } else {
        StaticFSM fsm = StaticFSM.create(builder, latency - 1);
        Guard atZero = fsm.eq(0);
        Guard active = atZero.and(goHigh).or(atZero.not());
        for (Assignment a : island.assignments())
          out.add(fsm.translate(a, latency).and(active));
        out.addAll(fsm.adderInputs());
        Guard last = fsm.eq(latency - 1);
        out.addAll(fsm.step(active.and(last.not()), last));
        out.add(new Assignment(sig.port("in"), go, atZero));
        out.add(new Assignment(sig.port("write_en"), Constant.one(), atZero));
        out.add(new Assignment(comp.done(), Constant.one(), atZero.and(Guard.port(sig.port("out")))));
      }
      comp.setControl(new Control.Empty());
      logger.debug("{}: compiled static<{}> interface", comp.name(), latency);
    }
  }
}
