package schedc.passes;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.Diagnostics;
import schedc.ir.Assignment;
import schedc.ir.Attr;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.Group;
import schedc.ir.Guard;
import schedc.ir.Primitives;
import schedc.util.Log2;

/**
 * Top-down compilation of dynamic control into state machines.
 * <p>
 * Sequences, conditionals and loops of one schedule share a state register; every enable gets a state of its own.
 * Each par and each subtree marked {@code @new_fsm} is compiled separately and appears as a single enable in the
 * enclosing schedule. The top schedule is driven by the component's go and done ports.
 */
public class TopDownCompileControl implements Pass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME = "tdcc";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Compiles dynamic control into finite state machines";
  }
  @Override
  public List<PassOptions.Option> options() {
    return List.of(PassOptions.Option.flag("dump-fsm", "Log the states and transitions of every schedule", false),
                   PassOptions.Option.flag("early-transitions", "Run the first enable of a schedule in the start state", false),
                   PassOptions.Option.number("one-hot-cutoff", "Use one-hot encoding for schedules with at most this many states", 0));
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.NO_STATIC, PassCondition.NO_INVOKE, PassCondition.NO_REPEAT, PassCondition.NO_COMB_GROUPS);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.CONTROL_COMPILED);
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    for (Component comp : ctx.components()) {
      if (comp.isStatic())
        continue;
      var compiler = new ControlCompiler(new Builder(ctx, comp, true), options.flag("dump-fsm"), options.flag("early-transitions"),
                                         options.number("one-hot-cutoff"));
      compiler.compileComponent();
    }
  }

  /** Pending transition out of a state, taken when {@code guard} holds. */
  record Pred(int state, Guard guard) {
    Pred and(Guard extra) { return new Pred(state, guard.and(extra)); }
  }

  record Transition(int from, int to, Guard guard) {}

  private static List<Pred> and(List<Pred> preds, Guard extra) {
    var ret = new ArrayList<Pred>(preds.size());
    preds.forEach(p -> ret.add(p.and(extra)));
    return ret;
  }

  private static class ControlCompiler {
    private final Builder builder;
    private final Component comp;
    private final boolean dumpFsm;
    private final boolean earlyTransitions;
    private final long oneHotCutoff;
    private final Map<Control, Group> compiled = new IdentityHashMap<>();

    ControlCompiler(Builder builder, boolean dumpFsm, boolean earlyTransitions, long oneHotCutoff) {
      this.builder = builder;
      this.comp = builder.component();
      this.dumpFsm = dumpFsm;
      this.earlyTransitions = earlyTransitions;
      this.oneHotCutoff = oneHotCutoff;
    }

    void compileComponent() {
      Group top = compile(comp.control());
      if (top != null) {
        comp.continuous().add(new Assignment(top.go(), comp.go()));
        comp.continuous().add(new Assignment(comp.done(), top.done()));
      } else if (comp.continuous().stream().noneMatch(a -> a.dst().equals(comp.done()))) {
        // nothing to run: finish in the cycle of activation
        comp.continuous().add(new Assignment(comp.done(), Constant.one(), Guard.port(comp.go())));
      }
      comp.setControl(new Control.Empty());
    }

    /** Group that runs the subtree; null if the subtree contains no enable. */
    Group compile(Control c) {
      if (compiled.containsKey(c))
        return compiled.get(c);
      Group ret;
      if (c instanceof Control.Empty)
        ret = null;
      else if (c instanceof Control.Enable)
        ret = ((Control.Enable)c).group();
      else if (c instanceof Control.Par)
        ret = compilePar((Control.Par)c);
      else
        ret = new Schedule(c).build();
      compiled.put(c, ret);
      return ret;
    }

    /**
     * Each thread has a one-bit latch that remembers its done pulse. A thread runs while neither its latch nor its done is set,
     * and the par is done once every thread is latched or pulsing done. The latches are cleared in that cycle.
     */
    private Group compilePar(Control.Par par) {
      var threads = new ArrayList<Group>();
      for (Control child : par.stmts()) {
        Group g = compile(child);
        if (g != null)
          threads.add(g);
      }
      if (threads.isEmpty())
        return null;
      Group ret = builder.addGroup("par");
      var latches = new ArrayList<Cell>();
      Guard allDone = Guard.TRUE;
      for (Group thread : threads) {
        Cell pd = builder.addPrimitive("pd", Primitives.REG, 1);
        latches.add(pd);
        allDone = allDone.and(Guard.port(pd.port("out")).or(Guard.port(thread.done())));
      }
      for (int i = 0; i < threads.size(); ++i) {
        Group thread = threads.get(i);
        Cell pd = latches.get(i);
        Guard finished = Guard.port(pd.port("out")).or(Guard.port(thread.done()));
        ret.add(new Assignment(thread.go(), Constant.one(), finished.not()));
        Guard latchNow = Guard.port(thread.done()).and(allDone.not());
        ret.add(new Assignment(pd.port("in"), Constant.one(), latchNow));
        ret.add(new Assignment(pd.port("write_en"), Constant.one(), latchNow));
        comp.continuous().add(new Assignment(pd.port("in"), Constant.zero(), allDone));
        comp.continuous().add(new Assignment(pd.port("write_en"), Constant.one(), allDone));
      }
      ret.add(new Assignment(ret.done(), Constant.one(), allDone));
      logger.debug("{}: {} compiled into {} with {} threads", comp.name(), par.describe(), ret, threads.size());
      return ret;
    }

    /** States and transitions of the control below one schedule root. */
    private class Schedule {
      private final Control root;
      private final Map<Control, Integer> ids = new IdentityHashMap<>();
      private final Map<Control, Integer> states = new IdentityHashMap<>();
      private final TreeMap<Integer, Group> enables = new TreeMap<>();
      private final Set<Transition> transitions = new LinkedHashSet<>();
      private int nextId = 1;

      Schedule(Control root) {
        this.root = root;
        assignIds(root);
      }

      private boolean isLeaf(Control c) {
        return c != root && (c instanceof Control.Enable || c instanceof Control.Par || c.attributes().has(Attr.NEW_FSM));
      }

      /** Numbers the leaves in program order; the start state is 0. */
      private void assignIds(Control c) {
        if (isLeaf(c)) {
          ids.put(c, nextId++);
          return;
        }
        for (Control child : c.children())
          assignIds(child);
      }

      private int stateOf(Control leaf, List<Pred> preds) {
        Integer state = states.get(leaf);
        if (state == null) {
          boolean fromStart = preds.size() == 1 && preds.get(0).state() == 0 && preds.get(0).guard().isTrue();
          state = earlyTransitions && fromStart && !enables.containsKey(0) ? 0 : ids.get(leaf);
          states.put(leaf, state);
        }
        return state;
      }

      /** Adds the states of {@code c} entered from {@code preds}; returns the pending transitions out of {@code c}. */
      private List<Pred> calc(Control c, List<Pred> preds) {
        if (isLeaf(c)) {
          Group group = compile(c);
          if (group == null)
            return preds;
          int state = stateOf(c, preds);
          for (Pred p : preds)
            if (p.state() != state)
              transitions.add(new Transition(p.state(), state, p.guard()));
          enables.put(state, group);
          return List.of(new Pred(state, Guard.port(group.done())));
        }
        if (c instanceof Control.Empty)
          return preds;
        if (c instanceof Control.Seq) {
          List<Pred> cur = preds;
          for (Control child : ((Control.Seq)c).stmts())
            cur = calc(child, cur);
          return cur;
        }
        if (c instanceof Control.If) {
          var ifc = (Control.If)c;
          Guard port = Guard.port(ifc.port());
          var ret = new ArrayList<Pred>(calc(ifc.tbranch(), and(preds, port)));
          ret.addAll(calc(ifc.fbranch(), and(preds, port.not())));
          return ret;
        }
        if (c instanceof Control.While) {
          var loop = (Control.While)c;
          Guard port = Guard.port(loop.port());
          List<Pred> entry = and(preds, port);
          List<Pred> exits = calc(loop.body(), entry);
          // second pass over the body adds the back edges; leaf states are fixed, so forward edges are only repeated
          var again = new ArrayList<Pred>(entry);
          again.addAll(and(exits, port));
          List<Pred> loopExits = calc(loop.body(), again);
          var ret = new ArrayList<Pred>(preds);
          ret.addAll(loopExits);
          return and(ret, port.not());
        }
        throw new IllegalStateException(comp.name() + ": " + c.describe() + " must be lowered before " + NAME);
      }

      Group build() {
        List<Pred> exits = calc(root, List.of(new Pred(0, Guard.TRUE)));
        int last = enables.isEmpty() ? 0 : enables.lastKey();
        int finalState = last + 1;
        for (Pred p : exits)
          transitions.add(new Transition(p.state(), finalState, p.guard()));

        // dense numbering of the states in use
        var used = new TreeSet<Integer>(enables.keySet());
        used.add(0);
        used.add(finalState);
        var index = new TreeMap<Integer, Integer>();
        for (int state : used)
          index.put(state, index.size());
        int stateCount = used.size();
        boolean oneHot = stateCount <= oneHotCutoff && stateCount <= 65;
        int width = oneHot ? Math.max(1, stateCount - 1) : Log2.bitsFor(stateCount - 1);

        Group ret = builder.addGroup("tdcc");
        Cell fsm = builder.addPrimitive("fsm", Primitives.REG, width);
        StateEncoding enc = new StateEncoding(fsm, width, oneHot);
        for (var entry : enables.entrySet()) {
          Group group = entry.getValue();
          ret.add(new Assignment(group.go(), Constant.one(), enc.in(index.get(entry.getKey())).and(Guard.port(group.done()).not())));
        }
        for (Transition t : transitions) {
          Guard when = enc.in(index.get(t.from())).and(t.guard());
          ret.add(new Assignment(fsm.port("in"), enc.value(index.get(t.to())), when));
          ret.add(new Assignment(fsm.port("write_en"), Constant.one(), when));
        }
        Guard done = enc.in(index.get(finalState));
        ret.add(new Assignment(ret.done(), Constant.one(), done));
        comp.continuous().add(new Assignment(fsm.port("in"), enc.value(0), done));
        comp.continuous().add(new Assignment(fsm.port("write_en"), Constant.one(), done));

        if (dumpFsm)
          logger.info("{}: {} ({} states, {}):\n{}", comp.name(), ret, stateCount, oneHot ? "one-hot" : "binary", dump(index, finalState));
        else
          logger.debug("{}: {} compiled into {} with {} states", comp.name(), root.describe(), ret, stateCount);
        return ret;
      }

      private String dump(Map<Integer, Integer> index, int finalState) {
        var sb = new StringBuilder();
        for (var entry : enables.entrySet())
          sb.append("  ").append(index.get(entry.getKey())).append(": ").append(entry.getValue().name()).append('\n');
        sb.append("  ").append(index.get(finalState)).append(": done\n");
        for (Transition t : transitions)
          sb.append("  ").append(index.get(t.from())).append(" -> ").append(index.get(t.to())).append(" when ").append(t.guard()).append('\n');
        return sb.toString();
      }
    }
  }

  /**
   * Binary or one-hot values of the state register. In one-hot encoding the start state is 0
   * so that the register's reset value starts the schedule, and state {@code i > 0} sets bit {@code i-1}.
   */
  private static class StateEncoding {
    private final Cell fsm;
    private final int width;
    private final boolean oneHot;

    StateEncoding(Cell fsm, int width, boolean oneHot) {
      this.fsm = fsm;
      this.width = width;
      this.oneHot = oneHot;
    }

    Constant value(int state) {
      if (!oneHot)
        return Constant.of(state, width);
      return Constant.of(state == 0 ? 0 : 1L << (state - 1), width);
    }

    Guard in(int state) { return Guard.eq(fsm.port("out"), value(state)); }
  }
}
