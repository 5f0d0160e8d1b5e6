package schedc.passes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.CompileException;
import schedc.drc.Diagnostics;
import schedc.drc.WellFormedCheck;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.ControlRewriter;
import schedc.ir.StaticControl;
import schedc.util.IRPrinter;

/**
 * Registry of passes and aliases. Resolves a pipeline, parses pass options and runs the passes in order,
 * checking their preconditions and re-checking drivers after every rewriting pass.
 */
public class PassManager {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LinkedHashMap<String, Pass> passes = new LinkedHashMap<>();
  private final LinkedHashMap<String, List<String>> aliases = new LinkedHashMap<>();
  private boolean verifyDrivers = true;

  /** Pass manager with all passes and the aliases validate, pre-opt, compile and all. */
  public static PassManager standard() {
    var ret = new PassManager();
    ret.register(new WellFormed());
    ret.register(new StaticInference());
    ret.register(new StaticPromotion());
    ret.register(new CompileRef());
    ret.register(new StaticInliner());
    ret.register(new SimplifyStaticGuards());
    ret.register(new CompileStatic());
    ret.register(new CompileInvoke());
    ret.register(new CompileRepeat());
    ret.register(new RemoveCombGroups());
    ret.register(new TopDownCompileControl());
    ret.register(new DeadGroupRemoval());
    ret.registerAlias("validate", List.of(WellFormed.NAME));
    ret.registerAlias("pre-opt", List.of(StaticInference.NAME, StaticPromotion.NAME));
    ret.registerAlias("compile", List.of(CompileRef.NAME, StaticInliner.NAME, SimplifyStaticGuards.NAME, CompileStatic.NAME,
                                         CompileInvoke.NAME, CompileRepeat.NAME, RemoveCombGroups.NAME, TopDownCompileControl.NAME,
                                         DeadGroupRemoval.NAME));
    ret.registerAlias("all", List.of("validate", "pre-opt", "compile"));
    return ret;
  }

  public void register(Pass pass) {
    if (passes.containsKey(pass.name()) || aliases.containsKey(pass.name()))
      throw new IllegalArgumentException("Pass " + pass.name() + " is already registered");
    passes.put(pass.name(), pass);
  }

  /** Registers a name for a list of passes and aliases. */
  public void registerAlias(String alias, List<String> members) {
    if (passes.containsKey(alias) || aliases.containsKey(alias))
      throw new IllegalArgumentException("Name " + alias + " is already registered");
    aliases.put(alias, List.copyOf(members));
  }

  public Collection<Pass> passes() { return Collections.unmodifiableCollection(passes.values()); }
  public Map<String, List<String>> aliases() { return Collections.unmodifiableMap(aliases); }

  /** Whether drivers are re-checked after every rewriting pass. Enabled by default. */
  public void setVerifyDrivers(boolean verifyDrivers) { this.verifyDrivers = verifyDrivers; }

  /**
   * Expands aliases and removes the excluded passes.
   * @throws CompileException if a name is neither a pass nor an alias
   */
  public List<Pass> resolve(List<String> include, Collection<String> exclude) throws CompileException {
    for (String name : exclude)
      if (!passes.containsKey(name) && !aliases.containsKey(name))
        throw new CompileException("Unknown pass or alias " + name + " in the excluded passes");
    var excluded = new LinkedHashSet<String>();
    for (String name : exclude)
      expand(name, excluded::add, new ArrayList<>());
    var ret = new ArrayList<Pass>();
    for (String name : include) {
      if (!passes.containsKey(name) && !aliases.containsKey(name))
        throw new CompileException("Unknown pass or alias " + name);
      expand(name, passName -> {
        if (!excluded.contains(passName))
          ret.add(passes.get(passName));
      }, new ArrayList<>());
    }
    return ret;
  }

  private interface NameSink {
    void accept(String passName);
  }

  private void expand(String name, NameSink sink, List<String> stack) throws CompileException {
    if (passes.containsKey(name)) {
      sink.accept(name);
      return;
    }
    if (stack.contains(name))
      throw new CompileException("Alias " + name + " refers to itself");
    stack.add(name);
    for (String member : aliases.get(name)) {
      if (!passes.containsKey(member) && !aliases.containsKey(member))
        throw new CompileException("Alias " + name + " refers to unknown pass " + member);
      expand(member, sink, stack);
    }
    stack.remove(stack.size() - 1);
  }

  /**
   * Parses option settings of the form {@code pass:option=value}, or {@code pass:option} for a true flag.
   * @return option values per pass name
   */
  public Map<String, Map<String, String>> parseOptions(Collection<String> settings) throws CompileException {
    var ret = new LinkedHashMap<String, Map<String, String>>();
    for (String setting : settings) {
      int colon = setting.indexOf(':');
      if (colon <= 0 || colon == setting.length() - 1)
        throw new CompileException("Malformed pass option " + setting + ", expected pass:option=value");
      String passName = setting.substring(0, colon);
      if (!passes.containsKey(passName))
        throw new CompileException("Option " + setting + " refers to unknown pass " + passName);
      String rest = setting.substring(colon + 1);
      int eq = rest.indexOf('=');
      String option = eq < 0 ? rest : rest.substring(0, eq);
      String value = eq < 0 ? "true" : rest.substring(eq + 1);
      ret.computeIfAbsent(passName, k -> new LinkedHashMap<>()).put(option.trim(), value);
    }
    return ret;
  }

  /**
   * Runs the given passes in order.
   * @param options option values per pass name, as returned by {@link #parseOptions}
   * @throws CompileException on fatal diagnostics, missing preconditions or invalid options
   */
  public void run(Context ctx, List<Pass> pipeline, Map<String, Map<String, String>> options, Diagnostics diags) throws CompileException {
    var resolvedOptions = new HashMap<String, PassOptions>();
    for (Pass pass : pipeline)
      resolvedOptions.put(pass.name(), new PassOptions(pass.name(), pass.options(), options.getOrDefault(pass.name(), Map.of())));
    for (String passName : options.keySet())
      if (pipeline.stream().noneMatch(p -> p.name().equals(passName)))
        logger.warn("Options given for pass {}, which is not part of the pipeline", passName);

    Set<PassCondition> established = EnumSet.noneOf(PassCondition.class);
    for (Pass pass : pipeline) {
      Set<PassCondition> holding = EnumSet.copyOf(established);
      holding.addAll(observe(ctx));
      for (PassCondition cond : pass.requires())
        if (!holding.contains(cond))
          throw new CompileException("Pass " + pass.name() + " requires " + cond + ", which no earlier pass established");
      logger.debug("Running pass {}", pass.name());
      pass.run(ctx, resolvedOptions.get(pass.name()), diags);
      if (diags.hasFatalError())
        throw new CompileException("Pass " + pass.name() + " failed", diags.errors());
      established.removeAll(pass.invalidates());
      established.addAll(pass.produces());
      if (logger.isTraceEnabled() && pass.rewrites())
        logger.trace("After {}:\n{}", pass.name(), IRPrinter.print(ctx));
      if (pass.rewrites() && verifyDrivers) {
        new WellFormedCheck(ctx, diags).checkDrivers();
        if (diags.hasFatalError())
          throw new CompileException("Pass " + pass.name() + " produced conflicting drivers", diags.errors());
      }
    }
  }

  /** Resolves the pipeline, parses the options and runs it. */
  public void run(Context ctx, List<String> include, Collection<String> exclude, Collection<String> optionSettings, Diagnostics diags)
      throws CompileException {
    run(ctx, resolve(include, exclude), parseOptions(optionSettings), diags);
  }

  /** Conditions that can be read off the IR directly. */
  static Set<PassCondition> observe(Context ctx) {
    boolean noStatic = true, noInvoke = true, noRepeat = true, noComb = true, noRef = true;
    for (Component comp : ctx.components()) {
      if (!comp.staticGroups().isEmpty())
        noStatic = false;
      if (comp.cells().stream().anyMatch(Cell::isReference))
        noRef = false;
      var found = new boolean[5];
      ControlRewriter.forEach(comp.control(), c -> {
        if (c instanceof StaticControl)
          found[0] = true;
        if (c instanceof Control.Invoke)
          found[1] = true;
        if (c instanceof Control.Repeat)
          found[2] = true;
        if ((c instanceof Control.If && ((Control.If)c).comb().isPresent()) || (c instanceof Control.While && ((Control.While)c).comb().isPresent()))
          found[3] = true;
        if ((c instanceof Control.Invoke && !((Control.Invoke)c).bindings().refCells().isEmpty()) ||
            (c instanceof StaticControl.StaticInvoke && !((StaticControl.StaticInvoke)c).bindings().refCells().isEmpty()))
          found[4] = true;
      });
      noStatic &= !found[0];
      noInvoke &= !found[1];
      noRepeat &= !found[2];
      noComb &= !found[3];
      noRef &= !found[4];
    }
    Set<PassCondition> ret = EnumSet.noneOf(PassCondition.class);
    if (noStatic)
      ret.add(PassCondition.NO_STATIC);
    if (noInvoke)
      ret.add(PassCondition.NO_INVOKE);
    if (noRepeat)
      ret.add(PassCondition.NO_REPEAT);
    if (noComb)
      ret.add(PassCondition.NO_COMB_GROUPS);
    if (noRef)
      ret.add(PassCondition.NO_REF_CELLS);
    return ret;
  }

  /** Human readable list of passes, their options and the aliases. */
  public String describe() {
    var sb = new StringBuilder();
    sb.append("Passes:\n");
    for (Pass pass : passes.values()) {
      sb.append("  ").append(pass.name()).append(": ").append(pass.description()).append('\n');
      for (PassOptions.Option opt : pass.options())
        sb.append("    ").append(pass.name()).append(':').append(opt.name()).append(" (default ").append(opt.defaultValue()).append("): ")
            .append(opt.description()).append('\n');
    }
    sb.append("Aliases:\n");
    aliases.forEach((name, members) -> sb.append("  ").append(name).append(": ").append(String.join(", ", members)).append('\n'));
    return sb.toString();
  }
}
