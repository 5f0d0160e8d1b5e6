package schedc.passes;

import java.util.List;
import java.util.Set;
import schedc.drc.CompileException;
import schedc.drc.Diagnostics;
import schedc.ir.Context;

/**
 * A transformation or analysis of the whole program, run by {@link PassManager}.
 */
public interface Pass {
  String name();

  String description();

  default List<PassOptions.Option> options() { return List.of(); }

  /** Conditions that must hold before the pass runs. */
  default Set<PassCondition> requires() { return Set.of(); }

  /** Conditions that hold after the pass ran. */
  default Set<PassCondition> produces() { return Set.of(); }

  /** Conditions that no longer hold after the pass ran. */
  default Set<PassCondition> invalidates() { return Set.of(); }

  /** True if the pass changes assignments, so drivers are re-checked afterwards. */
  default boolean rewrites() { return true; }

  void run(Context ctx, PassOptions options, Diagnostics diags) throws CompileException;
}
