package schedc.passes;

import java.util.Set;
import schedc.analysis.LatencyInference;
import schedc.drc.Diagnostics;
import schedc.ir.Component;
import schedc.ir.Context;

/**
 * Annotates groups, control nodes and components with {@code @promotable(N)} where their latency is fixed.
 */
public class StaticInference implements Pass {
  public static final String NAME = "static-inference";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Infers fixed latencies and annotates them as @promotable";
  }
  @Override
  public Set<PassCondition> requires() {
    return Set.of(PassCondition.WELL_FORMED);
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.INFERRED);
  }
  @Override
  public boolean rewrites() {
    return false;
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    var inference = new LatencyInference(ctx, diags);
    for (Component comp : ctx.postOrder())
      inference.annotate(comp);
  }
}
