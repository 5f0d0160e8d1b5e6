package schedc.passes;

import java.util.Set;
import schedc.drc.Diagnostics;
import schedc.drc.WellFormedCheck;
import schedc.ir.Context;

/**
 * Runs all design rule checks. Errors abort the pipeline.
 */
public class WellFormed implements Pass {
  public static final String NAME = "well-formed";

  @Override
  public String name() {
    return NAME;
  }
  @Override
  public String description() {
    return "Checks drivers, group handshakes, cycle guards, invokes and control references";
  }
  @Override
  public Set<PassCondition> produces() {
    return Set.of(PassCondition.WELL_FORMED);
  }
  @Override
  public boolean rewrites() {
    return false;
  }

  @Override
  public void run(Context ctx, PassOptions options, Diagnostics diags) {
    new WellFormedCheck(ctx, diags).checkAll();
  }
}
