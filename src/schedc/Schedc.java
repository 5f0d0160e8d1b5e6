package schedc;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.CompileException;
import schedc.drc.Diagnostic;
import schedc.drc.Diagnostics;
import schedc.ir.Context;
import schedc.passes.PassManager;
import schedc.ui.SchedcConfig;

/**
 * Entry point for compiling a program with a configured pass pipeline.
 */
public class Schedc {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SchedcConfig cfg;
  private final PassManager passManager;
  private Diagnostics diags = new Diagnostics();

  public Schedc() { this(new SchedcConfig()); }

  public Schedc(SchedcConfig cfg) { this(cfg, PassManager.standard()); }

  public Schedc(SchedcConfig cfg, PassManager passManager) {
    this.cfg = cfg;
    this.passManager = passManager;
    passManager.setVerifyDrivers(cfg.verify_drivers);
  }

  public SchedcConfig config() { return cfg; }
  public PassManager passManager() { return passManager; }

  /** Diagnostics of the last compilation. */
  public List<Diagnostic> diagnostics() { return diags.all(); }

  /**
   * Runs the configured pipeline on the program, rewriting it in place.
   * @return false if the compilation was aborted; the reasons are logged and available from {@link #diagnostics()}
   */
  public boolean compile(Context ctx) {
    diags = new Diagnostics();
    try {
      passManager.run(ctx, cfg.passes, cfg.exclude_passes, cfg.pass_options, diags);
    } catch (CompileException e) {
      logger.error("Compilation aborted: {}", e.getMessage());
      return false;
    }
    logger.info("Compiled {} components with {} warnings", ctx.components().size(), diags.warnings().size());
    return true;
  }
}
