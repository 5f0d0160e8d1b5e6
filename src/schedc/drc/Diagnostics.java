package schedc.drc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import schedc.drc.Diagnostic.Category;
import schedc.drc.Diagnostic.Severity;

/**
 * Collects diagnostics of a compilation and logs them as they are reported.
 */
public class Diagnostics {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<Diagnostic> reported = new ArrayList<>();
  private boolean hasFatalError = false;

  public void error(String component, String origin, String message) { report(new Diagnostic(Severity.ERROR, Category.STRUCTURE, component, origin, message)); }

  public void warning(Category category, String component, String origin, String message) {
    report(new Diagnostic(Severity.WARNING, category, component, origin, message));
  }

  public void report(Diagnostic diag) {
    reported.add(diag);
    if (diag.isError()) {
      logger.error(diag.toString());
      hasFatalError = true;
    } else
      logger.warn(diag.toString());
  }

  public boolean hasFatalError() { return hasFatalError; }

  public List<Diagnostic> all() { return Collections.unmodifiableList(reported); }

  public List<Diagnostic> errors() { return reported.stream().filter(Diagnostic::isError).collect(Collectors.toList()); }

  public List<Diagnostic> warnings() { return reported.stream().filter(d -> !d.isError()).collect(Collectors.toList()); }
}
