package schedc.drc;

import java.util.List;

/**
 * Compilation was aborted, either because of fatal diagnostics or because the pass pipeline is misconfigured.
 */
public class CompileException extends Exception {
  private static final long serialVersionUID = 1L;

  private final List<Diagnostic> diagnostics;

  public CompileException(String message) { this(message, List.of()); }

  public CompileException(String message, List<Diagnostic> diagnostics) {
    super(message);
    this.diagnostics = List.copyOf(diagnostics);
  }

  /** The fatal diagnostics that caused the abort, if any. */
  public List<Diagnostic> diagnostics() { return diagnostics; }
}
