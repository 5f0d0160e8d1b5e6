package schedc.drc;

/**
 * One finding of a check or pass.
 * @param component the component the finding is about
 * @param origin the control node or group that caused it
 */
public record Diagnostic(Severity severity, Category category, String component, String origin, String message) {
  public enum Severity { ERROR, WARNING }

  public enum Category {
    /** Malformed IR, aborts the pipeline. */
    STRUCTURE,
    /** A latency claim that does not hold; the affected subtree stays dynamic. */
    LATENCY_CONTRACT,
    /** Legal but possibly unintended. */
    ADVISORY
  }

  public boolean isError() { return severity == Severity.ERROR; }

  @Override
  public String toString() {
    return component + ": " + origin + ": " + message;
  }
}
