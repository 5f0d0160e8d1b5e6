package schedc.ir;

/**
 * Group with a fixed latency. It has no holes; its assignments are active in cycles {@code [0, latency)} of its activation
 * and may be restricted further by cycle guards.
 */
public class StaticGroup extends GroupBase {
  private final long latency;

  public StaticGroup(String name, long latency) {
    super(name);
    if (latency < 1)
      throw new IllegalArgumentException("Static group " + name + " must have a latency of at least one cycle, got " + latency);
    this.latency = latency;
  }

  public long latency() { return latency; }

  @Override
  public String kind() {
    return "static<" + latency + "> group";
  }
}
