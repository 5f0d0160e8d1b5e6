package schedc.ir;

/**
 * Recognized attributes. Numeric attributes carry a cycle or trip count, flags carry no payload.
 */
public enum Attr {
  /** Provably N cycles, not yet rewritten to static. */
  PROMOTABLE("promotable", true),
  /** Already rewritten from dynamic to static. */
  PROMOTED("promoted", false),
  /** Trip count of a while loop. */
  BOUND("bound", true),
  /** Declared or compiled latency of a component. */
  STATIC("static", true),
  /** Compile the subtree with a dedicated state register. */
  NEW_FSM("new_fsm", false);

  public final String text;
  public final boolean numeric;

  Attr(String text, boolean numeric) {
    this.text = text;
    this.numeric = numeric;
  }

  public static Attr fromName(String name) {
    for (Attr attr : values())
      if (attr.text.equals(name))
        return attr;
    throw new IllegalArgumentException("Unrecognized attribute @" + name);
  }
}
