package schedc.ir;

import java.util.ArrayList;

/**
 * Helper to add cells and groups to a component with fresh names.
 */
public class Builder {
  private final Context ctx;
  private final Component comp;
  private final boolean generated;

  /**
   * @param generated mark created cells as compiler-generated
   */
  public Builder(Context ctx, Component comp, boolean generated) {
    this.ctx = ctx;
    this.comp = comp;
    this.generated = generated;
  }

  public Component component() { return comp; }

  /** Adds a primitive cell named {@code prefix} or a fresh variant of it. */
  public Cell addPrimitive(String prefix, String primitive, int width) {
    String name = comp.freshName(prefix);
    var cell = new Cell(name, new Cell.PrimitiveProto(primitive, width), ctx.primitives().instantiatePorts(primitive, name, width), false,
                        generated);
    return comp.addCell(cell);
  }

  /** Adds an instance of another component. */
  public Cell addInstance(String name, Component callee, boolean reference) {
    var ports = new ArrayList<Port>();
    for (Port port : callee.signature())
      ports.add(new Port(Port.Owner.CELL, name, port.name(), port.width(), port.direction(), port.role(), false));
    return comp.addCell(new Cell(name, new Cell.ComponentProto(callee.id(), callee.name()), ports, reference, generated));
  }

  public Group addGroup(String prefix) { return comp.addGroup(new Group(comp.freshName(prefix))); }

  public StaticGroup addStaticGroup(String prefix, long latency) { return comp.addGroup(new StaticGroup(comp.freshName(prefix), latency)); }
}
