package schedc.ir;

import java.util.Objects;

/**
 * A port of a cell, of a component signature, or a hole of a group.
 * Ports are identified by their owner and name; width, direction, role and stability are descriptive.
 */
public final class Port implements Atom {
  public enum Direction { INPUT, OUTPUT }

  /** Interface role of a port. */
  public enum Role { NONE, GO, DONE, CLK, RESET }

  /** Kind of object that owns a port. */
  public enum Owner { CELL, SIGNATURE, HOLE }

  private final Owner owner;
  private final String parent;
  private final String name;
  private final int width;
  private final Direction direction;
  private final Role role;
  private final boolean stable;

  public Port(Owner owner, String parent, String name, int width, Direction direction, Role role, boolean stable) {
    if (width <= 0)
      throw new IllegalArgumentException("Port " + parent + "." + name + " must have a positive width");
    this.owner = Objects.requireNonNull(owner);
    this.parent = owner == Owner.SIGNATURE ? "" : Objects.requireNonNull(parent);
    this.name = Objects.requireNonNull(name);
    this.width = width;
    this.direction = Objects.requireNonNull(direction);
    this.role = Objects.requireNonNull(role);
    this.stable = stable;
  }

  /** Creates the go or done hole of a group. */
  public static Port hole(String group, Role role) {
    if (role != Role.GO && role != Role.DONE)
      throw new IllegalArgumentException("Holes are either go or done");
    return new Port(Owner.HOLE, group, role == Role.GO ? "go" : "done", 1, role == Role.GO ? Direction.INPUT : Direction.OUTPUT, role,
                    false);
  }

  /** Name of the owning cell or group, empty for signature ports. */
  public String parent() { return parent; }
  public String name() { return name; }
  @Override
  public int width() {
    return width;
  }
  public Direction direction() { return direction; }
  public Role role() { return role; }
  /** True if the port only changes at a clock edge (e.g. a register output). */
  public boolean isStable() { return stable; }
  public boolean isHole() { return owner == Owner.HOLE; }
  public boolean isCellPort() { return owner == Owner.CELL; }
  public boolean isSignature() { return owner == Owner.SIGNATURE; }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof Port))
      return false;
    Port other = (Port)o;
    return owner == other.owner && parent.equals(other.parent) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(owner, parent, name);
  }

  @Override
  public String toString() {
    switch (owner) {
    case CELL:
      return parent + "." + name;
    case HOLE:
      return parent + "[" + name + "]";
    default:
      return name;
    }
  }
}
