package schedc.ir;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Instance of a primitive or of another component. Component instances refer to the callee by arena index.
 */
public class Cell {
  /** What a cell instantiates. */
  public interface Prototype {}

  public record PrimitiveProto(String primitive, int width) implements Prototype {
    @Override
    public String toString() {
      return primitive + "(" + width + ")";
    }
  }

  public record ComponentProto(int componentId, String componentName) implements Prototype {
    @Override
    public String toString() {
      return componentName + "()";
    }
  }

  private final String name;
  private final Prototype prototype;
  private final LinkedHashMap<String, Port> ports = new LinkedHashMap<>();
  private final boolean reference;
  private final boolean generated;

  public Cell(String name, Prototype prototype, List<Port> ports, boolean reference, boolean generated) {
    this.name = name;
    this.prototype = prototype;
    for (Port port : ports) {
      if (!port.isCellPort() || !port.parent().equals(name))
        throw new IllegalArgumentException("Port " + port + " does not belong to cell " + name);
      this.ports.put(port.name(), port);
    }
    this.reference = reference;
    this.generated = generated;
  }

  public String name() { return name; }
  public Prototype prototype() { return prototype; }
  /** True if the cell is supplied by the invoker. */
  public boolean isReference() { return reference; }
  /** True if the compiler introduced the cell. */
  public boolean isGenerated() { return generated; }

  public boolean isPrimitive(String primitive) {
    return prototype instanceof PrimitiveProto && ((PrimitiveProto)prototype).primitive().equals(primitive);
  }

  public Optional<Integer> componentId() {
    if (prototype instanceof ComponentProto)
      return Optional.of(((ComponentProto)prototype).componentId());
    return Optional.empty();
  }

  public Collection<Port> ports() { return Collections.unmodifiableCollection(ports.values()); }

  /** Adds a port that the callee signature gained after the cell was created. */
  public void addPort(Port port) {
    if (!port.isCellPort() || !port.parent().equals(name))
      throw new IllegalArgumentException("Port " + port + " does not belong to cell " + name);
    if (ports.putIfAbsent(port.name(), port) != null)
      throw new IllegalArgumentException("Cell " + name + " already has a port " + port.name());
  }

  public boolean hasPort(String portName) { return ports.containsKey(portName); }

  public Port port(String portName) {
    Port ret = ports.get(portName);
    if (ret == null)
      throw new IllegalArgumentException("Cell " + name + " has no port " + portName);
    return ret;
  }

  public Optional<Port> port(Port.Role role) { return ports.values().stream().filter(p -> p.role() == role).findFirst(); }

  @Override
  public String toString() {
    return (reference ? "ref " : "") + name + " = " + prototype;
  }
}
