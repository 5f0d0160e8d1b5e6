package schedc.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Arena of all components of a program. Cells refer to components by their index here.
 */
public class Context {
  private final List<Component> components = new ArrayList<>();
  private final HashMap<String, Integer> byName = new HashMap<>();
  private final Primitives primitives;
  private String entrypoint = "main";

  public Context() { this(Primitives.standard()); }
  public Context(Primitives primitives) { this.primitives = primitives; }

  public Primitives primitives() { return primitives; }

  public String entrypoint() { return entrypoint; }
  public void setEntrypoint(String entrypoint) { this.entrypoint = entrypoint; }

  public Component add(Component comp) {
    if (byName.containsKey(comp.name()))
      throw new IllegalArgumentException("Duplicate component " + comp.name());
    comp.setId(components.size());
    components.add(comp);
    byName.put(comp.name(), comp.id());
    return comp;
  }

  public List<Component> components() { return Collections.unmodifiableList(components); }

  public Component component(int id) { return components.get(id); }

  public Optional<Component> find(String name) {
    Integer id = byName.get(name);
    return id == null ? Optional.empty() : Optional.of(components.get(id));
  }

  public Component component(String name) {
    return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown component " + name));
  }

  /** Component instantiated by a cell, if the cell is not a primitive. */
  public Optional<Component> callee(Cell cell) { return cell.componentId().map(this::component); }

  /** Components ordered so that every component comes after the components it instantiates. */
  public List<Component> postOrder() {
    var ret = new ArrayList<Component>();
    var visited = new boolean[components.size()];
    for (Component comp : components)
      visit(comp, visited, ret);
    return ret;
  }

  private void visit(Component comp, boolean[] visited, List<Component> out) {
    if (visited[comp.id()])
      return;
    visited[comp.id()] = true;
    for (Cell cell : comp.cells())
      callee(cell).ifPresent(callee -> visit(callee, visited, out));
    out.add(comp);
  }
}
