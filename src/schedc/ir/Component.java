package schedc.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A hardware component: signature, cells, groups, continuous assignments and a control program.
 * Groups, static groups, combinational groups and cells share one namespace.
 */
public class Component {
  private final String name;
  private int id = -1;
  private final LinkedHashMap<String, Port> signature = new LinkedHashMap<>();
  private final LinkedHashMap<String, Cell> cells = new LinkedHashMap<>();
  private final LinkedHashMap<String, Group> groups = new LinkedHashMap<>();
  private final LinkedHashMap<String, StaticGroup> staticGroups = new LinkedHashMap<>();
  private final LinkedHashMap<String, CombGroup> combGroups = new LinkedHashMap<>();
  private final List<Assignment> continuous = new ArrayList<>();
  private final Attributes attributes = new Attributes();
  private final Set<String> usedNames = new HashSet<>();
  private Control control = new Control.Empty();

  /** Creates a component with the interface ports go, done, clk and reset. */
  public Component(String name) {
    this.name = Objects.requireNonNull(name);
    addPort("go", 1, Port.Direction.INPUT, Port.Role.GO);
    addPort("done", 1, Port.Direction.OUTPUT, Port.Role.DONE);
    addPort("clk", 1, Port.Direction.INPUT, Port.Role.CLK);
    addPort("reset", 1, Port.Direction.INPUT, Port.Role.RESET);
  }

  public String name() { return name; }

  /** Index in the owning {@link Context}, -1 before the component is added. */
  public int id() { return id; }
  void setId(int id) { this.id = id; }

  public Attributes attributes() { return attributes; }

  public Port addPort(String portName, int width, Port.Direction direction, Port.Role role) {
    if (signature.containsKey(portName))
      throw new IllegalArgumentException("Component " + name + " already has a port " + portName);
    var port = new Port(Port.Owner.SIGNATURE, "", portName, width, direction, role, false);
    signature.put(portName, port);
    return port;
  }

  public Collection<Port> signature() { return Collections.unmodifiableCollection(signature.values()); }

  public Port port(String portName) {
    Port ret = signature.get(portName);
    if (ret == null)
      throw new IllegalArgumentException("Component " + name + " has no port " + portName);
    return ret;
  }
  public boolean hasPort(String portName) { return signature.containsKey(portName); }

  public Port go() { return port("go"); }
  public Port done() { return port("done"); }

  private void claim(String itemName) {
    if (!usedNames.add(itemName))
      throw new IllegalArgumentException("Name " + itemName + " is already used in component " + name);
  }

  /** Returns {@code prefix} if unused, otherwise the first unused {@code prefix<i>}. Does not reserve the name. */
  public String freshName(String prefix) {
    if (!usedNames.contains(prefix))
      return prefix;
    for (int i = 0;; ++i)
      if (!usedNames.contains(prefix + i))
        return prefix + i;
  }

  public Cell addCell(Cell cell) {
    claim(cell.name());
    cells.put(cell.name(), cell);
    return cell;
  }
  /** Removes a cell; its name stays reserved. */
  public boolean removeCell(Cell cell) { return cells.remove(cell.name(), cell); }
  public Collection<Cell> cells() { return Collections.unmodifiableCollection(cells.values()); }
  public Optional<Cell> findCell(String cellName) { return Optional.ofNullable(cells.get(cellName)); }
  public Cell cell(String cellName) {
    return findCell(cellName).orElseThrow(() -> new IllegalArgumentException("Component " + name + " has no cell " + cellName));
  }

  public <G extends GroupBase> G addGroup(G group) {
    claim(group.name());
    if (group instanceof Group)
      groups.put(group.name(), (Group)group);
    else if (group instanceof StaticGroup)
      staticGroups.put(group.name(), (StaticGroup)group);
    else
      combGroups.put(group.name(), (CombGroup)group);
    return group;
  }

  /** Removes a group of any kind; its name stays reserved. */
  public boolean removeGroup(GroupBase group) {
    return groups.remove(group.name(), group) || staticGroups.remove(group.name(), group) || combGroups.remove(group.name(), group);
  }

  public Collection<Group> groups() { return Collections.unmodifiableCollection(groups.values()); }
  public Collection<StaticGroup> staticGroups() { return Collections.unmodifiableCollection(staticGroups.values()); }
  public Collection<CombGroup> combGroups() { return Collections.unmodifiableCollection(combGroups.values()); }

  /** All groups of all kinds. */
  public List<GroupBase> allGroups() {
    var ret = new ArrayList<GroupBase>(groups.values());
    ret.addAll(staticGroups.values());
    ret.addAll(combGroups.values());
    return ret;
  }

  public Optional<Group> findGroup(String groupName) { return Optional.ofNullable(groups.get(groupName)); }
  public Optional<StaticGroup> findStaticGroup(String groupName) { return Optional.ofNullable(staticGroups.get(groupName)); }
  public Optional<CombGroup> findCombGroup(String groupName) { return Optional.ofNullable(combGroups.get(groupName)); }

  /** Continuous assignments, active in every cycle. The list is mutable. */
  public List<Assignment> continuous() { return continuous; }

  public Control control() { return control; }
  public void setControl(Control control) { this.control = Objects.requireNonNull(control); }

  /** True if the component has a fixed latency ({@code static<N>}). */
  public boolean isStatic() { return attributes.has(Attr.STATIC); }
  public OptionalLong latency() { return attributes.get(Attr.STATIC); }

  @Override
  public String toString() {
    return "component " + name;
  }
}
