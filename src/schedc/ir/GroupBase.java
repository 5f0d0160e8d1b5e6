package schedc.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Named bag of guarded assignments. Base of dynamic, static and combinational groups.
 */
public abstract class GroupBase {
  private final String name;
  private final List<Assignment> assignments = new ArrayList<>();
  private final Attributes attributes = new Attributes();

  protected GroupBase(String name) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Group name must not be empty");
    this.name = name;
  }

  public String name() { return name; }
  public Attributes attributes() { return attributes; }
  public List<Assignment> assignments() { return Collections.unmodifiableList(assignments); }

  public void add(Assignment assignment) { assignments.add(assignment); }
  public void addAll(Collection<Assignment> toAdd) { assignments.addAll(toAdd); }
  public boolean remove(Assignment assignment) { return assignments.remove(assignment); }
  public boolean removeIf(Predicate<Assignment> pred) { return assignments.removeIf(pred); }
  public void replaceAll(UnaryOperator<Assignment> fn) { assignments.replaceAll(fn); }
  public void clear() { assignments.clear(); }

  /**
   * Redirects every assignment to {@code from} so it drives {@code to} instead.
   * @return the number of rewritten assignments
   */
  public int rewriteDestination(Port from, Port to) {
    int count = 0;
    for (int i = 0; i < assignments.size(); ++i) {
      if (assignments.get(i).dst().equals(from)) {
        assignments.set(i, assignments.get(i).withDst(to));
        ++count;
      }
    }
    return count;
  }

  /** Substitutes ports in destinations, sources and guards. */
  public void rewritePorts(Map<Port, Port> mapping) {
    if (!mapping.isEmpty())
      assignments.replaceAll(a -> a.mapPorts(p -> mapping.getOrDefault(p, p)));
  }

  /** Ports driven by this group. */
  public Set<Port> writes() { return assignments.stream().map(Assignment::dst).collect(Collectors.toCollection(LinkedHashSet::new)); }

  /** Ports read by this group, through sources or guards. */
  public Set<Port> reads() {
    var ret = new LinkedHashSet<Port>();
    assignments.forEach(a -> ret.addAll(a.reads()));
    return ret;
  }

  public List<Assignment> writesTo(Port port) {
    return assignments.stream().filter(a -> a.dst().equals(port)).collect(Collectors.toList());
  }

  /** Keyword used by the printer and diagnostics. */
  public abstract String kind();

  @Override
  public String toString() {
    return kind() + " " + name;
  }
}
