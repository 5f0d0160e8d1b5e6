package schedc.ir;

import java.util.List;

/**
 * Dynamic group with go and done holes.
 * All assignments except the writes to the own done hole are only active while go is high.
 */
public class Group extends GroupBase {
  private final Port go;
  private final Port done;

  public Group(String name) {
    super(name);
    this.go = Port.hole(name, Port.Role.GO);
    this.done = Port.hole(name, Port.Role.DONE);
  }

  public Port go() { return go; }
  public Port done() { return done; }

  public List<Assignment> doneAssignments() { return writesTo(done); }

  /** True if the assignment belongs to the handshake of this group rather than its body. */
  public boolean isDoneWrite(Assignment assignment) { return assignment.dst().equals(done); }

  @Override
  public String kind() {
    return "group";
  }
}
