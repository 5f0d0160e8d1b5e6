package schedc.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured control program of a component.
 * Dynamic nodes are mutable in place (children can be replaced); static nodes are in {@link StaticControl}.
 */
public interface Control {

  Attributes attributes();

  <R> R accept(ControlVisitor<R> visitor);

  /** Direct children, in order. */
  List<Control> children();

  /** Short human-readable identification for diagnostics. */
  String describe();

  default boolean isStatic() { return false; }

  /**
   * Port bindings of an invocation.
   * @param inputs callee input port name to the driving atom in the caller
   * @param outputs callee output port name to the caller port it drives
   * @param refCells callee reference cell name to the caller cell supplied for it
   */
  record Bindings(Map<String, Atom> inputs, Map<String, Port> outputs, Map<String, String> refCells) {
    public Bindings {
      inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
      outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
      refCells = Collections.unmodifiableMap(new LinkedHashMap<>(refCells));
    }
    public static Bindings empty() { return new Bindings(Map.of(), Map.of(), Map.of()); }
  }

  final class Empty implements Control {
    private final Attributes attributes = new Attributes();
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitEmpty(this);
    }
    @Override
    public List<Control> children() {
      return List.of();
    }
    @Override
    public String describe() {
      return "empty";
    }
  }

  final class Enable implements Control {
    private final Attributes attributes = new Attributes();
    private final Group group;
    public Enable(Group group) { this.group = Objects.requireNonNull(group); }
    public Group group() { return group; }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitEnable(this);
    }
    @Override
    public List<Control> children() {
      return List.of();
    }
    @Override
    public String describe() {
      return "enable " + group.name();
    }
  }

  final class Invoke implements Control {
    private final Attributes attributes = new Attributes();
    private final Cell cell;
    private final Bindings bindings;
    private final CombGroup comb;
    public Invoke(Cell cell, Bindings bindings, CombGroup comb) {
      this.cell = Objects.requireNonNull(cell);
      this.bindings = Objects.requireNonNull(bindings);
      this.comb = comb;
    }
    public Cell cell() { return cell; }
    public Bindings bindings() { return bindings; }
    public Optional<CombGroup> comb() { return Optional.ofNullable(comb); }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitInvoke(this);
    }
    @Override
    public List<Control> children() {
      return List.of();
    }
    @Override
    public String describe() {
      return "invoke " + cell.name();
    }
  }

  final class Seq implements Control {
    private final Attributes attributes = new Attributes();
    private final List<Control> stmts;
    public Seq(List<? extends Control> stmts) { this.stmts = new ArrayList<>(stmts); }
    /** Mutable list of children. */
    public List<Control> stmts() { return stmts; }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitSeq(this);
    }
    @Override
    public List<Control> children() {
      return Collections.unmodifiableList(stmts);
    }
    @Override
    public String describe() {
      return "seq[" + stmts.size() + "]";
    }
  }

  final class Par implements Control {
    private final Attributes attributes = new Attributes();
    private final List<Control> stmts;
    public Par(List<? extends Control> stmts) { this.stmts = new ArrayList<>(stmts); }
    /** Mutable list of threads. */
    public List<Control> stmts() { return stmts; }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitPar(this);
    }
    @Override
    public List<Control> children() {
      return Collections.unmodifiableList(stmts);
    }
    @Override
    public String describe() {
      return "par[" + stmts.size() + "]";
    }
  }

  final class If implements Control {
    private final Attributes attributes = new Attributes();
    private final Port port;
    private final CombGroup comb;
    private Control tbranch;
    private Control fbranch;
    public If(Port port, CombGroup comb, Control tbranch, Control fbranch) {
      this.port = Objects.requireNonNull(port);
      this.comb = comb;
      this.tbranch = Objects.requireNonNull(tbranch);
      this.fbranch = Objects.requireNonNull(fbranch);
    }
    public Port port() { return port; }
    public Optional<CombGroup> comb() { return Optional.ofNullable(comb); }
    public Control tbranch() { return tbranch; }
    public Control fbranch() { return fbranch; }
    public void setTbranch(Control tbranch) { this.tbranch = Objects.requireNonNull(tbranch); }
    public void setFbranch(Control fbranch) { this.fbranch = Objects.requireNonNull(fbranch); }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitIf(this);
    }
    @Override
    public List<Control> children() {
      return List.of(tbranch, fbranch);
    }
    @Override
    public String describe() {
      return "if " + port;
    }
  }

  final class While implements Control {
    private final Attributes attributes = new Attributes();
    private final Port port;
    private final CombGroup comb;
    private Control body;
    public While(Port port, CombGroup comb, Control body) {
      this.port = Objects.requireNonNull(port);
      this.comb = comb;
      this.body = Objects.requireNonNull(body);
    }
    public Port port() { return port; }
    public Optional<CombGroup> comb() { return Optional.ofNullable(comb); }
    public Control body() { return body; }
    public void setBody(Control body) { this.body = Objects.requireNonNull(body); }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitWhile(this);
    }
    @Override
    public List<Control> children() {
      return List.of(body);
    }
    @Override
    public String describe() {
      return "while " + port;
    }
  }

  final class Repeat implements Control {
    private final Attributes attributes = new Attributes();
    private final long count;
    private Control body;
    public Repeat(long count, Control body) {
      if (count < 0)
        throw new IllegalArgumentException("Repeat count must not be negative");
      this.count = count;
      this.body = Objects.requireNonNull(body);
    }
    public long count() { return count; }
    public Control body() { return body; }
    public void setBody(Control body) { this.body = Objects.requireNonNull(body); }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitRepeat(this);
    }
    @Override
    public List<Control> children() {
      return List.of(body);
    }
    @Override
    public String describe() {
      return "repeat " + count;
    }
  }
}
