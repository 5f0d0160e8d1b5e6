package schedc.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Control nodes with a latency fixed at compile time. Static nodes are immutable; rewrites rebuild them.
 */
public interface StaticControl extends Control {

  /** Number of cycles from activation to completion, at least one. */
  long latency();

  @Override
  default boolean isStatic() {
    return true;
  }

  private static long checkLatency(long latency, String what) {
    if (latency < 1)
      throw new IllegalArgumentException("Static " + what + " must take at least one cycle, got " + latency);
    return latency;
  }

  final class StaticEnable implements StaticControl {
    private final Attributes attributes = new Attributes();
    private final StaticGroup group;
    public StaticEnable(StaticGroup group) { this.group = Objects.requireNonNull(group); }
    public StaticGroup group() { return group; }
    @Override
    public long latency() {
      return group.latency();
    }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitStaticEnable(this);
    }
    @Override
    public List<Control> children() {
      return List.of();
    }
    @Override
    public String describe() {
      return "static enable " + group.name();
    }
  }

  final class StaticSeq implements StaticControl {
    private final Attributes attributes = new Attributes();
    private final List<StaticControl> stmts;
    private final long latency;
    public StaticSeq(List<? extends StaticControl> stmts) {
      this.stmts = List.copyOf(stmts);
      this.latency = checkLatency(this.stmts.stream().mapToLong(StaticControl::latency).sum(), "seq");
    }
    public List<StaticControl> stmts() { return stmts; }
    @Override
    public long latency() {
      return latency;
    }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitStaticSeq(this);
    }
    @Override
    public List<Control> children() {
      return List.copyOf(stmts);
    }
    @Override
    public String describe() {
      return "static<" + latency + "> seq[" + stmts.size() + "]";
    }
  }

  final class StaticPar implements StaticControl {
    private final Attributes attributes = new Attributes();
    private final List<StaticControl> stmts;
    private final long latency;
    public StaticPar(List<? extends StaticControl> stmts) {
      this.stmts = List.copyOf(stmts);
      this.latency = checkLatency(this.stmts.stream().mapToLong(StaticControl::latency).max().orElse(0), "par");
    }
    public List<StaticControl> stmts() { return stmts; }
    @Override
    public long latency() {
      return latency;
    }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitStaticPar(this);
    }
    @Override
    public List<Control> children() {
      return List.copyOf(stmts);
    }
    @Override
    public String describe() {
      return "static<" + latency + "> par[" + stmts.size() + "]";
    }
  }

  /** Static conditional. The condition is sampled in the first cycle and held for the rest of the latency. */
  final class StaticIf implements StaticControl {
    private final Attributes attributes = new Attributes();
    private final Port port;
    private final CombGroup comb;
    private final StaticControl tbranch;
    private final StaticControl fbranch;
    private final long latency;
    public StaticIf(Port port, CombGroup comb, StaticControl tbranch, StaticControl fbranch) {
      this.port = Objects.requireNonNull(port);
      this.comb = comb;
      this.tbranch = Objects.requireNonNull(tbranch);
      this.fbranch = Objects.requireNonNull(fbranch);
      this.latency = Math.max(tbranch.latency(), fbranch.latency());
    }
    public Port port() { return port; }
    public Optional<CombGroup> comb() { return Optional.ofNullable(comb); }
    public StaticControl tbranch() { return tbranch; }
    public StaticControl fbranch() { return fbranch; }
    @Override
    public long latency() {
      return latency;
    }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitStaticIf(this);
    }
    @Override
    public List<Control> children() {
      return List.of(tbranch, fbranch);
    }
    @Override
    public String describe() {
      return "static<" + latency + "> if " + port;
    }
  }

  final class StaticRepeat implements StaticControl {
    private final Attributes attributes = new Attributes();
    private final long count;
    private final StaticControl body;
    private final long latency;
    public StaticRepeat(long count, StaticControl body) {
      this.count = count;
      this.body = Objects.requireNonNull(body);
      this.latency = checkLatency(Math.multiplyExact(count, body.latency()), "repeat");
    }
    public long count() { return count; }
    public StaticControl body() { return body; }
    @Override
    public long latency() {
      return latency;
    }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitStaticRepeat(this);
    }
    @Override
    public List<Control> children() {
      return List.of(body);
    }
    @Override
    public String describe() {
      return "static<" + latency + "> repeat " + count;
    }
  }

  final class StaticInvoke implements StaticControl {
    private final Attributes attributes = new Attributes();
    private final Cell cell;
    private final Control.Bindings bindings;
    private final long latency;
    public StaticInvoke(Cell cell, Control.Bindings bindings, long latency) {
      this.cell = Objects.requireNonNull(cell);
      this.bindings = Objects.requireNonNull(bindings);
      this.latency = checkLatency(latency, "invoke");
    }
    public Cell cell() { return cell; }
    public Control.Bindings bindings() { return bindings; }
    @Override
    public long latency() {
      return latency;
    }
    @Override
    public Attributes attributes() {
      return attributes;
    }
    @Override
    public <R> R accept(ControlVisitor<R> visitor) {
      return visitor.visitStaticInvoke(this);
    }
    @Override
    public List<Control> children() {
      return List.of();
    }
    @Override
    public String describe() {
      return "static<" + latency + "> invoke " + cell.name();
    }
  }
}
