package schedc.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import schedc.ir.Assignment;
import schedc.ir.Atom;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Constant;
import schedc.ir.Control;
import schedc.ir.GroupBase;
import schedc.ir.Port;
import schedc.ir.Primitives;

/**
 * Recognizes counting loops and computes their trip count.
 * <p>
 * The recognized shape is an index register initialized to a constant by the step preceding the loop,
 * compared against a constant with {@code <}, {@code <=} or {@code !=}, and incremented by a constant through an adder
 * in exactly one place of the loop body.
 */
public class TripCountAnalysis {
  private final Component comp;

  public TripCountAnalysis(Component comp) { this.comp = comp; }

  /**
   * @param previous the control node executed right before the loop, or null
   * @return the number of iterations, or empty if the loop does not have the recognized shape
   */
  public OptionalLong tripCount(Control.While loop, Control previous) {
    Port cond = loop.port();
    if (!cond.isCellPort() || !cond.name().equals("out"))
      return OptionalLong.empty();
    Cell cmp = comp.findCell(cond.parent()).orElse(null);
    if (cmp == null || !(cmp.isPrimitive(Primitives.LT) || cmp.isPrimitive(Primitives.LE) || cmp.isPrimitive(Primitives.NEQ)))
      return OptionalLong.empty();

    List<Assignment> scope = new ArrayList<>(comp.continuous());
    loop.comb().ifPresent(cg -> scope.addAll(cg.assignments()));
    Optional<Operands> operands = operands(scope, cmp);
    if (operands.isEmpty() || !(operands.get().left instanceof Port) || !(operands.get().right instanceof Constant))
      return OptionalLong.empty();
    Port idxOut = (Port)operands.get().left;
    long bound = ((Constant)operands.get().right).value();
    Cell idx = comp.findCell(idxOut.parent()).orElse(null);
    if (idx == null || !idx.isPrimitive(Primitives.REG) || !idxOut.name().equals("out"))
      return OptionalLong.empty();

    OptionalLong init = initialValue(previous, idx);
    OptionalLong step = increment(loop.body(), idx);
    if (init.isEmpty() || step.isEmpty() || step.getAsLong() <= 0)
      return OptionalLong.empty();
    long a = init.getAsLong(), s = step.getAsLong();
    if (cmp.isPrimitive(Primitives.LT))
      return OptionalLong.of(a >= bound ? 0 : (bound - a + s - 1) / s);
    if (cmp.isPrimitive(Primitives.LE))
      return OptionalLong.of(a > bound ? 0 : (bound - a) / s + 1);
    if (a == bound)
      return OptionalLong.of(0);
    if (bound > a && (bound - a) % s == 0)
      return OptionalLong.of((bound - a) / s);
    return OptionalLong.empty();
  }

  private record Operands(Atom left, Atom right) {}

  /** The unconditional drivers of a two-input primitive's left and right ports. */
  private static Optional<Operands> operands(List<Assignment> scope, Cell cell) {
    Optional<Assignment> left = uniqueDriver(scope, cell.port("left"));
    Optional<Assignment> right = uniqueDriver(scope, cell.port("right"));
    if (left.isEmpty() || right.isEmpty())
      return Optional.empty();
    return Optional.of(new Operands(left.get().src(), right.get().src()));
  }

  private static Optional<Assignment> uniqueDriver(List<Assignment> scope, Port port) {
    Assignment found = null;
    for (Assignment a : scope) {
      if (!a.dst().equals(port))
        continue;
      if (found != null || !a.guard().isTrue())
        return Optional.empty();
      found = a;
    }
    return Optional.ofNullable(found);
  }

  private OptionalLong initialValue(Control previous, Cell idx) {
    if (!(previous instanceof Control.Enable))
      return OptionalLong.empty();
    var group = ((Control.Enable)previous).group();
    Optional<Assignment> write = uniqueDriver(group.assignments(), idx.port("in"));
    if (write.isEmpty() || !(write.get().src() instanceof Constant))
      return OptionalLong.empty();
    return OptionalLong.of(((Constant)write.get().src()).value());
  }

  private OptionalLong increment(Control body, Cell idx) {
    Assignment write = null;
    GroupBase writer = null;
    for (GroupBase group : ReadWriteSets.groupsOf(body)) {
      for (Assignment a : group.writesTo(idx.port("in"))) {
        if (write != null)
          return OptionalLong.empty();
        write = a;
        writer = group;
      }
    }
    if (write == null || !(write.src() instanceof Port))
      return OptionalLong.empty();
    Port adderOut = (Port)write.src();
    Cell adder = comp.findCell(adderOut.parent()).orElse(null);
    if (adder == null || !adder.isPrimitive(Primitives.ADD))
      return OptionalLong.empty();
    List<Assignment> scope = new ArrayList<>(comp.continuous());
    scope.addAll(writer.assignments());
    Optional<Operands> ops = operands(scope, adder);
    if (ops.isEmpty())
      return OptionalLong.empty();
    Port idxOut = idx.port("out");
    if (idxOut.equals(ops.get().left) && ops.get().right instanceof Constant)
      return OptionalLong.of(((Constant)ops.get().right).value());
    if (idxOut.equals(ops.get().right) && ops.get().left instanceof Constant)
      return OptionalLong.of(((Constant)ops.get().left).value());
    return OptionalLong.empty();
  }
}
