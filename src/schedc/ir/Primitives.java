package schedc.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Library of primitive cell types known to the compiler.
 */
public class Primitives {
  /**
   * Port of a primitive.
   * @param parametric true if the port has the primitive's width parameter, false for single-bit ports
   */
  public record PortDef(String name, boolean parametric, Port.Direction direction, Port.Role role, boolean stable) {}

  /**
   * Primitive description.
   * @param latency cycles from go to done for primitives with a go/done interface
   */
  public record PrimitiveDef(String name, List<PortDef> ports, OptionalLong latency) {
    public Optional<PortDef> port(Port.Role role) { return ports.stream().filter(p -> p.role() == role).findFirst(); }
  }

  public static final String REG = "std_reg";
  public static final String WIRE = "std_wire";
  public static final String ADD = "std_add";
  public static final String SUB = "std_sub";
  public static final String AND = "std_and";
  public static final String OR = "std_or";
  public static final String NOT = "std_not";
  public static final String LT = "std_lt";
  public static final String GT = "std_gt";
  public static final String LE = "std_le";
  public static final String GE = "std_ge";
  public static final String EQ = "std_eq";
  public static final String NEQ = "std_neq";
  public static final String MULT_PIPE = "std_mult_pipe";

  private final LinkedHashMap<String, PrimitiveDef> defs = new LinkedHashMap<>();

  public static Primitives standard() {
    var ret = new Primitives();
    ret.add(new PrimitiveDef(REG,
                             List.of(in("in", true), new PortDef("write_en", false, Port.Direction.INPUT, Port.Role.GO, false), clk(), reset(),
                                     new PortDef("out", true, Port.Direction.OUTPUT, Port.Role.NONE, true),
                                     new PortDef("done", false, Port.Direction.OUTPUT, Port.Role.DONE, true)),
                             OptionalLong.of(1)));
    ret.add(new PrimitiveDef(WIRE, List.of(in("in", true), out("out", true)), OptionalLong.empty()));
    for (String binop : List.of(ADD, SUB, AND, OR))
      ret.add(new PrimitiveDef(binop, List.of(in("left", true), in("right", true), out("out", true)), OptionalLong.empty()));
    for (String cmp : List.of(LT, GT, LE, GE, EQ, NEQ))
      ret.add(new PrimitiveDef(cmp, List.of(in("left", true), in("right", true), out("out", false)), OptionalLong.empty()));
    ret.add(new PrimitiveDef(NOT, List.of(in("in", true), out("out", true)), OptionalLong.empty()));
    ret.add(new PrimitiveDef(MULT_PIPE,
                             List.of(in("left", true), in("right", true), new PortDef("go", false, Port.Direction.INPUT, Port.Role.GO, false), clk(),
                                     reset(), new PortDef("out", true, Port.Direction.OUTPUT, Port.Role.NONE, true),
                                     new PortDef("done", false, Port.Direction.OUTPUT, Port.Role.DONE, true)),
                             OptionalLong.of(3)));
    return ret;
  }

  private static PortDef in(String name, boolean parametric) { return new PortDef(name, parametric, Port.Direction.INPUT, Port.Role.NONE, false); }
  private static PortDef out(String name, boolean parametric) {
    return new PortDef(name, parametric, Port.Direction.OUTPUT, Port.Role.NONE, false);
  }
  private static PortDef clk() { return new PortDef("clk", false, Port.Direction.INPUT, Port.Role.CLK, false); }
  private static PortDef reset() { return new PortDef("reset", false, Port.Direction.INPUT, Port.Role.RESET, false); }

  public void add(PrimitiveDef def) { defs.put(def.name(), def); }

  public boolean has(String name) { return defs.containsKey(name); }

  public PrimitiveDef get(String name) {
    PrimitiveDef def = defs.get(name);
    if (def == null)
      throw new IllegalArgumentException("Unknown primitive " + name);
    return def;
  }

  /** Creates the ports of a primitive instance. */
  public List<Port> instantiatePorts(String primitive, String cellName, int width) {
    var ret = new ArrayList<Port>();
    for (PortDef def : get(primitive).ports())
      ret.add(new Port(Port.Owner.CELL, cellName, def.name(), def.parametric() ? width : 1, def.direction(), def.role(), def.stable()));
    return ret;
  }
}
