package schedc.frontend;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import schedc.ir.Atom;
import schedc.ir.Attr;
import schedc.ir.Attributes;
import schedc.ir.Builder;
import schedc.ir.Cell;
import schedc.ir.CombGroup;
import schedc.ir.Component;
import schedc.ir.Context;
import schedc.ir.Control;
import schedc.ir.Group;
import schedc.ir.GroupBase;
import schedc.ir.Port;
import schedc.ir.StaticControl;
import schedc.ir.StaticGroup;

/**
 * Reads a program description from YAML.
 * <p>
 * The document holds an optional {@code entrypoint} and a list of {@code components}. Each component lists
 * {@code ports}, {@code cells}, {@code groups}, {@code static_groups}, {@code comb_groups}, {@code continuous} assignments,
 * {@code attributes} and a {@code control} tree. Assignments and guards are written in the syntax of the IR printer.
 * A control node is either a group name (an enable), {@code empty}, or a map with one of the keys {@code seq}, {@code par},
 * {@code if}, {@code while}, {@code repeat}, {@code invoke}, {@code static_seq}, {@code static_par}, {@code static_if},
 * {@code static_repeat}, {@code static_invoke}, optionally next to {@code attributes}.
 */
public class ComponentYamlReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Context ctx;

  public ComponentYamlReader() { this(new Context()); }
  public ComponentYamlReader(Context ctx) { this.ctx = ctx; }

  public Context read(File file) throws FrontendException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in, file.getName());
    } catch (IOException e) {
      throw new FrontendException("Cannot read " + file + ": " + e.getMessage(), e);
    }
  }

  public Context read(InputStream in, String source) throws FrontendException {
    Object doc;
    try {
      doc = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new FrontendException(source + ": " + e.getMessage(), e);
    }
    return read(doc, source);
  }

  public Context read(String yaml) throws FrontendException {
    Object doc;
    try {
      doc = new Yaml().load(yaml);
    } catch (YAMLException e) {
      throw new FrontendException("Malformed YAML: " + e.getMessage(), e);
    }
    return read(doc, "<string>");
  }

  private Context read(Object doc, String source) throws FrontendException {
    Map<String, Object> top = map(doc, source);
    List<Object> compDescs = list(top.get("components"), source + ": components");
    if (top.containsKey("entrypoint"))
      ctx.setEntrypoint(string(top.get("entrypoint"), source + ": entrypoint"));

    // signatures first, so that cells can instantiate components declared further down
    var descs = new ArrayList<Map<String, Object>>();
    for (Object compObj : compDescs) {
      Map<String, Object> desc = map(compObj, source + ": component");
      String name = string(desc.get("name"), source + ": component name");
      var comp = new Component(name);
      try {
        ctx.add(comp);
      } catch (IllegalArgumentException e) {
        throw new FrontendException(source + ": " + e.getMessage(), e);
      }
      readPorts(comp, desc);
      descs.add(desc);
    }
    for (Map<String, Object> desc : descs) {
      Component comp = ctx.component(string(desc.get("name"), source));
      new ComponentReader(comp, desc).read();
    }
    logger.debug("Read {} components from {}", ctx.components().size(), source);
    return ctx;
  }

  private void readPorts(Component comp, Map<String, Object> desc) throws FrontendException {
    String where = comp.name() + ": port";
    for (Object portObj : list(desc.get("ports"), where)) {
      Map<String, Object> port = map(portObj, where);
      String name = string(port.get("name"), where);
      int width = (int)number(port.getOrDefault("width", 1), where + " " + name);
      String dir = string(port.getOrDefault("direction", "input"), where + " " + name);
      Port.Direction direction;
      if (dir.equals("input"))
        direction = Port.Direction.INPUT;
      else if (dir.equals("output"))
        direction = Port.Direction.OUTPUT;
      else
        throw new FrontendException(where + " " + name + ": direction must be input or output, got " + dir);
      try {
        comp.addPort(name, width, direction, Port.Role.NONE);
      } catch (IllegalArgumentException e) {
        throw new FrontendException(where + " " + name + ": " + e.getMessage(), e);
      }
    }
  }

  /** Reads the body of one component. */
  private class ComponentReader {
    private final Component comp;
    private final Map<String, Object> desc;
    private final GuardParser parser;

    ComponentReader(Component comp, Map<String, Object> desc) {
      this.comp = comp;
      this.desc = desc;
      this.parser = new GuardParser(comp);
    }

    void read() throws FrontendException {
      readAttributes(comp.attributes(), desc.get("attributes"), comp.name());
      readCells();
      // declare all groups before parsing assignments, which may refer to other groups' holes
      var bodies = new LinkedHashMap<GroupBase, Object>();
      for (Object obj : list(desc.get("groups"), comp.name() + ": groups")) {
        Map<String, Object> g = map(obj, comp.name() + ": group");
        bodies.put(declare(g, new Group(string(g.get("name"), comp.name() + ": group name"))), g);
      }
      for (Object obj : list(desc.get("static_groups"), comp.name() + ": static_groups")) {
        Map<String, Object> g = map(obj, comp.name() + ": static group");
        String name = string(g.get("name"), comp.name() + ": static group name");
        long latency = number(g.get("latency"), comp.name() + ": static group " + name + " latency");
        try {
          bodies.put(declare(g, new StaticGroup(name, latency)), g);
        } catch (IllegalArgumentException e) {
          throw new FrontendException(comp.name() + ": static group " + name + ": " + e.getMessage(), e);
        }
      }
      for (Object obj : list(desc.get("comb_groups"), comp.name() + ": comb_groups")) {
        Map<String, Object> g = map(obj, comp.name() + ": comb group");
        bodies.put(declare(g, new CombGroup(string(g.get("name"), comp.name() + ": comb group name"))), g);
      }
      for (var entry : bodies.entrySet()) {
        GroupBase group = entry.getKey();
        Map<String, Object> g = map(entry.getValue(), comp.name());
        for (Object a : list(g.get("assignments"), comp.name() + ": group " + group.name()))
          group.add(parser.parseAssignment(string(a, comp.name() + ": group " + group.name())));
      }
      for (Object a : list(desc.get("continuous"), comp.name() + ": continuous"))
        comp.continuous().add(parser.parseAssignment(string(a, comp.name() + ": continuous assignment")));
      if (desc.get("control") != null)
        comp.setControl(control(desc.get("control")));
    }

    private <G extends GroupBase> G declare(Map<String, Object> g, G group) throws FrontendException {
      try {
        comp.addGroup(group);
      } catch (IllegalArgumentException e) {
        throw new FrontendException(comp.name() + ": " + e.getMessage(), e);
      }
      readAttributes(group.attributes(), g.get("attributes"), comp.name() + ": group " + group.name());
      return group;
    }

    private void readCells() throws FrontendException {
      var builder = new Builder(ctx, comp, false);
      for (Object obj : list(desc.get("cells"), comp.name() + ": cells")) {
        Map<String, Object> c = map(obj, comp.name() + ": cell");
        String name = string(c.get("name"), comp.name() + ": cell name");
        String where = comp.name() + ": cell " + name;
        boolean ref = Boolean.TRUE.equals(c.get("ref"));
        try {
          if (c.containsKey("primitive")) {
            String prim = string(c.get("primitive"), where);
            if (!ctx.primitives().has(prim))
              throw new FrontendException(where + ": unknown primitive " + prim);
            int width = (int)number(c.getOrDefault("width", 1), where);
            comp.addCell(new Cell(name, new Cell.PrimitiveProto(prim, width), ctx.primitives().instantiatePorts(prim, name, width), ref, false));
          } else if (c.containsKey("component")) {
            String calleeName = string(c.get("component"), where);
            Component callee = ctx.find(calleeName).orElseThrow(() -> new FrontendException(where + ": unknown component " + calleeName));
            builder.addInstance(name, callee, ref);
          } else
            throw new FrontendException(where + ": either primitive or component must be given");
        } catch (IllegalArgumentException e) {
          throw new FrontendException(where + ": " + e.getMessage(), e);
        }
      }
    }

    private Control control(Object obj) throws FrontendException {
      if (obj instanceof String) {
        String name = (String)obj;
        if (name.equals("empty"))
          return new Control.Empty();
        return enable(name);
      }
      Map<String, Object> node = map(obj, comp.name() + ": control");
      var kinds = new ArrayList<String>(node.keySet());
      kinds.remove("attributes");
      if (kinds.size() != 1)
        throw new FrontendException(comp.name() + ": control node must have exactly one kind, got " + kinds);
      String kind = kinds.get(0);
      Control ret;
      try {
        ret = control(kind, node.get(kind));
      } catch (IllegalArgumentException | ArithmeticException e) {
        throw new FrontendException(comp.name() + ": " + kind + ": " + e.getMessage(), e);
      }
      readAttributes(ret.attributes(), node.get("attributes"), comp.name() + ": " + ret.describe());
      return ret;
    }

    private Control enable(String name) throws FrontendException {
      var group = comp.findGroup(name);
      if (group.isPresent())
        return new Control.Enable(group.get());
      var staticGroup = comp.findStaticGroup(name);
      if (staticGroup.isPresent())
        return new StaticControl.StaticEnable(staticGroup.get());
      throw new FrontendException(comp.name() + ": control enables unknown group " + name);
    }

    private Control control(String kind, Object body) throws FrontendException {
      String where = comp.name() + ": " + kind;
      switch (kind) {
      case "enable":
        return enable(string(body, where));
      case "empty":
        return new Control.Empty();
      case "seq":
        return new Control.Seq(controls(body, where));
      case "par":
        return new Control.Par(controls(body, where));
      case "if": {
        Map<String, Object> m = map(body, where);
        return new Control.If(parser.parsePort(string(m.get("port"), where)), comb(m.get("comb")), branch(m.get("then")), branch(m.get("else")));
      }
      case "while": {
        Map<String, Object> m = map(body, where);
        return new Control.While(parser.parsePort(string(m.get("port"), where)), comb(m.get("comb")), control(m.get("body")));
      }
      case "repeat": {
        Map<String, Object> m = map(body, where);
        return new Control.Repeat(number(m.get("count"), where + " count"), control(m.get("body")));
      }
      case "invoke": {
        Map<String, Object> m = map(body, where);
        return new Control.Invoke(cell(m, where), bindings(m, where), comb(m.get("comb")));
      }
      case "static_seq":
        return new StaticControl.StaticSeq(staticControls(body, where));
      case "static_par":
        return new StaticControl.StaticPar(staticControls(body, where));
      case "static_if": {
        Map<String, Object> m = map(body, where);
        return new StaticControl.StaticIf(parser.parsePort(string(m.get("port"), where)), comb(m.get("comb")), staticControl(m.get("then"), where),
                                          staticControl(m.get("else"), where));
      }
      case "static_repeat": {
        Map<String, Object> m = map(body, where);
        return new StaticControl.StaticRepeat(number(m.get("count"), where + " count"), staticControl(m.get("body"), where));
      }
      case "static_invoke": {
        Map<String, Object> m = map(body, where);
        return new StaticControl.StaticInvoke(cell(m, where), bindings(m, where), number(m.get("latency"), where + " latency"));
      }
      default:
        throw new FrontendException(comp.name() + ": unknown control kind " + kind);
      }
    }

    private Control branch(Object obj) throws FrontendException { return obj == null ? new Control.Empty() : control(obj); }

    private List<Control> controls(Object obj, String where) throws FrontendException {
      var ret = new ArrayList<Control>();
      for (Object child : list(obj, where))
        ret.add(control(child));
      return ret;
    }

    private StaticControl staticControl(Object obj, String where) throws FrontendException {
      Control c = control(obj);
      if (!(c instanceof StaticControl))
        throw new FrontendException(where + ": " + c.describe() + " is not static");
      return (StaticControl)c;
    }

    private List<StaticControl> staticControls(Object obj, String where) throws FrontendException {
      var ret = new ArrayList<StaticControl>();
      for (Object child : list(obj, where))
        ret.add(staticControl(child, where));
      return ret;
    }

    private CombGroup comb(Object obj) throws FrontendException {
      if (obj == null)
        return null;
      String name = string(obj, comp.name() + ": comb");
      return comp.findCombGroup(name).orElseThrow(() -> new FrontendException(comp.name() + ": unknown comb group " + name));
    }

    private Cell cell(Map<String, Object> m, String where) throws FrontendException {
      String name = string(m.get("cell"), where + " cell");
      return comp.findCell(name).orElseThrow(() -> new FrontendException(where + ": unknown cell " + name));
    }

    private Control.Bindings bindings(Map<String, Object> m, String where) throws FrontendException {
      var inputs = new LinkedHashMap<String, Atom>();
      for (var e : map(m.getOrDefault("inputs", Map.of()), where + " inputs").entrySet())
        inputs.put(e.getKey(), parser.parseAtom(string(e.getValue(), where + " input " + e.getKey())));
      var outputs = new LinkedHashMap<String, Port>();
      for (var e : map(m.getOrDefault("outputs", Map.of()), where + " outputs").entrySet())
        outputs.put(e.getKey(), parser.parsePort(string(e.getValue(), where + " output " + e.getKey())));
      var refCells = new LinkedHashMap<String, String>();
      for (var e : map(m.getOrDefault("ref_cells", Map.of()), where + " ref_cells").entrySet())
        refCells.put(e.getKey(), string(e.getValue(), where + " ref cell " + e.getKey()));
      return new Control.Bindings(inputs, outputs, refCells);
    }
  }

  /** Attributes are a map from name to value; flags take no value. */
  private static void readAttributes(Attributes attributes, Object obj, String where) throws FrontendException {
    if (obj == null)
      return;
    for (var e : map(obj, where + " attributes").entrySet()) {
      try {
        Attr attr = Attr.fromName(e.getKey());
        if (attr.numeric)
          attributes.set(attr, number(e.getValue(), where + " @" + e.getKey()));
        else
          attributes.set(attr);
      } catch (IllegalArgumentException ex) {
        throw new FrontendException(where + ": " + ex.getMessage(), ex);
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> map(Object obj, String where) throws FrontendException {
    if (!(obj instanceof Map))
      throw new FrontendException(where + ": expected a map, got " + describe(obj));
    return (Map<String, Object>)obj;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> list(Object obj, String where) throws FrontendException {
    if (obj == null)
      return List.of();
    if (!(obj instanceof List))
      throw new FrontendException(where + ": expected a list, got " + describe(obj));
    return (List<Object>)obj;
  }

  private static String string(Object obj, String where) throws FrontendException {
    if (!(obj instanceof String))
      throw new FrontendException(where + ": expected a string, got " + describe(obj));
    return (String)obj;
  }

  private static long number(Object obj, String where) throws FrontendException {
    if (!(obj instanceof Integer) && !(obj instanceof Long))
      throw new FrontendException(where + ": expected an integer, got " + describe(obj));
    return ((Number)obj).longValue();
  }

  private static String describe(Object obj) { return obj == null ? "nothing" : obj.getClass().getSimpleName() + " " + obj; }
}
