package schedc.passes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import schedc.drc.CompileException;

/**
 * Values of the options of one pass, validated against the options the pass declares.
 */
public class PassOptions {
  /**
   * Option declared by a pass.
   * @param numeric false for boolean options
   */
  public record Option(String name, String description, boolean numeric, String defaultValue) {
    public static Option flag(String name, String description, boolean defaultValue) {
      return new Option(name, description, false, Boolean.toString(defaultValue));
    }
    public static Option number(String name, String description, long defaultValue) {
      return new Option(name, description, true, Long.toString(defaultValue));
    }
  }

  private final String passName;
  private final Map<String, Option> declared = new LinkedHashMap<>();
  private final Map<String, String> values = new LinkedHashMap<>();

  /**
   * @param given option values as text; unknown names or malformed values are rejected
   */
  public PassOptions(String passName, List<Option> declaredOptions, Map<String, String> given) throws CompileException {
    this.passName = passName;
    for (Option opt : declaredOptions) {
      declared.put(opt.name(), opt);
      values.put(opt.name(), opt.defaultValue());
    }
    for (Map.Entry<String, String> entry : given.entrySet()) {
      Option opt = declared.get(entry.getKey());
      if (opt == null)
        throw new CompileException("Pass " + passName + " has no option " + entry.getKey() + "; known options: " + declared.keySet());
      String value = entry.getValue() == null ? "true" : entry.getValue().trim();
      if (opt.numeric()) {
        try {
          Long.parseLong(value);
        } catch (NumberFormatException e) {
          throw new CompileException("Option " + passName + ":" + opt.name() + " expects a number, got " + value);
        }
      } else if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false"))
        throw new CompileException("Option " + passName + ":" + opt.name() + " expects true or false, got " + value);
      values.put(opt.name(), value);
    }
  }

  public static PassOptions defaults(Pass pass) {
    try {
      return new PassOptions(pass.name(), pass.options(), Map.of());
    } catch (CompileException e) {
      throw new IllegalStateException(e);
    }
  }

  private String value(String name) {
    String value = values.get(name);
    if (value == null)
      throw new IllegalArgumentException("Pass " + passName + " does not declare option " + name);
    return value;
  }

  public boolean flag(String name) { return Boolean.parseBoolean(value(name).toLowerCase()); }

  public long number(String name) { return Long.parseLong(value(name)); }

  public Map<String, String> values() { return Collections.unmodifiableMap(values); }
}
