package schedc.ir;

import java.util.EnumMap;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Typed attribute set of a control node, group or component.
 */
public class Attributes {
  private final EnumMap<Attr, Long> values = new EnumMap<>(Attr.class);

  public Attributes() {}
  public Attributes(Attributes other) { values.putAll(other.values); }

  public boolean has(Attr attr) { return values.containsKey(attr); }

  public OptionalLong get(Attr attr) {
    Long value = values.get(attr);
    return value == null ? OptionalLong.empty() : OptionalLong.of(value);
  }

  /** Sets a numeric attribute. */
  public Attributes set(Attr attr, long value) {
    if (!attr.numeric)
      throw new IllegalArgumentException("@" + attr.text + " does not take a value");
    if (value < 0)
      throw new IllegalArgumentException("@" + attr.text + " must not be negative");
    values.put(attr, value);
    return this;
  }

  /** Sets a flag attribute. */
  public Attributes set(Attr attr) {
    if (attr.numeric)
      throw new IllegalArgumentException("@" + attr.text + " requires a value");
    values.put(attr, 1L);
    return this;
  }

  public void remove(Attr attr) { values.remove(attr); }

  /** Copies all attributes of {@code other}, overwriting values already set. */
  public void addAll(Attributes other) { values.putAll(other.values); }

  public boolean isEmpty() { return values.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    return o instanceof Attributes && ((Attributes)o).values.equals(values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.entrySet()
        .stream()
        .map(e -> "@" + e.getKey().text + (e.getKey().numeric ? "(" + e.getValue() + ")" : ""))
        .collect(Collectors.joining(" "));
  }
}
