package schedc.ir;

/** Zero-latency group computing a condition in the cycle it is read. */
public class CombGroup extends GroupBase {
  public CombGroup(String name) { super(name); }

  @Override
  public String kind() {
    return "comb group";
  }
}
