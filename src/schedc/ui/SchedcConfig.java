package schedc.ui;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.yaml.snakeyaml.Yaml;

/**
 * Data-Class to hold tool options. Can be read from YAML, with one key per field.
 */
public class SchedcConfig {

  /** Passes and aliases to run, in order. */
  public List<String> passes = new ArrayList<>(List.of("all"));
  /** Passes removed from the resolved pipeline. */
  public List<String> exclude_passes = new ArrayList<>();
  /** Pass options in the form {@code pass:option=value} or {@code pass:option}. */
  public List<String> pass_options = new ArrayList<>();

  /** Re-check for conflicting drivers after every rewriting pass. */
  public boolean verify_drivers = true;

  /** File to print the compiled program to; standard output if empty. */
  public String output = "";

  public static SchedcConfig fromYaml(InputStream in) { return orDefault(new Yaml().loadAs(in, SchedcConfig.class)); }

  public static SchedcConfig fromYaml(String yaml) { return orDefault(new Yaml().loadAs(yaml, SchedcConfig.class)); }

  // an empty document yields no object
  private static SchedcConfig orDefault(SchedcConfig cfg) { return cfg == null ? new SchedcConfig() : cfg; }
}
