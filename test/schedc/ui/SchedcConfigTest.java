package schedc.ui;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SchedcConfigTest {

  @Test
  void testFromYaml() {
    SchedcConfig cfg = SchedcConfig.fromYaml(String.join("\n",
                                                         "passes: [validate, pre-opt, compile]",
                                                         "exclude_passes: [dead-group-removal]",
                                                         "pass_options:",
                                                         "  - tdcc:early-transitions",
                                                         "  - compile-static:early-reset=false",
                                                         "verify_drivers: false",
                                                         "output: out.txt",
                                                         ""));
    Assertions.assertEquals(List.of("validate", "pre-opt", "compile"), cfg.passes);
    Assertions.assertEquals(List.of("dead-group-removal"), cfg.exclude_passes);
    Assertions.assertEquals(List.of("tdcc:early-transitions", "compile-static:early-reset=false"), cfg.pass_options);
    Assertions.assertFalse(cfg.verify_drivers);
    Assertions.assertEquals("out.txt", cfg.output);
  }

  @Test
  void testMissingKeysKeepDefaults() {
    SchedcConfig cfg = SchedcConfig.fromYaml("output: x.txt\n");
    Assertions.assertEquals(List.of("all"), cfg.passes);
    Assertions.assertTrue(cfg.exclude_passes.isEmpty());
    Assertions.assertTrue(cfg.verify_drivers);

    cfg = SchedcConfig.fromYaml("");
    Assertions.assertEquals(List.of("all"), cfg.passes);
    Assertions.assertEquals("", cfg.output);
  }
}
