package schedc.passes;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import schedc.ir.Component;
import schedc.sim.Programs;

class DeadGroupRemovalTest {

  private static String withGroup(String yaml, String name, String... assignments) {
    var sb = new StringBuilder();
    sb.append("      - name: ").append(name).append("\n        assignments:\n");
    for (String a : assignments)
      sb.append("          - \"").append(a).append("\"\n");
    return yaml.replace("    control:\n", sb + "    control:\n");
  }

  @Test
  void testUnreferencedGroupIsRemoved() throws Exception {
    Component main = Programs.read(withGroup(Programs.SEQ, "C", "r2.in = 32'd1", "C[done] = r2.done")).component("main");
    Assertions.assertEquals(1, DeadGroupRemoval.removeDead(main));
    Assertions.assertTrue(main.findGroup("C").isEmpty());
    Assertions.assertEquals(2, main.groups().size());
    Assertions.assertEquals(0, DeadGroupRemoval.removeDead(main));
  }

  @Test
  void testGroupsReachedThroughHolesStay() throws Exception {
    String yaml = withGroup(Programs.SEQ, "C", "r2.in = 32'd1", "D[go] = 1'd1", "C[done] = D[done]");
    yaml = withGroup(yaml, "D", "r2.write_en = 1'd1", "D[done] = r2.done");
    yaml = withGroup(yaml, "E", "r1.in = 32'd3", "E[done] = r1.done");
    yaml = withGroup(yaml, "F", "r1.in = 32'd4", "F[done] = r1.done");
    // A enables C, which enables D; E is only referenced from the continuous assignments
    yaml = yaml.replace("\"A[done] = r1.done\"", "\"A[done] = r1.done\"\n          - \"C[go] = r1.done\"")
               .replace("    control:\n", "    continuous:\n      - \"E[go] = r2.done\"\n    control:\n");
    Component main = Programs.read(yaml).component("main");
    Assertions.assertEquals(1, DeadGroupRemoval.removeDead(main));
    for (String name : new String[] {"A", "B", "C", "D", "E"})
      Assertions.assertTrue(main.findGroup(name).isPresent(), name);
    Assertions.assertTrue(main.findGroup("F").isEmpty());
  }

  @Test
  void testCombGroupOfLiveCondition() throws Exception {
    Component main = Programs.read(Programs.WHILE).component("main");
    Assertions.assertEquals(0, DeadGroupRemoval.removeDead(main));
    Assertions.assertTrue(main.findCombGroup("cond").isPresent());
  }
}
