package schedc.ir;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import schedc.sim.Programs;

class GroupBaseTest {

  @Test
  void testReadsAndWrites() throws Exception {
    Component main = Programs.read(Programs.SEQ).component("main");
    Group b = main.findGroup("B").get();
    Cell r1 = main.cell("r1");
    Cell r2 = main.cell("r2");
    Assertions.assertEquals(Set.of(r2.port("in"), r2.port("write_en"), b.done()), b.writes());
    Assertions.assertEquals(Set.of(r1.port("out"), r2.port("done")), b.reads());
    Assertions.assertEquals(List.of(new Assignment(b.done(), r2.port("done"))), b.doneAssignments());
  }

  @Test
  void testRewriteDestination() throws Exception {
    Component main = Programs.read(Programs.SEQ).component("main");
    Group a = main.findGroup("A").get();
    Cell r1 = main.cell("r1");
    Cell r2 = main.cell("r2");
    Assertions.assertEquals(1, a.rewriteDestination(r1.port("in"), r2.port("in")));
    Assertions.assertTrue(a.writesTo(r1.port("in")).isEmpty());
    Assertions.assertEquals(List.of(new Assignment(r2.port("in"), Constant.of(5, 32))), a.writesTo(r2.port("in")));
    // nothing drives r1.out
    Assertions.assertEquals(0, a.rewriteDestination(r1.port("out"), r2.port("out")));
    Assertions.assertEquals(3, a.assignments().size());
  }

  @Test
  void testRewritePortsInSourcesAndGuards() throws Exception {
    Component main = Programs.read(Programs.SEQ.replace("\"r2.in = r1.out\"", "\"r2.in = r1.done ? r1.out\"")).component("main");
    Group b = main.findGroup("B").get();
    Cell r1 = main.cell("r1");
    Cell r2 = main.cell("r2");
    b.rewritePorts(Map.of(r1.port("out"), r2.port("out"), r1.port("done"), r2.port("done")));
    Assertions.assertEquals(new Assignment(r2.port("in"), r2.port("out"), Guard.port(r2.port("done"))), b.assignments().get(0));
    Assertions.assertEquals(Set.of(r2.port("out"), r2.port("done")), b.reads());
  }

  @Test
  void testRemoveDoneWrites() throws Exception {
    Component main = Programs.read(Programs.SEQ).component("main");
    Group a = main.findGroup("A").get();
    Assertions.assertTrue(a.removeIf(a::isDoneWrite));
    Assertions.assertFalse(a.removeIf(a::isDoneWrite));
    Assertions.assertTrue(a.doneAssignments().isEmpty());
    Assertions.assertEquals(2, a.assignments().size());
  }

  @Test
  void testEmptyName() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new Group(""));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new StaticGroup("S", 0));
  }
}
