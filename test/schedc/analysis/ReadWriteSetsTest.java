package schedc.analysis;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import schedc.ir.Cell;
import schedc.ir.Component;
import schedc.ir.Control;
import schedc.ir.GroupBase;
import schedc.sim.Programs;

class ReadWriteSetsTest {

  @Test
  void testGroupsOfLoopIncludeCombGroup() throws Exception {
    Component main = Programs.read(Programs.WHILE).component("main");
    Assertions.assertEquals(List.of("cond", "incr"),
                            ReadWriteSets.groupsOf(main.control()).stream().map(GroupBase::name).sorted().collect(Collectors.toList()));
  }

  @Test
  void testLoopReadsConditionPort() throws Exception {
    Component main = Programs.read(Programs.WHILE).component("main");
    Cell i = main.cell("i");
    Cell lt = main.cell("lt");
    Set<?> reads = ReadWriteSets.readsOf(main.control());
    Assertions.assertTrue(reads.contains(lt.port("out")));
    Assertions.assertTrue(reads.contains(i.port("out")));
    Set<?> writes = ReadWriteSets.writesOf(main.control());
    Assertions.assertTrue(writes.contains(lt.port("left")));
    Assertions.assertTrue(writes.contains(i.port("in")));
    Assertions.assertFalse(writes.contains(lt.port("out")));
  }

  @Test
  void testBranchesOfConditional() throws Exception {
    Component main = Programs.read(Programs.IF).component("main");
    var cond = (Control.If)main.control();
    Assertions.assertTrue(ReadWriteSets.readsOf(cond).contains(cond.port()));
    Assertions.assertFalse(ReadWriteSets.readsOf(cond.tbranch()).contains(cond.port()));
    // both branches drive the same register
    Cell r = main.cell("r");
    Assertions.assertEquals(Set.of(r.port("in"), r.port("write_en"), main.findGroup("T").get().done(), main.findGroup("F").get().done()),
                            ReadWriteSets.writesOf(cond));
  }

  @Test
  void testInvokeBindings() throws Exception {
    String yaml = Programs.PAR.replace("par: [A, B]", "seq: [A, {invoke: {cell: m, inputs: {left: 32'd6, right: r.out}}}]");
    Component main = Programs.read(yaml).component("main");
    var invoke = (Control.Invoke)((Control.Seq)main.control()).stmts().get(1);
    Cell m = main.cell("m");
    Cell r = main.cell("r");
    Assertions.assertEquals(Set.of(m.port("left"), m.port("right")), ReadWriteSets.writesOf(invoke));
    Assertions.assertEquals(Set.of(r.port("out")), ReadWriteSets.readsOf(invoke));
  }
}
