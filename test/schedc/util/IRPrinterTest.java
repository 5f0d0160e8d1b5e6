package schedc.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import schedc.frontend.GuardParser;
import schedc.ir.Assignment;
import schedc.ir.Component;
import schedc.sim.Programs;

class IRPrinterTest {

  @Test
  void testComponent() throws Exception {
    Component main = Programs.read(Programs.IF).component("main");
    String expected = String.join("\n",
                                  "component main(sel: 1) -> () {",
                                  "  cells {",
                                  "    r = std_reg(8);",
                                  "  }",
                                  "  wires {",
                                  "    group T {",
                                  "      r.in = 8'd1;",
                                  "      r.write_en = 1'd1;",
                                  "      T[done] = r.done;",
                                  "    }",
                                  "    group F {",
                                  "      r.in = 8'd2;",
                                  "      r.write_en = 1'd1;",
                                  "      F[done] = r.done;",
                                  "    }",
                                  "  }",
                                  "  control {",
                                  "    if sel {",
                                  "      T;",
                                  "    } else {",
                                  "      F;",
                                  "    }",
                                  "  }",
                                  "}",
                                  "");
    Assertions.assertEquals(expected, IRPrinter.print(main));
  }

  @Test
  void testAttributesAndStaticControl() throws Exception {
    Component main = Programs.read(Programs.BOUNDED_LOOP).component("main");
    String text = IRPrinter.print(main.control(), 0);
    Assertions.assertTrue(text.contains("\n  @bound(3) while lt.out {\n    incr;\n  }\n"), text);

    main = Programs.compile(Programs.SEQ, "validate,pre-opt").component("main");
    Assertions.assertEquals("@promoted static<2> seq {\n  @promoted A_static;\n  @promoted B_static;\n}\n", IRPrinter.print(main.control(), 0));
  }

  @Test
  void testPrintedAssignmentsParseBack() throws Exception {
    Component main = Programs.compile(Programs.PAR, "all").component("main");
    var parser = new GuardParser(main);
    for (var group : main.allGroups())
      for (Assignment a : group.assignments()) {
        String text = a.toString();
        Assertions.assertEquals(text, parser.parseAssignment(text).toString());
      }
  }
}
