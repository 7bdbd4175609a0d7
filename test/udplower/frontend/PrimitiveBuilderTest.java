package udplower.frontend;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import udplower.ast.AstBasicDType;
import udplower.ast.AstPrimitive;
import udplower.ast.AstUdpTable;
import udplower.ast.AstUdpTableLine;
import udplower.ast.AstUdpTableLineVal;
import udplower.ast.AstVar;
import udplower.ast.FileLine;

class PrimitiveBuilderTest {
  static final FileLine FL = new FileLine("t.v", 1);

  static String symbols(List<AstUdpTableLineVal> vals) {
    StringBuilder sb = new StringBuilder();
    vals.forEach(valp -> sb.append(valp.getText()));
    return sb.toString();
  }

  @Test
  void testBuild() {
    AstPrimitive primp = new PrimitiveBuilder("and2", "cells.v", 10).output("q").input("a").input("b").line("1 1 : 1").line("0 ? : 0").build();
    Assertions.assertEquals("and2", primp.getName());
    Assertions.assertEquals(new FileLine("cells.v", 10), primp.getFileline());
    Assertions.assertEquals(3, primp.getPorts().size());
    AstVar qp = primp.getPorts().get(0);
    Assertions.assertEquals("q", qp.getName());
    Assertions.assertEquals(AstVar.Direction.Output, qp.getDirection());
    Assertions.assertEquals(AstVar.VarType.Port, qp.getVarType());
    Assertions.assertEquals(1, qp.getWidth());
    Assertions.assertEquals(11, qp.getFileline().getLineno());
    Assertions.assertEquals(13, primp.getPorts().get(2).getFileline().getLineno());

    AstUdpTable tablep = primp.getTable();
    Assertions.assertEquals(14, tablep.getFileline().getLineno());
    Assertions.assertEquals(2, tablep.getLines().size());
    Assertions.assertEquals(15, tablep.getLines().get(0).getFileline().getLineno());
    Assertions.assertEquals("0?", symbols(tablep.getLines().get(1).getIfield()));
    Assertions.assertEquals("0", symbols(tablep.getLines().get(1).getOfield()));
  }

  @Test
  void testOutputReg() {
    AstPrimitive primp = new PrimitiveBuilder("seq").outputReg("q").input("d").build();
    Assertions.assertEquals(AstBasicDType.Keyword.Reg, primp.getPorts().get(0).getChildDType().getKeyword());
    Assertions.assertNotNull(primp.getTable());
    Assertions.assertTrue(primp.getTable().getLines().isEmpty());
  }

  @Test
  void testWithoutTable() {
    AstPrimitive primp = new PrimitiveBuilder("empty").output("q").input("a").withoutTable().build();
    Assertions.assertNull(primp.getTable());
    Assertions.assertEquals(2, primp.getStmts().size());
  }

  @Test
  void testPortNeedsDirection() {
    Assertions.assertThrows(IllegalArgumentException.class,
                            () -> new PrimitiveBuilder("p").port("a", AstVar.Direction.None, AstBasicDType.Keyword.Wire));
  }

  @Test
  void testParseLineCompact() {
    AstUdpTableLine linep = PrimitiveBuilder.parseLine(FL, "0?1:x;");
    Assertions.assertEquals("0?1", symbols(linep.getIfield()));
    Assertions.assertEquals("x", symbols(linep.getOfield()));
    Assertions.assertEquals(FL, linep.getFileline());
  }

  @Test
  void testParseLineEmptyFields() {
    AstUdpTableLine linep = PrimitiveBuilder.parseLine(FL, " : 1");
    Assertions.assertTrue(linep.getIfield().isEmpty());
    linep = PrimitiveBuilder.parseLine(FL, "1 0 :");
    Assertions.assertTrue(linep.getOfield().isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {"0 1 1", "(01) 0 : 1", "0 1 : 0 : 1", "0 : 1 : 0 : 1"})
  void testParseLineRejects(String text) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> PrimitiveBuilder.parseLine(FL, text));
  }
}
