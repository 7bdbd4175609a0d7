package udplower.pass;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import udplower.ast.AstBasicDType;
import udplower.ast.AstPrimitive;
import udplower.ast.AstVar;
import udplower.ast.FileLine;
import udplower.frontend.PrimitiveBuilder;

class PortClassifierTest {

  static void classifyAll(AstPrimitive primp, UdpContext ctx) {
    PortClassifier classifier = new PortClassifier();
    primp.getVars().forEach(varp -> classifier.classify(varp, ctx));
  }

  @Test
  void testDeclarationOrder() {
    AstPrimitive primp = new PrimitiveBuilder("p").output("q").input("a").input("b").build();
    UdpContext ctx = new UdpContext();
    ctx.enterPrimitive(primp);
    classifyAll(primp, ctx);

    Assertions.assertSame(primp, ctx.getPrimitive());
    Assertions.assertEquals(List.of(primp.getVars().get(1), primp.getVars().get(2)), ctx.getInputVars());
    Assertions.assertEquals(List.of(primp.getVars().get(0)), ctx.getOutputVars());
    Assertions.assertTrue(ctx.isFirstOutput());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> ctx.getInputVars().clear());
  }

  @Test
  void testInputFirstAndInout() {
    AstPrimitive primp = new PrimitiveBuilder("p").input("a").port("io", AstVar.Direction.Inout, AstBasicDType.Keyword.Wire).output("q").build();
    primp.addStmt(new AstVar(new FileLine("p.v", 9), AstVar.VarType.Var, "w", AstBasicDType.bit(new FileLine("p.v", 9), AstBasicDType.Keyword.Wire)));
    UdpContext ctx = new UdpContext();
    ctx.enterPrimitive(primp);
    classifyAll(primp, ctx);

    Assertions.assertFalse(ctx.isFirstOutput());
    Assertions.assertEquals(1, ctx.getInputVars().size());
    // Inout counts as an output; plain variables are not ports.
    Assertions.assertEquals(2, ctx.getOutputVars().size());
  }

  @Test
  void testStateResetBetweenPrimitives() {
    AstPrimitive firstp = new PrimitiveBuilder("p1").output("q").input("a").build();
    AstPrimitive secondp = new PrimitiveBuilder("p2").input("b").output("y").build();
    UdpContext ctx = new UdpContext();
    ctx.enterPrimitive(firstp);
    classifyAll(firstp, ctx);
    ctx.leavePrimitive();
    Assertions.assertNull(ctx.getPrimitive());

    // Outside a primitive nothing is classified.
    classifyAll(secondp, ctx);
    Assertions.assertEquals(1, ctx.getInputVars().size());

    ctx.enterPrimitive(secondp);
    Assertions.assertTrue(ctx.getInputVars().isEmpty());
    Assertions.assertTrue(ctx.getOutputVars().isEmpty());
    Assertions.assertFalse(ctx.isFirstOutput());
    classifyAll(secondp, ctx);
    Assertions.assertEquals("b", ctx.getInputVars().get(0).getName());
    Assertions.assertFalse(ctx.isFirstOutput());
  }
}
