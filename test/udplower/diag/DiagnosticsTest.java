package udplower.diag;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import udplower.ast.AstBasicDType;
import udplower.ast.AstVar;
import udplower.ast.FileLine;

class DiagnosticsTest {
  static final FileLine FL = new FileLine("udp.v", 3);

  @Test
  void testCollectsAndCounts() {
    AstVar varp = new AstVar(FL, AstVar.VarType.Port, "q", AstVar.Direction.Output, AstBasicDType.bit(FL, AstBasicDType.Keyword.Implicit));
    Diagnostics diag = new Diagnostics();
    Assertions.assertFalse(diag.hasErrors());
    diag.warn(varp, "just a warning");
    Assertions.assertFalse(diag.hasErrors());
    diag.error(varp, "first error");
    diag.error(varp, "second error");

    Assertions.assertEquals(3, diag.getAll().size());
    Assertions.assertEquals(2, diag.getErrorCount());
    Assertions.assertEquals(1, diag.getWarningCount());
    Assertions.assertEquals(2, diag.getErrors().size());
    Assertions.assertTrue(diag.contains("second"));
    Assertions.assertFalse(diag.contains("third"));
    Assertions.assertEquals("first error", diag.getErrors().get(0).message());
  }

  @Test
  void testFormat() {
    AstVar varp = new AstVar(FL, AstVar.VarType.Port, "q", AstVar.Direction.Output, AstBasicDType.bit(FL, AstBasicDType.Keyword.Implicit));
    Diagnostics diag = new Diagnostics();
    diag.error(varp, "first port must be the output port");
    Diagnostic error = diag.getAll().get(0);
    Assertions.assertEquals(Severity.Error, error.severity());
    Assertions.assertEquals("%Error: udp.v:3: first port must be the output port (Var 'q')", error.format());
    Assertions.assertEquals("%Warning: udp.v:3: msg", new Diagnostic(Severity.Warning, FL, "msg", "").format());
  }

  @Test
  void testLogLimitKeepsCollecting() {
    AstVar varp = new AstVar(FL, AstVar.VarType.Var, "t", AstBasicDType.bit(FL, AstBasicDType.Keyword.Wire));
    Diagnostics diag = new Diagnostics();
    diag.setMaxLoggedErrors(1);
    for (int i = 0; i < 4; ++i)
      diag.error(varp, "error " + i);
    Assertions.assertEquals(4, diag.getErrorCount());
    Assertions.assertTrue(diag.contains("error 3"));
  }
}
