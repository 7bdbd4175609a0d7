package udplower.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import udplower.ast.AstAlways;
import udplower.ast.AstIf;
import udplower.ast.AstPrimitive;
import udplower.ast.AstVar;

/**
 * Traversal state of table lowering for the primitive currently visited.
 * Reset on entry to every primitive, so nothing leaks from one primitive to the next.
 */
public class UdpContext {
  // Filled by PortClassifier
  AstPrimitive primp = null;
  final List<AstVar> inputVars = new ArrayList<>();
  final List<AstVar> outputVars = new ArrayList<>();
  boolean firstIsOutput = false;

  // Filled by TableLowerer, advanced by RowCompiler
  int inputNum = 0;
  AstVar ifieldVarp = null;
  AstVar ofieldVarp = null;
  AstAlways alwaysp = null;
  AstIf lineStmtp = null; // chain tail, null before the first row

  void enterPrimitive(AstPrimitive primp) {
    this.primp = primp;
    inputVars.clear();
    outputVars.clear();
    firstIsOutput = false;
    resetTable();
  }

  void leavePrimitive() {
    primp = null;
    resetTable();
  }

  void resetTable() {
    inputNum = 0;
    ifieldVarp = null;
    ofieldVarp = null;
    alwaysp = null;
    lineStmtp = null;
  }

  public AstPrimitive getPrimitive() { return primp; }
  public List<AstVar> getInputVars() { return Collections.unmodifiableList(inputVars); }
  public List<AstVar> getOutputVars() { return Collections.unmodifiableList(outputVars); }
  /** True if the first IO port seen in the current primitive was an output. */
  public boolean isFirstOutput() { return firstIsOutput; }
}
