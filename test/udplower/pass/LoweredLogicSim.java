package udplower.pass;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import udplower.ast.AstAlways;
import udplower.ast.AstAnd;
import udplower.ast.AstAssignW;
import udplower.ast.AstConcat;
import udplower.ast.AstConst;
import udplower.ast.AstEq;
import udplower.ast.AstIf;
import udplower.ast.AstNode;
import udplower.ast.AstNodeAssign;
import udplower.ast.AstNodeExpr;
import udplower.ast.AstPrimitive;
import udplower.ast.AstVar;
import udplower.ast.AstVarRef;
import udplower.num.BitNumber;

/**
 * Evaluates a lowered primitive for one input combination: continuous assignments first, then the always blocks.
 * If conditions that are x take the else branch, as in Verilog.
 */
public class LoweredLogicSim {
  private final AstPrimitive primp;
  private final Map<AstVar, BitNumber> env = new HashMap<>();

  public LoweredLogicSim(AstPrimitive primp) { this.primp = primp; }

  /** Sets a variable by name. */
  public LoweredLogicSim set(String name, BitNumber value) {
    env.put(findVar(name), value);
    return this;
  }
  public LoweredLogicSim set(String name, char bit) { return set(name, new BitNumber(1).setBit(0, bit)); }

  public BitNumber get(String name) { return env.get(findVar(name)); }

  private AstVar findVar(String name) {
    return primp.getVars().stream().filter(varp -> varp.getName().equals(name)).findFirst().orElseThrow(
        () -> new IllegalArgumentException("No variable " + name + " in " + primp.getName()));
  }

  /** Runs the assignments and always blocks once. */
  public LoweredLogicSim evaluate() {
    for (AstNode stmtp : primp.getStmts())
      if (stmtp instanceof AstAssignW)
        exec(stmtp);
    for (AstNode stmtp : primp.getStmts())
      if (stmtp instanceof AstAlways)
        execAll(((AstAlways)stmtp).getStmts());
    return this;
  }

  private void execAll(List<AstNode> stmts) {
    for (AstNode stmtp : stmts)
      exec(stmtp);
  }

  private void exec(AstNode stmtp) {
    if (stmtp instanceof AstNodeAssign) {
      AstNodeAssign assignp = (AstNodeAssign)stmtp;
      env.put(assignp.getLhs().getVar(), eval(assignp.getRhs()));
    } else if (stmtp instanceof AstIf) {
      AstIf ifp = (AstIf)stmtp;
      if (eval(ifp.getCond()).isTrue())
        execAll(ifp.getThens());
      else
        execAll(ifp.getElses());
    } else {
      throw new IllegalStateException("Unexpected statement " + stmtp);
    }
  }

  public BitNumber eval(AstNodeExpr exprp) {
    if (exprp instanceof AstVarRef) {
      BitNumber value = env.get(((AstVarRef)exprp).getVar());
      if (value == null)
        return new BitNumber(exprp.getWidth()).setBit(0, 'x');
      return value;
    }
    if (exprp instanceof AstConst)
      return ((AstConst)exprp).getNum();
    if (exprp instanceof AstConcat)
      return eval(((AstConcat)exprp).getLhs()).concat(eval(((AstConcat)exprp).getRhs()));
    if (exprp instanceof AstAnd)
      return eval(((AstAnd)exprp).getLhs()).and(eval(((AstAnd)exprp).getRhs()));
    if (exprp instanceof AstEq)
      return eval(((AstEq)exprp).getLhs()).logicalEq(eval(((AstEq)exprp).getRhs()));
    throw new IllegalStateException("Unexpected expression " + exprp);
  }
}
