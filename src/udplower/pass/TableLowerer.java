package udplower.pass;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import udplower.ast.AstAlways;
import udplower.ast.AstAssignW;
import udplower.ast.AstBasicDType;
import udplower.ast.AstConcat;
import udplower.ast.AstNode;
import udplower.ast.AstNodeExpr;
import udplower.ast.AstUdpTable;
import udplower.ast.AstVar;
import udplower.ast.AstVarRef;
import udplower.ast.FileLine;
import udplower.ast.NodeDeleter;
import udplower.diag.Diagnostics;

/**
 * Lowers one table: checks the port structure, creates the input field variable with its packing assignment
 * and the always block that will hold the line chain.
 * {@link #begin} runs before the lines are compiled, {@link #finish} afterwards.
 */
class TableLowerer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Diagnostics diag;
  private final String ifieldVarName;

  TableLowerer(Diagnostics diag, String ifieldVarName) {
    this.diag = diag;
    this.ifieldVarName = ifieldVarName;
  }

  void begin(AstUdpTable nodep, UdpContext ctx) {
    FileLine fl = nodep.getFileline();
    ctx.resetTable();
    ctx.inputNum = ctx.inputVars.size();
    int outputNum = ctx.outputVars.size();

    if (outputNum != 1) {
      AstNode errp = outputNum > 0 ? ctx.outputVars.get(outputNum - 1) : nodep;
      diag.error(errp, outputNum + " output ports for table, exactly one required");
    }
    if (!ctx.firstIsOutput && outputNum > 0)
      diag.error(ctx.inputVars.get(0), "first port must be the output port");
    if (outputNum > 0) {
      ctx.ofieldVarp = ctx.outputVars.get(0);
      AstBasicDType dtypep = ctx.ofieldVarp.getChildDType();
      if (dtypep.isStateful())
        diag.error(dtypep, "sequential tables are not supported");
    }
    if (ctx.inputNum == 0)
      diag.error(nodep, "table requires at least one input port");

    if (ctx.inputNum > 0) {
      AstBasicDType typep = new AstBasicDType(fl, AstBasicDType.Keyword.Logic, ctx.inputNum, AstBasicDType.Signing.NoSign);
      ctx.ifieldVarp = new AstVar(fl, AstVar.VarType.ModuleTemp, uniqueName(ctx), typep);
      ctx.inputVars.get(ctx.inputNum - 1).addNextHere(ctx.ifieldVarp);
    }
    // Latch: an input combination without a matching line leaves the output unassigned.
    ctx.alwaysp = new AstAlways(fl, AstAlways.Keyword.Always);
    logger.debug("UDP. Lowering table of {} with {} inputs", ctx.primp.getName(), ctx.inputNum);
  }

  /**
   * Packs all inputs into one expression, first input at bit 0: {in[n-1], ... {in[1], in[0]}}.
   */
  static AstNodeExpr buildPacking(FileLine fl, List<AstVar> inputVars) {
    AstNodeExpr concatp = new AstVarRef(fl, inputVars.get(0), AstVarRef.Access.Read);
    for (int i = 1; i < inputVars.size(); ++i)
      concatp = new AstConcat(fl, new AstVarRef(fl, inputVars.get(i), AstVarRef.Access.Read), concatp);
    return concatp;
  }

  void finish(AstUdpTable nodep, UdpContext ctx, NodeDeleter deleter) {
    FileLine fl = nodep.getFileline();
    List<AstNode> newStmts = new ArrayList<>(2);
    if (ctx.ifieldVarp != null) {
      AstVarRef ifieldRefp = new AstVarRef(fl, ctx.ifieldVarp, AstVarRef.Access.Write);
      newStmts.add(new AstAssignW(fl, ifieldRefp, buildPacking(fl, ctx.inputVars)));
    }
    newStmts.add(ctx.alwaysp);
    nodep.replaceWith(newStmts);
    deleter.pushDelete(nodep);
    ctx.resetTable();
  }

  private String uniqueName(UdpContext ctx) {
    String name = ifieldVarName;
    int suffix = 0;
    while (nameTaken(ctx, name))
      name = ifieldVarName + "__" + (++suffix);
    return name;
  }

  private static boolean nameTaken(UdpContext ctx, String name) {
    return ctx.primp.getVars().stream().anyMatch(varp -> varp.getName().equals(name));
  }
}
