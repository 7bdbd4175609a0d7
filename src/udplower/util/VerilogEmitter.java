package udplower.util;

import java.util.List;
import java.util.stream.Collectors;
import udplower.ast.AstAlways;
import udplower.ast.AstAnd;
import udplower.ast.AstBasicDType;
import udplower.ast.AstConcat;
import udplower.ast.AstConst;
import udplower.ast.AstEq;
import udplower.ast.AstIf;
import udplower.ast.AstNetlist;
import udplower.ast.AstNode;
import udplower.ast.AstNodeAssign;
import udplower.ast.AstNodeExpr;
import udplower.ast.AstNodeModule;
import udplower.ast.AstPrimitive;
import udplower.ast.AstUdpTable;
import udplower.ast.AstUdpTableLine;
import udplower.ast.AstUdpTableLineVal;
import udplower.ast.AstVar;
import udplower.ast.AstVarRef;
import udplower.ast.NodeKind;

/**
 * Renders a netlist tree as Verilog text. Used for tree dumps and for the command line output.
 */
public class VerilogEmitter {
  public String tab = "    ";

  public String emit(AstNetlist rootp) {
    StringBuilder sb = new StringBuilder();
    for (AstNodeModule modp : rootp.getModules())
      emitModule(sb, modp);
    return sb.toString();
  }

  public String emitModule(AstNodeModule modp) {
    StringBuilder sb = new StringBuilder();
    emitModule(sb, modp);
    return sb.toString();
  }

  private void emitModule(StringBuilder sb, AstNodeModule modp) {
    String keyword = (modp instanceof AstPrimitive) ? "primitive" : "module";
    String portNames = modp.getPorts().stream().map(AstVar::getName).collect(Collectors.joining(", "));
    sb.append(keyword).append(" ").append(modp.getName()).append("(").append(portNames).append(");\n");
    for (AstNode stmtp : modp.getStmts())
      emitStmt(sb, stmtp, 1);
    sb.append("end").append(keyword).append("\n");
  }

  /** Declaration text of a variable without the indentation, e.g. {@code output reg q;} or {@code logic [1:0] t;}. */
  public String declaration(AstVar varp) {
    AstBasicDType dtypep = varp.getChildDType();
    StringBuilder sb = new StringBuilder();
    if (varp.isIO())
      sb.append(varp.getDirection().name().toLowerCase()).append(" ");
    if (dtypep.getKeyword() != AstBasicDType.Keyword.Implicit)
      sb.append(dtypep.getKeyword().getText()).append(" ");
    else if (!varp.isIO())
      sb.append("wire ");
    if (dtypep.getSigning() == AstBasicDType.Signing.Signed)
      sb.append("signed ");
    if (dtypep.getWidth() > 1)
      sb.append("[").append(dtypep.getWidth() - 1).append(":0] ");
    sb.append(varp.getName()).append(";");
    return sb.toString();
  }

  private void emitStmt(StringBuilder sb, AstNode stmtp, int level) {
    String indent = tab.repeat(level);
    if (stmtp instanceof AstVar) {
      sb.append(indent).append(declaration((AstVar)stmtp)).append("\n");
    } else if (stmtp instanceof AstNodeAssign) {
      AstNodeAssign assignp = (AstNodeAssign)stmtp;
      sb.append(indent);
      if (stmtp.getKind() == NodeKind.AssignW)
        sb.append("assign ");
      sb.append(expr(assignp.getLhs())).append(" = ").append(expr(assignp.getRhs())).append(";\n");
    } else if (stmtp instanceof AstAlways) {
      AstAlways alwaysp = (AstAlways)stmtp;
      sb.append(indent).append(alwaysp.getKeyword().getText()).append(" begin\n");
      for (AstNode subp : alwaysp.getStmts())
        emitStmt(sb, subp, level + 1);
      sb.append(indent).append("end\n");
    } else if (stmtp instanceof AstIf) {
      sb.append(indent);
      emitIf(sb, (AstIf)stmtp, level);
    } else if (stmtp instanceof AstUdpTable) {
      sb.append(indent).append("table\n");
      for (AstUdpTableLine linep : ((AstUdpTable)stmtp).getLines())
        sb.append(tab.repeat(level + 1)).append(tableLine(linep)).append("\n");
      sb.append(indent).append("endtable\n");
    } else {
      sb.append(indent).append("// ").append(stmtp.getKind().getDumpName()).append("\n");
    }
  }

  // Expects the indentation of the first line to be written already.
  private void emitIf(StringBuilder sb, AstIf ifp, int level) {
    String indent = tab.repeat(level);
    sb.append("if ").append(parenthesized(ifp.getCond())).append("\n");
    emitBranch(sb, ifp.getThens(), level);
    List<AstNode> elses = ifp.getElses();
    if (elses.isEmpty())
      return;
    AstIf elseIfp = ifp.getElseIf();
    if (elseIfp != null) {
      sb.append(indent).append("else ");
      emitIf(sb, elseIfp, level);
    } else {
      sb.append(indent).append("else\n");
      emitBranch(sb, elses, level);
    }
  }

  private void emitBranch(StringBuilder sb, List<AstNode> stmts, int level) {
    String indent = tab.repeat(level);
    if (stmts.isEmpty()) {
      sb.append(indent).append(tab).append(";\n");
    } else if (stmts.size() == 1) {
      emitStmt(sb, stmts.get(0), level + 1);
    } else {
      sb.append(indent).append("begin\n");
      for (AstNode subp : stmts)
        emitStmt(sb, subp, level + 1);
      sb.append(indent).append("end\n");
    }
  }

  /** Table line in source notation, e.g. {@code 0 1 : 1;}. */
  public String tableLine(AstUdpTableLine linep) {
    String ifield = linep.getIfield().stream().map(AstUdpTableLineVal::getText).collect(Collectors.joining(" "));
    String ofield = linep.getOfield().stream().map(AstUdpTableLineVal::getText).collect(Collectors.joining(" "));
    return ifield + " : " + ofield + ";";
  }

  private String parenthesized(AstNodeExpr exprp) {
    // Binary operators carry their own parentheses.
    return (exprp instanceof AstEq || exprp instanceof AstAnd) ? expr(exprp) : "(" + expr(exprp) + ")";
  }

  /** Expression text; binary operators are always parenthesized, nested concatenations flattened. */
  public String expr(AstNodeExpr exprp) {
    if (exprp instanceof AstVarRef)
      return ((AstVarRef)exprp).getVar().getName();
    if (exprp instanceof AstConst)
      return ((AstConst)exprp).getNum().toString();
    if (exprp instanceof AstConcat)
      return "{" + concatItems((AstConcat)exprp) + "}";
    if (exprp instanceof AstAnd)
      return "(" + expr(((AstAnd)exprp).getLhs()) + " & " + expr(((AstAnd)exprp).getRhs()) + ")";
    if (exprp instanceof AstEq)
      return "(" + expr(((AstEq)exprp).getLhs()) + " == " + expr(((AstEq)exprp).getRhs()) + ")";
    return "/*" + exprp.getKind().getDumpName() + "*/";
  }

  private String concatItems(AstConcat concatp) {
    String lhs = (concatp.getLhs() instanceof AstConcat) ? concatItems((AstConcat)concatp.getLhs()) : expr(concatp.getLhs());
    String rhs = (concatp.getRhs() instanceof AstConcat) ? concatItems((AstConcat)concatp.getRhs()) : expr(concatp.getRhs());
    return lhs + ", " + rhs;
  }
}
