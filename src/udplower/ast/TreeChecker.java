package udplower.ast;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Consistency check over a whole netlist after a tree-rewriting pass.
 * <p>
 * Checks parent links, that no deleted node is reachable, that variable references point to variables of the enclosing module,
 * and that operand widths of bitwise operators, comparisons and assignments agree.
 * With {@link #setRequireNoTables(boolean)}, table nodes are reported as well.
 */
public class TreeChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private boolean requireNoTables = false;

  /** Also report any remaining {@link AstUdpTable}, {@link AstUdpTableLine} or {@link AstUdpTableLineVal}. */
  public TreeChecker setRequireNoTables(boolean requireNoTables) {
    this.requireNoTables = requireNoTables;
    return this;
  }

  /** Returns the list of problems found; empty if the tree is consistent. */
  public List<String> collectProblems(AstNetlist rootp) {
    List<String> problems = new ArrayList<>();
    if (rootp.isDeleted())
      problems.add("root is deleted");
    for (AstNodeModule modp : rootp.getModules()) {
      Set<AstVar> moduleVars = new HashSet<>();
      modp.streamAll().filter(nodep -> nodep instanceof AstVar).forEach(nodep -> moduleVars.add((AstVar)nodep));
      checkNode(modp, rootp, moduleVars, problems);
    }
    return problems;
  }

  /**
   * Runs the check and throws if it fails.
   * @param rootp the netlist to check
   * @param stage name of the pass that just ran, for the error message
   */
  public void check(AstNetlist rootp, String stage) {
    List<String> problems = collectProblems(rootp);
    if (!problems.isEmpty())
      throw new TreeCheckException(stage, problems);
    logger.debug("Tree check after {} passed", stage);
  }

  private void checkNode(AstNode nodep, AstNode expectedParent, Set<AstVar> moduleVars, List<String> problems) {
    if (nodep.isDeleted())
      problems.add(nodep + ": deleted node is still reachable");
    if (nodep.getParent() != expectedParent)
      problems.add(nodep + ": broken parent link");
    if (requireNoTables && nodep.getKind().isUdpTableKind())
      problems.add(nodep + ": table node left after table lowering");

    if (nodep instanceof AstVarRef) {
      AstVar varp = ((AstVarRef)nodep).getVar();
      if (varp.isDeleted() || !moduleVars.contains(varp))
        problems.add(nodep + ": reference to " + varp.prettyName() + " outside of the enclosing module");
    } else if (nodep instanceof AstAnd || nodep instanceof AstEq) {
      AstNodeBiop biopp = (AstNodeBiop)nodep;
      if (biopp.getLhs() == null || biopp.getRhs() == null)
        problems.add(nodep + ": missing operand");
      else if (biopp.getLhs().getWidth() != biopp.getRhs().getWidth())
        problems.add(nodep + ": operand widths differ (" + biopp.getLhs().getWidth() + " vs " + biopp.getRhs().getWidth() + ")");
    } else if (nodep instanceof AstNodeAssign) {
      AstNodeAssign assignp = (AstNodeAssign)nodep;
      if (assignp.getLhs() == null || assignp.getRhs() == null)
        problems.add(nodep + ": missing operand");
      else if (assignp.getLhs().getWidth() != assignp.getRhs().getWidth())
        problems.add(nodep + ": assignment width mismatch (" + assignp.getLhs().getWidth() + " vs " + assignp.getRhs().getWidth() + ")");
    } else if (nodep instanceof AstIf) {
      AstNodeExpr condp = ((AstIf)nodep).getCond();
      if (condp == null || condp.getWidth() != 1)
        problems.add(nodep + ": condition must be one bit wide");
    }

    for (int slot = 0; slot < nodep.getNumOps(); ++slot) {
      for (AstNode childp : nodep.getOp(slot)) {
        if (childp.getParentSlot() != slot)
          problems.add(childp + ": wrong parent slot");
        checkNode(childp, nodep, moduleVars, problems);
      }
    }
  }
}
