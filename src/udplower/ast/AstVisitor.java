package udplower.ast;

import java.util.List;

/**
 * Depth-first traversal over the netlist tree with dispatch on {@link NodeKind}.
 * Kinds without a dedicated visit method go to {@link #visitNode(AstNode, Object)}, which forwards to the children.
 * <p>
 * Children are iterated over a snapshot of the child list, so visit methods may replace the node they visit
 * or insert siblings; nodes added during the iteration are not visited.
 *
 * @param <C> per-traversal context value passed to every visit call
 */
public abstract class AstVisitor<C> {

  public void iterate(AstNode nodep, C ctx) {
    switch (nodep.getKind()) {
    case Primitive:
      visitPrimitive((AstPrimitive)nodep, ctx);
      break;
    case Var:
      visitVar((AstVar)nodep, ctx);
      break;
    case UdpTable:
      visitUdpTable((AstUdpTable)nodep, ctx);
      break;
    case UdpTableLine:
      visitUdpTableLine((AstUdpTableLine)nodep, ctx);
      break;
    default:
      visitNode(nodep, ctx);
      break;
    }
  }

  public void iterateChildren(AstNode nodep, C ctx) {
    List<AstNode> snapshot = nodep.children();
    for (AstNode childp : snapshot) {
      // A sibling visit may have removed it already.
      if (childp.getParent() == nodep)
        iterate(childp, ctx);
    }
  }

  protected void visitPrimitive(AstPrimitive nodep, C ctx) { visitNode(nodep, ctx); }
  protected void visitVar(AstVar nodep, C ctx) { visitNode(nodep, ctx); }
  protected void visitUdpTable(AstUdpTable nodep, C ctx) { visitNode(nodep, ctx); }
  protected void visitUdpTableLine(AstUdpTableLine nodep, C ctx) { visitNode(nodep, ctx); }

  /** Fallback for all other kinds. */
  protected void visitNode(AstNode nodep, C ctx) { iterateChildren(nodep, ctx); }
}
