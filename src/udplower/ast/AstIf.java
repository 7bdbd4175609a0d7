package udplower.ast;

import java.util.List;

/** Procedural if statement. An else-if chain is an {@link AstIf} as the single statement of the else list. */
public class AstIf extends AstNode {
  public AstIf(FileLine fileline, AstNodeExpr condp, AstNode thensp) {
    super(fileline, 3);
    addOp(0, condp);
    if (thensp != null)
      addOp(1, thensp);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.If;
  }

  public AstNodeExpr getCond() { return (AstNodeExpr)getOp1(0); }
  public List<AstNode> getThens() { return getOp(1); }
  public List<AstNode> getElses() { return getOp(2); }

  public void addThens(AstNode stmtp) { addOp(1, stmtp); }
  public void addElses(AstNode stmtp) { addOp(2, stmtp); }

  /** Returns the chained else-if, or null if the else list is not a single {@link AstIf}. */
  public AstIf getElseIf() {
    List<AstNode> elses = getElses();
    return (elses.size() == 1 && elses.get(0) instanceof AstIf) ? (AstIf)elses.get(0) : null;
  }
}
