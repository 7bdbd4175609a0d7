package udplower.ast;

/** Assignment of an expression to a variable reference. */
public abstract class AstNodeAssign extends AstNode {
  protected AstNodeAssign(FileLine fileline, AstVarRef lhsp, AstNodeExpr rhsp) {
    super(fileline, 2);
    if (lhsp.getAccess() != AstVarRef.Access.Write)
      throw new IllegalArgumentException("Assignment target must be a write reference");
    addOp(0, lhsp);
    addOp(1, rhsp);
  }

  public AstVarRef getLhs() { return (AstVarRef)getOp1(0); }
  public AstNodeExpr getRhs() { return (AstNodeExpr)getOp1(1); }
}
