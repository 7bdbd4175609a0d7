package udplower.ast;

/** Expression with two operands. */
public abstract class AstNodeBiop extends AstNodeExpr {
  protected AstNodeBiop(FileLine fileline, AstNodeExpr lhsp, AstNodeExpr rhsp) {
    super(fileline, 2);
    addOp(0, lhsp);
    addOp(1, rhsp);
  }

  public AstNodeExpr getLhs() { return (AstNodeExpr)getOp1(0); }
  public AstNodeExpr getRhs() { return (AstNodeExpr)getOp1(1); }
}
