package udplower.ast;

/** Base of all expression nodes. */
public abstract class AstNodeExpr extends AstNode {
  protected AstNodeExpr(FileLine fileline, int numOps) { super(fileline, numOps); }

  /** Bit width of the expression result. */
  public abstract int getWidth();
}
