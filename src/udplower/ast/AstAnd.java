package udplower.ast;

/** Bitwise AND of two equally wide operands. */
public class AstAnd extends AstNodeBiop {
  public AstAnd(FileLine fileline, AstNodeExpr lhsp, AstNodeExpr rhsp) { super(fileline, lhsp, rhsp); }

  @Override
  public NodeKind getKind() {
    return NodeKind.And;
  }

  @Override
  public int getWidth() {
    return getLhs().getWidth();
  }
}
