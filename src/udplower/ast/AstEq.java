package udplower.ast;

/** Unsigned equality of two equally wide operands; one bit wide. */
public class AstEq extends AstNodeBiop {
  public AstEq(FileLine fileline, AstNodeExpr lhsp, AstNodeExpr rhsp) { super(fileline, lhsp, rhsp); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Eq;
  }

  @Override
  public int getWidth() {
    return 1;
  }
}
