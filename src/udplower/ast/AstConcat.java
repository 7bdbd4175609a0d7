package udplower.ast;

/** Concatenation {lhs, rhs}: lhs forms the high-order bits, rhs the low-order bits. */
public class AstConcat extends AstNodeBiop {
  public AstConcat(FileLine fileline, AstNodeExpr lhsp, AstNodeExpr rhsp) { super(fileline, lhsp, rhsp); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Concat;
  }

  @Override
  public int getWidth() {
    return getLhs().getWidth() + getRhs().getWidth();
  }
}
