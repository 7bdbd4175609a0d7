package udplower.ast;

/** Procedural blocking assignment of a whole variable. */
public class AstAssign extends AstNodeAssign {
  public AstAssign(FileLine fileline, AstVarRef lhsp, AstNodeExpr rhsp) { super(fileline, lhsp, rhsp); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Assign;
  }
}
