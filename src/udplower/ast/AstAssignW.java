package udplower.ast;

/** Continuous assignment ({@code assign lhs = rhs;}) at module level. */
public class AstAssignW extends AstNodeAssign {
  public AstAssignW(FileLine fileline, AstVarRef lhsp, AstNodeExpr rhsp) { super(fileline, lhsp, rhsp); }

  @Override
  public NodeKind getKind() {
    return NodeKind.AssignW;
  }
}
