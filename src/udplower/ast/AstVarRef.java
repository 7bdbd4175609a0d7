package udplower.ast;

/** Reference to a variable. The target is not a child; it must stay reachable in the same tree. */
public class AstVarRef extends AstNodeExpr {
  public enum Access {
    Read,
    Write
  }

  private final AstVar varp;
  private final Access access;

  public AstVarRef(FileLine fileline, AstVar varp, Access access) {
    super(fileline, 0);
    this.varp = varp;
    this.access = access;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.VarRef;
  }

  public AstVar getVar() { return varp; }
  public Access getAccess() { return access; }

  @Override
  public int getWidth() {
    return varp.getWidth();
  }

  @Override
  public String prettyName() {
    return "VarRef '" + varp.getName() + "'";
  }
}
