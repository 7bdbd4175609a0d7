package udplower.ast;

/** Regular module. Table lowering passes through it without changes. */
public class AstModule extends AstNodeModule {
  public AstModule(FileLine fileline, String name) { super(fileline, name); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Module;
  }
}
