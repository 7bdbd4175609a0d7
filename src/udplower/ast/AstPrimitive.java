package udplower.ast;

/**
 * User-defined primitive. Its statements are the port declarations followed by one {@link AstUdpTable} until the table gets lowered.
 */
public class AstPrimitive extends AstNodeModule {
  public AstPrimitive(FileLine fileline, String name) { super(fileline, name); }

  @Override
  public NodeKind getKind() {
    return NodeKind.Primitive;
  }

  /** Returns the table of this primitive, or null if there is none (anymore). */
  public AstUdpTable getTable() {
    return getStmts().stream().filter(stmtp -> stmtp instanceof AstUdpTable).map(stmtp -> (AstUdpTable)stmtp).findFirst().orElse(null);
  }
}
