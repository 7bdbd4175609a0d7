package udplower.ast;

import java.util.List;
import java.util.stream.Collectors;

/** Common base of {@link AstModule} and {@link AstPrimitive}: a named unit with an ordered statement list. */
public abstract class AstNodeModule extends AstNode {
  private final String name;

  protected AstNodeModule(FileLine fileline, String name) {
    super(fileline, 1);
    this.name = name;
  }

  public String getName() { return name; }

  public void addStmt(AstNode stmtp) { addOp(0, stmtp); }
  public List<AstNode> getStmts() { return getOp(0); }

  /** Declared variables in statement order, ports included. */
  public List<AstVar> getVars() {
    return getStmts().stream().filter(stmtp -> stmtp instanceof AstVar).map(stmtp -> (AstVar)stmtp).collect(Collectors.toList());
  }

  /** IO variables in declaration order. */
  public List<AstVar> getPorts() { return getVars().stream().filter(AstVar::isIO).collect(Collectors.toList()); }

  @Override
  public String prettyName() {
    return getKind().name() + " '" + name + "'";
  }
}
