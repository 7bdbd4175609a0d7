package udplower.ast;

import java.util.List;

/**
 * Procedural block. With {@link Keyword#Always} and no sensitivity list it re-evaluates whenever a read variable changes;
 * variables it does not assign on some path keep their previous value.
 */
public class AstAlways extends AstNode {
  public enum Keyword {
    Always("always");

    private final String text;

    private Keyword(String text) { this.text = text; }
    public String getText() { return text; }
  }

  private final Keyword keyword;

  public AstAlways(FileLine fileline, Keyword keyword) {
    super(fileline, 1);
    this.keyword = keyword;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.Always;
  }

  public Keyword getKeyword() { return keyword; }

  public void addStmt(AstNode stmtp) { addOp(0, stmtp); }
  public List<AstNode> getStmts() { return getOp(0); }
}
