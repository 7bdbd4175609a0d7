package udplower.ast;

import udplower.num.BitNumber;

/** Constant value. */
public class AstConst extends AstNodeExpr {
  private final BitNumber num;

  public AstConst(FileLine fileline, BitNumber num) {
    super(fileline, 0);
    this.num = num.copy();
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.Const;
  }

  /** Returns a copy of the value. */
  public BitNumber getNum() { return num.copy(); }

  @Override
  public int getWidth() {
    return num.getWidth();
  }

  @Override
  public String prettyName() {
    return "Const " + num;
  }
}
